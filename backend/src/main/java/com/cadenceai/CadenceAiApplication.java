package com.cadenceai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CadenceAi - deterministic parser for natural-language music editing commands.
 */
@SpringBootApplication
public class CadenceAiApplication {

	public static void main(String[] args) {
		SpringApplication.run(CadenceAiApplication.class, args);
	}

}
