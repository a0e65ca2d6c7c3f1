package com.cadenceai.infrastructure.parse.tokenizer;

public class InvalidTokenizerConfigException extends RuntimeException {

    public InvalidTokenizerConfigException(String message) {
        super(message);
    }

    public InvalidTokenizerConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
