package com.cadenceai.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record LemmaRequest(
        @NotEmpty(message = "At least one word is required")
        @Size(max = 500, message = "At most 500 words per request")
        List<String> words
) {}
