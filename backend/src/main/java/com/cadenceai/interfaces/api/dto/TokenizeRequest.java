package com.cadenceai.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;

public record TokenizeRequest(
        @NotBlank(message = "Text is required")
        String text
) {}
