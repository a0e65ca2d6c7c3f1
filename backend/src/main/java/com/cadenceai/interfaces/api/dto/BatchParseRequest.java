package com.cadenceai.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BatchParseRequest(
        @NotEmpty(message = "At least one text is required")
        @Size(max = 100, message = "A batch must not exceed 100 texts")
        List<@NotBlank(message = "Texts must not be blank") String> texts
) {}
