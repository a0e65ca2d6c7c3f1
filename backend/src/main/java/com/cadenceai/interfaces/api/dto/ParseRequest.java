package com.cadenceai.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.Set;

public record ParseRequest(
        @NotBlank(message = "Text is required")
        String text,

        @Valid
        List<KnownEntityDto> knownEntities
) {
    public record KnownEntityDto(
            @NotBlank(message = "Entity name is required")
            String name,

            String entityType,

            Set<String> tags
    ) {}
}
