package com.cadenceai.domain.parse.model.quantifier;

/**
 * Periodic selection: "every other bar" selects step 2, offset 0.
 */
public record OrdinalFilter(
        int step,
        int offset,
        String description
) {}
