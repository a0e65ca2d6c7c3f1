package com.cadenceai.domain.parse.model.quantifier;

/**
 * @param value     stated count
 * @param precision how the count constrains the selection
 * @param unit      counted noun, if any
 */
public record CountSpec(
        int value,
        CountPrecision precision,
        String unit
) {}
