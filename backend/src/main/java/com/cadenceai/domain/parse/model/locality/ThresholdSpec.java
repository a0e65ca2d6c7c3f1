package com.cadenceai.domain.parse.model.locality;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param type             floor, ceiling, exact or approximate
 * @param numericValue     value stated right after the marker ("at least 3 dB"), nullable
 * @param unit             canonical unit id of {@code numericValue}, nullable
 * @param qualitativeLevel qualitative level ("a bit"), nullable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ThresholdSpec(
        ThresholdType type,
        Double numericValue,
        String unit,
        String qualitativeLevel
) {
    public static ThresholdSpec of(ThresholdType type) {
        return new ThresholdSpec(type, null, null, null);
    }

    public ThresholdSpec withValue(double value, String unit) {
        return new ThresholdSpec(type, value, unit, qualitativeLevel);
    }
}
