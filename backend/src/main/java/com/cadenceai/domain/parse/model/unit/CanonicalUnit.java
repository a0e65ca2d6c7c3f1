package com.cadenceai.domain.parse.model.unit;

/**
 * @param id           canonical unit id, e.g. "semitone"
 * @param symbol       display symbol, e.g. "st"
 * @param dimension    physical dimension
 * @param toBaseFactor multiplier converting one of this unit into the dimension's base unit
 */
public record CanonicalUnit(
        String id,
        String symbol,
        Dimension dimension,
        double toBaseFactor
) {
    public boolean sameDimension(CanonicalUnit other) {
        return dimension == other.dimension;
    }
}
