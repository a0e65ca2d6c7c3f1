package com.cadenceai.domain.parse.model.unit;

import com.cadenceai.domain.parse.model.token.Span;

/**
 * A number with a unit, e.g. "+3 dB" or "7st".
 *
 * @param value    parsed number
 * @param unit     canonical unit
 * @param mode     absolute, relative, percentage or factor
 * @param original source text of the matched window
 * @param span     source range (empty when parsed from bare strings)
 */
public record UnitExpression(
        ParsedNumber value,
        CanonicalUnit unit,
        UnitMode mode,
        String original,
        Span span
) {
    public Dimension dimension() {
        return unit.dimension();
    }
}
