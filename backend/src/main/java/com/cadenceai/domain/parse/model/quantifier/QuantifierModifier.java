package com.cadenceai.domain.parse.model.quantifier;

import com.cadenceai.domain.parse.model.token.Span;

public record QuantifierModifier(
        QuantifierModifierType type,
        String value,
        Span span
) {}
