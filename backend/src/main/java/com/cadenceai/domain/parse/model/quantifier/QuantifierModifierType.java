package com.cadenceai.domain.parse.model.quantifier;

public enum QuantifierModifierType {
    EXACTLY,
    AT_LEAST,
    AT_MOST,
    ABOUT,
    ONLY,
    JUST,
    EVEN,
    ALSO,
    OTHER,
    REMAINING,
    SPECIFIC,
    PARTICULAR,
    INDIVIDUAL,
    SINGLE,
    ENTIRE,
    WHOLE
}
