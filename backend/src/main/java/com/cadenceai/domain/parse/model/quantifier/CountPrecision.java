package com.cadenceai.domain.parse.model.quantifier;

public enum CountPrecision {
    EXACT,
    AT_LEAST,
    AT_MOST,
    APPROXIMATE,
    RANGE
}
