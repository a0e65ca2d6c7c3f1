package com.cadenceai.domain.parse.model.quantifier;

public enum QuantifierType {
    UNIVERSAL,
    EXISTENTIAL,
    PROPORTIONAL,
    NUMERIC,
    PARTITIVE,
    DISTRIBUTIVE,
    NEGATIVE,
    INTERROGATIVE,
    RELATIVE,
    DEGREE,
    DEFINITE_PLURAL,
    BARE_PLURAL
}
