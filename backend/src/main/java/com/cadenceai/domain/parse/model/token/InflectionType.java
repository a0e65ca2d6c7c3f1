package com.cadenceai.domain.parse.model.token;

public enum InflectionType {
    BASE,
    THIRD_PERSON_S,
    PAST_TENSE,
    PAST_PARTICIPLE,
    PRESENT_PARTICIPLE,
    COMPARATIVE,
    SUPERLATIVE,
    NOMINALIZATION,
    ADVERBIAL,
    UNKNOWN
}
