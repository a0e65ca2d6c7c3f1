package com.cadenceai.domain.parse.model.token;

public enum WordClass {
    VERB,
    ADJECTIVE,
    ADVERB,
    NOUN,
    UNKNOWN
}
