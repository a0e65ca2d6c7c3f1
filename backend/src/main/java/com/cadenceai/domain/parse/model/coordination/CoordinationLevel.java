package com.cadenceai.domain.parse.model.coordination;

public enum CoordinationLevel {
    SENTENCE,
    VERB_PHRASE,
    ADJECTIVE,
    NOUN_PHRASE,
    PREP_PHRASE,
    MIXED
}
