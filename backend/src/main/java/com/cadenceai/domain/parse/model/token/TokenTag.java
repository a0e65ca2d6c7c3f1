package com.cadenceai.domain.parse.model.token;

/**
 * Heuristic part-of-speech-like tags attached by the tokenizer.
 * These are hints for the grammar analyzers, not a committed parse.
 */
public enum TokenTag {
    VERB,
    ADJECTIVE,
    NOUN,
    ADVERB,
    PREPOSITION,
    DETERMINER,
    CONJUNCTION,
    PRONOUN,
    NEGATION,
    QUANTIFIER,
    DEGREE,
    MUSICAL,
    NUMBER_WORD,
    UNIT_WORD,
    QUESTION,
    MODAL,
    IMPERATIVE
}
