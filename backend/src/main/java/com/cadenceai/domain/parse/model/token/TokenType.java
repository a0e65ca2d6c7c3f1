package com.cadenceai.domain.parse.model.token;

public enum TokenType {
    WORD,
    NUMBER,
    ORDINAL,
    UNIT,
    PUNCTUATION,
    QUOTE,
    OPERATOR,
    MULTI_WORD,
    CONTRACTION,
    WHITESPACE,
    UNKNOWN
}
