package com.cadenceai.domain.parse.model.coordination;

public enum RhetoricalRelation {
    LIST,
    SEQUENCE,
    CONTRAST,
    ALTERNATIVE,
    CONDITION,
    CORRECTION,
    ELABORATION,
    PURPOSE
}
