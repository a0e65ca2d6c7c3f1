package com.cadenceai.domain.parse.model.coordination;

public enum ConstituentRole {
    FIRST_CONJUNCT,
    SECOND_CONJUNCT,
    CONDITION,
    ACTION,
    CORRECTION,
    ELABORATION,
    CAUSE,
    EFFECT
}
