package com.cadenceai.domain.parse.model.coordination;

public enum ConjunctionPosition {
    /** Between the conjuncts: "X and Y" */
    INFIX,
    /** Before the first conjunct: "if X, Y" */
    PREFIX,
    /** First half of a paired marker: "both X and Y" */
    CORRELATIVE,
    /** After the conjuncts: "X as well" */
    SUFFIX
}
