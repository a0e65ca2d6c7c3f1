package com.cadenceai.domain.parse.model.quantifier;

/**
 * @param type         quantifier category
 * @param surface      matched quantifier text
 * @param strong       strong (presuppositional) determiner
 * @param monotoneUp   upward entailing in its restriction
 * @param monotoneDown downward entailing in its restriction
 * @param proportion   proportion for proportional quantifiers, null otherwise
 */
public record Quantifier(
        QuantifierType type,
        String surface,
        boolean strong,
        boolean monotoneUp,
        boolean monotoneDown,
        Double proportion
) {}
