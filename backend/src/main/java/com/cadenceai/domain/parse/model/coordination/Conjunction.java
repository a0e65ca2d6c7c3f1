package com.cadenceai.domain.parse.model.coordination;

import com.cadenceai.domain.parse.model.token.Span;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param canonical       canonical conjunction form from the lexicon
 * @param surface         matched text
 * @param position        where the conjunction sits relative to its conjuncts
 * @param priority        lexicon priority
 * @param span            source range
 * @param correlativeSpan range of the linked partner ("and" for "both"), null if none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Conjunction(
        String canonical,
        String surface,
        ConjunctionPosition position,
        int priority,
        Span span,
        Span correlativeSpan
) {}
