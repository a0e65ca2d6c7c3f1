package com.cadenceai.domain.parse.lexicon;

import com.cadenceai.domain.parse.model.coordination.CoordinationKind;

import java.util.Optional;
import java.util.Set;

public interface ConjunctionLexicon {

    Optional<ConjunctionEntry> lookup(String phrase);

    int maxFormWords();

    /**
     * Other kinds a conjunction surface can express ("while": concurrent or contrastive).
     * Empty when the surface is unambiguous.
     */
    Set<CoordinationKind> alternativeKinds(String surface);
}
