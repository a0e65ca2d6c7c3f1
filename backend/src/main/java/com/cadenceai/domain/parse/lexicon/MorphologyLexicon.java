package com.cadenceai.domain.parse.lexicon;

import java.util.Optional;

public interface MorphologyLexicon {

    Optional<InflectedForm> lookupVerbForm(String form);

    Optional<InflectedForm> lookupAdjectiveForm(String form);

    /**
     * True if {@code word} is an independently known base word; stem repair only accepts known words.
     */
    boolean isKnownWord(String word);
}
