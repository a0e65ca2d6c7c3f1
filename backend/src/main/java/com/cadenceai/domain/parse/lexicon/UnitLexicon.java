package com.cadenceai.domain.parse.lexicon;

import com.cadenceai.domain.parse.model.unit.CanonicalUnit;

import java.util.Optional;

public interface UnitLexicon {

    /**
     * Resolves a unit alias ("st", "semitones", "db") to its canonical unit.
     */
    Optional<CanonicalUnit> lookupUnit(String alias);

    /**
     * Longest alias length in words.
     */
    int maxAliasWords();
}
