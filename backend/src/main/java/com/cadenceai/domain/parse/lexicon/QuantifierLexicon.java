package com.cadenceai.domain.parse.lexicon;

import com.cadenceai.domain.parse.model.quantifier.EntityType;
import com.cadenceai.domain.parse.model.quantifier.QuantifierModifierType;

import java.util.Optional;
import java.util.Set;

public interface QuantifierLexicon {

    Optional<QuantifierEntry> lookup(String phrase);

    int maxFormWords();

    /**
     * Entity types a noun (singular or plural) can denote; empty if unknown.
     */
    Set<EntityType> entityTypes(String noun);

    Optional<QuantifierModifierType> modifier(String word);
}
