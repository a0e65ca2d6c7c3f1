package com.cadenceai.domain.parse.lexicon;

import java.util.Optional;

public interface NamingLexicon {

    Optional<NamingVerbEntry> lookupVerb(String phrase);

    int maxVerbWords();

    /**
     * Canonical entity type for an entity keyword ("tracks" → "track", "fx" → "effect").
     */
    Optional<String> entityType(String keyword);
}
