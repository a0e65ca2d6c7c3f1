package com.cadenceai.domain.parse.lexicon;

import java.util.Set;

/**
 * A named project entity a reference can resolve to.
 */
public record KnownEntity(
        String name,
        String entityType,
        Set<String> tags
) {
    public KnownEntity {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }
}
