package com.cadenceai.domain.parse.lexicon;

import java.util.List;

/**
 * Read-only view of the named entities in the current project.
 */
public interface EntityDirectory {

    List<KnownEntity> entities();

    static EntityDirectory of(List<KnownEntity> entities) {
        List<KnownEntity> snapshot = List.copyOf(entities);
        return () -> snapshot;
    }
}
