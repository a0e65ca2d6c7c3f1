package com.cadenceai.domain.parse.model.quantifier;

import java.util.List;
import java.util.Set;

/**
 * The noun phrase a quantifier ranges over.
 *
 * @param headNoun    head noun lemma, null if none was found
 * @param entityTypes entity categories inferred from the head noun
 * @param modifiers   prenominal adjectives/nouns ("muted" in "all muted tracks")
 * @param ppModifiers postnominal prepositional phrases ("in the chorus")
 * @param explicit    true if the restriction was stated rather than inferred
 */
public record Restriction(
        String headNoun,
        Set<EntityType> entityTypes,
        List<String> modifiers,
        List<String> ppModifiers,
        boolean explicit
) {
    public Restriction {
        entityTypes = Set.copyOf(entityTypes);
        modifiers = List.copyOf(modifiers);
        ppModifiers = List.copyOf(ppModifiers);
    }

    public boolean isEmpty() {
        return headNoun == null;
    }
}
