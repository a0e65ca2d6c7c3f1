package com.cadenceai.domain.parse.model.coordination;

import com.cadenceai.domain.parse.model.token.Span;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param index           position among the conjuncts, 0-based
 * @param surface         source text of the conjunct
 * @param span            source range, null when the conjunct is missing
 * @param role            role within the coordination
 * @param elided          true if material was elided from this conjunct
 * @param elidedMaterial  recovered material ("add" in "add reverb and delay"), null if none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Constituent(
        int index,
        String surface,
        Span span,
        ConstituentRole role,
        boolean elided,
        String elidedMaterial
) {
    public Constituent withElision(String material) {
        return new Constituent(index, surface, span, role, true, material);
    }

    public boolean isEmpty() {
        return surface.isBlank();
    }
}
