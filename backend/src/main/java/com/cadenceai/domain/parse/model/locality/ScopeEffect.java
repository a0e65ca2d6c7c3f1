package com.cadenceai.domain.parse.model.locality;

/**
 * @param modification   how the edit scope changes
 * @param exclusive      true if only the named element may change
 * @param priorityAdjust extra priority for the marked element
 */
public record ScopeEffect(
        ScopeModification modification,
        boolean exclusive,
        double priorityAdjust
) {
    public static final ScopeEffect NONE = new ScopeEffect(ScopeModification.NONE, false, 0.0);
}
