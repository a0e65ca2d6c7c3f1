package com.cadenceai.domain.parse.model.locality;

import com.cadenceai.domain.parse.model.token.Span;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A locality marker and the biases derived from it.
 *
 * @param type                marker type
 * @param marker              matched marker
 * @param costBias            cost bias for the planner
 * @param scopeEffect         effect on edit scope
 * @param impliedPreservation implied preservation constraint, nullable
 * @param markerSpan          source range of the marker
 * @param scopeSpan           source range the marker governs, nullable until resolved
 * @param confidence          in [0, 1]
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EditLocalityExpression(
        LocalityType type,
        LocalityMarker marker,
        CostBias costBias,
        ScopeEffect scopeEffect,
        ImpliedPreservation impliedPreservation,
        Span markerSpan,
        Span scopeSpan,
        double confidence
) {
    public String surface() {
        return marker.surface();
    }
}
