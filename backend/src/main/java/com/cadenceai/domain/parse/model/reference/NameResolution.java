package com.cadenceai.domain.parse.model.reference;

import com.cadenceai.domain.parse.model.AnalysisWarning;

import java.util.List;

/**
 * Result of matching a {@link NamedReference} against the known entities.
 * A quoted name with no match stays {@link ResolutionStatus#NOT_FOUND}; it is never swapped for
 * a similar name.
 *
 * @param reference the reference being resolved
 * @param status    outcome
 * @param matches   names of matching entities
 * @param warnings  resolution warnings
 */
public record NameResolution(
        NamedReference reference,
        ResolutionStatus status,
        List<String> matches,
        List<AnalysisWarning> warnings
) {
    public NameResolution {
        matches = List.copyOf(matches);
        warnings = List.copyOf(warnings);
    }

    public boolean isResolved() {
        return status == ResolutionStatus.RESOLVED;
    }
}
