package com.cadenceai.domain.parse.model;

import com.cadenceai.domain.parse.model.token.Span;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured ambiguity or anomaly report attached to a parsed fragment.
 * Warnings never replace a reading; the fragment they belong to is still produced.
 *
 * @param code       analyzer-specific warning code
 * @param message    human-readable description
 * @param span       offending source range
 * @param candidates alternative readings or conflicting markers, if known
 */
public record AnalysisWarning(
        @JsonIgnore WarningCode code,
        String message,
        Span span,
        List<String> candidates
) {
    public AnalysisWarning {
        candidates = List.copyOf(candidates);
    }

    public AnalysisWarning(WarningCode code, String message, Span span) {
        this(code, message, span, List.of());
    }

    @JsonProperty("code")
    public String codeName() {
        return code.code();
    }

    public boolean is(WarningCode other) {
        return code == other;
    }
}
