package com.cadenceai.domain.parse.model.reference;

public enum ResolutionStatus {
    RESOLVED,
    NOT_FOUND,
    MULTIPLE_MATCHES,
    /** Unquoted name; matching is left to a downstream fuzzy matcher. */
    FUZZY_REQUIRED
}
