package com.cadenceai.domain.parse.model.locality;

/**
 * Kind of scope/cost bias a locality marker expresses.
 */
public enum LocalityType {
    /** "just", "only" */
    RESTRICTION,
    /** "at least" */
    MINIMUM_THRESHOLD,
    /** "at most", "no more than" */
    MAXIMUM_THRESHOLD,
    /** "about", "roughly" */
    APPROXIMATION,
    /** "exclusively", "solely" */
    EXCLUSIVITY,
    /** "especially", "mainly" */
    EMPHASIS,
    /** "exactly", "precisely" */
    PRECISION,
    /** "enough" */
    SUFFICIENCY,
    /** "too much", "overly" */
    EXCESS,
    /** "completely", "entirely" */
    TOTALITY
}
