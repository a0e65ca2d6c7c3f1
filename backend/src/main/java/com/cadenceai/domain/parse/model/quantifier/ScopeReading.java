package com.cadenceai.domain.parse.model.quantifier;

/**
 * How a quantifier applies to the entities it selects.
 * {@link #UNDERSPECIFIED} is a legitimate final answer, not an error.
 */
public enum ScopeReading {
    /** Per entity: "every chorus" */
    DISTRIBUTIVE,
    /** The group as a whole: "all choruses" */
    COLLECTIVE,
    /** Effect summed across entities */
    CUMULATIVE,
    UNDERSPECIFIED
}
