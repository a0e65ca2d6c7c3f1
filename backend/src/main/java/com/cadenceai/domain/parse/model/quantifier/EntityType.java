package com.cadenceai.domain.parse.model.quantifier;

/**
 * Coarse entity category inferred from a head noun.
 */
public enum EntityType {
    SECTION,
    LAYER,
    TRACK,
    RANGE,
    NOTE,
    EVENT,
    MUSICAL_OBJECT,
    INSTRUMENT,
    EFFECT,
    CARD,
    PARAM
}
