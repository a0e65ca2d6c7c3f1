package com.cadenceai.domain.parse.model.unit;

/**
 * Physical dimension of a unit. Conversion is only defined within one dimension.
 */
public enum Dimension {
    TIME_MUSICAL,
    TIME_ABSOLUTE,
    PITCH,
    FREQUENCY,
    DYNAMICS,
    TEMPO,
    PERCENTAGE,
    SPATIAL,
    MIDI,
    RATIO,
    DIMENSIONLESS
}
