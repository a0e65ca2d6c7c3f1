package com.cadenceai.domain.parse.model.unit;

public enum UnitMode {
    /** "120 bpm" */
    ABSOLUTE,
    /** "+3 dB", "-2 semitones" */
    RELATIVE,
    /** "20%" */
    PERCENTAGE,
    /** "3:2", "2x" */
    FACTOR
}
