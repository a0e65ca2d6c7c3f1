package com.cadenceai.domain.parse.model.time;

import com.cadenceai.domain.parse.model.WarningCode;

public enum TimeWarningCode implements WarningCode {
    AMBIGUOUS_SECTION,
    MISSING_ORDINAL,
    BAR_OUT_OF_RANGE,
    BEAT_OUT_OF_RANGE,
    CONFLICTING_REFERENCES,
    UNKNOWN_SECTION,
    INCOMPLETE_RANGE
}
