package com.cadenceai.domain.parse.model.locality;

import com.cadenceai.domain.parse.model.WarningCode;

public enum LocalityWarningCode implements WarningCode {
    CONFLICTING_MARKERS,
    REINFORCING_MARKERS,
    RANGE_CONSTRAINT
}
