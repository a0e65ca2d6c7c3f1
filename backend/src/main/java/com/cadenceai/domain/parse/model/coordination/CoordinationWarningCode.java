package com.cadenceai.domain.parse.model.coordination;

import com.cadenceai.domain.parse.model.WarningCode;

public enum CoordinationWarningCode implements WarningCode {
    AMBIGUOUS_SCOPE,
    AMBIGUOUS_CONJUNCTION,
    MISSING_CORRELATIVE,
    ELLIPSIS_DETECTED,
    THREE_WAY_COORDINATION,
    NESTED_COORDINATION,
    COMMA_SPLICE
}
