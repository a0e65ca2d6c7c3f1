package com.cadenceai.domain.parse.model.time;

/**
 * Position relative to a containing range: "the end of the chorus".
 */
public enum PositionAnchor {
    START,
    END,
    MIDDLE
}
