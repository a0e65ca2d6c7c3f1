package com.cadenceai.domain.parse.model.time;

public enum TemporalRelation {
    BEFORE,
    AFTER,
    DURING,
    UNTIL,
    SINCE,
    BETWEEN
}
