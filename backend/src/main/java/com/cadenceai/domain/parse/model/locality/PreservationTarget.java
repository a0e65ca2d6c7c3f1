package com.cadenceai.domain.parse.model.locality;

public enum PreservationTarget {
    EVERYTHING_ELSE,
    NAMED_ASPECTS,
    UNSPECIFIED
}
