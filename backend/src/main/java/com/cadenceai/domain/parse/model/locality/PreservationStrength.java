package com.cadenceai.domain.parse.model.locality;

public enum PreservationStrength {
    STRONG,
    MODERATE,
    WEAK
}
