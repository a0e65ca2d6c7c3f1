package com.cadenceai.domain.parse.model.locality;

public enum ThresholdType {
    FLOOR,
    CEILING,
    EXACT,
    APPROXIMATE
}
