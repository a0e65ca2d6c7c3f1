package com.cadenceai.domain.parse.model.locality;

public enum CostDirection {
    MINIMIZE,
    MAXIMIZE,
    CONSTRAIN,
    RELAX,
    NEUTRAL
}
