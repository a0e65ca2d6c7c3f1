package com.cadenceai.domain.parse.model.locality;

public enum ScopeModification {
    NARROW,
    WIDEN,
    LOCK,
    RELAX,
    NONE
}
