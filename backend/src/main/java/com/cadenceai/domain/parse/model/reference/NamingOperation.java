package com.cadenceai.domain.parse.model.reference;

public enum NamingOperation {
    REFERENCE_BY_NAME,
    ASSIGN_NAME,
    RENAME,
    REMOVE_NAME,
    SEARCH_BY_NAME
}
