package com.cadenceai.domain.parse.model.reference;

import com.cadenceai.domain.parse.model.WarningCode;

public enum ReferenceWarningCode implements WarningCode {
    NAME_NOT_FOUND,
    MULTIPLE_MATCHES,
    AMBIGUOUS_BARE_NAME,
    UNCLOSED_QUOTE,
    EMPTY_NAME,
    RESERVED_NAME,
    NAME_TOO_LONG,
    SPECIAL_CHARACTERS,
    RENAMING_SOURCE_MISSING,
    FUZZY_MATCH_USED
}
