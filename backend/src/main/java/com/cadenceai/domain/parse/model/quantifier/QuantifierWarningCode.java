package com.cadenceai.domain.parse.model.quantifier;

import com.cadenceai.domain.parse.model.WarningCode;

public enum QuantifierWarningCode implements WarningCode {
    SCOPE_AMBIGUITY,
    DISTRIBUTIVE_OR_COLLECTIVE,
    EMPTY_RESTRICTION,
    COUNT_EXCEEDS_AVAILABLE,
    NEGATIVE_SCOPE_AMBIGUITY,
    PARTITIVE_AMBIGUITY,
    BARE_PLURAL_GENERIC,
    FLOATING_QUANTIFIER,
    PROPORTIONAL_VAGUE
}
