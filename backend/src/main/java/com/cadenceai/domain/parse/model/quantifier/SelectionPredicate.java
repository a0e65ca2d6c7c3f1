package com.cadenceai.domain.parse.model.quantifier;

import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.WarningCode;
import com.cadenceai.domain.parse.model.token.Span;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Quantified noun phrase: which entities an edit applies to, and how.
 *
 * @param predicateId   stable id within one utterance ("sel:0", "sel:1", ...)
 * @param quantifier    the quantifier and its semantic properties
 * @param restriction   the noun phrase being quantified over
 * @param scopeReading  default reading; may be underspecified
 * @param count         stated count, for numeric quantifiers
 * @param ordinalFilter periodic filter for "every other"/"every third"
 * @param modifiers     quantifier modifiers ("only", "exactly", ...)
 * @param surface       matched source text
 * @param span          source range
 * @param confidence    in [0, 1]
 * @param warnings      ambiguity reports
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SelectionPredicate(
        String predicateId,
        Quantifier quantifier,
        Restriction restriction,
        ScopeReading scopeReading,
        CountSpec count,
        OrdinalFilter ordinalFilter,
        List<QuantifierModifier> modifiers,
        String surface,
        Span span,
        double confidence,
        List<AnalysisWarning> warnings
) {
    public SelectionPredicate {
        modifiers = List.copyOf(modifiers);
        warnings = List.copyOf(warnings);
    }

    public QuantifierType type() {
        return quantifier.type();
    }

    public boolean hasWarning(WarningCode code) {
        return warnings.stream().anyMatch(w -> w.is(code));
    }
}
