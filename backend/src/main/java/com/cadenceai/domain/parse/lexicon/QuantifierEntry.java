package com.cadenceai.domain.parse.lexicon;

import com.cadenceai.domain.parse.model.quantifier.QuantifierType;
import com.cadenceai.domain.parse.model.quantifier.ScopeReading;

import java.util.List;

/**
 * @param forms              surface forms
 * @param type               quantifier type
 * @param defaultReading     reading assumed unless context overrides it
 * @param strong             strong determiner
 * @param monotoneUp         upward monotone
 * @param monotoneDown       downward monotone
 * @param proportion         proportion for proportional quantifiers, nullable
 * @param partitivePreferred prefers an "of the" continuation
 * @param ordinalStep        period for distributive "every other/third", nullable
 * @param priority           match priority
 */
public record QuantifierEntry(
        List<String> forms,
        QuantifierType type,
        ScopeReading defaultReading,
        boolean strong,
        boolean monotoneUp,
        boolean monotoneDown,
        Double proportion,
        boolean partitivePreferred,
        Integer ordinalStep,
        int priority
) {
    public QuantifierEntry {
        forms = List.copyOf(forms);
    }
}
