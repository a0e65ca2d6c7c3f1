package com.cadenceai.domain.parse.lexicon;

import com.cadenceai.domain.parse.model.coordination.ConjunctionPosition;
import com.cadenceai.domain.parse.model.coordination.CoordinationKind;

import java.util.List;

/**
 * @param forms               surface forms
 * @param kind                coordination kind
 * @param orderStrict         conjunct order carries meaning
 * @param position            placement relative to the conjuncts
 * @param correlative         partner form ("and" for "both"), nullable
 * @param correlativeRequired missing partner is reported
 * @param priority            match priority
 */
public record ConjunctionEntry(
        List<String> forms,
        CoordinationKind kind,
        boolean orderStrict,
        ConjunctionPosition position,
        String correlative,
        boolean correlativeRequired,
        int priority
) {
    public ConjunctionEntry {
        forms = List.copyOf(forms);
    }

    public String canonical() {
        return forms.get(0);
    }

    public boolean hasCorrelative() {
        return correlative != null;
    }
}
