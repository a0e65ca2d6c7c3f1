package com.cadenceai.domain.parse.lexicon;

import com.cadenceai.domain.parse.model.reference.NamingOperation;
import com.cadenceai.domain.parse.model.reference.NamedReferenceType;

import java.util.List;

/**
 * @param forms       surface forms
 * @param operation   naming operation
 * @param pattern     reference pattern for reference_by_name verbs, nullable otherwise
 * @param preposition expected preposition before the new name ("to", "as"), nullable
 * @param priority    match priority
 */
public record NamingVerbEntry(
        List<String> forms,
        NamingOperation operation,
        NamedReferenceType pattern,
        String preposition,
        int priority
) {
    public NamingVerbEntry {
        forms = List.copyOf(forms);
    }
}
