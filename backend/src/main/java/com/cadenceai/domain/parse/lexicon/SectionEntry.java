package com.cadenceai.domain.parse.lexicon;

import java.util.List;

/**
 * @param canonical canonical section name
 * @param forms     synonyms, canonical first
 * @param order     typical structural position
 * @param repeats   the section usually occurs more than once
 */
public record SectionEntry(
        String canonical,
        List<String> forms,
        int order,
        boolean repeats
) {
    public SectionEntry {
        forms = List.copyOf(forms);
    }
}
