package com.cadenceai.domain.parse.lexicon;

import com.cadenceai.domain.parse.model.locality.LocalityType;

import java.util.List;

/**
 * @param canonical canonical marker
 * @param variants  surface variants
 * @param type      locality type
 * @param strength  in [0, 1]
 */
public record LocalityEntry(
        String canonical,
        List<String> variants,
        LocalityType type,
        double strength
) {
    public LocalityEntry {
        variants = List.copyOf(variants);
    }

    public boolean isMultiWord() {
        return canonical.contains(" ");
    }
}
