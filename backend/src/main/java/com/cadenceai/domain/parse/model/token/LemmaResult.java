package com.cadenceai.domain.parse.model.token;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Morphological analysis of one word.
 *
 * @param lemma      dictionary form
 * @param original   the word as given
 * @param inflection inflection category
 * @param fromTable  true if resolved from the domain tables rather than suffix rules
 * @param rule       suffix rule that fired (null for table hits and base forms)
 * @param wordClass  coarse word class
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LemmaResult(
        String lemma,
        String original,
        InflectionType inflection,
        boolean fromTable,
        String rule,
        WordClass wordClass
) {
    public boolean isInflected() {
        return inflection != InflectionType.BASE && inflection != InflectionType.UNKNOWN;
    }
}
