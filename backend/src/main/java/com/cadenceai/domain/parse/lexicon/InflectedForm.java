package com.cadenceai.domain.parse.lexicon;

import com.cadenceai.domain.parse.model.token.InflectionType;
import com.cadenceai.domain.parse.model.token.WordClass;

/**
 * A surface form found in a domain morphology table.
 */
public record InflectedForm(
        String lemma,
        InflectionType inflection,
        WordClass wordClass
) {}
