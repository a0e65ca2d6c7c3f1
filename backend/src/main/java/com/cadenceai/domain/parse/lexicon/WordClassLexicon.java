package com.cadenceai.domain.parse.lexicon;

import com.cadenceai.domain.parse.model.token.TokenTag;

import java.util.Set;

/**
 * Closed word lists behind the tokenizer's heuristic tags.
 */
public interface WordClassLexicon {

    Set<TokenTag> tagsFor(String word);

    default boolean has(String word, TokenTag tag) {
        return tagsFor(word).contains(tag);
    }
}
