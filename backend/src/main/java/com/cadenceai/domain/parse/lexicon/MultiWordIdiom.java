package com.cadenceai.domain.parse.lexicon;

import com.cadenceai.domain.parse.model.token.TokenTag;

import java.util.List;
import java.util.Set;

/**
 * Fixed multi-word expression merged into a single token: "and then", "every other".
 *
 * @param words     lowercase words to match, in order
 * @param canonical canonical text of the merged token
 * @param tags      tags the merged token inherits
 * @param priority  higher wins when several idioms match at one position
 */
public record MultiWordIdiom(
        List<String> words,
        String canonical,
        Set<TokenTag> tags,
        int priority
) {
    public MultiWordIdiom {
        words = List.copyOf(words);
        tags = Set.copyOf(tags);
    }

    public static MultiWordIdiom of(String canonical, int priority, TokenTag... tags) {
        return new MultiWordIdiom(List.of(canonical.split(" ")), canonical, Set.of(tags), priority);
    }

    public String firstWord() {
        return words.get(0);
    }

    public int length() {
        return words.size();
    }
}
