package com.cadenceai.domain.parse.model.token;

import java.util.Set;

/**
 * One word of the flattened word view that the grammar analyzers scan.
 * Merged idiom tokens expand back into one word per component span.
 *
 * @param text       normalized lowercase text
 * @param original   exact source text
 * @param span       source position
 * @param tokenIndex index of the owning {@link Token}
 * @param tags       tags of the owning token
 * @param type       type of the owning token ({@link TokenType#MULTI_WORD} for idiom components)
 */
public record Word(
        String text,
        String original,
        Span span,
        int tokenIndex,
        Set<TokenTag> tags,
        TokenType type
) {
    public Word {
        tags = Set.copyOf(tags);
    }

    public boolean hasTag(TokenTag tag) {
        return tags.contains(tag);
    }

    public boolean is(String value) {
        return text.equals(value);
    }

    public boolean isPunctuation() {
        return type == TokenType.PUNCTUATION;
    }

    public static Word of(String text, int start) {
        return new Word(text, text, new Span(start, start + text.length()), -1, Set.of(), TokenType.WORD);
    }
}
