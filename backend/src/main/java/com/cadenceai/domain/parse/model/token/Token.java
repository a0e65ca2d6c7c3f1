package com.cadenceai.domain.parse.model.token;

import java.util.List;
import java.util.Set;

/**
 * A single token of a {@link TokenStream}.
 *
 * @param type           shape class assigned by the tokenizer
 * @param normalizedText lowercase, typography-folded text (canonical form for merged idioms)
 * @param originalText   exact source text covered by {@code span}
 * @param span           position in the source
 * @param index          position in {@code TokenStream.allTokens()}
 * @param tags           heuristic tags
 * @param merged         true if this token absorbed several raw tokens
 * @param componentSpans spans of the absorbed raw tokens; empty unless merged
 */
public record Token(
        TokenType type,
        String normalizedText,
        String originalText,
        Span span,
        int index,
        Set<TokenTag> tags,
        boolean merged,
        List<Span> componentSpans
) {
    public Token {
        tags = Set.copyOf(tags);
        componentSpans = List.copyOf(componentSpans);
    }

    public boolean hasTag(TokenTag tag) {
        return tags.contains(tag);
    }

    public boolean isWhitespace() {
        return type == TokenType.WHITESPACE;
    }
}
