package com.cadenceai.domain.parse.model.token;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Tokenizer output. {@code allTokens} tiles the source exactly; {@code tokens} drops whitespace.
 *
 * @param source           the raw input
 * @param normalizedSource the input after 1:1 typography folding (same length as {@code source})
 * @param tokens           non-whitespace tokens
 * @param allTokens        every token, whitespace included
 * @param metadata         counts and flags for diagnostics
 */
public record TokenStream(
        String source,
        @JsonIgnore String normalizedSource,
        List<Token> tokens,
        List<Token> allTokens,
        TokenStreamMetadata metadata
) {
    public TokenStream {
        tokens = List.copyOf(tokens);
        allTokens = List.copyOf(allTokens);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }
}
