package com.cadenceai.domain.parse.model.token;

import java.util.Map;

/**
 * @param rawTokenCount tokens produced by the raw scan, whitespace included
 * @param mergedCount   multi-word idioms merged
 * @param typeCounts    counts over the non-whitespace tokens
 * @param hasUnknown    true if any token could not be classified
 * @param hasQuotes     true if any quoted span was found
 * @param inputLength   length of the source string
 */
public record TokenStreamMetadata(
        int rawTokenCount,
        int mergedCount,
        Map<TokenType, Integer> typeCounts,
        boolean hasUnknown,
        boolean hasQuotes,
        int inputLength
) {
    public TokenStreamMetadata {
        typeCounts = Map.copyOf(typeCounts);
    }
}
