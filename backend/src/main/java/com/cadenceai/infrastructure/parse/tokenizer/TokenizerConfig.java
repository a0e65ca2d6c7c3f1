package com.cadenceai.infrastructure.parse.tokenizer;

import com.cadenceai.domain.parse.lexicon.MultiWordIdiom;

import java.util.List;

/**
 * @param preserveWhitespace keep whitespace tokens in {@code TokenStream.tokens()}
 * @param mergeMultiWord     merge idioms into single tokens
 * @param tagTokens          attach word-class tags
 * @param normalizeQuotes    fold smart quotes, dashes and ellipses before scanning
 * @param additionalIdioms   idioms tried after the built-in ones
 */
public record TokenizerConfig(
        boolean preserveWhitespace,
        boolean mergeMultiWord,
        boolean tagTokens,
        boolean normalizeQuotes,
        List<MultiWordIdiom> additionalIdioms
) {
    public static final TokenizerConfig DEFAULT = new TokenizerConfig(false, true, true, true, List.of());

    public TokenizerConfig {
        additionalIdioms = additionalIdioms == null ? List.of() : List.copyOf(additionalIdioms);
        for (MultiWordIdiom idiom : additionalIdioms) {
            validate(idiom);
        }
    }

    public TokenizerConfig withAdditionalIdioms(List<MultiWordIdiom> idioms) {
        return new TokenizerConfig(preserveWhitespace, mergeMultiWord, tagTokens, normalizeQuotes, idioms);
    }

    public TokenizerConfig withPreserveWhitespace(boolean preserve) {
        return new TokenizerConfig(preserve, mergeMultiWord, tagTokens, normalizeQuotes, additionalIdioms);
    }

    private static void validate(MultiWordIdiom idiom) {
        if (idiom.words().isEmpty() || idiom.words().stream().anyMatch(word -> word == null || word.isBlank())) {
            throw new InvalidTokenizerConfigException("Idiom '" + idiom.canonical() + "' has empty words");
        }
        if (idiom.priority() <= 0) {
            throw new InvalidTokenizerConfigException(
                    "Idiom '" + idiom.canonical() + "' needs a positive priority, got " + idiom.priority());
        }
    }
}
