package com.cadenceai.infrastructure.parse.tokenizer;

import com.cadenceai.domain.parse.model.token.Span;
import com.cadenceai.domain.parse.model.token.Token;
import com.cadenceai.domain.parse.model.token.TokenStream;
import com.cadenceai.domain.parse.model.token.TokenTag;
import com.cadenceai.domain.parse.model.token.TokenType;
import com.cadenceai.domain.parse.model.token.Word;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Lookups over a {@link TokenStream} and the flattened word view the grammar analyzers scan.
 */
public final class TokenStreams {

    private TokenStreams() {
    }

    /**
     * Non-whitespace tokens lying entirely inside {@code span}.
     */
    public static List<Token> tokensInSpan(TokenStream stream, Span span) {
        return stream.tokens().stream()
                .filter(token -> !token.isWhitespace() && span.contains(token.span()))
                .toList();
    }

    public static Optional<Token> tokenAtPosition(TokenStream stream, int position) {
        return stream.tokens().stream()
                .filter(token -> token.span().contains(position))
                .findFirst();
    }

    /**
     * Span from the start of token {@code startIdx} to the end of token {@code endIdx} (inclusive),
     * indexing {@code stream.tokens()}.
     */
    public static Optional<Span> tokenRangeSpan(TokenStream stream, int startIdx, int endIdx) {
        List<Token> tokens = stream.tokens();
        if (startIdx < 0 || endIdx >= tokens.size() || startIdx > endIdx) {
            return Optional.empty();
        }
        return Optional.of(new Span(tokens.get(startIdx).span().start(), tokens.get(endIdx).span().end()));
    }

    /**
     * Word view: one word per non-whitespace token, except that merged idioms expand into one
     * word per component span. Component text is sliced from the source at the recorded span.
     */
    public static List<Word> words(TokenStream stream) {
        List<Word> words = new ArrayList<>();
        for (Token token : stream.tokens()) {
            if (token.isWhitespace()) continue;
            if (!token.merged()) {
                words.add(new Word(token.normalizedText(), token.originalText(), token.span(),
                        token.index(), token.tags(), token.type()));
                continue;
            }
            for (Span component : token.componentSpans()) {
                String text = component.slice(stream.normalizedSource()).toLowerCase(Locale.ROOT);
                words.add(new Word(text, component.slice(stream.source()), component,
                        token.index(), token.tags(), TokenType.MULTI_WORD));
            }
        }
        return words;
    }

    /**
     * Original text of consecutive words, with a single space wherever the source had a gap.
     */
    public static String surface(List<Word> words) {
        if (words.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(words.get(0).original());
        for (int k = 1; k < words.size(); k++) {
            if (words.get(k).span().start() > words.get(k - 1).span().end()) sb.append(' ');
            sb.append(words.get(k).original());
        }
        return sb.toString();
    }

    /**
     * Source range covering {@code words}; the words must be non-empty.
     */
    public static Span spanOf(List<Word> words) {
        return new Span(words.get(0).span().start(), words.get(words.size() - 1).span().end());
    }

    public static String format(Token token) {
        String tags = token.tags().isEmpty() ? "" : token.tags().stream()
                .map(TokenTag::name)
                .sorted()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", ", " [", "]"));
        String merged = token.merged() ? " (merged)" : "";
        return token.type().name().toLowerCase(Locale.ROOT)
                + "(\"" + token.originalText() + "\", " + token.span().start() + ":" + token.span().end() + ")"
                + tags + merged;
    }

    public static String format(TokenStream stream) {
        StringBuilder sb = new StringBuilder();
        sb.append("TokenStream: \"").append(stream.source()).append("\"\n");
        sb.append("  ").append(stream.tokens().size()).append(" tokens (")
                .append(stream.metadata().rawTokenCount()).append(" raw, ")
                .append(stream.metadata().mergedCount()).append(" merged)");
        for (Token token : stream.tokens()) {
            sb.append("\n  ").append(token.index()).append(": ").append(format(token));
        }
        return sb.toString();
    }
}
