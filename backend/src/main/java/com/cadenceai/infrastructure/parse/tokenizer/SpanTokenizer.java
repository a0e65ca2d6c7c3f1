package com.cadenceai.infrastructure.parse.tokenizer;

import com.cadenceai.domain.parse.lexicon.IdiomLexicon;
import com.cadenceai.domain.parse.lexicon.MultiWordIdiom;
import com.cadenceai.domain.parse.lexicon.UnitLexicon;
import com.cadenceai.domain.parse.lexicon.WordClassLexicon;
import com.cadenceai.domain.parse.model.token.Span;
import com.cadenceai.domain.parse.model.token.Token;
import com.cadenceai.domain.parse.model.token.TokenStream;
import com.cadenceai.domain.parse.model.token.TokenStreamMetadata;
import com.cadenceai.domain.parse.model.token.TokenTag;
import com.cadenceai.domain.parse.model.token.TokenType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Span-preserving tokenizer.
 *
 * Stages:
 *   1. typography folding (1:1, offsets unchanged)
 *   2. raw scan into whitespace, quote, punctuation, operator, word and unknown runs
 *   3. multi-word idiom merge (whitespace between merged words is absorbed)
 *   4. classification and tagging
 *
 * {@code allTokens} always tiles the source: concatenating their original texts gives the input back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpanTokenizer {

    private record RawToken(String text, Span span) {
        boolean isWhitespace() {
            return Character.isWhitespace(text.charAt(0));
        }
    }

    private record MergedRun(String text, Span span, boolean merged, List<Span> componentSpans, Set<TokenTag> idiomTags) {
        static MergedRun of(RawToken raw) {
            return new MergedRun(raw.text(), raw.span(), false, List.of(), Set.of());
        }
    }

    private static final String PUNCTUATION_CHARS = ".,;:!?()[]{}";
    private static final String OPERATOR_CHARS = "+-*/=<>";

    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern ORDINAL = Pattern.compile("^(\\d+)(st|nd|rd|th)$");
    private static final Pattern CONTRACTION = Pattern.compile("^[a-z]+'[a-z]+$");
    private static final Pattern ATTACHED_UNIT = Pattern.compile("^\\d+(?:\\.\\d+)?([a-z%]+)$");
    private static final Pattern RATIO = Pattern.compile("^\\d+(?:\\.\\d+)?:\\d+(?:\\.\\d+)?$");
    private static final Pattern WORD = Pattern.compile("^[a-z'-]+$");

    private static final Comparator<MultiWordIdiom> IDIOM_ORDER =
            Comparator.comparingInt(MultiWordIdiom::priority).reversed()
                    .thenComparing(Comparator.comparingInt(MultiWordIdiom::length).reversed());

    private final TextNormalizer textNormalizer;
    private final IdiomLexicon idiomLexicon;
    private final WordClassLexicon wordClassLexicon;
    private final UnitLexicon unitLexicon;

    @Value("${parser.tokenizer.merge-multi-word:true}")
    private boolean mergeMultiWord = true;

    @Value("${parser.tokenizer.tag-tokens:true}")
    private boolean tagTokens = true;

    @Value("${parser.tokenizer.normalize-quotes:true}")
    private boolean normalizeQuotes = true;

    /**
     * Tokenizes with the configured defaults.
     */
    public TokenStream tokenize(String source) {
        return tokenize(source, defaultConfig());
    }

    public TokenStream tokenize(String source, TokenizerConfig config) {
        String input = source == null ? "" : source;
        String folded = config.normalizeQuotes() ? textNormalizer.foldTypography(input) : input;

        List<RawToken> rawTokens = rawScan(folded);

        List<MergedRun> runs;
        int mergedCount = 0;
        if (config.mergeMultiWord()) {
            runs = mergeMultiWords(rawTokens, config.additionalIdioms());
            mergedCount = (int) runs.stream().filter(MergedRun::merged).count();
        } else {
            runs = rawTokens.stream().map(MergedRun::of).toList();
        }

        List<Token> allTokens = new ArrayList<>(runs.size());
        for (MergedRun run : runs) {
            allTokens.add(toToken(run, input, allTokens.size(), config));
        }

        List<Token> tokens = config.preserveWhitespace()
                ? allTokens
                : allTokens.stream().filter(token -> !token.isWhitespace()).toList();

        Map<TokenType, Integer> typeCounts = new EnumMap<>(TokenType.class);
        for (Token token : tokens) {
            typeCounts.merge(token.type(), 1, Integer::sum);
        }
        TokenStreamMetadata metadata = new TokenStreamMetadata(
                rawTokens.size(),
                mergedCount,
                typeCounts,
                typeCounts.containsKey(TokenType.UNKNOWN),
                typeCounts.containsKey(TokenType.QUOTE),
                input.length());

        log.debug("[Tokenizer] {} chars → {} tokens ({} raw, {} merged)",
                input.length(), tokens.size(), rawTokens.size(), mergedCount);
        return new TokenStream(input, folded, tokens, allTokens, metadata);
    }

    public TokenizerConfig defaultConfig() {
        return new TokenizerConfig(false, mergeMultiWord, tagTokens, normalizeQuotes, List.of());
    }

    // ── Raw scan ──

    private List<RawToken> rawScan(String text) {
        List<RawToken> tokens = new ArrayList<>();
        int length = text.length();
        int pos = 0;

        while (pos < length) {
            char ch = text.charAt(pos);
            int start = pos;

            if (Character.isWhitespace(ch)) {
                while (pos < length && Character.isWhitespace(text.charAt(pos))) pos++;
            } else if (ch == '"' || ch == '\'') {
                pos++;
                while (pos < length && text.charAt(pos) != ch) pos++;
                if (pos < length) pos++; // closing quote
            } else if (PUNCTUATION_CHARS.indexOf(ch) >= 0) {
                pos++;
            } else if (OPERATOR_CHARS.indexOf(ch) >= 0) {
                while (pos < length && OPERATOR_CHARS.indexOf(text.charAt(pos)) >= 0) pos++;
            } else if (isWordStart(ch)) {
                pos = scanWordRun(text, pos);
            } else if (Character.isHighSurrogate(ch) && pos + 1 < length && Character.isLowSurrogate(text.charAt(pos + 1))) {
                pos += 2;
            } else {
                pos++;
            }

            tokens.add(new RawToken(text.substring(start, pos), new Span(start, pos)));
        }
        return tokens;
    }

    private static int scanWordRun(String text, int pos) {
        int length = text.length();
        while (pos < length) {
            char ch = text.charAt(pos);
            if (isWordStart(ch) || ch == '%') {
                pos++;
            } else if (ch == '.' || ch == '-' || ch == ':') {
                // a trailing separator belongs to the next token
                if (pos + 1 >= length || Character.isWhitespace(text.charAt(pos + 1))) break;
                pos++;
            } else if (ch == '\'') {
                // apostrophe only between two letters; otherwise it opens a quote
                boolean between = Character.isLetter(text.charAt(pos - 1))
                        && pos + 1 < length && Character.isLetter(text.charAt(pos + 1));
                if (!between) break;
                pos++;
            } else {
                break;
            }
        }
        return pos;
    }

    private static boolean isWordStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9') || ch == '_';
    }

    // ── Multi-word merge ──

    private List<MergedRun> mergeMultiWords(List<RawToken> rawTokens, List<MultiWordIdiom> additional) {
        Map<String, List<MultiWordIdiom>> additionalByFirst = new HashMap<>();
        for (MultiWordIdiom idiom : additional) {
            additionalByFirst.computeIfAbsent(idiom.firstWord().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(idiom);
        }

        List<MergedRun> result = new ArrayList<>();
        int i = 0;
        while (i < rawTokens.size()) {
            RawToken token = rawTokens.get(i);
            if (token.isWhitespace()) {
                result.add(MergedRun.of(token));
                i++;
                continue;
            }

            String lower = token.text().toLowerCase(Locale.ROOT);
            List<MultiWordIdiom> candidates = new ArrayList<>(idiomLexicon.candidates(lower));
            candidates.addAll(additionalByFirst.getOrDefault(lower, List.of()));
            candidates.sort(IDIOM_ORDER); // stable: table order breaks ties

            int next = -1;
            for (MultiWordIdiom idiom : candidates) {
                List<Span> components = matchIdiom(rawTokens, i, idiom);
                if (components != null) {
                    Span union = Span.covering(components);
                    result.add(new MergedRun(idiom.canonical(), union, true, components, idiom.tags()));
                    next = indexAfter(rawTokens, i, union.end());
                    break;
                }
            }

            if (next < 0) {
                result.add(MergedRun.of(token));
                i++;
            } else {
                i = next;
            }
        }
        return result;
    }

    /**
     * @return the span of each matched word, or null when the idiom does not match at {@code start}
     */
    private static List<Span> matchIdiom(List<RawToken> rawTokens, int start, MultiWordIdiom idiom) {
        List<Span> components = new ArrayList<>(idiom.length());
        int j = start;
        int wordIdx = 0;
        while (j < rawTokens.size() && wordIdx < idiom.length()) {
            RawToken raw = rawTokens.get(j);
            if (raw.isWhitespace()) {
                if (wordIdx == 0) return null;
                j++;
                continue;
            }
            if (!raw.text().equalsIgnoreCase(idiom.words().get(wordIdx))) return null;
            components.add(raw.span());
            wordIdx++;
            j++;
        }
        return wordIdx == idiom.length() ? components : null;
    }

    private static int indexAfter(List<RawToken> rawTokens, int from, int end) {
        int j = from;
        while (j < rawTokens.size() && rawTokens.get(j).span().end() <= end) j++;
        return j;
    }

    // ── Classification ──

    private Token toToken(MergedRun run, String source, int index, TokenizerConfig config) {
        String normalized = run.text().toLowerCase(Locale.ROOT);
        TokenType type = run.merged() ? TokenType.MULTI_WORD : classify(normalized);

        Set<TokenTag> tags = EnumSet.noneOf(TokenTag.class);
        if (config.tagTokens() && type != TokenType.WHITESPACE) {
            tags.addAll(wordClassLexicon.tagsFor(normalized));
        }
        tags.addAll(run.idiomTags());

        return new Token(type, normalized, run.span().slice(source), run.span(), index, tags,
                run.merged(), run.componentSpans());
    }

    TokenType classify(String text) {
        if (NUMBER.matcher(text).matches()) return TokenType.NUMBER;
        if (isOrdinal(text)) return TokenType.ORDINAL;
        char first = text.charAt(0);
        if (first == '"' || first == '\'') return TokenType.QUOTE;
        if (allIn(text, OPERATOR_CHARS)) return TokenType.OPERATOR;
        if (allIn(text, PUNCTUATION_CHARS)) return TokenType.PUNCTUATION;
        if (CONTRACTION.matcher(text).matches()) return TokenType.CONTRACTION;
        if (text.isBlank()) return TokenType.WHITESPACE;
        if (isUnit(text)) return TokenType.UNIT;
        if (WORD.matcher(text).matches()) return TokenType.WORD;
        return TokenType.UNKNOWN;
    }

    /**
     * "1st", "22nd", "13th"; the suffix has to agree with the number, so "7st" is not an ordinal.
     */
    private static boolean isOrdinal(String text) {
        Matcher m = ORDINAL.matcher(text);
        if (!m.matches()) return false;
        String digits = m.group(1);
        int lastTwo = Integer.parseInt(digits.substring(Math.max(0, digits.length() - 2)));
        String expected = switch (lastTwo % 10) {
            case 1 -> lastTwo == 11 ? "th" : "st";
            case 2 -> lastTwo == 12 ? "th" : "nd";
            case 3 -> lastTwo == 13 ? "th" : "rd";
            default -> "th";
        };
        return expected.equals(m.group(2));
    }

    private boolean isUnit(String text) {
        if (RATIO.matcher(text).matches()) return true;
        Matcher m = ATTACHED_UNIT.matcher(text);
        return m.matches() && unitLexicon.lookupUnit(m.group(1)).isPresent();
    }

    private static boolean allIn(String text, String chars) {
        for (int i = 0; i < text.length(); i++) {
            if (chars.indexOf(text.charAt(i)) < 0) return false;
        }
        return true;
    }
}
