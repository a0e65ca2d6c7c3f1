package com.cadenceai.infrastructure.parse.unit;

import com.cadenceai.domain.parse.lexicon.UnitLexicon;
import com.cadenceai.domain.parse.model.token.Span;
import com.cadenceai.domain.parse.model.token.TokenType;
import com.cadenceai.domain.parse.model.token.Word;
import com.cadenceai.domain.parse.model.unit.CanonicalUnit;
import com.cadenceai.domain.parse.model.unit.Dimension;
import com.cadenceai.domain.parse.model.unit.ParsedNumber;
import com.cadenceai.domain.parse.model.unit.UnitExpression;
import com.cadenceai.domain.parse.model.unit.UnitMode;
import com.cadenceai.domain.parse.model.unit.UnitScanResult;
import com.cadenceai.infrastructure.parse.lexicon.StaticUnitLexicon;
import com.cadenceai.infrastructure.parse.tokenizer.TokenStreams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes number + unit expressions in a word window:
 * "3 dB", "+2 semitones", "7st", "120bpm", "20%", "50 percent", "3:2", "2x".
 *
 * A window matches only if all of its items are consumed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnitExpressionParser {

    private static final int MAX_WINDOW = 4;

    private static final Pattern ATTACHED = Pattern.compile("^([+-]?(?:\\d+(?:\\.\\d+)?|\\.\\d+))([a-z%]+)$");
    private static final Pattern RATIO = Pattern.compile("^(\\d+(?:\\.\\d+)?):(\\d+(?:\\.\\d+)?)$");

    private final NumberParser numberParser;
    private final UnitLexicon unitLexicon;

    /**
     * Parses a window of bare strings. The result carries an empty span at offset 0.
     */
    public Optional<UnitExpression> parse(List<String> window) {
        if (window == null || window.isEmpty()) {
            return Optional.empty();
        }
        List<String> items = window.stream().map(item -> item.strip().toLowerCase(Locale.ROOT)).toList();
        return parseItems(items, String.join(" ", window), new Span(0, 0));
    }

    /**
     * Greedy left-to-right scan with windows of 4 down to 1 words. Matches never overlap.
     */
    public UnitScanResult scan(List<Word> words) {
        List<UnitExpression> expressions = new ArrayList<>();
        Set<Integer> consumed = new LinkedHashSet<>();

        int i = 0;
        while (i < words.size()) {
            int matched = 0;
            for (int size = Math.min(MAX_WINDOW, words.size() - i); size >= 1 && matched == 0; size--) {
                List<Word> window = words.subList(i, i + size);
                if (!isContiguousSign(window)) continue;
                Optional<UnitExpression> expression = parseWords(window);
                if (expression.isPresent()) {
                    expressions.add(expression.get());
                    matched = size;
                }
            }
            if (matched > 0) {
                for (int k = i; k < i + matched; k++) consumed.add(k);
                i += matched;
            } else {
                i++;
            }
        }

        if (!expressions.isEmpty()) {
            log.debug("[UnitParser] {} unit expressions in {} words", expressions.size(), words.size());
        }
        return new UnitScanResult(expressions, consumed);
    }

    public Optional<UnitExpression> parseWords(List<Word> window) {
        // "1st" is an ordinal, not one semitone
        if (window.isEmpty() || window.stream().anyMatch(word -> word.type() == TokenType.ORDINAL)) {
            return Optional.empty();
        }
        Span span = Span.covering(window.stream().map(Word::span).toList());
        List<String> items = window.stream().map(Word::text).toList();
        String original = TokenStreams.surface(window);
        return parseItems(items, original, span);
    }

    private Optional<UnitExpression> parseItems(List<String> items, String original, Span span) {
        int sign = 0;
        List<String> rest = items;
        String first = items.get(0);
        if (first.equals("+") || first.equals("-")) {
            sign = first.equals("-") ? -1 : 1;
            rest = items.subList(1, items.size());
        }
        if (rest.isEmpty()) {
            return Optional.empty();
        }

        Optional<Match> match = rest.size() == 1 ? parseSingle(rest.get(0)) : parseSpaced(rest);
        final int outerSign = sign;
        return match.map(m -> toExpression(m, outerSign, original, span));
    }

    private record Match(ParsedNumber number, CanonicalUnit unit) {}

    private Optional<Match> parseSingle(String item) {
        Matcher ratio = RATIO.matcher(item);
        if (ratio.matches()) {
            double denominator = Double.parseDouble(ratio.group(2));
            if (denominator == 0) {
                return Optional.empty();
            }
            double value = Double.parseDouble(ratio.group(1)) / denominator;
            return Optional.of(new Match(new ParsedNumber(value, false, item), StaticUnitLexicon.RATIO));
        }

        Matcher attached = ATTACHED.matcher(item);
        if (!attached.matches()) {
            return Optional.empty();
        }
        Optional<ParsedNumber> number = numberParser.parse(attached.group(1));
        Optional<CanonicalUnit> unit = unitLexicon.lookupUnit(attached.group(2));
        if (number.isEmpty() || unit.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Match(number.get(), unit.get()));
    }

    private Optional<Match> parseSpaced(List<String> items) {
        if (items.size() - 1 > unitLexicon.maxAliasWords()) {
            return Optional.empty();
        }
        Optional<ParsedNumber> number = numberParser.parse(items.get(0));
        if (number.isEmpty()) {
            return Optional.empty();
        }
        String alias = String.join(" ", items.subList(1, items.size()));
        return unitLexicon.lookupUnit(alias).map(unit -> new Match(number.get(), unit));
    }

    private static UnitExpression toExpression(Match match, int outerSign, String original, Span span) {
        ParsedNumber number = match.number();
        if (outerSign != 0) {
            double magnitude = Math.abs(number.value());
            number = new ParsedNumber(outerSign * magnitude, true, (outerSign < 0 ? "-" : "+") + number.original());
        }
        return new UnitExpression(number, match.unit(), modeOf(number, match.unit()), original, span);
    }

    static UnitMode modeOf(ParsedNumber number, CanonicalUnit unit) {
        if (number.explicitSign()) return UnitMode.RELATIVE;
        if (unit.dimension() == Dimension.PERCENTAGE) return UnitMode.PERCENTAGE;
        if (unit.dimension() == Dimension.RATIO || unit.dimension() == Dimension.DIMENSIONLESS) return UnitMode.FACTOR;
        return UnitMode.ABSOLUTE;
    }

    /**
     * A separate sign word only counts when it touches the number that follows it.
     */
    private static boolean isContiguousSign(List<Word> window) {
        Word first = window.get(0);
        if (!first.is("+") && !first.is("-")) {
            return true;
        }
        return window.size() > 1 && first.span().end() == window.get(1).span().start();
    }
}
