package com.cadenceai.infrastructure.parse.unit;

import com.cadenceai.domain.parse.model.unit.ParsedNumber;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses decimal numbers ("3", "+0.5", "-12") and English number words ("twelve", "twenty-five",
 * "half").
 */
@Component
public class NumberParser {

    private static final Pattern DECIMAL = Pattern.compile("^[+-]?(\\d+(\\.\\d+)?|\\.\\d+)$");

    private static final Map<String, Integer> UNITS_AND_TEENS = Map.ofEntries(
            Map.entry("zero", 0), Map.entry("one", 1), Map.entry("two", 2), Map.entry("three", 3),
            Map.entry("four", 4), Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7),
            Map.entry("eight", 8), Map.entry("nine", 9), Map.entry("ten", 10), Map.entry("eleven", 11),
            Map.entry("twelve", 12), Map.entry("thirteen", 13), Map.entry("fourteen", 14),
            Map.entry("fifteen", 15), Map.entry("sixteen", 16), Map.entry("seventeen", 17),
            Map.entry("eighteen", 18), Map.entry("nineteen", 19), Map.entry("twenty", 20)
    );

    private static final Map<String, Integer> DECADES = Map.of(
            "twenty", 20, "thirty", 30, "forty", 40, "fifty", 50,
            "sixty", 60, "seventy", 70, "eighty", 80, "ninety", 90
    );

    private static final Map<String, Double> OTHER_WORDS = Map.of(
            "half", 0.5,
            "dozen", 12.0,
            "hundred", 100.0
    );

    public Optional<ParsedNumber> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.strip();
        if (DECIMAL.matcher(trimmed).matches()) {
            boolean explicitSign = trimmed.charAt(0) == '+' || trimmed.charAt(0) == '-';
            return Optional.of(new ParsedNumber(Double.parseDouble(trimmed), explicitSign, trimmed));
        }
        return parseWord(trimmed.toLowerCase(Locale.ROOT))
                .map(value -> new ParsedNumber(value, false, trimmed));
    }

    /**
     * Integer value of a number word or digit string, used for counts and ordinals.
     */
    public Optional<Integer> parseInteger(String text) {
        return parse(text)
                .filter(number -> !number.explicitSign())
                .map(ParsedNumber::value)
                .filter(value -> value == Math.rint(value) && value <= Integer.MAX_VALUE)
                .map(Double::intValue);
    }

    public boolean isNumber(String text) {
        return parse(text).isPresent();
    }

    private static Optional<Double> parseWord(String word) {
        Integer simple = UNITS_AND_TEENS.get(word);
        if (simple != null) return Optional.of(simple.doubleValue());
        Integer decade = DECADES.get(word);
        if (decade != null) return Optional.of(decade.doubleValue());
        Double other = OTHER_WORDS.get(word);
        if (other != null) return Optional.of(other);

        // "twenty-five"
        int dash = word.indexOf('-');
        if (dash > 0) {
            Integer tens = DECADES.get(word.substring(0, dash));
            Integer ones = UNITS_AND_TEENS.get(word.substring(dash + 1));
            if (tens != null && ones != null && ones >= 1 && ones <= 9) {
                return Optional.of((double) (tens + ones));
            }
        }
        return Optional.empty();
    }
}
