package com.cadenceai.infrastructure.parse.unit;

import com.cadenceai.domain.parse.model.token.Span;
import com.cadenceai.domain.parse.model.unit.Dimension;
import com.cadenceai.domain.parse.model.unit.UnitExpression;
import com.cadenceai.domain.parse.model.unit.UnitMode;
import com.cadenceai.domain.parse.model.unit.UnitScanResult;
import com.cadenceai.infrastructure.parse.ParserFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class UnitExpressionParserTest {

    private UnitExpressionParser parser;

    @BeforeEach
    void setUp() {
        parser = ParserFixtures.unitParser();
    }

    @Nested
    @DisplayName("Scanning an utterance")
    class Scan {

        @Test
        @DisplayName("spaced number and unit")
        void spaced_unit() {
            String source = "raise the vocal by 3 dB";
            UnitScanResult result = parser.scan(ParserFixtures.words(source));

            assertThat(result.expressions()).hasSize(1);
            UnitExpression expression = result.expressions().get(0);
            assertThat(expression.unit().id()).isEqualTo("decibel");
            assertThat(expression.value().value()).isEqualTo(3.0);
            assertThat(expression.mode()).isEqualTo(UnitMode.ABSOLUTE);
            assertThat(expression.span().slice(source)).isEqualTo("3 dB");
        }

        @Test
        @DisplayName("a sign touching the number makes the change relative")
        void signed_attached_unit() {
            String source = "pitch it +7st";
            UnitExpression expression = parser.scan(ParserFixtures.words(source)).expressions().get(0);

            assertThat(expression.unit().id()).isEqualTo("semitone");
            assertThat(expression.value().value()).isEqualTo(7.0);
            assertThat(expression.value().sign()).isEqualTo(1);
            assertThat(expression.mode()).isEqualTo(UnitMode.RELATIVE);
            assertThat(expression.original()).isEqualTo("+7st");
        }

        @Test
        @DisplayName("a negative shift keeps its sign")
        void negative_shift() {
            UnitExpression expression = parser.scan(ParserFixtures.words("drop it -2 semitones"))
                    .expressions().get(0);

            assertThat(expression.value().value()).isEqualTo(-2.0);
            assertThat(expression.mode()).isEqualTo(UnitMode.RELATIVE);
        }

        @Test
        @DisplayName("a detached sign is not part of the number")
        void detached_sign_ignored() {
            UnitExpression expression = parser.scan(ParserFixtures.words("pan - 30 degrees"))
                    .expressions().get(0);

            assertThat(expression.value().value()).isEqualTo(30.0);
            assertThat(expression.value().explicitSign()).isFalse();
        }

        @Test
        @DisplayName("percentages, ratios and multipliers get their own modes")
        void modes() {
            List<UnitExpression> expressions = parser.scan(ParserFixtures.words("20% wetter, ratio 3:2, 2x faster"))
                    .expressions();

            assertThat(expressions).extracting(UnitExpression::mode)
                    .containsExactly(UnitMode.PERCENTAGE, UnitMode.FACTOR, UnitMode.FACTOR);
            assertThat(expressions.get(1).value().value()).isEqualTo(1.5);
            assertThat(expressions.get(1).dimension()).isEqualTo(Dimension.RATIO);
        }

        @Test
        @DisplayName("multi-word aliases and number words")
        void multi_word_alias() {
            UnitExpression expression = parser.scan(ParserFixtures.words("shift it two half steps"))
                    .expressions().get(0);

            assertThat(expression.unit().id()).isEqualTo("semitone");
            assertThat(expression.value().value()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("ordinals are not units")
        void ordinal_is_not_a_unit() {
            UnitScanResult result = parser.scan(ParserFixtures.words("the 1st chorus"));

            assertThat(result.expressions()).isEmpty();
            assertThat(result.consumedIndices()).isEmpty();
        }

        @Test
        @DisplayName("consumed indices cover every matched word")
        void consumed_indices() {
            UnitScanResult result = parser.scan(ParserFixtures.words("add 4 bars and 120 bpm"));

            assertThat(result.expressions()).hasSize(2);
            assertThat(result.consumedIndices()).containsExactlyInAnyOrder(1, 2, 4, 5);
        }
    }

    @Nested
    @DisplayName("Parsing bare strings")
    class Bare {

        @Test
        @DisplayName("a whole window must be consumed")
        void whole_window() {
            assertThat(parser.parse(List.of("12", "semitones"))).isPresent();
            assertThat(parser.parse(List.of("12", "semitones", "up"))).isEmpty();
        }

        @Test
        @DisplayName("bare-string results carry an empty span")
        void empty_span() {
            Optional<UnitExpression> expression = parser.parse(List.of("500ms"));

            assertThat(expression).isPresent();
            assertThat(expression.get().span()).isEqualTo(new Span(0, 0));
            assertThat(expression.get().unit().id()).isEqualTo("millisecond");
        }

        @Test
        @DisplayName("a zero denominator is not a ratio")
        void zero_denominator() {
            assertThat(parser.parse(List.of("3:0"))).isEmpty();
        }

        @Test
        @DisplayName("empty and unknown input")
        void empty_and_unknown() {
            assertThat(parser.parse(List.of())).isEmpty();
            assertThat(parser.parse(List.of("3", "bananas"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Converting")
    class Convert {

        private final UnitConverter converter = new UnitConverter();

        @Test
        @DisplayName("within a dimension through its base unit")
        void same_dimension() {
            UnitExpression bars = parser.parse(List.of("2", "bars")).orElseThrow();
            UnitExpression beat = parser.parse(List.of("1", "beat")).orElseThrow();

            assertThat(converter.convert(bars, beat.unit()).getAsDouble()).isEqualTo(8.0);
        }

        @Test
        @DisplayName("milliseconds to seconds")
        void time() {
            UnitExpression ms = parser.parse(List.of("250", "ms")).orElseThrow();
            UnitExpression second = parser.parse(List.of("1", "second")).orElseThrow();

            assertThat(converter.convert(ms, second.unit()).getAsDouble()).isCloseTo(0.25, within(1e-9));
        }

        @Test
        @DisplayName("across dimensions there is no answer")
        void different_dimensions() {
            UnitExpression db = parser.parse(List.of("3", "db")).orElseThrow();
            UnitExpression hz = parser.parse(List.of("100", "hz")).orElseThrow();

            assertThat(converter.convert(db, hz.unit())).isEmpty();
        }
    }
}
