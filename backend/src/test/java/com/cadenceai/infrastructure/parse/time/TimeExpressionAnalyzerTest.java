package com.cadenceai.infrastructure.parse.time;

import com.cadenceai.domain.parse.model.time.DurationUnit;
import com.cadenceai.domain.parse.model.time.MusicalPosition;
import com.cadenceai.domain.parse.model.time.PositionAnchor;
import com.cadenceai.domain.parse.model.time.TemporalRelation;
import com.cadenceai.domain.parse.model.time.TimeExpression;
import com.cadenceai.domain.parse.model.time.TimeRange;
import com.cadenceai.domain.parse.model.time.TimeWarningCode;
import com.cadenceai.infrastructure.parse.ParserFixtures;
import com.cadenceai.infrastructure.parse.lexicon.StaticSectionLexicon;
import com.cadenceai.infrastructure.parse.unit.NumberParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimeExpressionAnalyzerTest {

    private TimeExpressionAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new TimeExpressionAnalyzer(new StaticSectionLexicon(), new NumberParser());
    }

    private List<TimeExpression> scan(String text) {
        return analyzer.scan(ParserFixtures.words(text));
    }

    private TimeExpression only(String text) {
        List<TimeExpression> expressions = scan(text);
        assertThat(expressions).hasSize(1);
        return expressions.get(0);
    }

    @Nested
    @DisplayName("Bar ranges")
    class Ranges {

        @Test
        @DisplayName("from bar to bar")
        void from_to() {
            TimeExpression expression = only("loop from bar 8 to bar 16");

            assertThat(expression.range()).isEqualTo(
                    new TimeRange.Absolute(MusicalPosition.ofBar(8), MusicalPosition.ofBar(16)));
            assertThat(expression.surface()).isEqualTo("from bar 8 to bar 16");
            assertThat(expression.wordCount()).isEqualTo(6);
            assertThat(expression.confidence()).isEqualTo(0.8);
            assertThat(expression.warnings()).isEmpty();
        }

        @Test
        @DisplayName("the closing bar may be a bare number")
        void bare_end_number() {
            TimeExpression expression = only("from bar 8 to 16");

            assertThat(expression.range()).isEqualTo(
                    new TimeRange.Absolute(MusicalPosition.ofBar(8), MusicalPosition.ofBar(16)));
        }

        @Test
        @DisplayName("a backwards range is reported")
        void backwards() {
            TimeExpression expression = only("from bar 16 to bar 8");

            assertThat(expression.hasWarning(TimeWarningCode.CONFLICTING_REFERENCES)).isTrue();
        }

        @Test
        @DisplayName("between ... and")
        void between() {
            TimeExpression expression = only("between bar 4 and bar 8");

            assertThat(expression.range()).isEqualTo(
                    new TimeRange.Absolute(MusicalPosition.ofBar(4), MusicalPosition.ofBar(8)));
            assertThat(expression.confidence()).isEqualTo(0.7);
        }

        @Test
        @DisplayName("a start without an end reads as since")
        void incomplete_range() {
            TimeExpression expression = only("from the verse");

            assertThat(expression.range()).isEqualTo(
                    new TimeRange.Relative(TemporalRelation.SINCE, TimeRange.Section.of("verse")));
            assertThat(expression.hasWarning(TimeWarningCode.INCOMPLETE_RANGE)).isTrue();
            assertThat(expression.confidence()).isEqualTo(0.6);
        }

        @Test
        @DisplayName("beats past the bar length are out of range")
        void beat_out_of_range() {
            TimeExpression expression = only("at bar 5 beat 20");

            assertThat(expression.range()).isEqualTo(
                    new TimeRange.Point(MusicalPosition.of(5, 20), null, null));
            assertThat(expression.hasWarning(TimeWarningCode.BEAT_OUT_OF_RANGE)).isTrue();
        }
    }

    @Nested
    @DisplayName("Sections")
    class Sections {

        @Test
        @DisplayName("an ordinal picks one instance")
        void ordinal_section() {
            TimeExpression expression = only("brighten the second verse");

            assertThat(expression.range()).isEqualTo(TimeRange.Section.nth("verse", 2));
            assertThat(expression.surface()).isEqualTo("the second verse");
            assertThat(expression.warnings()).isEmpty();
        }

        @Test
        @DisplayName("a digit ordinal picks one instance")
        void digit_ordinal_section() {
            assertThat(only("brighten the 3rd verse").range()).isEqualTo(TimeRange.Section.nth("verse", 3));
        }

        @Test
        @DisplayName("an ordinal too large for a count is not taken as one")
        void oversized_ordinal() {
            List<TimeExpression> expressions = scan("mute the 12345678901st chorus");

            assertThat(expressions).extracting(TimeExpression::range)
                    .filteredOn(TimeRange.Section.class::isInstance)
                    .allSatisfy(range -> assertThat(((TimeRange.Section) range).ordinal()).isNull());
        }

        @Test
        @DisplayName("a repeating section without an ordinal asks which one")
        void missing_ordinal() {
            TimeExpression expression = only("add reverb in the chorus");

            assertThat(expression.range()).isEqualTo(TimeRange.Section.of("chorus"));
            assertThat(expression.warnings()).filteredOn(w -> w.is(TimeWarningCode.MISSING_ORDINAL))
                    .singleElement()
                    .satisfies(w -> assertThat(w.candidates()).contains("first chorus", "every chorus"));
        }

        @Test
        @DisplayName("a quantified section is not missing its ordinal")
        void quantified_section() {
            TimeExpression expression = only("brighten every chorus");

            assertThat(expression.surface()).isEqualTo("chorus");
            assertThat(expression.warnings()).isEmpty();
        }

        @Test
        @DisplayName("last counts from the end")
        void before_last() {
            TimeExpression expression = only("fade in before the last chorus");

            assertThat(expression.range()).isEqualTo(new TimeRange.Relative(TemporalRelation.BEFORE,
                    new TimeRange.Section("chorus", null, true, 0)));
        }

        @Test
        @DisplayName("section words that are everyday words are flagged")
        void ambiguous_section_word() {
            TimeExpression expression = only("make the drop louder");

            assertThat(expression.range()).isEqualTo(TimeRange.Section.of("breakdown"));
            assertThat(expression.hasWarning(TimeWarningCode.AMBIGUOUS_SECTION)).isTrue();
        }

        @Test
        @DisplayName("a leading command verb is not a section")
        void solo_is_a_command() {
            assertThat(scan("solo the drums")).isEmpty();
        }

        @Test
        @DisplayName("a section followed by a bar range becomes an intersection")
        void section_and_bars() {
            TimeExpression expression = only("in the chorus from bar 8 to 16");

            assertThat(expression.range()).isInstanceOfSatisfying(TimeRange.Composite.class, composite -> {
                assertThat(composite.combination()).isEqualTo(TimeRange.Combination.INTERSECTION);
                assertThat(composite.components()).containsExactly(TimeRange.Section.of("chorus"),
                        new TimeRange.Absolute(MusicalPosition.ofBar(8), MusicalPosition.ofBar(16)));
            });
            assertThat(expression.surface()).isEqualTo("in the chorus from bar 8 to 16");
        }
    }

    @Nested
    @DisplayName("Durations, repetitions and the whole song")
    class Other {

        @Test
        @DisplayName("for N bars")
        void duration() {
            TimeExpression expression = only("loop it for 4 bars");

            assertThat(expression.range()).isEqualTo(new TimeRange.Duration(4.0, DurationUnit.BAR, null));
        }

        @Test
        @DisplayName("a duration may be anchored to a start bar")
        void anchored_duration() {
            TimeExpression expression = analyzer.parse(ParserFixtures.words("for 2 bars from bar 9")).orElseThrow();

            assertThat(expression.range()).isEqualTo(new TimeRange.Duration(2.0, DurationUnit.BAR,
                    new TimeRange.Point(MusicalPosition.ofBar(9), null, null)));
        }

        @Test
        @DisplayName("every other bar")
        void every_other() {
            TimeExpression expression = only("mute every other bar");

            assertThat(expression.range()).isEqualTo(new TimeRange.Repetition(2, DurationUnit.BAR, true, null));
        }

        @Test
        @DisplayName("the end of a section")
        void end_of_section() {
            TimeExpression expression = only("at the end of the bridge");

            assertThat(expression.range()).isEqualTo(
                    new TimeRange.Point(null, PositionAnchor.END, TimeRange.Section.of("bridge")));
        }

        @Test
        @DisplayName("whole-song phrases")
        void whole_song() {
            assertThat(only("widen it everywhere").range()).isEqualTo(new TimeRange.Whole("everywhere"));
            assertThat(only("compress across the whole track").range())
                    .isEqualTo(new TimeRange.Whole("the whole track"));
        }

        @Test
        @DisplayName("parse needs the expression at the start of the window")
        void parse_at_start() {
            assertThat(analyzer.parse(ParserFixtures.words("raise it for 4 bars"))).isEmpty();
            assertThat(analyzer.parse(List.of())).isEmpty();
        }
    }
}
