package com.cadenceai.infrastructure.parse.quantifier;

import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.quantifier.CountPrecision;
import com.cadenceai.domain.parse.model.quantifier.EntityType;
import com.cadenceai.domain.parse.model.quantifier.QuantifierType;
import com.cadenceai.domain.parse.model.quantifier.QuantifierWarningCode;
import com.cadenceai.domain.parse.model.quantifier.ScopeReading;
import com.cadenceai.domain.parse.model.quantifier.SelectionPredicate;
import com.cadenceai.infrastructure.parse.ParserFixtures;
import com.cadenceai.infrastructure.parse.lexicon.StaticQuantifierLexicon;
import com.cadenceai.infrastructure.parse.unit.NumberParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QuantifierScopeAnalyzerTest {

    private QuantifierScopeAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new QuantifierScopeAnalyzer(new StaticQuantifierLexicon(), ParserFixtures.normalizer(), new NumberParser());
    }

    private List<SelectionPredicate> analyze(String text) {
        return analyzer.analyze(ParserFixtures.words(text));
    }

    @Nested
    @DisplayName("Universal quantifiers")
    class Universal {

        @Test
        @DisplayName("every reads distributively over its noun")
        void every_is_distributive() {
            List<SelectionPredicate> predicates = analyze("make every chorus brighter");

            assertThat(predicates).hasSize(1);
            SelectionPredicate predicate = predicates.get(0);
            assertThat(predicate.predicateId()).isEqualTo("sel:0");
            assertThat(predicate.type()).isEqualTo(QuantifierType.UNIVERSAL);
            assertThat(predicate.scopeReading()).isEqualTo(ScopeReading.DISTRIBUTIVE);
            assertThat(predicate.restriction().headNoun()).isEqualTo("chorus");
            assertThat(predicate.restriction().entityTypes()).containsExactly(EntityType.SECTION);
            assertThat(predicate.surface()).isEqualTo("every chorus");
            assertThat(predicate.warnings()).isEmpty();
        }

        @Test
        @DisplayName("compound nouns are headed by their last noun")
        void compound_head() {
            SelectionPredicate predicate = analyze("mute all the drum tracks").get(0);

            assertThat(predicate.scopeReading()).isEqualTo(ScopeReading.COLLECTIVE);
            assertThat(predicate.quantifier().surface()).isEqualTo("all the");
            assertThat(predicate.restriction().headNoun()).isEqualTo("track");
            assertThat(predicate.restriction().modifiers()).containsExactly("drum");
            assertThat(predicate.restriction().entityTypes()).contains(EntityType.TRACK, EntityType.LAYER);
        }

        @Test
        @DisplayName("a distributive cue after a collective universal is flagged")
        void distributive_cue() {
            SelectionPredicate predicate = analyze("compress all the drums individually").get(0);

            assertThat(predicate.hasWarning(QuantifierWarningCode.DISTRIBUTIVE_OR_COLLECTIVE)).isTrue();
        }

        @Test
        @DisplayName("a universal after its noun floats back onto it")
        void floating_quantifier() {
            SelectionPredicate predicate = analyze("mute the tracks all").get(0);

            assertThat(predicate.surface()).isEqualTo("the tracks all");
            assertThat(predicate.restriction().headNoun()).isEqualTo("track");
            assertThat(predicate.hasWarning(QuantifierWarningCode.FLOATING_QUANTIFIER)).isTrue();
        }

        @Test
        @DisplayName("a quantifier with nothing to range over reports an empty restriction")
        void empty_restriction() {
            SelectionPredicate predicate = analyze("delete all").get(0);

            assertThat(predicate.restriction().isEmpty()).isTrue();
            assertThat(predicate.hasWarning(QuantifierWarningCode.EMPTY_RESTRICTION)).isTrue();
        }
    }

    @Nested
    @DisplayName("Periodic and vague quantifiers")
    class Periodic {

        @Test
        @DisplayName("every other selects every second entity")
        void every_other() {
            SelectionPredicate predicate = analyze("double every other bar").get(0);

            assertThat(predicate.type()).isEqualTo(QuantifierType.DISTRIBUTIVE);
            assertThat(predicate.ordinalFilter().step()).isEqualTo(2);
            assertThat(predicate.ordinalFilter().offset()).isZero();
            assertThat(predicate.restriction().entityTypes()).containsExactly(EntityType.RANGE);
        }

        @Test
        @DisplayName("some stays underspecified and may be partitive")
        void some_is_underspecified() {
            SelectionPredicate predicate = analyze("change some tracks").get(0);

            assertThat(predicate.type()).isEqualTo(QuantifierType.EXISTENTIAL);
            assertThat(predicate.scopeReading()).isEqualTo(ScopeReading.UNDERSPECIFIED);
            assertThat(predicate.hasWarning(QuantifierWarningCode.SCOPE_AMBIGUITY)).isTrue();
            assertThat(predicate.hasWarning(QuantifierWarningCode.PARTITIVE_AMBIGUITY)).isTrue();
            assertThat(predicate.warnings()).filteredOn(w -> w.is(QuantifierWarningCode.SCOPE_AMBIGUITY))
                    .first().extracting(AnalysisWarning::candidates).isEqualTo(List.of("distributive", "collective"));
        }

        @Test
        @DisplayName("a degree phrase is not an existential")
        void a_bit_is_not_a_quantifier() {
            assertThat(analyze("make it a bit brighter")).isEmpty();
        }

        @Test
        @DisplayName("negative quantifiers may scope over the verb")
        void negative_scope() {
            SelectionPredicate predicate = analyze("no reverb on the vocals").get(0);

            assertThat(predicate.type()).isEqualTo(QuantifierType.NEGATIVE);
            assertThat(predicate.restriction().ppModifiers()).containsExactly("on the vocals");
            assertThat(predicate.hasWarning(QuantifierWarningCode.NEGATIVE_SCOPE_AMBIGUITY)).isTrue();
        }
    }

    @Nested
    @DisplayName("Counts")
    class Counts {

        @Test
        @DisplayName("a count modifier sets the precision")
        void exactly() {
            SelectionPredicate predicate = analyze("mute exactly 3 choruses").get(0);

            assertThat(predicate.type()).isEqualTo(QuantifierType.NUMERIC);
            assertThat(predicate.count().value()).isEqualTo(3);
            assertThat(predicate.count().precision()).isEqualTo(CountPrecision.EXACT);
            assertThat(predicate.count().unit()).isEqualTo("chorus");
            assertThat(predicate.surface()).isEqualTo("exactly 3 choruses");
        }

        @Test
        @DisplayName("number words count too")
        void at_least_two() {
            SelectionPredicate predicate = analyze("loop at least two bars").get(0);

            assertThat(predicate.count().value()).isEqualTo(2);
            assertThat(predicate.count().precision()).isEqualTo(CountPrecision.AT_LEAST);
        }

        @Test
        @DisplayName("a measurement is not a count")
        void decibels_are_not_counted() {
            assertThat(analyze("boost 3 dB")).isEmpty();
        }

        @Test
        @DisplayName("counts above the configured limit are flagged")
        void count_limit() {
            ReflectionTestUtils.setField(analyzer, "maxCount", 4);

            SelectionPredicate predicate = analyze("loop 8 bars").get(0);

            assertThat(predicate.hasWarning(QuantifierWarningCode.COUNT_EXCEEDS_AVAILABLE)).isTrue();
        }

        @Test
        @DisplayName("a count above the default limit is kept and flagged")
        void count_above_default_limit() {
            SelectionPredicate predicate = analyze("loop 20000 bars").get(0);

            assertThat(predicate.count().value()).isEqualTo(20000);
            assertThat(predicate.hasWarning(QuantifierWarningCode.COUNT_EXCEEDS_AVAILABLE)).isTrue();
        }

        @Test
        @DisplayName("a count at the default limit is not flagged")
        void count_at_default_limit() {
            SelectionPredicate predicate = analyze("loop 10000 bars").get(0);

            assertThat(predicate.hasWarning(QuantifierWarningCode.COUNT_EXCEEDS_AVAILABLE)).isFalse();
        }
    }

    @Nested
    @DisplayName("Implicit plurals")
    class Plurals {

        @Test
        @DisplayName("a definite plural selects the whole group")
        void definite_plural() {
            SelectionPredicate predicate = analyze("brighten the choruses").get(0);

            assertThat(predicate.type()).isEqualTo(QuantifierType.DEFINITE_PLURAL);
            assertThat(predicate.scopeReading()).isEqualTo(ScopeReading.COLLECTIVE);
            assertThat(predicate.restriction().headNoun()).isEqualTo("chorus");
        }

        @Test
        @DisplayName("a bare plural after the verb is generic")
        void bare_plural() {
            SelectionPredicate predicate = analyze("mute drums").get(0);

            assertThat(predicate.type()).isEqualTo(QuantifierType.BARE_PLURAL);
            assertThat(predicate.hasWarning(QuantifierWarningCode.BARE_PLURAL_GENERIC)).isTrue();
        }
    }

    @Test
    @DisplayName("predicates come back in source order with sequential ids")
    void ordering() {
        List<SelectionPredicate> predicates = analyze("mute the drums in every chorus");

        assertThat(predicates).extracting(SelectionPredicate::type)
                .containsExactly(QuantifierType.DEFINITE_PLURAL, QuantifierType.UNIVERSAL);
        assertThat(predicates).extracting(SelectionPredicate::predicateId).containsExactly("sel:0", "sel:1");
    }
}
