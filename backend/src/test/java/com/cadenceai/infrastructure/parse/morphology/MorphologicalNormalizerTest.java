package com.cadenceai.infrastructure.parse.morphology;

import com.cadenceai.domain.parse.model.token.InflectionType;
import com.cadenceai.domain.parse.model.token.LemmaResult;
import com.cadenceai.domain.parse.model.token.WordClass;
import com.cadenceai.infrastructure.parse.ParserFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MorphologicalNormalizerTest {

    private MorphologicalNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = ParserFixtures.normalizer();
    }

    @Nested
    @DisplayName("Table lookups")
    class Tables {

        @ParameterizedTest(name = "{0} → {1} ({2})")
        @CsvSource({
                "brighter, bright, COMPARATIVE",
                "darkest, dark, SUPERLATIVE",
                "got, get, PAST_TENSE",
                "muting, mute, PRESENT_PARTICIPLE",
                "copies, copy, THIRD_PERSON_S",
                "warmth, warm, NOMINALIZATION"
        })
        void resolves_domain_forms(String word, String lemma, InflectionType inflection) {
            LemmaResult result = normalizer.lemmatize(word);

            assertThat(result.lemma()).isEqualTo(lemma);
            assertThat(result.inflection()).isEqualTo(inflection);
            assertThat(result.fromTable()).isTrue();
            assertThat(result.rule()).isNull();
        }

        @Test
        @DisplayName("a form filling several cells takes the first one")
        void first_cell_wins() {
            LemmaResult result = normalizer.lemmatize("set");

            assertThat(result.inflection()).isEqualTo(InflectionType.BASE);
            assertThat(result.isInflected()).isFalse();
        }

        @Test
        @DisplayName("lookup is case-insensitive and keeps the original")
        void keeps_original_case() {
            LemmaResult result = normalizer.lemmatize("Muted");

            assertThat(result.lemma()).isEqualTo("mute");
            assertThat(result.original()).isEqualTo("Muted");
            assertThat(result.wordClass()).isEqualTo(WordClass.VERB);
        }
    }

    @Nested
    @DisplayName("Suffix rules")
    class Rules {

        @ParameterizedTest(name = "{0} → {1}")
        @CsvSource({
                "reverbing, reverb, PRESENT_PARTICIPLE",
                "crisper, crisp, COMPARATIVE",
                "boxes, box, THIRD_PERSON_S",
                "echoes, echo, THIRD_PERSON_S",
                "vibes, vibe, THIRD_PERSON_S",
                "melodies, melody, THIRD_PERSON_S",
                "aggressively, aggressive, ADVERBIAL"
        })
        void strips_suffixes(String word, String lemma, InflectionType inflection) {
            LemmaResult result = normalizer.lemmatize(word);

            assertThat(result.lemma()).isEqualTo(lemma);
            assertThat(result.inflection()).isEqualTo(inflection);
            assertThat(result.fromTable()).isFalse();
            assertThat(result.rule()).isNotNull();
        }

        @Test
        @DisplayName("nouns that merely end in -er are left alone")
        void non_comparatives_are_base() {
            LemmaResult result = normalizer.lemmatize("fader");

            assertThat(result.lemma()).isEqualTo("fader");
            assertThat(result.inflection()).isEqualTo(InflectionType.BASE);
        }

        @Test
        @DisplayName("a double s is not a plural")
        void double_s_is_base() {
            assertThat(normalizer.lemmatize("glass").lemma()).isEqualTo("glass");
        }
    }

    @Test
    @DisplayName("null and blank words come back as empty base forms")
    void total_on_null() {
        LemmaResult result = normalizer.lemmatize(null);

        assertThat(result.lemma()).isEmpty();
        assertThat(result.inflection()).isEqualTo(InflectionType.BASE);
        assertThat(normalizer.lemmatize("   ").lemma()).isEmpty();
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"brighter", "muted", "choruses", "got", "warmth", "reverb", "Louder", "compressing"})
    @DisplayName("repeated lemmatization gives equal results")
    void lemmatize_is_deterministic(String word) {
        LemmaResult first = normalizer.lemmatize(word);

        assertThat(normalizer.lemmatize(word)).isEqualTo(first);
        assertThat(ParserFixtures.normalizer().lemmatize(word)).isEqualTo(first);
        assertThat(normalizer.lemmatizeAll(List.of(word, word))).containsOnly(first);
    }

    @Test
    @DisplayName("batch lemmatization keeps input order")
    void lemmatize_all_keeps_order() {
        List<LemmaResult> results = normalizer.lemmatizeAll(List.of("added", "louder", "drums"));

        assertThat(results).extracting(LemmaResult::lemma).containsExactly("add", "loud", "drum");
    }

    @Test
    @DisplayName("format names the inflection and where it came from")
    void format_describes_result() {
        assertThat(normalizer.format(normalizer.lemmatize("brighter")))
                .isEqualTo("\"brighter\" → \"bright\" (comparative, adjective, table)");
        assertThat(normalizer.format(normalizer.lemmatize("reverb"))).isEqualTo("\"reverb\" = base form");
    }
}
