package com.cadenceai.infrastructure.parse.reference;

import com.cadenceai.domain.parse.model.reference.NamedReference;
import com.cadenceai.domain.parse.model.reference.NamedReferenceType;
import com.cadenceai.domain.parse.model.reference.NamingOperation;
import com.cadenceai.domain.parse.model.reference.QuoteStyle;
import com.cadenceai.domain.parse.model.reference.ReferenceWarningCode;
import com.cadenceai.domain.parse.model.reference.ResolutionStrategy;
import com.cadenceai.infrastructure.parse.ParserFixtures;
import com.cadenceai.infrastructure.parse.lexicon.StaticNamingLexicon;
import com.cadenceai.infrastructure.parse.tokenizer.SpanTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NamedReferenceAnalyzerTest {

    private final SpanTokenizer tokenizer = ParserFixtures.tokenizer();
    private NamedReferenceAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new NamedReferenceAnalyzer(new StaticNamingLexicon());
    }

    private List<NamedReference> analyze(String text) {
        return analyzer.analyze(tokenizer.tokenize(text));
    }

    @Nested
    @DisplayName("Quoted names")
    class Quoted {

        @Test
        @DisplayName("called pattern picks up the entity keyword before it")
        void called_pattern() {
            List<NamedReference> references = analyze("mute the track called 'Glass Pad'");

            assertThat(references).hasSize(1);
            NamedReference reference = references.get(0);
            assertThat(reference.refId()).isEqualTo("ref:0");
            assertThat(reference.name()).isEqualTo("Glass Pad");
            assertThat(reference.type()).isEqualTo(NamedReferenceType.CALLED_PATTERN);
            assertThat(reference.quoteStyle()).isEqualTo(QuoteStyle.SINGLE);
            assertThat(reference.entityTypeHint()).isEqualTo("track");
            assertThat(reference.namingVerb()).isEqualTo("called");
            assertThat(reference.resolutionStrategy()).isEqualTo(ResolutionStrategy.EXACT_MATCH);
            assertThat(reference.surface()).isEqualTo("track called 'Glass Pad'");
            assertThat(reference.confidence()).isEqualTo(0.9);
            assertThat(reference.warnings()).isEmpty();
        }

        @Test
        @DisplayName("an entity keyword after the quote types it")
        void quoted_with_type() {
            NamedReference reference = analyze("mute the \"Glass Pad\" track").get(0);

            assertThat(reference.type()).isEqualTo(NamedReferenceType.QUOTED_WITH_TYPE);
            assertThat(reference.quoteStyle()).isEqualTo(QuoteStyle.DOUBLE);
            assertThat(reference.entityKeyword()).isEqualTo("track");
            assertThat(reference.surface()).isEqualTo("the \"Glass Pad\" track");
        }

        @Test
        @DisplayName("a naming command assigns the quoted name")
        void naming_command() {
            NamedReference reference = analyze("call it 'Warm Keys'").get(0);

            assertThat(reference.type()).isEqualTo(NamedReferenceType.NAMING_COMMAND);
            assertThat(reference.namingOperation()).isEqualTo(NamingOperation.ASSIGN_NAME);
            assertThat(reference.namingVerb()).isEqualTo("call it");
        }

        @Test
        @DisplayName("a rename with only the new name has no source")
        void rename_without_source() {
            NamedReference reference = analyze("rename to 'Hook'").get(0);

            assertThat(reference.type()).isEqualTo(NamedReferenceType.RENAMING_COMMAND);
            assertThat(reference.hasWarning(ReferenceWarningCode.RENAMING_SOURCE_MISSING)).isTrue();
        }

        @Test
        @DisplayName("an unclosed quote runs to the end of the input")
        void unclosed_quote() {
            NamedReference reference = analyze("call it 'Warm").get(0);

            assertThat(reference.name()).isEqualTo("Warm");
            assertThat(reference.hasWarning(ReferenceWarningCode.UNCLOSED_QUOTE)).isTrue();
        }

        @Test
        @DisplayName("reserved words are not names")
        void reserved_name() {
            assertThat(analyze("call it 'all'").get(0).hasWarning(ReferenceWarningCode.RESERVED_NAME)).isTrue();
        }
    }

    @Nested
    @DisplayName("Unquoted names")
    class Bare {

        @Test
        @DisplayName("a capitalized phrase alone is not a reference")
        void bare_phrase_is_not_a_name() {
            assertThat(analyze("mute Glass Pad")).isEmpty();
        }

        @Test
        @DisplayName("after a naming verb the name is taken but needs fuzzy matching")
        void bare_after_called() {
            NamedReference reference = analyze("the track called Glass Pad").get(0);

            assertThat(reference.type()).isEqualTo(NamedReferenceType.BARE_NAME);
            assertThat(reference.name()).isEqualTo("Glass Pad");
            assertThat(reference.entityTypeHint()).isEqualTo("track");
            assertThat(reference.resolutionStrategy()).isEqualTo(ResolutionStrategy.FUZZY_MATCH);
            assertThat(reference.confidence()).isEqualTo(0.6);
            assertThat(reference.hasWarning(ReferenceWarningCode.AMBIGUOUS_BARE_NAME)).isTrue();
        }

        @Test
        @DisplayName("rename ... to ... yields both names in order")
        void rename_two_names() {
            List<NamedReference> references = analyze("rename Lead to Hook");

            assertThat(references).extracting(NamedReference::name).containsExactly("Lead", "Hook");
            assertThat(references).extracting(NamedReference::refId).containsExactly("ref:0", "ref:1");
            assertThat(references).extracting(NamedReference::type)
                    .containsOnly(NamedReferenceType.RENAMING_COMMAND);
        }

        @Test
        @DisplayName("a naming verb mid-sentence is not a command")
        void not_imperative() {
            assertThat(analyze("the track name is long")).isEmpty();
        }
    }

    @Test
    @DisplayName("tags match by tag")
    void tagged_reference() {
        NamedReference reference = analyze("solo #lead").get(0);

        assertThat(reference.type()).isEqualTo(NamedReferenceType.TAGGED_REFERENCE);
        assertThat(reference.name()).isEqualTo("lead");
        assertThat(reference.resolutionStrategy()).isEqualTo(ResolutionStrategy.TAG_MATCH);
        assertThat(reference.surface()).isEqualTo("#lead");
    }
}
