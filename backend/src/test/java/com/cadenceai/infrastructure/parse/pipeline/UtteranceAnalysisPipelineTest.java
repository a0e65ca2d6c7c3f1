package com.cadenceai.infrastructure.parse.pipeline;

import com.cadenceai.domain.parse.lexicon.EntityDirectory;
import com.cadenceai.domain.parse.lexicon.KnownEntity;
import com.cadenceai.domain.parse.model.UtteranceAnalysis;
import com.cadenceai.domain.parse.model.quantifier.QuantifierType;
import com.cadenceai.domain.parse.model.reference.ResolutionStatus;
import com.cadenceai.domain.parse.model.time.TimeRange;
import com.cadenceai.domain.parse.model.token.LemmaResult;
import com.cadenceai.infrastructure.parse.ParserFixtures;
import com.cadenceai.infrastructure.parse.coordination.CoordinationAnalyzer;
import com.cadenceai.infrastructure.parse.lexicon.StaticConjunctionLexicon;
import com.cadenceai.infrastructure.parse.lexicon.StaticLocalityLexicon;
import com.cadenceai.infrastructure.parse.lexicon.StaticNamingLexicon;
import com.cadenceai.infrastructure.parse.lexicon.StaticQuantifierLexicon;
import com.cadenceai.infrastructure.parse.lexicon.StaticSectionLexicon;
import com.cadenceai.infrastructure.parse.lexicon.StaticWordClassLexicon;
import com.cadenceai.infrastructure.parse.locality.EditLocalityAnalyzer;
import com.cadenceai.infrastructure.parse.locality.LocalityInteractionAnalyzer;
import com.cadenceai.infrastructure.parse.morphology.MorphologicalNormalizer;
import com.cadenceai.infrastructure.parse.quantifier.QuantifierScopeAnalyzer;
import com.cadenceai.infrastructure.parse.reference.NameResolver;
import com.cadenceai.infrastructure.parse.reference.NamedReferenceAnalyzer;
import com.cadenceai.infrastructure.parse.time.TimeExpressionAnalyzer;
import com.cadenceai.infrastructure.parse.unit.NumberParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class UtteranceAnalysisPipelineTest {

    private UtteranceAnalysisPipeline pipeline;
    private EntityDirectory directory;

    @BeforeEach
    void setUp() {
        NumberParser numberParser = new NumberParser();
        MorphologicalNormalizer normalizer = ParserFixtures.normalizer();

        pipeline = new UtteranceAnalysisPipeline(
                ParserFixtures.tokenizer(),
                normalizer,
                ParserFixtures.unitParser(),
                new QuantifierScopeAnalyzer(new StaticQuantifierLexicon(), normalizer, numberParser),
                new CoordinationAnalyzer(new StaticConjunctionLexicon(), new StaticWordClassLexicon(), normalizer),
                new TimeExpressionAnalyzer(new StaticSectionLexicon(), numberParser),
                new NamedReferenceAnalyzer(new StaticNamingLexicon()),
                new NameResolver(),
                new EditLocalityAnalyzer(new StaticLocalityLexicon(), ParserFixtures.unitParser(), numberParser),
                new LocalityInteractionAnalyzer()
        );
        directory = EntityDirectory.of(List.of(new KnownEntity("Glass Pad", "track", Set.of())));
    }

    @Test
    @DisplayName("each stage sees the same words")
    void stages_share_words() {
        UtteranceAnalysis analysis = pipeline.analyze("make every chorus brighter");

        assertThat(analysis.lemmas()).hasSize(4);
        assertThat(analysis.lemmas()).extracting(LemmaResult::original)
                .containsExactly("make", "every", "chorus", "brighter");
        assertThat(analysis.lemmas().get(3).lemma()).isEqualTo("bright");
        assertThat(analysis.selections()).singleElement()
                .satisfies(s -> assertThat(s.type()).isEqualTo(QuantifierType.UNIVERSAL));
        assertThat(analysis.timeExpressions()).singleElement()
                .satisfies(t -> assertThat(t.range()).isEqualTo(TimeRange.Section.of("chorus")));
        assertThat(analysis.units()).isEmpty();
        assertThat(analysis.coordination().coordinations()).isEmpty();
        assertThat(analysis.warningCount()).isZero();
    }

    @Test
    @DisplayName("quoted names resolve against the supplied entities")
    void resolves_names() {
        UtteranceAnalysis analysis = pipeline.analyze("raise the track called 'Glass Pad' by 3 dB", directory);

        assertThat(analysis.units()).singleElement()
                .satisfies(u -> assertThat(u.unit().id()).isEqualTo("decibel"));
        assertThat(analysis.references()).hasSize(1);
        assertThat(analysis.resolutions()).singleElement()
                .satisfies(r -> assertThat(r.status()).isEqualTo(ResolutionStatus.RESOLVED));
    }

    @Test
    @DisplayName("an unknown quoted name is reported, not approximated")
    void unknown_quoted_name() {
        UtteranceAnalysis analysis = pipeline.analyze("solo the track called 'Glass Pads'", directory);

        assertThat(analysis.resolutions()).singleElement()
                .satisfies(r -> assertThat(r.status()).isEqualTo(ResolutionStatus.NOT_FOUND));
        assertThat(analysis.warningCount()).isPositive();
    }

    @Test
    @DisplayName("without a directory names stay unresolved")
    void no_directory() {
        UtteranceAnalysis analysis = pipeline.analyze("raise the track called 'Glass Pad'");

        assertThat(analysis.references()).hasSize(1);
        assertThat(analysis.resolutions()).isEmpty();
    }

    @Test
    @DisplayName("locality markers are combined after scanning")
    void locality_interaction() {
        UtteranceAnalysis analysis = pipeline.analyze("just mute the bass completely");

        assertThat(analysis.locality()).hasSize(2);
        assertThat(analysis.localityInteraction().hasConflicts()).isTrue();
    }

    @Test
    @DisplayName("coordination runs alongside the other analyzers")
    void coordination() {
        UtteranceAnalysis analysis = pipeline.analyze("add reverb and delay for 4 bars");

        assertThat(analysis.coordination().coordinations()).hasSize(1);
        assertThat(analysis.timeExpressions()).hasSize(1);
    }

    @Test
    @DisplayName("empty input gives an empty analysis")
    void empty_input() {
        UtteranceAnalysis analysis = pipeline.analyze("");

        assertThat(analysis.tokens().tokens()).isEmpty();
        assertThat(analysis.lemmas()).isEmpty();
        assertThat(analysis.selections()).isEmpty();
        assertThat(analysis.references()).isEmpty();
        assertThat(analysis.warningCount()).isZero();
    }
}
