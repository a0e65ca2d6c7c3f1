package com.cadenceai.application.parse;

import com.cadenceai.application.parse.exception.BatchTooLargeException;
import com.cadenceai.application.parse.exception.InputTooLongException;
import com.cadenceai.domain.parse.lexicon.EntityDirectory;
import com.cadenceai.domain.parse.lexicon.KnownEntity;
import com.cadenceai.domain.parse.model.UtteranceAnalysis;
import com.cadenceai.domain.parse.model.coordination.CoordinationAnalysis;
import com.cadenceai.domain.parse.model.locality.LocalityInteraction;
import com.cadenceai.domain.parse.model.token.LemmaResult;
import com.cadenceai.domain.parse.model.token.TokenStream;
import com.cadenceai.infrastructure.parse.AnalysisFailedException;
import com.cadenceai.infrastructure.parse.ParserFixtures;
import com.cadenceai.infrastructure.parse.morphology.MorphologicalNormalizer;
import com.cadenceai.infrastructure.parse.pipeline.UtteranceAnalysisPipeline;
import com.cadenceai.infrastructure.parse.tokenizer.SpanTokenizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UtteranceParseAppServiceTest {

    @Mock
    private UtteranceAnalysisPipeline pipeline;

    @Mock
    private SpanTokenizer tokenizer;

    private ExecutorService executor;
    private UtteranceParseAppService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        MorphologicalNormalizer normalizer = ParserFixtures.normalizer();
        service = new UtteranceParseAppService(pipeline, tokenizer, normalizer, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static UtteranceAnalysis analysisOf(String text) {
        TokenStream tokens = ParserFixtures.tokenizer().tokenize(text);
        return new UtteranceAnalysis(tokens, List.of(), List.of(), List.of(), CoordinationAnalysis.EMPTY,
                List.of(), List.of(), List.of(), List.of(), LocalityInteraction.NONE);
    }

    @Test
    @DisplayName("known entities are handed to the pipeline as a directory")
    void parse_with_entities() {
        UtteranceAnalysis expected = analysisOf("mute 'Glass Pad'");
        ArgumentCaptor<EntityDirectory> directory = ArgumentCaptor.forClass(EntityDirectory.class);
        when(pipeline.analyze(eq("mute 'Glass Pad'"), directory.capture())).thenReturn(expected);

        UtteranceAnalysis result = service.parse("mute 'Glass Pad'",
                List.of(new KnownEntity("Glass Pad", "track", Set.of())));

        assertThat(result).isSameAs(expected);
        assertThat(directory.getValue().entities()).extracting(KnownEntity::name).containsExactly("Glass Pad");
    }

    @Test
    @DisplayName("without entities no directory is built")
    void parse_without_entities() {
        UtteranceAnalysis expected = analysisOf("mute it");
        when(pipeline.analyze(eq("mute it"), isNull())).thenReturn(expected);

        assertThat(service.parse("mute it", null)).isSameAs(expected);
    }

    @Test
    @DisplayName("input over the configured length is rejected before analysis")
    void input_too_long() {
        ReflectionTestUtils.setField(service, "maxInputLength", 10);

        assertThatThrownBy(() -> service.parse("make every chorus brighter", null))
                .isInstanceOf(InputTooLongException.class)
                .hasMessageContaining("at most 10");
        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("batch results come back in input order")
    void batch_keeps_order() {
        UtteranceAnalysis first = analysisOf("mute the drums");
        UtteranceAnalysis second = analysisOf("add reverb");
        when(pipeline.analyze("mute the drums")).thenReturn(first);
        when(pipeline.analyze("add reverb")).thenReturn(second);

        List<UtteranceAnalysis> results = service.parseBatch(List.of("mute the drums", "add reverb"));

        assertThat(results).containsExactly(first, second);
    }

    @Test
    @DisplayName("an oversized batch is rejected")
    void batch_too_large() {
        ReflectionTestUtils.setField(service, "maxBatchSize", 2);

        assertThatThrownBy(() -> service.parseBatch(List.of("a", "b", "c")))
                .isInstanceOf(BatchTooLargeException.class);
        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("a failing worker surfaces as an analysis failure with its cause")
    void batch_worker_failure() {
        when(pipeline.analyze(anyString())).thenThrow(new IllegalStateException("lexicon missing"));

        assertThatThrownBy(() -> service.parseBatch(List.of("mute it")))
                .isInstanceOf(AnalysisFailedException.class)
                .hasMessageContaining("lexicon missing")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("tokenize delegates to the tokenizer after the length check")
    void tokenize_delegates() {
        TokenStream stream = ParserFixtures.tokenizer().tokenize("mute it");
        when(tokenizer.tokenize("mute it")).thenReturn(stream);

        assertThat(service.tokenize("mute it")).isSameAs(stream);
        verify(tokenizer).tokenize("mute it");
    }

    @Test
    @DisplayName("lemmatize keeps word order")
    void lemmatize() {
        assertThat(service.lemmatize(List.of("muted", "brighter")))
                .extracting(LemmaResult::lemma)
                .containsExactly("mute", "bright");
    }
}
