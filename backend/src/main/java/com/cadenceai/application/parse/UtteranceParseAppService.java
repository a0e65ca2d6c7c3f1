package com.cadenceai.application.parse;

import com.cadenceai.application.parse.exception.BatchTooLargeException;
import com.cadenceai.application.parse.exception.InputTooLongException;
import com.cadenceai.domain.parse.lexicon.EntityDirectory;
import com.cadenceai.domain.parse.lexicon.KnownEntity;
import com.cadenceai.domain.parse.model.UtteranceAnalysis;
import com.cadenceai.domain.parse.model.token.LemmaResult;
import com.cadenceai.domain.parse.model.token.TokenStream;
import com.cadenceai.infrastructure.parse.AnalysisFailedException;
import com.cadenceai.infrastructure.parse.morphology.MorphologicalNormalizer;
import com.cadenceai.infrastructure.parse.pipeline.UtteranceAnalysisPipeline;
import com.cadenceai.infrastructure.parse.tokenizer.SpanTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Slf4j
@Service
@RequiredArgsConstructor
public class UtteranceParseAppService {

    private final UtteranceAnalysisPipeline pipeline;
    private final SpanTokenizer tokenizer;
    private final MorphologicalNormalizer normalizer;
    private final ExecutorService analysisExecutor;

    @Value("${parser.max-input-length:2000}")
    private int maxInputLength = 2000;

    @Value("${parser.batch.max-size:100}")
    private int maxBatchSize = 100;

    /**
     * Full analysis of one utterance. Known entities, when given, are used to resolve quoted names.
     */
    public UtteranceAnalysis parse(String text, List<KnownEntity> knownEntities) {
        validateLength(text);
        EntityDirectory directory = knownEntities == null ? null : EntityDirectory.of(knownEntities);
        return pipeline.analyze(text, directory);
    }

    /**
     * Analyzes each utterance on the analysis executor. Results come back in input order.
     */
    public List<UtteranceAnalysis> parseBatch(List<String> texts) {
        if (texts.size() > maxBatchSize) {
            throw new BatchTooLargeException(texts.size(), maxBatchSize);
        }
        texts.forEach(this::validateLength);

        long start = System.currentTimeMillis();
        List<CompletableFuture<UtteranceAnalysis>> futures = texts.stream()
                .map(text -> CompletableFuture.supplyAsync(() -> pipeline.analyze(text), analysisExecutor))
                .toList();

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AnalysisFailedException("Batch analysis failed: " + cause.getMessage(), cause);
        }

        List<UtteranceAnalysis> results = futures.stream().map(CompletableFuture::join).toList();
        log.info("[ParseService] Batch of {} analyzed in {}ms", results.size(), System.currentTimeMillis() - start);
        return results;
    }

    public TokenStream tokenize(String text) {
        validateLength(text);
        return tokenizer.tokenize(text);
    }

    public List<LemmaResult> lemmatize(List<String> words) {
        return normalizer.lemmatizeAll(words);
    }

    private void validateLength(String text) {
        if (text != null && text.length() > maxInputLength) {
            throw new InputTooLongException(text.length(), maxInputLength);
        }
    }
}
