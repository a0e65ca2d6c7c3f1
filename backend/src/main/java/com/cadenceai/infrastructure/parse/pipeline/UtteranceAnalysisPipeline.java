package com.cadenceai.infrastructure.parse.pipeline;

import com.cadenceai.domain.parse.lexicon.EntityDirectory;
import com.cadenceai.domain.parse.model.UtteranceAnalysis;
import com.cadenceai.domain.parse.model.reference.NameResolution;
import com.cadenceai.domain.parse.model.reference.NamedReference;
import com.cadenceai.domain.parse.model.reference.ResolutionStatus;
import com.cadenceai.domain.parse.model.token.Word;
import com.cadenceai.infrastructure.parse.coordination.CoordinationAnalyzer;
import com.cadenceai.infrastructure.parse.locality.EditLocalityAnalyzer;
import com.cadenceai.infrastructure.parse.locality.LocalityInteractionAnalyzer;
import com.cadenceai.infrastructure.parse.morphology.MorphologicalNormalizer;
import com.cadenceai.infrastructure.parse.quantifier.QuantifierScopeAnalyzer;
import com.cadenceai.infrastructure.parse.reference.NameResolver;
import com.cadenceai.infrastructure.parse.reference.NamedReferenceAnalyzer;
import com.cadenceai.infrastructure.parse.time.TimeExpressionAnalyzer;
import com.cadenceai.infrastructure.parse.tokenizer.SpanTokenizer;
import com.cadenceai.infrastructure.parse.tokenizer.TokenStreams;
import com.cadenceai.infrastructure.parse.unit.UnitExpressionParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs every parsing stage over one utterance:
 * <p>
 * tokenize → word view → lemmas → units → grammar analyzers → locality interactions → name resolution
 * </p>
 * The grammar analyzers are independent of each other; each sees the same word view.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UtteranceAnalysisPipeline {

    private final SpanTokenizer tokenizer;
    private final MorphologicalNormalizer normalizer;
    private final UnitExpressionParser unitParser;
    private final QuantifierScopeAnalyzer quantifierAnalyzer;
    private final CoordinationAnalyzer coordinationAnalyzer;
    private final TimeExpressionAnalyzer timeAnalyzer;
    private final NamedReferenceAnalyzer referenceAnalyzer;
    private final NameResolver nameResolver;
    private final EditLocalityAnalyzer localityAnalyzer;
    private final LocalityInteractionAnalyzer interactionAnalyzer;

    public UtteranceAnalysis analyze(String text) {
        return analyze(text, null);
    }

    /**
     * @param directory known project entities; when null, references are left unresolved
     */
    public UtteranceAnalysis analyze(String text, EntityDirectory directory) {
        long start = System.currentTimeMillis();

        UtteranceAnalysisContext ctx = new UtteranceAnalysisContext();
        ctx.setText(text);
        ctx.setDirectory(directory);

        // 1. Tokens and lemmas
        tokenize(ctx);

        // 2. Units
        ctx.setUnits(unitParser.scan(ctx.getWords()));

        // 3. Grammar
        analyzeGrammar(ctx);

        // 4. Names
        if (directory != null) {
            resolveNames(ctx);
        }

        UtteranceAnalysis analysis = ctx.toAnalysis();
        log.info("[Pipeline] {} tokens, {} units, {} selections, {} coordinations, {} time, {} names, {} locality, {} warnings ({}ms)",
                analysis.tokens().tokens().size(),
                analysis.units().size(),
                analysis.selections().size(),
                analysis.coordination().coordinations().size(),
                analysis.timeExpressions().size(),
                analysis.references().size(),
                analysis.locality().size(),
                analysis.warningCount(),
                System.currentTimeMillis() - start);
        return analysis;
    }

    // ===== Stages =====

    private void tokenize(UtteranceAnalysisContext ctx) {
        ctx.setTokens(tokenizer.tokenize(ctx.getText()));
        ctx.setWords(TokenStreams.words(ctx.getTokens()));
        ctx.setLemmas(normalizer.lemmatizeAll(ctx.getWords().stream().map(Word::text).toList()));
    }

    private void analyzeGrammar(UtteranceAnalysisContext ctx) {
        ctx.setSelections(quantifierAnalyzer.analyze(ctx.getWords()));
        ctx.setCoordination(coordinationAnalyzer.analyze(ctx.getWords()));
        ctx.setTimeExpressions(timeAnalyzer.scan(ctx.getWords()));
        ctx.setReferences(referenceAnalyzer.analyze(ctx.getTokens()));
        ctx.setLocality(localityAnalyzer.scan(ctx.getWords()));
        ctx.setLocalityInteraction(interactionAnalyzer.analyze(ctx.getLocality().expressions()));
    }

    private void resolveNames(UtteranceAnalysisContext ctx) {
        ctx.setResolutions(nameResolver.resolveAll(ctx.getReferences(), ctx.getDirectory()));
        for (NameResolution resolution : ctx.getResolutions()) {
            NamedReference reference = resolution.reference();
            if (reference.isQuoted() && resolution.status() == ResolutionStatus.NOT_FOUND) {
                log.warn("[Pipeline] Quoted name \"{}\" matches no known entity", reference.name());
            }
        }
    }
}
