package com.cadenceai.infrastructure.parse.pipeline;

import com.cadenceai.domain.parse.lexicon.EntityDirectory;
import com.cadenceai.domain.parse.model.UtteranceAnalysis;
import com.cadenceai.domain.parse.model.coordination.CoordinationAnalysis;
import com.cadenceai.domain.parse.model.locality.LocalityInteraction;
import com.cadenceai.domain.parse.model.locality.LocalityScanResult;
import com.cadenceai.domain.parse.model.quantifier.SelectionPredicate;
import com.cadenceai.domain.parse.model.reference.NameResolution;
import com.cadenceai.domain.parse.model.reference.NamedReference;
import com.cadenceai.domain.parse.model.time.TimeExpression;
import com.cadenceai.domain.parse.model.token.LemmaResult;
import com.cadenceai.domain.parse.model.token.TokenStream;
import com.cadenceai.domain.parse.model.token.Word;
import com.cadenceai.domain.parse.model.unit.UnitScanResult;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context passed through the analysis stages of one utterance.
 * Each stage reads what earlier stages left and adds its own result.
 */
@Data
public class UtteranceAnalysisContext {

    // --- Input ---
    private String text;
    private EntityDirectory directory;

    // --- Tokens ---
    private TokenStream tokens;
    private List<Word> words = new ArrayList<>();
    private List<LemmaResult> lemmas = new ArrayList<>();

    // --- Units ---
    private UnitScanResult units;

    // --- Grammar ---
    private List<SelectionPredicate> selections = new ArrayList<>();
    private CoordinationAnalysis coordination = CoordinationAnalysis.EMPTY;
    private List<TimeExpression> timeExpressions = new ArrayList<>();
    private List<NamedReference> references = new ArrayList<>();
    private List<NameResolution> resolutions = new ArrayList<>();
    private LocalityScanResult locality = LocalityScanResult.EMPTY;
    private LocalityInteraction localityInteraction = LocalityInteraction.NONE;

    public UtteranceAnalysis toAnalysis() {
        return new UtteranceAnalysis(
                tokens,
                lemmas,
                units != null ? units.expressions() : List.of(),
                selections,
                coordination,
                timeExpressions,
                references,
                resolutions,
                locality.expressions(),
                localityInteraction
        );
    }
}
