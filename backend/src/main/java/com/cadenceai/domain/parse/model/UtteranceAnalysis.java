package com.cadenceai.domain.parse.model;

import com.cadenceai.domain.parse.model.coordination.CoordinationAnalysis;
import com.cadenceai.domain.parse.model.locality.EditLocalityExpression;
import com.cadenceai.domain.parse.model.locality.LocalityInteraction;
import com.cadenceai.domain.parse.model.quantifier.SelectionPredicate;
import com.cadenceai.domain.parse.model.reference.NameResolution;
import com.cadenceai.domain.parse.model.reference.NamedReference;
import com.cadenceai.domain.parse.model.time.TimeExpression;
import com.cadenceai.domain.parse.model.token.LemmaResult;
import com.cadenceai.domain.parse.model.token.TokenStream;
import com.cadenceai.domain.parse.model.unit.UnitExpression;

import java.util.List;

/**
 * Everything the parser found in one utterance.
 */
public record UtteranceAnalysis(
        TokenStream tokens,
        List<LemmaResult> lemmas,
        List<UnitExpression> units,
        List<SelectionPredicate> selections,
        CoordinationAnalysis coordination,
        List<TimeExpression> timeExpressions,
        List<NamedReference> references,
        List<NameResolution> resolutions,
        List<EditLocalityExpression> locality,
        LocalityInteraction localityInteraction
) {
    public UtteranceAnalysis {
        lemmas = List.copyOf(lemmas);
        units = List.copyOf(units);
        selections = List.copyOf(selections);
        timeExpressions = List.copyOf(timeExpressions);
        references = List.copyOf(references);
        resolutions = List.copyOf(resolutions);
        locality = List.copyOf(locality);
    }

    public int warningCount() {
        return selections.stream().mapToInt(s -> s.warnings().size()).sum()
                + coordination.coordinations().stream().mapToInt(c -> c.warnings().size()).sum()
                + timeExpressions.stream().mapToInt(t -> t.warnings().size()).sum()
                + references.stream().mapToInt(r -> r.warnings().size()).sum()
                + resolutions.stream().mapToInt(r -> r.warnings().size()).sum()
                + localityInteraction.conflicts().size();
    }
}
