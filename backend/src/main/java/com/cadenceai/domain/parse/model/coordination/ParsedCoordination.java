package com.cadenceai.domain.parse.model.coordination;

import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.WarningCode;
import com.cadenceai.domain.parse.model.token.Span;

import java.util.List;

/**
 * A coordination structure: "add reverb and then boost the highs".
 *
 * @param kind               semantic kind of the conjunction
 * @param level              syntactic level being coordinated
 * @param conjunction        the conjunction and its linked partner
 * @param constituents       conjuncts in source order
 * @param orderStrict        true if conjunct order carries meaning
 * @param correlativeUsed    true if a paired marker ("both...and") was linked
 * @param ellipsis           ellipsis classification
 * @param rhetoricalRelation discourse relation for the kind
 * @param span               source range of the whole structure
 * @param confidence         in [0, 1]
 * @param warnings           ambiguity reports
 */
public record ParsedCoordination(
        CoordinationKind kind,
        CoordinationLevel level,
        Conjunction conjunction,
        List<Constituent> constituents,
        boolean orderStrict,
        boolean correlativeUsed,
        EllipsisAnalysis ellipsis,
        RhetoricalRelation rhetoricalRelation,
        Span span,
        double confidence,
        List<AnalysisWarning> warnings
) {
    public ParsedCoordination {
        constituents = List.copyOf(constituents);
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarning(WarningCode code) {
        return warnings.stream().anyMatch(w -> w.is(code));
    }
}
