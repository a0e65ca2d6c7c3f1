package com.cadenceai.infrastructure.parse.locality;

import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.locality.CostBias;
import com.cadenceai.domain.parse.model.locality.EditLocalityExpression;
import com.cadenceai.domain.parse.model.locality.LocalityInteraction;
import com.cadenceai.domain.parse.model.locality.LocalityType;
import com.cadenceai.domain.parse.model.locality.LocalityWarningCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.cadenceai.domain.parse.model.locality.LocalityType.APPROXIMATION;
import static com.cadenceai.domain.parse.model.locality.LocalityType.MAXIMUM_THRESHOLD;
import static com.cadenceai.domain.parse.model.locality.LocalityType.MINIMUM_THRESHOLD;
import static com.cadenceai.domain.parse.model.locality.LocalityType.PRECISION;
import static com.cadenceai.domain.parse.model.locality.LocalityType.RESTRICTION;
import static com.cadenceai.domain.parse.model.locality.LocalityType.TOTALITY;

/**
 * Pairwise interactions between the locality markers of one utterance.
 */
@Slf4j
@Component
public class LocalityInteractionAnalyzer {

    private static final List<Set<LocalityType>> CONFLICTING = List.of(
            Set.of(RESTRICTION, TOTALITY),
            Set.of(PRECISION, APPROXIMATION)
    );

    private static final Set<LocalityType> RANGE = Set.of(MINIMUM_THRESHOLD, MAXIMUM_THRESHOLD);

    public LocalityInteraction analyze(List<EditLocalityExpression> expressions) {
        if (expressions.isEmpty()) {
            return LocalityInteraction.NONE;
        }

        List<AnalysisWarning> conflicts = new ArrayList<>();
        List<AnalysisWarning> reinforcements = new ArrayList<>();
        for (int i = 0; i < expressions.size(); i++) {
            for (int j = i + 1; j < expressions.size(); j++) {
                EditLocalityExpression a = expressions.get(i);
                EditLocalityExpression b = expressions.get(j);
                Set<LocalityType> pair = a.type() == b.type() ? Set.of(a.type()) : Set.of(a.type(), b.type());

                if (CONFLICTING.contains(pair)) {
                    conflicts.add(pairWarning(LocalityWarningCode.CONFLICTING_MARKERS, a, b,
                            quote(a) + " (" + typeName(a) + ") conflicts with " + quote(b) + " (" + typeName(b) + ")"));
                } else if (a.type() == RESTRICTION && b.type() == RESTRICTION) {
                    reinforcements.add(pairWarning(LocalityWarningCode.REINFORCING_MARKERS, a, b,
                            quote(a) + " reinforces " + quote(b) + ": strongly restricted scope"));
                } else if (RANGE.equals(pair)) {
                    reinforcements.add(pairWarning(LocalityWarningCode.RANGE_CONSTRAINT, a, b,
                            quote(a) + " and " + quote(b) + " define a range"));
                }
            }
        }

        if (!conflicts.isEmpty()) {
            log.debug("[Locality] {} conflicting marker pairs", conflicts.size());
        }
        return new LocalityInteraction(conflicts, reinforcements, combinedBias(expressions));
    }

    /**
     * The strongest marker sets direction and threshold, boosted by 10%. Preservation is implied
     * if any marker implies it.
     */
    static CostBias combinedBias(List<EditLocalityExpression> expressions) {
        if (expressions.isEmpty()) {
            return CostBias.NEUTRAL;
        }
        if (expressions.size() == 1) {
            return expressions.get(0).costBias();
        }
        // first of equal magnitudes wins
        CostBias strongest = expressions.stream()
                .map(EditLocalityExpression::costBias)
                .reduce((best, next) -> next.magnitude() > best.magnitude() ? next : best)
                .orElseThrow();
        boolean preserve = expressions.stream().anyMatch(e -> e.costBias().impliesPreserveRest());
        return new CostBias(strongest.direction(), Math.min(1.0, strongest.magnitude() * 1.1), preserve,
                strongest.threshold());
    }

    private static AnalysisWarning pairWarning(LocalityWarningCode code, EditLocalityExpression a,
                                               EditLocalityExpression b, String message) {
        List<EditLocalityExpression> ordered = new ArrayList<>(List.of(a, b));
        ordered.sort(Comparator.comparingInt(e -> e.markerSpan().start()));
        return new AnalysisWarning(code, message, a.markerSpan().union(b.markerSpan()),
                ordered.stream().map(EditLocalityExpression::surface).toList());
    }

    private static String quote(EditLocalityExpression expression) {
        return "\"" + expression.surface() + "\"";
    }

    private static String typeName(EditLocalityExpression expression) {
        return expression.type().name().toLowerCase(Locale.ROOT);
    }
}
