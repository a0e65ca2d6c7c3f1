package com.cadenceai.infrastructure.parse.locality;

import com.cadenceai.domain.parse.lexicon.LocalityEntry;
import com.cadenceai.domain.parse.lexicon.LocalityLexicon;
import com.cadenceai.domain.parse.model.locality.CostBias;
import com.cadenceai.domain.parse.model.locality.CostDirection;
import com.cadenceai.domain.parse.model.locality.EditLocalityExpression;
import com.cadenceai.domain.parse.model.locality.ImpliedPreservation;
import com.cadenceai.domain.parse.model.locality.LocalityLexiconStats;
import com.cadenceai.domain.parse.model.locality.LocalityMarker;
import com.cadenceai.domain.parse.model.locality.LocalityScanResult;
import com.cadenceai.domain.parse.model.locality.LocalityType;
import com.cadenceai.domain.parse.model.locality.PreservationStrength;
import com.cadenceai.domain.parse.model.locality.PreservationTarget;
import com.cadenceai.domain.parse.model.locality.ScopeEffect;
import com.cadenceai.domain.parse.model.locality.ScopeModification;
import com.cadenceai.domain.parse.model.locality.ThresholdSpec;
import com.cadenceai.domain.parse.model.locality.ThresholdType;
import com.cadenceai.domain.parse.model.token.Span;
import com.cadenceai.domain.parse.model.token.Word;
import com.cadenceai.domain.parse.model.unit.ParsedNumber;
import com.cadenceai.domain.parse.model.unit.UnitExpression;
import com.cadenceai.infrastructure.parse.tokenizer.TokenStreams;
import com.cadenceai.infrastructure.parse.unit.NumberParser;
import com.cadenceai.infrastructure.parse.unit.UnitExpressionParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds locality markers ("just", "at least", "completely") and turns each into the cost and scope
 * biases a planner would apply.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EditLocalityAnalyzer {

    private static final int MAX_MARKER_WORDS = 6;
    private static final int MAX_VALUE_WORDS = 4;

    private final LocalityLexicon localityLexicon;
    private final UnitExpressionParser unitExpressionParser;
    private final NumberParser numberParser;

    private record ThresholdValue(double value, String unit, Span span) {}

    public LocalityScanResult scan(List<Word> words) {
        List<EditLocalityExpression> expressions = new ArrayList<>();
        Set<Integer> consumed = new LinkedHashSet<>();
        List<String> diagnostics = new ArrayList<>();

        int i = 0;
        while (i < words.size()) {
            int matched = 0;
            for (int size = Math.min(MAX_MARKER_WORDS, words.size() - i); size >= 1 && matched == 0; size--) {
                List<Word> window = words.subList(i, i + size);
                Optional<LocalityEntry> entry = localityLexicon.lookup(joinText(window));
                if (entry.isEmpty()) continue;

                EditLocalityExpression expression = build(entry.get(), window);
                Optional<ThresholdValue> value = thresholdValue(expression, words, i + size);
                if (value.isPresent()) {
                    expression = withValue(expression, value.get());
                    diagnostics.add("\"" + expression.surface() + "\" sets " + expression.costBias().threshold().type()
                            .name().toLowerCase(Locale.ROOT) + " " + value.get().value()
                            + (value.get().unit() == null ? "" : " " + value.get().unit()));
                }
                expressions.add(expression);
                matched = size;
            }
            if (matched > 0) {
                for (int k = i; k < i + matched; k++) consumed.add(k);
                i += matched;
            } else {
                i++;
            }
        }

        if (expressions.size() > 1) {
            diagnostics.add("Found " + expressions.size() + " locality markers; check for interaction effects");
        }
        if (!expressions.isEmpty()) {
            log.debug("[Locality] {}", expressions.stream()
                    .map(e -> e.type() + "(\"" + e.surface() + "\")")
                    .collect(Collectors.joining(", ")));
        }
        return new LocalityScanResult(expressions, consumed, diagnostics);
    }

    private EditLocalityExpression build(LocalityEntry entry, List<Word> window) {
        LocalityMarker marker = new LocalityMarker(entry.canonical(), TokenStreams.surface(window), entry.type(), entry.strength());
        return new EditLocalityExpression(entry.type(), marker, costBias(entry), scopeEffect(entry),
                impliedPreservation(entry), TokenStreams.spanOf(window), null, confidence(entry));
    }

    static CostBias costBias(LocalityEntry entry) {
        double magnitude = entry.strength();
        return switch (entry.type()) {
            case RESTRICTION, EXCLUSIVITY -> new CostBias(CostDirection.MINIMIZE, magnitude, true, null);
            case MINIMUM_THRESHOLD, SUFFICIENCY -> new CostBias(CostDirection.CONSTRAIN, magnitude, false, ThresholdSpec.of(ThresholdType.FLOOR));
            case MAXIMUM_THRESHOLD, EXCESS -> new CostBias(CostDirection.CONSTRAIN, magnitude, false, ThresholdSpec.of(ThresholdType.CEILING));
            case APPROXIMATION -> new CostBias(CostDirection.RELAX, magnitude, false, ThresholdSpec.of(ThresholdType.APPROXIMATE));
            case PRECISION -> new CostBias(CostDirection.CONSTRAIN, magnitude, false, ThresholdSpec.of(ThresholdType.EXACT));
            case EMPHASIS -> new CostBias(CostDirection.NEUTRAL, magnitude, false, null);
            case TOTALITY -> new CostBias(CostDirection.MAXIMIZE, magnitude, false, null);
        };
    }

    static ScopeEffect scopeEffect(LocalityEntry entry) {
        return switch (entry.type()) {
            case RESTRICTION -> new ScopeEffect(ScopeModification.NARROW, true, 0.0);
            case EXCLUSIVITY -> new ScopeEffect(ScopeModification.LOCK, true, 0.0);
            case EMPHASIS -> new ScopeEffect(ScopeModification.NONE, false, entry.strength());
            case TOTALITY -> new ScopeEffect(ScopeModification.WIDEN, false, 0.0);
            case PRECISION -> new ScopeEffect(ScopeModification.LOCK, false, 0.0);
            case APPROXIMATION -> new ScopeEffect(ScopeModification.RELAX, false, 0.0);
            default -> ScopeEffect.NONE;
        };
    }

    /**
     * "just the bass" implies leave everything else alone. Only exclusivity makes that binding.
     */
    static ImpliedPreservation impliedPreservation(LocalityEntry entry) {
        return switch (entry.type()) {
            case RESTRICTION -> new ImpliedPreservation(PreservationTarget.EVERYTHING_ELSE,
                    entry.strength() >= 0.8 ? PreservationStrength.STRONG : PreservationStrength.MODERATE, true);
            case EXCLUSIVITY -> new ImpliedPreservation(PreservationTarget.EVERYTHING_ELSE, PreservationStrength.STRONG, false);
            case MINIMUM_THRESHOLD -> new ImpliedPreservation(PreservationTarget.NAMED_ASPECTS, PreservationStrength.MODERATE, true);
            default -> null;
        };
    }

    static double confidence(LocalityEntry entry) {
        double confidence = entry.strength() + (entry.isMultiWord() ? 0.1 : 0.0);
        return Math.min(1.0, confidence);
    }

    // ── Threshold values ──

    /**
     * "at least 3 dB", "no more than 20%": the number right after a threshold marker.
     */
    private Optional<ThresholdValue> thresholdValue(EditLocalityExpression expression, List<Word> words, int from) {
        if (expression.costBias().threshold() == null || from >= words.size()) {
            return Optional.empty();
        }
        for (int size = Math.min(MAX_VALUE_WORDS, words.size() - from); size >= 1; size--) {
            List<Word> window = words.subList(from, from + size);
            Optional<UnitExpression> unit = unitExpressionParser.parseWords(window);
            if (unit.isPresent()) {
                return Optional.of(new ThresholdValue(unit.get().value().value(), unit.get().unit().id(), unit.get().span()));
            }
        }
        Word next = words.get(from);
        return numberParser.parse(next.text())
                .map(ParsedNumber::value)
                .map(value -> new ThresholdValue(value, null, next.span()));
    }

    private static EditLocalityExpression withValue(EditLocalityExpression expression, ThresholdValue value) {
        CostBias bias = expression.costBias();
        CostBias filled = new CostBias(bias.direction(), bias.magnitude(), bias.impliesPreserveRest(),
                bias.threshold().withValue(value.value(), value.unit()));
        return new EditLocalityExpression(expression.type(), expression.marker(), filled, expression.scopeEffect(),
                expression.impliedPreservation(), expression.markerSpan(), expression.markerSpan().union(value.span()),
                expression.confidence());
    }

    // ── Tooling ──

    public String describe(EditLocalityExpression expression) {
        String surface = "\"" + expression.surface() + "\"";
        String description = switch (expression.type()) {
            case RESTRICTION -> "Scope restricted by " + surface + ": prefer minimal changes and preserve everything not mentioned.";
            case MINIMUM_THRESHOLD -> "Floor set by " + surface + ": at minimum this much must change.";
            case MAXIMUM_THRESHOLD -> "Ceiling set by " + surface + ": do not exceed this amount of change.";
            case APPROXIMATION -> "Precision relaxed by " + surface + ": approximate values are acceptable.";
            case EXCLUSIVITY -> "Exclusive scope set by " + surface + ": only the named element may change.";
            case EMPHASIS -> "Priority raised by " + surface + ": this element gets more attention.";
            case PRECISION -> "Exact value required by " + surface + ": values must match precisely.";
            case SUFFICIENCY -> "Sufficiency set by " + surface + ": change until it is enough, then stop.";
            case EXCESS -> "Excess flagged by " + surface + ": the current amount is too much.";
            case TOTALITY -> "Full scope requested by " + surface + ": apply the change everywhere it fits.";
        };
        ThresholdSpec threshold = expression.costBias().threshold();
        if (threshold != null && threshold.numericValue() != null) {
            description += " Value: " + formatValue(threshold.numericValue())
                    + (threshold.unit() == null ? "" : " " + threshold.unit()) + ".";
        }
        return description;
    }

    public LocalityLexiconStats stats() {
        List<LocalityEntry> entries = localityLexicon.entries();
        Map<LocalityType, Integer> byType = new EnumMap<>(LocalityType.class);
        int variants = 0;
        double strength = 0;
        for (LocalityEntry entry : entries) {
            byType.merge(entry.type(), 1, Integer::sum);
            variants += entry.variants().size();
            strength += entry.strength();
        }
        return new LocalityLexiconStats(entries.size(), byType, variants,
                entries.isEmpty() ? 0.0 : strength / entries.size());
    }

    private static String formatValue(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    private static String joinText(List<Word> words) {
        return words.stream().map(Word::text).collect(Collectors.joining(" "));
    }
}
