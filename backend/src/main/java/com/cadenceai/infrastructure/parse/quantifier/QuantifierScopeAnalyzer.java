package com.cadenceai.infrastructure.parse.quantifier;

import com.cadenceai.domain.parse.lexicon.QuantifierEntry;
import com.cadenceai.domain.parse.lexicon.QuantifierLexicon;
import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.quantifier.CountPrecision;
import com.cadenceai.domain.parse.model.quantifier.CountSpec;
import com.cadenceai.domain.parse.model.quantifier.EntityType;
import com.cadenceai.domain.parse.model.quantifier.OrdinalFilter;
import com.cadenceai.domain.parse.model.quantifier.Quantifier;
import com.cadenceai.domain.parse.model.quantifier.QuantifierModifier;
import com.cadenceai.domain.parse.model.quantifier.QuantifierModifierType;
import com.cadenceai.domain.parse.model.quantifier.QuantifierType;
import com.cadenceai.domain.parse.model.quantifier.QuantifierWarningCode;
import com.cadenceai.domain.parse.model.quantifier.Restriction;
import com.cadenceai.domain.parse.model.quantifier.ScopeReading;
import com.cadenceai.domain.parse.model.quantifier.SelectionPredicate;
import com.cadenceai.domain.parse.model.token.InflectionType;
import com.cadenceai.domain.parse.model.token.LemmaResult;
import com.cadenceai.domain.parse.model.token.Span;
import com.cadenceai.domain.parse.model.token.TokenTag;
import com.cadenceai.domain.parse.model.token.TokenType;
import com.cadenceai.domain.parse.model.token.Word;
import com.cadenceai.infrastructure.parse.morphology.MorphologicalNormalizer;
import com.cadenceai.infrastructure.parse.tokenizer.TokenStreams;
import com.cadenceai.infrastructure.parse.unit.NumberParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds quantified noun phrases ("every other bar", "all the drum tracks", "exactly 3 choruses")
 * and turns them into selection predicates with a scope reading and restriction.
 *
 * Readings that cannot be decided from the sentence stay {@link ScopeReading#UNDERSPECIFIED}
 * with a warning instead of being guessed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuantifierScopeAnalyzer {

    private static final int MAX_FORM_WINDOW = 5;
    private static final int MAX_NUMBER_WORD = 90;

    private static final Pattern DIGITS = Pattern.compile("^\\d{1,9}$");

    private static final Set<String> STOP_WORDS = Set.of(
            "and", "or", "but", "not", "then", "if", "so", "because", "that", "which",
            "when", "where", "while", "is", "are", "was", "were", "be", "do", "does",
            "should", "would", "could", "can", "will"
    );

    private static final Set<String> DETERMINERS = Set.of(
            "the", "a", "an", "this", "that", "these", "those", "my", "our", "your", "its", "their"
    );

    private static final Set<String> DEFINITE_DETERMINERS = Set.of("the", "these", "those");

    private static final Set<String> PP_PREPOSITIONS = Set.of(
            "in", "on", "of", "at", "from", "within", "during", "across", "throughout"
    );

    private static final Set<String> DISTRIBUTIVE_CUES = Set.of(
            "each", "individually", "separately", "respectively", "independently", "alternately"
    );

    // "a bit brighter" is a degree phrase, not an existential over bits
    private static final Set<String> MEASURE_NOUNS = Set.of("bit", "little", "tad", "touch", "lot", "while", "few");

    private static final Set<QuantifierModifierType> PRE_QUANTIFIER = EnumSet.of(
            QuantifierModifierType.ONLY, QuantifierModifierType.JUST,
            QuantifierModifierType.EVEN, QuantifierModifierType.ALSO
    );

    private static final Map<QuantifierModifierType, CountPrecision> COUNT_PRECISION = Map.of(
            QuantifierModifierType.EXACTLY, CountPrecision.EXACT,
            QuantifierModifierType.AT_LEAST, CountPrecision.AT_LEAST,
            QuantifierModifierType.AT_MOST, CountPrecision.AT_MOST,
            QuantifierModifierType.ABOUT, CountPrecision.APPROXIMATE
    );

    private static final List<String> SCOPE_CANDIDATES = List.of("distributive", "collective");

    private final QuantifierLexicon quantifierLexicon;
    private final MorphologicalNormalizer morphologicalNormalizer;
    private final NumberParser numberParser;

    @Value("${parser.quantifier.max-count:10000}")
    private int maxCount = 10000;

    /**
     * Noun phrase following a quantifier. {@code head} is -1 when no head noun was found;
     * {@code end} is exclusive.
     */
    private record NounPhrase(int head, int end, boolean hasOf, Integer count, List<String> modifiers,
                              List<String> ppModifiers, List<QuantifierModifier> quantifierModifiers) {}

    private record Found(int start, int end, Quantifier quantifier, ScopeReading reading, CountSpec count,
                         OrdinalFilter ordinalFilter, Restriction restriction, List<QuantifierModifier> modifiers,
                         double confidence, List<QuantifierWarningCode> warnings) {}

    public List<SelectionPredicate> analyze(List<Word> words) {
        boolean[] consumed = new boolean[words.size()];
        List<Found> found = new ArrayList<>();

        int i = 0;
        while (i < words.size()) {
            Optional<Found> match = matchAt(words, i, consumed);
            if (match.isPresent()) {
                Found f = match.get();
                for (int k = f.start(); k < f.end(); k++) consumed[k] = true;
                found.add(f);
                i = Math.max(i + 1, f.end());
            } else {
                i++;
            }
        }
        found.addAll(plurals(words, consumed));
        found.sort(Comparator.comparingInt(Found::start));

        List<SelectionPredicate> predicates = new ArrayList<>();
        for (Found f : found) {
            predicates.add(toPredicate("sel:" + predicates.size(), f, words));
        }
        if (!predicates.isEmpty()) {
            log.debug("[Quantifier] {} selection predicates in {} words", predicates.size(), words.size());
        }
        return predicates;
    }

    private Optional<Found> matchAt(List<Word> words, int i, boolean[] consumed) {
        if (consumed[i] || words.get(i).isPunctuation()) {
            return Optional.empty();
        }
        Optional<Found> counted = matchCountModifier(words, i, consumed);
        if (counted.isPresent()) {
            return counted;
        }
        int window = Math.min(Math.min(MAX_FORM_WINDOW, quantifierLexicon.maxFormWords()), words.size() - i);
        for (int size = window; size >= 1; size--) {
            if (!available(words, consumed, i, i + size)) continue;
            String phrase = joinText(words, i, i + size);
            Optional<QuantifierEntry> entry = quantifierLexicon.lookup(phrase);
            if (entry.isPresent()) {
                Optional<Found> result = fromEntry(words, i, i + size, entry.get(), consumed);
                if (result.isPresent()) {
                    return result;
                }
            }
        }
        return matchNumeric(words, i, i, null, consumed);
    }

    private Optional<Found> fromEntry(List<Word> words, int start, int qEnd, QuantifierEntry entry, boolean[] consumed) {
        NounPhrase np = nounPhrase(words, qEnd, consumed);
        String form = joinText(words, start, qEnd);

        if ((form.equals("a") || form.equals("an")) && np.head() >= 0
                && MEASURE_NOUNS.contains(words.get(np.head()).text())) {
            return Optional.empty();
        }

        List<QuantifierWarningCode> warnings = new ArrayList<>();
        int spanStart = leadingModifierStart(words, start, consumed);
        int head = np.head();
        int end = np.end();

        // "the tracks all": universal floated after its noun
        if (head < 0 && entry.type() == QuantifierType.UNIVERSAL && start > 0
                && !consumed[start - 1] && isPluralNoun(words.get(start - 1))) {
            head = start - 1;
            spanStart = start > 1 && DEFINITE_DETERMINERS.contains(words.get(start - 2).text()) && !consumed[start - 2]
                    ? start - 2 : start - 1;
            end = qEnd;
            warnings.add(QuantifierWarningCode.FLOATING_QUANTIFIER);
        }

        Restriction restriction = restriction(words, head, np);
        Quantifier quantifier = new Quantifier(entry.type(), TokenStreams.surface(words.subList(start, qEnd)),
                entry.strong(), entry.monotoneUp(), entry.monotoneDown(), entry.proportion());

        CountSpec count = null;
        if (np.count() != null) {
            count = new CountSpec(np.count(), CountPrecision.EXACT, restriction.headNoun());
        } else if (form.startsWith("both")) {
            count = new CountSpec(2, CountPrecision.EXACT, restriction.headNoun());
        }

        OrdinalFilter ordinalFilter = entry.ordinalStep() == null ? null : new OrdinalFilter(entry.ordinalStep(), 0, form);

        List<QuantifierModifier> modifiers = new ArrayList<>();
        for (int k = spanStart; k < start; k++) {
            Word word = words.get(k);
            quantifierLexicon.modifier(word.text())
                    .ifPresent(type -> modifiers.add(new QuantifierModifier(type, word.text(), word.span())));
        }
        modifiers.addAll(np.quantifierModifiers());

        if (entry.partitivePreferred() && !form.contains("of") && !np.hasOf()) {
            warnings.add(QuantifierWarningCode.PARTITIVE_AMBIGUITY);
        }
        if (entry.type() == QuantifierType.UNIVERSAL && entry.defaultReading() == ScopeReading.COLLECTIVE
                && followedByDistributiveCue(words, np.end())) {
            warnings.add(QuantifierWarningCode.DISTRIBUTIVE_OR_COLLECTIVE);
        }

        double confidence = entry.priority() >= 14 ? 0.85 : 0.7;
        return Optional.of(new Found(spanStart, Math.max(end, qEnd), quantifier, entry.defaultReading(), count,
                ordinalFilter, restriction, modifiers, confidence, warnings));
    }

    /**
     * "exactly 3 bars", "at least two choruses", "about 8 beats".
     */
    private Optional<Found> matchCountModifier(List<Word> words, int i, boolean[] consumed) {
        for (int size = Math.min(2, words.size() - i - 1); size >= 1; size--) {
            if (!available(words, consumed, i, i + size + 1)) continue;
            Optional<QuantifierModifierType> type = quantifierLexicon.modifier(joinText(words, i, i + size))
                    .filter(COUNT_PRECISION::containsKey);
            if (type.isEmpty() || countValue(words.get(i + size)).isEmpty()) continue;
            QuantifierModifier modifier = new QuantifierModifier(type.get(), joinText(words, i, i + size),
                    TokenStreams.spanOf(words.subList(i, i + size)));
            return matchNumeric(words, i, i + size, modifier, consumed);
        }
        return Optional.empty();
    }

    private Optional<Found> matchNumeric(List<Word> words, int start, int numberAt, QuantifierModifier modifier,
                                         boolean[] consumed) {
        if (numberAt + 1 >= words.size() || consumed[numberAt + 1]) {
            return Optional.empty();
        }
        Optional<Integer> value = countValue(words.get(numberAt));
        Word next = words.get(numberAt + 1);
        if (value.isEmpty() || isStop(next)) {
            return Optional.empty();
        }
        // "3 dB" is a unit expression unless the unit also names something countable ("3 bars")
        if (next.hasTag(TokenTag.UNIT_WORD) && quantifierLexicon.entityTypes(next.text()).isEmpty()) {
            return Optional.empty();
        }

        NounPhrase np = nounPhrase(words, numberAt + 1, consumed);
        Restriction restriction = restriction(words, np.head(), np);
        CountPrecision precision = modifier == null ? CountPrecision.EXACT : COUNT_PRECISION.get(modifier.type());
        CountSpec count = new CountSpec(value.get(), precision, restriction.headNoun());

        Quantifier quantifier = new Quantifier(QuantifierType.NUMERIC, words.get(numberAt).original(),
                true, true, false, null);
        List<QuantifierModifier> modifiers = new ArrayList<>();
        if (modifier != null) modifiers.add(modifier);
        modifiers.addAll(np.quantifierModifiers());

        List<QuantifierWarningCode> warnings = new ArrayList<>();
        if (value.get() > maxCount) {
            warnings.add(QuantifierWarningCode.COUNT_EXCEEDS_AVAILABLE);
        }
        return Optional.of(new Found(start, Math.max(np.end(), numberAt + 1), quantifier, ScopeReading.UNDERSPECIFIED,
                count, null, restriction, modifiers, 0.8, warnings));
    }

    /**
     * Definite plurals ("the choruses") and a bare plural right after an initial verb ("mute drums"),
     * for nouns no explicit quantifier has claimed.
     */
    private List<Found> plurals(List<Word> words, boolean[] consumed) {
        List<Found> found = new ArrayList<>();
        for (int i = 0; i < words.size(); i++) {
            if (consumed[i]) continue;
            Word word = words.get(i);

            if (DEFINITE_DETERMINERS.contains(word.text())) {
                int k = i + 1;
                List<String> adjectives = new ArrayList<>();
                while (k < words.size() && !consumed[k] && isAdjective(words.get(k))) {
                    adjectives.add(words.get(k).text());
                    k++;
                }
                if (k < words.size() && !consumed[k] && isPluralNoun(words.get(k))) {
                    NounPhrase np = new NounPhrase(k, k + 1, false, null, adjectives, ppModifiers(words, k + 1), List.of());
                    Quantifier quantifier = new Quantifier(QuantifierType.DEFINITE_PLURAL, word.original(),
                            true, true, false, null);
                    found.add(new Found(i, k + 1, quantifier, ScopeReading.COLLECTIVE, null, null,
                            restriction(words, k, np), List.of(), 0.7, List.of()));
                    for (int c = i; c <= k; c++) consumed[c] = true;
                    i = k;
                }
                continue;
            }

            if (i == 1 && words.get(0).hasTag(TokenTag.VERB) && isPluralNoun(word)) {
                NounPhrase np = new NounPhrase(i, i + 1, false, null, List.of(), ppModifiers(words, i + 1), List.of());
                Quantifier quantifier = new Quantifier(QuantifierType.BARE_PLURAL, word.original(),
                        false, true, false, null);
                found.add(new Found(i, i + 1, quantifier, ScopeReading.UNDERSPECIFIED, null, null,
                        restriction(words, i, np), List.of(), 0.6,
                        List.of(QuantifierWarningCode.BARE_PLURAL_GENERIC)));
                consumed[i] = true;
            }
        }
        return found;
    }

    private NounPhrase nounPhrase(List<Word> words, int from, boolean[] consumed) {
        int k = from;
        boolean hasOf = false;
        if (k < words.size() && !consumed[k] && words.get(k).is("of")) {
            hasOf = true;
            k++;
            if (k < words.size() && !consumed[k] && words.get(k).is("the")) k++;
        }

        List<String> modifiers = new ArrayList<>();
        List<QuantifierModifier> quantifierModifiers = new ArrayList<>();
        Integer count = null;
        int head = -1;
        while (k < words.size()) {
            Word word = words.get(k);
            if (consumed[k] || isStop(word) || word.hasTag(TokenTag.PREPOSITION)) break;

            Optional<QuantifierModifierType> modifier = quantifierLexicon.modifier(word.text());
            if (modifier.isPresent()) {
                quantifierModifiers.add(new QuantifierModifier(modifier.get(), word.text(), word.span()));
                k++;
                continue;
            }
            if (DETERMINERS.contains(word.text()) || word.hasTag(TokenTag.DETERMINER)) {
                k++;
                continue;
            }
            Optional<Integer> value = countValue(word);
            if (count == null && value.isPresent()) {
                count = value.get();
                k++;
                continue;
            }
            if (isAdjective(word)) {
                modifiers.add(word.text());
                k++;
                continue;
            }

            head = k++;
            // compound nouns: the last known noun heads the phrase ("drum tracks")
            while (k < words.size() && !consumed[k] && !isStop(words.get(k))
                    && !quantifierLexicon.entityTypes(words.get(k).text()).isEmpty()) {
                modifiers.add(words.get(head).text());
                head = k++;
            }
            break;
        }

        List<String> pps = head < 0 ? List.of() : ppModifiers(words, head + 1);
        int end = head < 0 ? from : head + 1;
        if (head < 0 && hasOf) end = Math.min(from + 1, words.size());
        return new NounPhrase(head, end, hasOf, count, modifiers, pps, quantifierModifiers);
    }

    /**
     * One postnominal PP: preposition, optional determiner and its object ("in the chorus").
     */
    private List<String> ppModifiers(List<Word> words, int from) {
        if (from >= words.size() || !PP_PREPOSITIONS.contains(words.get(from).text())) {
            return List.of();
        }
        int k = from + 1;
        if (k < words.size() && DETERMINERS.contains(words.get(k).text())) k++;
        if (k >= words.size() || isStop(words.get(k))) {
            return List.of();
        }
        return List.of(TokenStreams.surface(words.subList(from, k + 1)).toLowerCase(Locale.ROOT));
    }

    private Restriction restriction(List<Word> words, int head, NounPhrase np) {
        if (head < 0) {
            return new Restriction(null, Set.of(), np.modifiers(), List.of(), false);
        }
        String noun = words.get(head).text();
        String lemma = nounLemma(noun);
        Set<EntityType> types = EnumSet.noneOf(EntityType.class);
        types.addAll(quantifierLexicon.entityTypes(noun));
        types.addAll(quantifierLexicon.entityTypes(lemma));
        return new Restriction(lemma, types, np.modifiers(), np.ppModifiers(), true);
    }

    private SelectionPredicate toPredicate(String id, Found found, List<Word> words) {
        List<Word> covered = words.subList(found.start(), found.end());
        Span span = TokenStreams.spanOf(covered);
        String surface = TokenStreams.surface(covered);

        List<AnalysisWarning> warnings = new ArrayList<>();
        QuantifierType type = found.quantifier().type();
        if (found.reading() == ScopeReading.UNDERSPECIFIED && type != QuantifierType.INTERROGATIVE) {
            warnings.add(new AnalysisWarning(QuantifierWarningCode.SCOPE_AMBIGUITY,
                    "\"" + surface + "\" can apply to each entity or to the group", span, SCOPE_CANDIDATES));
        }
        if (found.restriction().isEmpty()) {
            warnings.add(new AnalysisWarning(QuantifierWarningCode.EMPTY_RESTRICTION,
                    "No noun follows \"" + found.quantifier().surface() + "\"", span));
        }
        if (type == QuantifierType.NEGATIVE) {
            warnings.add(new AnalysisWarning(QuantifierWarningCode.NEGATIVE_SCOPE_AMBIGUITY,
                    "Negative quantifier \"" + found.quantifier().surface() + "\" may scope over the verb", span));
        }
        if (type == QuantifierType.PROPORTIONAL || type == QuantifierType.DEGREE) {
            warnings.add(new AnalysisWarning(QuantifierWarningCode.PROPORTIONAL_VAGUE,
                    "\"" + found.quantifier().surface() + "\" does not fix an exact amount", span));
        }
        for (QuantifierWarningCode code : found.warnings()) {
            warnings.add(new AnalysisWarning(code, describe(code, found), span));
        }

        return new SelectionPredicate(id, found.quantifier(), found.restriction(), found.reading(), found.count(),
                found.ordinalFilter(), found.modifiers(), surface, span, found.confidence(), warnings);
    }

    private String describe(QuantifierWarningCode code, Found found) {
        return switch (code) {
            case PARTITIVE_AMBIGUITY -> "\"" + found.quantifier().surface() + "\" may select part of a known set";
            case DISTRIBUTIVE_OR_COLLECTIVE -> "Edit may apply to the group or to each member separately";
            case COUNT_EXCEEDS_AVAILABLE -> "Count " + found.count().value() + " exceeds the limit of " + maxCount;
            case BARE_PLURAL_GENERIC -> "Bare plural may mean all or some of the entities";
            case FLOATING_QUANTIFIER -> "\"" + found.quantifier().surface() + "\" follows the noun it quantifies";
            default -> code.code();
        };
    }

    private String nounLemma(String noun) {
        LemmaResult result = morphologicalNormalizer.lemmatize(noun);
        if (result.inflection() != InflectionType.THIRD_PERSON_S) {
            return noun;
        }
        boolean lemmaKnown = !quantifierLexicon.entityTypes(result.lemma()).isEmpty();
        boolean nounKnown = !quantifierLexicon.entityTypes(noun).isEmpty();
        return lemmaKnown || !nounKnown ? result.lemma() : noun;
    }

    private boolean isPluralNoun(Word word) {
        return !quantifierLexicon.entityTypes(word.text()).isEmpty() && !nounLemma(word.text()).equals(word.text());
    }

    private boolean isAdjective(Word word) {
        return word.hasTag(TokenTag.ADJECTIVE) && quantifierLexicon.entityTypes(word.text()).isEmpty();
    }

    private Optional<Integer> countValue(Word word) {
        if (word.type() == TokenType.ORDINAL) {
            return Optional.empty();
        }
        if (DIGITS.matcher(word.text()).matches()) {
            // nine digits always fit an int; the configured limit is checked by the caller
            return Optional.of(Integer.parseInt(word.text()));
        }
        return numberParser.parseInteger(word.text()).filter(value -> value <= MAX_NUMBER_WORD);
    }

    private int leadingModifierStart(List<Word> words, int start, boolean[] consumed) {
        if (start == 0 || consumed[start - 1]) {
            return start;
        }
        boolean leading = quantifierLexicon.modifier(words.get(start - 1).text())
                .filter(PRE_QUANTIFIER::contains)
                .isPresent();
        return leading ? start - 1 : start;
    }

    private boolean followedByDistributiveCue(List<Word> words, int from) {
        for (int k = from; k < Math.min(words.size(), from + 3); k++) {
            Word word = words.get(k);
            if (word.isPunctuation()) return false;
            if (DISTRIBUTIVE_CUES.contains(word.text())) return true;
        }
        return false;
    }

    private static boolean isStop(Word word) {
        return word.isPunctuation() || STOP_WORDS.contains(word.text());
    }

    private static boolean available(List<Word> words, boolean[] consumed, int from, int to) {
        if (to > words.size()) return false;
        for (int k = from; k < to; k++) {
            if (consumed[k] || words.get(k).isPunctuation()) return false;
        }
        return true;
    }

    private static String joinText(List<Word> words, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int k = from; k < to; k++) {
            if (k > from) sb.append(' ');
            sb.append(words.get(k).text());
        }
        return sb.toString();
    }
}
