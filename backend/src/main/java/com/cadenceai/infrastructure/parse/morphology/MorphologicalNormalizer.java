package com.cadenceai.infrastructure.parse.morphology;

import com.cadenceai.domain.parse.lexicon.InflectedForm;
import com.cadenceai.domain.parse.lexicon.MorphologyLexicon;
import com.cadenceai.domain.parse.model.token.InflectionType;
import com.cadenceai.domain.parse.model.token.LemmaResult;
import com.cadenceai.domain.parse.model.token.WordClass;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Table-first lemmatizer. Domain verb and adjective tables win; unknown words fall through to
 * ordered suffix rules. Stem repair (degemination, silent-e) only produces known words.
 */
@Component
@RequiredArgsConstructor
public class MorphologicalNormalizer {

    private record SuffixRule(String suffix, int minLength, InflectionType inflection, WordClass wordClass,
                              Set<String> exceptions) {
        boolean applies(String word) {
            return word.endsWith(suffix) && word.length() > minLength && !exceptions.contains(word);
        }

        String label() {
            return "-" + suffix + " → stem";
        }
    }

    private static final Set<String> NON_COMPARATIVES = Set.of(
            "after", "never", "over", "under", "super", "other",
            "either", "neither", "ever", "however", "whatever",
            "wherever", "whenever", "whether", "together", "butter",
            "water", "matter", "filter", "trigger", "mixer",
            "compressor", "limiter", "master", "slider", "fader",
            "speaker", "player", "layer", "order", "power",
            "number", "finger", "letter", "chapter", "center",
            "meter", "counter", "register", "chamber", "timber",
            "member", "remember", "consider"
    );

    private static final Set<String> NON_SUPERLATIVES = Set.of(
            "test", "best", "rest", "nest", "west", "east",
            "chest", "guest", "quest", "vest", "fest", "pest",
            "arrest", "request", "suggest", "invest", "interest",
            "protest", "manifest", "harvest", "forest"
    );

    private static final List<SuffixRule> RULES = List.of(
            new SuffixRule("ing", 4, InflectionType.PRESENT_PARTICIPLE, WordClass.VERB, Set.of()),
            new SuffixRule("ed", 3, InflectionType.PAST_TENSE, WordClass.VERB, Set.of()),
            new SuffixRule("er", 3, InflectionType.COMPARATIVE, WordClass.ADJECTIVE, NON_COMPARATIVES),
            new SuffixRule("est", 4, InflectionType.SUPERLATIVE, WordClass.ADJECTIVE, NON_SUPERLATIVES),
            new SuffixRule("es", 3, InflectionType.THIRD_PERSON_S, WordClass.VERB, Set.of()),
            new SuffixRule("s", 2, InflectionType.THIRD_PERSON_S, WordClass.VERB, Set.of()),
            new SuffixRule("ness", 5, InflectionType.NOMINALIZATION, WordClass.NOUN, Set.of()),
            new SuffixRule("ly", 3, InflectionType.ADVERBIAL, WordClass.ADVERB, Set.of())
    );

    private static final String DOUBLING_CONSONANTS = "bcdfgklmnprstvz";
    private static final List<String> SIBILANT_ENDINGS = List.of("s", "x", "z", "ch", "sh", "o");

    private final MorphologyLexicon morphologyLexicon;

    /**
     * Total: every input yields a result. Null and blank words come back as empty base forms.
     */
    public LemmaResult lemmatize(String word) {
        String original = word == null ? "" : word;
        String lower = original.strip().toLowerCase(Locale.ROOT);

        Optional<InflectedForm> tableHit = morphologyLexicon.lookupVerbForm(lower)
                .or(() -> morphologyLexicon.lookupAdjectiveForm(lower));
        if (tableHit.isPresent()) {
            InflectedForm form = tableHit.get();
            return new LemmaResult(form.lemma(), original, form.inflection(), true, null, form.wordClass());
        }

        for (SuffixRule rule : RULES) {
            if (rule.suffix().equals("s") && lower.endsWith("ss")) continue;
            if (rule.applies(lower)) {
                return new LemmaResult(stem(lower, rule), original, rule.inflection(), false, rule.label(), rule.wordClass());
            }
        }

        return new LemmaResult(lower, original, InflectionType.BASE, false, null, WordClass.UNKNOWN);
    }

    public List<LemmaResult> lemmatizeAll(List<String> words) {
        return words.stream().map(this::lemmatize).toList();
    }

    public String format(LemmaResult result) {
        if (result.inflection() == InflectionType.BASE) {
            return "\"" + result.original() + "\" = base form";
        }
        String source = result.fromTable() ? "table" : "rule: " + (result.rule() == null ? "unknown" : result.rule());
        return "\"" + result.original() + "\" → \"" + result.lemma() + "\" ("
                + result.inflection().name().toLowerCase(Locale.ROOT) + ", "
                + result.wordClass().name().toLowerCase(Locale.ROOT) + ", " + source + ")";
    }

    private String stem(String word, SuffixRule rule) {
        if (rule.suffix().equals("es")) {
            String dropS = word.substring(0, word.length() - 1);
            String dropEs = word.substring(0, word.length() - 2);
            if (morphologyLexicon.isKnownWord(dropS)) return dropS;
            if (dropEs.endsWith("i") && dropEs.length() > 2) return dropEs.substring(0, dropEs.length() - 1) + "y";
            // "-es" only follows sibilants and -o ("boxes", "pitches", "echoes"); otherwise it is "-e" + "s"
            if (SIBILANT_ENDINGS.stream().noneMatch(dropEs::endsWith)) return dropS;
            return dropEs;
        }
        String stem = word.substring(0, word.length() - rule.suffix().length());
        if (rule.suffix().equals("s") || rule.suffix().equals("ness") || rule.suffix().equals("ly")) {
            return stem;
        }
        return repair(stem);
    }

    private String repair(String stem) {
        if (stem.length() < 2) return stem;
        if (morphologyLexicon.isKnownWord(stem + "e")) {
            return stem + "e";
        }
        char last = stem.charAt(stem.length() - 1);
        char secondLast = stem.charAt(stem.length() - 2);
        if (last == secondLast && DOUBLING_CONSONANTS.indexOf(last) >= 0) {
            String degeminated = stem.substring(0, stem.length() - 1);
            if (morphologyLexicon.isKnownWord(degeminated)) {
                return degeminated;
            }
        }
        return stem;
    }
}
