package com.cadenceai.infrastructure.parse.lexicon;

import com.cadenceai.domain.parse.lexicon.LocalityEntry;
import com.cadenceai.domain.parse.lexicon.LocalityLexicon;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.cadenceai.domain.parse.model.locality.LocalityType.APPROXIMATION;
import static com.cadenceai.domain.parse.model.locality.LocalityType.EMPHASIS;
import static com.cadenceai.domain.parse.model.locality.LocalityType.EXCESS;
import static com.cadenceai.domain.parse.model.locality.LocalityType.EXCLUSIVITY;
import static com.cadenceai.domain.parse.model.locality.LocalityType.MAXIMUM_THRESHOLD;
import static com.cadenceai.domain.parse.model.locality.LocalityType.MINIMUM_THRESHOLD;
import static com.cadenceai.domain.parse.model.locality.LocalityType.PRECISION;
import static com.cadenceai.domain.parse.model.locality.LocalityType.RESTRICTION;
import static com.cadenceai.domain.parse.model.locality.LocalityType.SUFFICIENCY;
import static com.cadenceai.domain.parse.model.locality.LocalityType.TOTALITY;

/**
 * Edit-locality markers ("just", "at least", "completely"). Canonical forms and variants are
 * indexed lowercased; the first entry to claim a phrase keeps it.
 */
@Component
public class StaticLocalityLexicon implements LocalityLexicon {

    private static final List<LocalityEntry> ENTRIES = List.of(
            new LocalityEntry("just", List.of("just", "jus"), RESTRICTION, 0.7),
            new LocalityEntry("only", List.of("only"), RESTRICTION, 0.85),
            new LocalityEntry("merely", List.of("merely", "simply"), RESTRICTION, 0.6),
            new LocalityEntry("nothing but", List.of("nothing but", "nothing other than", "nothing except"), RESTRICTION, 0.95),
            new LocalityEntry("all I want is", List.of("all I want is", "all I need is", "all that needs to change is",
                    "the only thing"), RESTRICTION, 0.9),

            new LocalityEntry("at least", List.of("at least", "at a minimum", "at minimum", "minimum",
                    "no less than", "not less than"), MINIMUM_THRESHOLD, 0.8),
            new LocalityEntry("at the very least", List.of("at the very least", "at bare minimum", "minimally"),
                    MINIMUM_THRESHOLD, 0.9),
            new LocalityEntry("at most", List.of("at most", "at maximum", "at max", "no more than", "not more than",
                    "up to"), MAXIMUM_THRESHOLD, 0.8),
            new LocalityEntry("at the very most", List.of("at the very most", "at absolute maximum", "maximum of"),
                    MAXIMUM_THRESHOLD, 0.9),

            new LocalityEntry("about", List.of("about", "around", "roughly", "approximately", "approx", "circa",
                    "more or less"), APPROXIMATION, 0.5),
            new LocalityEntry("kind of", List.of("kind of", "sort of", "kinda", "sorta", "somewhat", "a bit"),
                    APPROXIMATION, 0.3),
            new LocalityEntry("ish", List.of("-ish", "ish"), APPROXIMATION, 0.3),

            new LocalityEntry("exclusively", List.of("exclusively", "solely", "purely", "entirely and only"),
                    EXCLUSIVITY, 0.95),
            new LocalityEntry("strictly", List.of("strictly", "absolutely only", "literally only"), EXCLUSIVITY, 0.95),

            new LocalityEntry("especially", List.of("especially", "particularly", "in particular", "notably"),
                    EMPHASIS, 0.6),
            new LocalityEntry("primarily", List.of("primarily", "mainly", "mostly", "chiefly", "above all"),
                    EMPHASIS, 0.7),
            new LocalityEntry("focus on", List.of("focus on", "concentrate on", "pay attention to", "prioritize"),
                    EMPHASIS, 0.75),

            new LocalityEntry("exactly", List.of("exactly", "precisely", "specifically"), PRECISION, 0.9),
            new LocalityEntry("literally", List.of("literally"), PRECISION, 0.85),
            new LocalityEntry("to the beat", List.of("to the beat", "to the bar", "to the note", "to the db"),
                    PRECISION, 0.8),

            new LocalityEntry("enough", List.of("enough", "sufficient", "sufficiently", "adequate", "adequately"),
                    SUFFICIENCY, 0.5),
            new LocalityEntry("just enough", List.of("just enough", "barely enough", "just sufficient"),
                    SUFFICIENCY, 0.6),

            new LocalityEntry("too much", List.of("too much", "too many", "too", "overly", "excessively", "way too"),
                    EXCESS, 0.8),
            new LocalityEntry("too little", List.of("too little", "too few", "not enough", "insufficient",
                    "insufficiently"), EXCESS, 0.8),

            new LocalityEntry("completely", List.of("completely", "entirely", "totally", "wholly", "fully"),
                    TOTALITY, 0.9),
            new LocalityEntry("throughout", List.of("throughout", "all the way through", "from start to finish",
                    "across the whole thing"), TOTALITY, 0.85)
    );

    private static final Map<String, LocalityEntry> BY_PHRASE = indexPhrases();

    @Override
    public Optional<LocalityEntry> lookup(String phrase) {
        return Optional.ofNullable(BY_PHRASE.get(phrase.toLowerCase(Locale.ROOT)));
    }

    @Override
    public List<LocalityEntry> entries() {
        return ENTRIES;
    }

    private static Map<String, LocalityEntry> indexPhrases() {
        Map<String, LocalityEntry> index = new HashMap<>();
        for (LocalityEntry entry : ENTRIES) {
            index.putIfAbsent(entry.canonical().toLowerCase(Locale.ROOT), entry);
            entry.variants().forEach(variant -> index.putIfAbsent(variant.toLowerCase(Locale.ROOT), entry));
        }
        return Map.copyOf(index);
    }
}
