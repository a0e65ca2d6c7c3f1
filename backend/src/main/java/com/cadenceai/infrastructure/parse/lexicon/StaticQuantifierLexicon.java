package com.cadenceai.infrastructure.parse.lexicon;

import com.cadenceai.domain.parse.lexicon.QuantifierEntry;
import com.cadenceai.domain.parse.lexicon.QuantifierLexicon;
import com.cadenceai.domain.parse.model.quantifier.EntityType;
import com.cadenceai.domain.parse.model.quantifier.QuantifierModifierType;
import com.cadenceai.domain.parse.model.quantifier.QuantifierType;
import com.cadenceai.domain.parse.model.quantifier.ScopeReading;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.cadenceai.domain.parse.model.quantifier.QuantifierType.DEGREE;
import static com.cadenceai.domain.parse.model.quantifier.QuantifierType.DISTRIBUTIVE;
import static com.cadenceai.domain.parse.model.quantifier.QuantifierType.EXISTENTIAL;
import static com.cadenceai.domain.parse.model.quantifier.QuantifierType.INTERROGATIVE;
import static com.cadenceai.domain.parse.model.quantifier.QuantifierType.NEGATIVE;
import static com.cadenceai.domain.parse.model.quantifier.QuantifierType.PROPORTIONAL;
import static com.cadenceai.domain.parse.model.quantifier.QuantifierType.RELATIVE;
import static com.cadenceai.domain.parse.model.quantifier.QuantifierType.UNIVERSAL;
import static com.cadenceai.domain.parse.model.quantifier.ScopeReading.COLLECTIVE;
import static com.cadenceai.domain.parse.model.quantifier.ScopeReading.UNDERSPECIFIED;

/**
 * Quantifier surface forms with their generalized-quantifier properties, plus the noun table
 * used to infer entity types for a restriction.
 */
@Component
public class StaticQuantifierLexicon implements QuantifierLexicon {

    private static final Set<QuantifierType> STRONG_TYPES = EnumSet.of(UNIVERSAL, PROPORTIONAL, NEGATIVE, DISTRIBUTIVE);

    private static final List<QuantifierEntry> ENTRIES = List.of(
            // Universal
            entry(List.of("all", "all the", "all of the", "every single"), UNIVERSAL, COLLECTIVE, true, false, 1.0, false, null, 15),
            entry(List.of("every"), UNIVERSAL, ScopeReading.DISTRIBUTIVE, true, false, 1.0, false, null, 15),
            entry(List.of("each"), UNIVERSAL, ScopeReading.DISTRIBUTIVE, true, false, 1.0, false, null, 16),
            entry(List.of("the whole", "the entire", "the full"), UNIVERSAL, COLLECTIVE, true, false, 1.0, false, null, 18),
            entry(List.of("both", "both of the", "both the"), UNIVERSAL, COLLECTIVE, true, false, 1.0, false, null, 14),

            // Existential
            entry(List.of("some", "some of the"), EXISTENTIAL, UNDERSPECIFIED, true, false, null, true, null, 10),
            entry(List.of("a", "an", "one"), EXISTENTIAL, UNDERSPECIFIED, true, false, null, false, null, 8),
            entry(List.of("any", "any of the"), EXISTENTIAL, UNDERSPECIFIED, true, false, null, true, null, 10),
            entry(List.of("certain", "certain of the"), EXISTENTIAL, UNDERSPECIFIED, true, false, null, true, null, 9),

            // Proportional
            entry(List.of("most", "most of the"), PROPORTIONAL, COLLECTIVE, true, false, 0.5, true, null, 12),
            entry(List.of("half", "half of the", "half the"), PROPORTIONAL, COLLECTIVE, false, false, 0.5, true, null, 14),
            entry(List.of("a third of", "a third of the", "one third of the"), PROPORTIONAL, COLLECTIVE, false, false, 1.0 / 3, true, null, 14),
            entry(List.of("a quarter of", "a quarter of the", "one quarter of the"), PROPORTIONAL, COLLECTIVE, false, false, 0.25, true, null, 14),

            // Vague cardinality
            entry(List.of("a few", "a few of the"), DEGREE, UNDERSPECIFIED, true, false, null, true, null, 10),
            entry(List.of("several", "several of the"), DEGREE, UNDERSPECIFIED, true, false, null, true, null, 10),
            entry(List.of("many", "many of the"), DEGREE, UNDERSPECIFIED, true, false, null, true, null, 10),
            entry(List.of("a lot of", "lots of"), DEGREE, UNDERSPECIFIED, true, false, null, false, null, 9),
            entry(List.of("a couple", "a couple of", "a pair of"), DEGREE, UNDERSPECIFIED, true, false, null, false, null, 11),

            // Negative
            entry(List.of("no", "zero"), NEGATIVE, COLLECTIVE, false, true, 0.0, false, null, 14),
            entry(List.of("none", "none of the", "none of"), NEGATIVE, COLLECTIVE, false, true, 0.0, true, null, 14),
            entry(List.of("neither", "neither of the", "neither of"), NEGATIVE, COLLECTIVE, false, true, 0.0, true, null, 14),

            // Periodic
            entry(List.of("every other", "alternate", "alternating", "every second"), DISTRIBUTIVE, ScopeReading.DISTRIBUTIVE, false, false, 0.5, false, 2, 16),
            entry(List.of("every third", "every 3rd"), DISTRIBUTIVE, ScopeReading.DISTRIBUTIVE, false, false, 1.0 / 3, false, 3, 16),
            entry(List.of("every fourth", "every 4th"), DISTRIBUTIVE, ScopeReading.DISTRIBUTIVE, false, false, 0.25, false, 4, 16),

            // Interrogative
            entry(List.of("which", "which of the"), INTERROGATIVE, UNDERSPECIFIED, false, false, null, true, null, 12),
            entry(List.of("how many", "how many of the"), INTERROGATIVE, UNDERSPECIFIED, false, false, null, true, null, 12),
            entry(List.of("what", "what kind of"), INTERROGATIVE, UNDERSPECIFIED, false, false, null, false, null, 10),

            // Free relative
            entry(List.of("whichever", "whatever", "any"), RELATIVE, UNDERSPECIFIED, false, false, null, false, null, 8)
    );

    private static final Map<EntityType, List<String>> ENTITY_NOUNS = Map.ofEntries(
            Map.entry(EntityType.SECTION, List.of("chorus", "choruses", "verse", "verses", "bridge", "bridges",
                    "intro", "intros", "outro", "outros", "section", "sections", "part", "parts", "drop", "drops",
                    "build", "builds", "breakdown", "breakdowns", "prechorus", "pre-chorus", "pre-choruses",
                    "interlude", "interludes", "coda", "codas", "tag", "tags")),
            Map.entry(EntityType.LAYER, List.of("layer", "layers", "track", "tracks")),
            Map.entry(EntityType.TRACK, List.of("track", "tracks", "channel", "channels", "bus", "buses")),
            Map.entry(EntityType.RANGE, List.of("bar", "bars", "beat", "beats", "measure", "measures")),
            Map.entry(EntityType.NOTE, List.of("note", "notes")),
            Map.entry(EntityType.EVENT, List.of("note", "notes", "event", "events", "hit", "hits")),
            Map.entry(EntityType.MUSICAL_OBJECT, List.of("chord", "chords", "riff", "riffs", "motif", "motifs",
                    "phrase", "phrases", "pattern", "patterns", "melody", "melodies", "hook", "hooks")),
            Map.entry(EntityType.INSTRUMENT, List.of("drum", "drums", "bass", "guitar", "guitars", "piano",
                    "pianos", "synth", "synths", "vocal", "vocals", "string", "strings", "pad", "pads", "lead",
                    "leads", "organ", "kick", "kicks", "snare", "snares", "hat", "hats", "hi-hat", "hi-hats",
                    "cymbal", "cymbals", "tom", "toms")),
            Map.entry(EntityType.EFFECT, List.of("effect", "effects", "reverb", "delay", "compressor",
                    "compressors", "eq", "filter", "filters", "distortion", "phaser", "flanger", "tremolo")),
            Map.entry(EntityType.CARD, List.of("card", "cards")),
            Map.entry(EntityType.PARAM, List.of("parameter", "parameters", "param", "params", "setting",
                    "settings", "knob", "knobs", "fader", "faders", "slider", "sliders"))
    );

    private static final Map<String, QuantifierModifierType> MODIFIERS = Map.ofEntries(
            Map.entry("exactly", QuantifierModifierType.EXACTLY),
            Map.entry("at least", QuantifierModifierType.AT_LEAST),
            Map.entry("at most", QuantifierModifierType.AT_MOST),
            Map.entry("about", QuantifierModifierType.ABOUT),
            Map.entry("around", QuantifierModifierType.ABOUT),
            Map.entry("roughly", QuantifierModifierType.ABOUT),
            Map.entry("only", QuantifierModifierType.ONLY),
            Map.entry("just", QuantifierModifierType.JUST),
            Map.entry("even", QuantifierModifierType.EVEN),
            Map.entry("also", QuantifierModifierType.ALSO),
            Map.entry("other", QuantifierModifierType.OTHER),
            Map.entry("remaining", QuantifierModifierType.REMAINING),
            Map.entry("specific", QuantifierModifierType.SPECIFIC),
            Map.entry("particular", QuantifierModifierType.PARTICULAR),
            Map.entry("individual", QuantifierModifierType.INDIVIDUAL),
            Map.entry("single", QuantifierModifierType.SINGLE),
            Map.entry("entire", QuantifierModifierType.ENTIRE),
            Map.entry("whole", QuantifierModifierType.WHOLE)
    );

    private static final Map<String, QuantifierEntry> BY_FORM = indexForms();
    private static final Map<String, Set<EntityType>> ENTITY_TYPES = indexNouns();
    private static final int MAX_FORM_WORDS = BY_FORM.keySet().stream()
            .mapToInt(form -> form.split(" ").length)
            .max()
            .orElse(1);

    @Override
    public Optional<QuantifierEntry> lookup(String phrase) {
        return Optional.ofNullable(BY_FORM.get(phrase));
    }

    @Override
    public int maxFormWords() {
        return MAX_FORM_WORDS;
    }

    @Override
    public Set<EntityType> entityTypes(String noun) {
        return ENTITY_TYPES.getOrDefault(noun, Set.of());
    }

    @Override
    public Optional<QuantifierModifierType> modifier(String word) {
        return Optional.ofNullable(MODIFIERS.get(word));
    }

    private static QuantifierEntry entry(List<String> forms, QuantifierType type, ScopeReading reading,
                                         boolean monotoneUp, boolean monotoneDown, Double proportion,
                                         boolean partitivePreferred, Integer ordinalStep, int priority) {
        return new QuantifierEntry(forms, type, reading, STRONG_TYPES.contains(type), monotoneUp, monotoneDown,
                proportion, partitivePreferred, ordinalStep, priority);
    }

    private static Map<String, QuantifierEntry> indexForms() {
        Map<String, QuantifierEntry> index = new HashMap<>();
        for (QuantifierEntry entry : ENTRIES) {
            for (String form : entry.forms()) {
                index.merge(form, entry, (existing, candidate) ->
                        candidate.priority() > existing.priority() ? candidate : existing);
            }
        }
        return Map.copyOf(index);
    }

    private static Map<String, Set<EntityType>> indexNouns() {
        Map<String, Set<EntityType>> index = new HashMap<>();
        ENTITY_NOUNS.forEach((type, nouns) -> nouns.forEach(noun ->
                index.computeIfAbsent(noun, k -> EnumSet.noneOf(EntityType.class)).add(type)));
        index.replaceAll((noun, types) -> Set.copyOf(types));
        return Map.copyOf(index);
    }
}
