package com.cadenceai.infrastructure.parse.lexicon;

import com.cadenceai.domain.parse.lexicon.UnitLexicon;
import com.cadenceai.domain.parse.model.unit.CanonicalUnit;
import com.cadenceai.domain.parse.model.unit.Dimension;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Unit aliases grouped by dimension. Each dimension has a base unit with factor 1: beat, second,
 * semitone, hertz, decibel, bpm, percent, degree and raw MIDI value.
 */
@Slf4j
@Component
public class StaticUnitLexicon implements UnitLexicon {

    static final CanonicalUnit BAR = unit("bar", "bar", Dimension.TIME_MUSICAL, 4);
    static final CanonicalUnit BEAT = unit("beat", "beat", Dimension.TIME_MUSICAL, 1);
    static final CanonicalUnit WHOLE_NOTE = unit("whole_note", "1/1", Dimension.TIME_MUSICAL, 4);
    static final CanonicalUnit HALF_NOTE = unit("half_note", "1/2", Dimension.TIME_MUSICAL, 2);
    static final CanonicalUnit QUARTER_NOTE = unit("quarter_note", "1/4", Dimension.TIME_MUSICAL, 1);
    static final CanonicalUnit EIGHTH_NOTE = unit("eighth_note", "1/8", Dimension.TIME_MUSICAL, 0.5);
    static final CanonicalUnit SIXTEENTH_NOTE = unit("sixteenth_note", "1/16", Dimension.TIME_MUSICAL, 0.25);
    static final CanonicalUnit TICK = unit("tick", "tick", Dimension.TIME_MUSICAL, 1.0 / 480);

    static final CanonicalUnit MILLISECOND = unit("millisecond", "ms", Dimension.TIME_ABSOLUTE, 0.001);
    static final CanonicalUnit SECOND = unit("second", "s", Dimension.TIME_ABSOLUTE, 1);
    static final CanonicalUnit MINUTE = unit("minute", "min", Dimension.TIME_ABSOLUTE, 60);

    static final CanonicalUnit CENT = unit("cent", "ct", Dimension.PITCH, 0.01);
    static final CanonicalUnit SEMITONE = unit("semitone", "st", Dimension.PITCH, 1);
    static final CanonicalUnit WHOLE_TONE = unit("tone", "tone", Dimension.PITCH, 2);
    static final CanonicalUnit OCTAVE = unit("octave", "oct", Dimension.PITCH, 12);

    static final CanonicalUnit HERTZ = unit("hertz", "Hz", Dimension.FREQUENCY, 1);
    static final CanonicalUnit KILOHERTZ = unit("kilohertz", "kHz", Dimension.FREQUENCY, 1000);

    static final CanonicalUnit DECIBEL = unit("decibel", "dB", Dimension.DYNAMICS, 1);
    static final CanonicalUnit BPM = unit("bpm", "BPM", Dimension.TEMPO, 1);
    static final CanonicalUnit PERCENT = unit("percent", "%", Dimension.PERCENTAGE, 1);
    static final CanonicalUnit DEGREE = unit("degree", "°", Dimension.SPATIAL, 1);

    static final CanonicalUnit VELOCITY = unit("velocity", "vel", Dimension.MIDI, 1);
    static final CanonicalUnit CONTROL_CHANGE = unit("cc", "CC", Dimension.MIDI, 1);
    static final CanonicalUnit NOTE_NUMBER = unit("note_number", "note#", Dimension.MIDI, 1);

    public static final CanonicalUnit RATIO = unit("ratio", ":", Dimension.RATIO, 1);
    public static final CanonicalUnit TIMES = unit("times", "x", Dimension.DIMENSIONLESS, 1);

    private static final Map<String, CanonicalUnit> BUILT_IN = Map.ofEntries(
            Map.entry("bar", BAR), Map.entry("bars", BAR), Map.entry("measure", BAR), Map.entry("measures", BAR),
            Map.entry("beat", BEAT), Map.entry("beats", BEAT),
            Map.entry("whole note", WHOLE_NOTE), Map.entry("whole notes", WHOLE_NOTE),
            Map.entry("half note", HALF_NOTE), Map.entry("half notes", HALF_NOTE),
            Map.entry("quarter", QUARTER_NOTE), Map.entry("quarters", QUARTER_NOTE),
            Map.entry("quarter note", QUARTER_NOTE), Map.entry("quarter notes", QUARTER_NOTE),
            Map.entry("eighth", EIGHTH_NOTE), Map.entry("eighths", EIGHTH_NOTE),
            Map.entry("eighth note", EIGHTH_NOTE), Map.entry("eighth notes", EIGHTH_NOTE),
            Map.entry("sixteenth", SIXTEENTH_NOTE), Map.entry("sixteenths", SIXTEENTH_NOTE),
            Map.entry("sixteenth note", SIXTEENTH_NOTE), Map.entry("sixteenth notes", SIXTEENTH_NOTE),
            Map.entry("tick", TICK), Map.entry("ticks", TICK),

            Map.entry("ms", MILLISECOND), Map.entry("millisecond", MILLISECOND), Map.entry("milliseconds", MILLISECOND),
            Map.entry("s", SECOND), Map.entry("sec", SECOND), Map.entry("secs", SECOND),
            Map.entry("second", SECOND), Map.entry("seconds", SECOND),
            Map.entry("min", MINUTE), Map.entry("mins", MINUTE), Map.entry("minute", MINUTE), Map.entry("minutes", MINUTE),

            Map.entry("cent", CENT), Map.entry("cents", CENT), Map.entry("ct", CENT),
            Map.entry("semitone", SEMITONE), Map.entry("semitones", SEMITONE), Map.entry("st", SEMITONE),
            Map.entry("semi", SEMITONE), Map.entry("semis", SEMITONE),
            Map.entry("half step", SEMITONE), Map.entry("half steps", SEMITONE),
            Map.entry("tone", WHOLE_TONE), Map.entry("tones", WHOLE_TONE),
            Map.entry("whole step", WHOLE_TONE), Map.entry("whole steps", WHOLE_TONE),
            Map.entry("step", WHOLE_TONE), Map.entry("steps", WHOLE_TONE),
            Map.entry("octave", OCTAVE), Map.entry("octaves", OCTAVE), Map.entry("oct", OCTAVE),

            Map.entry("hz", HERTZ), Map.entry("hertz", HERTZ),
            Map.entry("khz", KILOHERTZ), Map.entry("k", KILOHERTZ), Map.entry("kilohertz", KILOHERTZ),

            Map.entry("db", DECIBEL), Map.entry("decibel", DECIBEL), Map.entry("decibels", DECIBEL),
            Map.entry("bpm", BPM),
            Map.entry("%", PERCENT), Map.entry("percent", PERCENT), Map.entry("pct", PERCENT),
            Map.entry("degree", DEGREE), Map.entry("degrees", DEGREE), Map.entry("deg", DEGREE),

            Map.entry("velocity", VELOCITY), Map.entry("vel", VELOCITY),
            Map.entry("cc", CONTROL_CHANGE),
            Map.entry("midi note", NOTE_NUMBER), Map.entry("note number", NOTE_NUMBER),

            Map.entry("x", TIMES), Map.entry("times", TIMES)
    );

    private volatile Map<String, CanonicalUnit> aliases;

    public StaticUnitLexicon() {
        this(BUILT_IN);
    }

    private StaticUnitLexicon(Map<String, CanonicalUnit> aliases) {
        this.aliases = aliases;
    }

    @Override
    public Optional<CanonicalUnit> lookupUnit(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(aliases.get(alias.toLowerCase(Locale.ROOT)));
    }

    @Override
    public int maxAliasWords() {
        return aliases.keySet().stream()
                .mapToInt(alias -> alias.split(" ").length)
                .max()
                .orElse(1);
    }

    /**
     * Returns a new lexicon holding this lexicon's aliases plus {@code extra}; this one is unchanged.
     */
    public StaticUnitLexicon withAliases(Map<String, CanonicalUnit> extra) {
        return new StaticUnitLexicon(merge(aliases, extra));
    }

    /**
     * Adds aliases to this lexicon. Readers see either the old or the new table, never a partial one.
     */
    public synchronized void register(Map<String, CanonicalUnit> extra) {
        aliases = merge(aliases, extra);
        log.info("[UnitLexicon] registered {} aliases, total {}", extra.size(), aliases.size());
    }

    public List<CanonicalUnit> units() {
        return aliases.values().stream().distinct().toList();
    }

    private static Map<String, CanonicalUnit> merge(Map<String, CanonicalUnit> base, Map<String, CanonicalUnit> extra) {
        Map<String, CanonicalUnit> merged = new HashMap<>(base);
        extra.forEach((alias, unit) -> merged.put(alias.toLowerCase(Locale.ROOT), unit));
        return Map.copyOf(merged);
    }

    private static CanonicalUnit unit(String id, String symbol, Dimension dimension, double factor) {
        return new CanonicalUnit(id, symbol, dimension, factor);
    }
}
