package com.cadenceai.domain.parse.model.time;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum DurationUnit {
    BAR("bar", "bars", "measure", "measures"),
    BEAT("beat", "beats"),
    SECOND("second", "seconds", "sec", "secs", "s"),
    MILLISECOND("millisecond", "milliseconds", "ms"),
    PHRASE("phrase", "phrases"),
    WHOLE_NOTE("whole", "whole note", "whole notes"),
    HALF_NOTE("half", "half note", "half notes"),
    QUARTER_NOTE("quarter", "quarter note", "quarter notes"),
    EIGHTH_NOTE("eighth", "eighth note", "eighth notes", "eighths"),
    SIXTEENTH_NOTE("sixteenth", "sixteenth note", "sixteenth notes", "sixteenths"),
    TICK("tick", "ticks");

    private static final Map<String, DurationUnit> BY_ALIAS = new HashMap<>();

    static {
        for (DurationUnit unit : values()) {
            for (String alias : unit.aliases) {
                BY_ALIAS.put(alias, unit);
            }
        }
    }

    private final String[] aliases;

    DurationUnit(String... aliases) {
        this.aliases = aliases;
    }

    public static Optional<DurationUnit> fromAlias(String alias) {
        return Optional.ofNullable(BY_ALIAS.get(alias.toLowerCase(Locale.ROOT)));
    }
}
