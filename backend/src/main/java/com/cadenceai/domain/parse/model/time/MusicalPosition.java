package com.cadenceai.domain.parse.model.time;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Comparator;

/**
 * 1-based musical position. Ordered by (bar, beat, subdivision); a missing beat counts as 1,
 * a missing subdivision as 0.
 *
 * @param bar         bar number
 * @param beat        beat within the bar, nullable
 * @param subdivision subdivision within the beat, nullable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MusicalPosition(
        int bar,
        Integer beat,
        Integer subdivision
) implements Comparable<MusicalPosition> {

    private static final Comparator<MusicalPosition> ORDER = Comparator
            .comparingInt(MusicalPosition::bar)
            .thenComparingInt(MusicalPosition::effectiveBeat)
            .thenComparingInt(MusicalPosition::effectiveSubdivision);

    public static MusicalPosition ofBar(int bar) {
        return new MusicalPosition(bar, null, null);
    }

    public static MusicalPosition of(int bar, int beat) {
        return new MusicalPosition(bar, beat, null);
    }

    int effectiveBeat() {
        return beat != null ? beat : 1;
    }

    int effectiveSubdivision() {
        return subdivision != null ? subdivision : 0;
    }

    @Override
    public int compareTo(MusicalPosition other) {
        return ORDER.compare(this, other);
    }
}
