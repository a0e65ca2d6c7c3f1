package com.cadenceai.domain.parse.model.time;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Closed set of time-range shapes an edit request can refer to.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TimeRange.Absolute.class, name = "absolute"),
        @JsonSubTypes.Type(value = TimeRange.Section.class, name = "section"),
        @JsonSubTypes.Type(value = TimeRange.Relative.class, name = "relative"),
        @JsonSubTypes.Type(value = TimeRange.Duration.class, name = "duration"),
        @JsonSubTypes.Type(value = TimeRange.Point.class, name = "point"),
        @JsonSubTypes.Type(value = TimeRange.Whole.class, name = "whole"),
        @JsonSubTypes.Type(value = TimeRange.Repetition.class, name = "repetition"),
        @JsonSubTypes.Type(value = TimeRange.Composite.class, name = "composite")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface TimeRange {

    /** "from bar 8 to bar 16" */
    record Absolute(MusicalPosition start, MusicalPosition end) implements TimeRange {}

    /**
     * "the second verse", "the last chorus".
     *
     * @param sectionName canonical section name
     * @param ordinal     1-based instance number, null if unspecified
     * @param isLast      counted from the end
     * @param fromEnd     instances back from the last one (0 = last, 1 = penultimate)
     */
    record Section(String sectionName, Integer ordinal, boolean isLast, int fromEnd) implements TimeRange {

        public static Section of(String sectionName) {
            return new Section(sectionName, null, false, 0);
        }

        public static Section nth(String sectionName, int ordinal) {
            return new Section(sectionName, ordinal, false, 0);
        }
    }

    /** "before the chorus" */
    record Relative(TemporalRelation relation, TimeRange reference) implements TimeRange {}

    /** "for 4 bars", optionally anchored: "for 2 bars from bar 9" */
    record Duration(double value, DurationUnit unit, TimeRange from) implements TimeRange {}

    /** "at bar 5", "at the end of the chorus" */
    record Point(MusicalPosition position, PositionAnchor anchor, TimeRange of) implements TimeRange {}

    /**
     * "everywhere", "the whole song".
     *
     * @param phrase canonical whole-song phrase that matched
     */
    record Whole(String phrase) implements TimeRange {}

    /** "every other bar", "every 4 beats" */
    record Repetition(int interval, DurationUnit unit, boolean everyOther, TimeRange within) implements TimeRange {}

    /** Explicit combination, never implicitly merged: "in the chorus from bar 8 to 16" */
    record Composite(List<TimeRange> components, Combination combination) implements TimeRange {
        public Composite {
            components = List.copyOf(components);
        }
    }

    enum Combination {
        INTERSECTION,
        UNION
    }
}
