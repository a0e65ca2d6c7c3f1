package com.cadenceai.domain.parse.model.token;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collection;

/**
 * Half-open character range {@code [start, end)} into the original source text.
 * Every structure produced by the parser carries one of these back to the text it came from.
 *
 * @param start inclusive start offset
 * @param end   exclusive end offset
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return start == end;
    }

    public boolean overlaps(Span other) {
        return start < other.end && other.start < end;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    public boolean contains(int offset) {
        return start <= offset && offset < end;
    }

    public Span union(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    /**
     * @throws IndexOutOfBoundsException if the span does not fit inside {@code source}
     */
    public String slice(String source) {
        return source.substring(start, end);
    }

    /**
     * Smallest span covering all given spans.
     *
     * @throws IllegalArgumentException if {@code spans} is empty
     */
    public static Span covering(Collection<Span> spans) {
        if (spans.isEmpty()) {
            throw new IllegalArgumentException("Cannot cover an empty span collection");
        }
        int start = Integer.MAX_VALUE;
        int end = 0;
        for (Span span : spans) {
            start = Math.min(start, span.start);
            end = Math.max(end, span.end);
        }
        return new Span(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
