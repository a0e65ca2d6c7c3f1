package com.cadenceai.domain.parse.model.coordination;

import com.cadenceai.domain.parse.model.token.Span;

import java.util.List;

/**
 * Comma-separated list of three or more items: "bass, drums, and keys".
 *
 * @param items       item texts in order
 * @param itemSpans   source range of each item
 * @param conjunction closing conjunction ("and"/"or")
 * @param oxfordComma true if a comma precedes the closing conjunction
 * @param span        source range of the whole list
 */
public record NWayCoordination(
        List<String> items,
        List<Span> itemSpans,
        String conjunction,
        boolean oxfordComma,
        Span span
) {
    public NWayCoordination {
        items = List.copyOf(items);
        itemSpans = List.copyOf(itemSpans);
    }
}
