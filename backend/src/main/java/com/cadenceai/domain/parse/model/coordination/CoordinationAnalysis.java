package com.cadenceai.domain.parse.model.coordination;

import java.util.List;

public record CoordinationAnalysis(
        List<ParsedCoordination> coordinations,
        List<NWayCoordination> nWayLists
) {
    public static final CoordinationAnalysis EMPTY = new CoordinationAnalysis(List.of(), List.of());

    public CoordinationAnalysis {
        coordinations = List.copyOf(coordinations);
        nWayLists = List.copyOf(nWayLists);
    }
}
