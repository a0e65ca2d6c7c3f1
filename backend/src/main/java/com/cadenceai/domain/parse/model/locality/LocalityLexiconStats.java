package com.cadenceai.domain.parse.model.locality;

import java.util.Map;

/**
 * Summary of the locality marker table, for tooling.
 */
public record LocalityLexiconStats(
        int totalMarkers,
        Map<LocalityType, Integer> byType,
        int totalVariants,
        double averageStrength
) {
    public LocalityLexiconStats {
        byType = Map.copyOf(byType);
    }
}
