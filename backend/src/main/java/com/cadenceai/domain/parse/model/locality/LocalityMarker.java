package com.cadenceai.domain.parse.model.locality;

/**
 * @param canonical    canonical marker form
 * @param surface      matched text
 * @param localityType marker type
 * @param strength     lexicon strength in [0, 1]
 */
public record LocalityMarker(
        String canonical,
        String surface,
        LocalityType localityType,
        double strength
) {}
