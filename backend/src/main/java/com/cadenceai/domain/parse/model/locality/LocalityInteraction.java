package com.cadenceai.domain.parse.model.locality;

import com.cadenceai.domain.parse.model.AnalysisWarning;

import java.util.List;

/**
 * How co-occurring locality markers combine.
 *
 * @param conflicts      conflicting marker pairs (restriction vs totality, precision vs approximation)
 * @param reinforcements reinforcing pairs (two restrictions, min + max range)
 * @param combinedBias   combined cost bias
 */
public record LocalityInteraction(
        List<AnalysisWarning> conflicts,
        List<AnalysisWarning> reinforcements,
        CostBias combinedBias
) {
    public static final LocalityInteraction NONE = new LocalityInteraction(List.of(), List.of(), CostBias.NEUTRAL);

    public LocalityInteraction {
        conflicts = List.copyOf(conflicts);
        reinforcements = List.copyOf(reinforcements);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
