package com.cadenceai.domain.parse.model.locality;

import java.util.List;
import java.util.Set;

/**
 * @param expressions     markers in source order
 * @param consumedIndices word indices covered by a marker
 * @param diagnostics     free-text notes for tooling
 */
public record LocalityScanResult(
        List<EditLocalityExpression> expressions,
        Set<Integer> consumedIndices,
        List<String> diagnostics
) {
    public static final LocalityScanResult EMPTY = new LocalityScanResult(List.of(), Set.of(), List.of());

    public LocalityScanResult {
        expressions = List.copyOf(expressions);
        consumedIndices = Set.copyOf(consumedIndices);
        diagnostics = List.copyOf(diagnostics);
    }
}
