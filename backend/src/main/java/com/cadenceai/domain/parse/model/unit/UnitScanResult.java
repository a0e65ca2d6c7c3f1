package com.cadenceai.domain.parse.model.unit;

import java.util.List;
import java.util.Set;

/**
 * @param expressions     matches in left-to-right order
 * @param consumedIndices word indices covered by a match
 */
public record UnitScanResult(
        List<UnitExpression> expressions,
        Set<Integer> consumedIndices
) {
    public UnitScanResult {
        expressions = List.copyOf(expressions);
        consumedIndices = Set.copyOf(consumedIndices);
    }
}
