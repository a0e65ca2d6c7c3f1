package com.cadenceai.domain.parse.model.locality;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Bias a locality marker puts on the planner's edit cost.
 *
 * @param direction           which way cost is pushed
 * @param magnitude           strength in [0, 1]
 * @param impliesPreserveRest true if untouched material should be preserved
 * @param threshold           threshold constraint, nullable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CostBias(
        CostDirection direction,
        double magnitude,
        boolean impliesPreserveRest,
        ThresholdSpec threshold
) {
    public static final CostBias NEUTRAL = new CostBias(CostDirection.NEUTRAL, 0.0, false, null);
}
