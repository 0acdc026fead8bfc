package com.evobus.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A check performing below threshold. Lower priority numbers are more urgent.
 */
public record ImprovementOpportunity(
    @JsonProperty("check_id") String checkId,
    @JsonProperty("effectiveness") double effectiveness,
    @JsonProperty("runtime_ms") double runtimeMs,
    @JsonProperty("cost_benefit_ratio") double costBenefitRatio,
    @JsonProperty("issue") String issue,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("priority") int priority
) {
}
