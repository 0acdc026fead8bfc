package com.evobus.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CheckPerformance(
    @JsonProperty("check_id") String checkId,
    @JsonProperty("effectiveness_score") double effectivenessScore,
    @JsonProperty("true_positives") long truePositives,
    @JsonProperty("false_positives") long falsePositives,
    @JsonProperty("avg_runtime_ms") double avgRuntimeMs,
    @JsonProperty("cost_benefit_ratio") double costBenefitRatio,
    @JsonProperty("recommendation") String recommendation
) {
}
