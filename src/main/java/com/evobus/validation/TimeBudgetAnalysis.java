package com.evobus.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Where validation time goes. The total is the sum of per-check average runtimes, i.e.
 * the expected cost of one full validation pass.
 */
public record TimeBudgetAnalysis(
    @JsonProperty("time_range") TimeRange timeRange,
    @JsonProperty("total_avg_validation_time_ms") Double totalAvgValidationTimeMs,
    @JsonProperty("checks_by_time") List<CheckTime> checksByTime,
    @JsonProperty("bottleneck_check") String bottleneckCheck,
    @JsonProperty("analysis") String analysis
) {

    public record CheckTime(
        @JsonProperty("check_id") String checkId,
        @JsonProperty("avg_runtime_ms") double avgRuntimeMs,
        @JsonProperty("share") double share
    ) {}
}
