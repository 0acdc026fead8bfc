package com.evobus.api;

import com.evobus.validation.CheckPerformance;
import com.evobus.validation.CheckResult;
import com.evobus.validation.EffectivenessTracker;
import com.evobus.validation.ImprovementOpportunity;
import com.evobus.validation.TimeBudgetAnalysis;
import com.evobus.validation.TimeRange;
import com.evobus.validation.ValidationCheckRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/validation")
public class ValidationController {

    private final EffectivenessTracker tracker;

    public ValidationController(EffectivenessTracker tracker) {
        this.tracker = tracker;
    }

    @PostMapping("/runs")
    @ResponseStatus(HttpStatus.CREATED)
    public ValidationCheckRecord recordRun(@RequestBody CheckRunRequest request) {
        return tracker.recordCheckRun(request.checkId(), request.result(), request.runtimeMs());
    }

    @GetMapping("/weights")
    public Map<String, Double> weights(@RequestParam(name = "time_range", defaultValue = "last_week") String timeRange) {
        return tracker.getValidationWeights(TimeRange.fromValue(timeRange));
    }

    @GetMapping("/checks/{checkId}")
    public ResponseEntity<CheckPerformance> check(@PathVariable String checkId,
                                                  @RequestParam(name = "time_range", defaultValue = "last_week") String timeRange) {
        return ResponseEntity.of(tracker.analyzeCheckPerformance(checkId, TimeRange.fromValue(timeRange)));
    }

    @GetMapping("/opportunities")
    public List<ImprovementOpportunity> opportunities(
            @RequestParam(name = "time_range", defaultValue = "last_week") String timeRange,
            @RequestParam(defaultValue = "0.70") double threshold) {
        return tracker.getImprovementOpportunities(TimeRange.fromValue(timeRange), threshold);
    }

    @GetMapping("/time-budget")
    public TimeBudgetAnalysis timeBudget(@RequestParam(name = "time_range", defaultValue = "last_week") String timeRange) {
        return tracker.getTimeBudgetAnalysis(TimeRange.fromValue(timeRange));
    }

    @PostMapping("/weights/recalculate")
    public Map<String, Double> recalculate() {
        return tracker.recalculateWeights();
    }

    public record CheckRunRequest(
        @JsonProperty("check_id") String checkId,
        @JsonProperty("result") CheckResult result,
        @JsonProperty("runtime_ms") Long runtimeMs
    ) {}
}
