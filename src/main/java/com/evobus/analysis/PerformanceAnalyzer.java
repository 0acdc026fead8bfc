package com.evobus.analysis;

import com.evobus.config.EvolutionProperties;
import com.evobus.routing.AggregatedMetric;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags unhealthy (model, complexity) aggregates. Stateless and read-only: it never
 * touches the aggregate or any proposal.
 */
@Component
public class PerformanceAnalyzer {

    private final Clock clock;
    private final double lowSuccessRate;
    private final double slowResponseMs;

    public PerformanceAnalyzer(Clock clock, EvolutionProperties properties) {
        this.clock = clock;
        this.lowSuccessRate = properties.getAnalyzer().getLowSuccessRate();
        this.slowResponseMs = properties.getAnalyzer().getSlowResponseMs();
    }

    public List<PerformanceAdvisory> analyze(AggregatedMetric metric) {
        List<PerformanceAdvisory> advisories = new ArrayList<>();
        if (metric == null || metric.usageCount() == 0) {
            return advisories;
        }

        double successRate = metric.successRate();
        if (successRate < lowSuccessRate) {
            advisories.add(new PerformanceAdvisory(
                AdvisoryType.LOW_SUCCESS_RATE,
                metric.modelName(),
                metric.complexityLevel(),
                successRate,
                lowSuccessRate,
                String.format("%s on %s tasks succeeds %.1f%% of the time (below %.1f%%)",
                    metric.modelName(), metric.complexityLevel().getValue(), successRate * 100, lowSuccessRate * 100),
                clock.instant()
            ));
        }

        if (metric.hasResponseTimes() && metric.avgResponseTimeMs() > slowResponseMs) {
            advisories.add(new PerformanceAdvisory(
                AdvisoryType.SLOW_RESPONSE,
                metric.modelName(),
                metric.complexityLevel(),
                metric.avgResponseTimeMs(),
                slowResponseMs,
                String.format("%s on %s tasks averages %.0fms (above %.0fms)",
                    metric.modelName(), metric.complexityLevel().getValue(), metric.avgResponseTimeMs(), slowResponseMs),
                clock.instant()
            ));
        }
        return advisories;
    }
}
