package com.evobus.learning;

import com.evobus.config.EvolutionProperties;
import com.evobus.routing.AggregatedMetric;

import java.util.ArrayList;
import java.util.List;

/**
 * Additive score rules: each rule is evaluated on its own, the deltas are summed, and the
 * result is clamped into the score range. Latency rules only fire when the aggregate has
 * response time samples.
 */
public class ScoreAdjustmentRules {

    // Absorbs float noise so a delta of exactly epsilon counts as "not greater".
    private static final double TOLERANCE = 1e-9;

    private final double minScore;
    private final double maxScore;
    private final double suppressionEpsilon;
    private final double highSuccessRate;
    private final double lowSuccessRate;
    private final double fastResponseMs;
    private final double slowResponseMs;
    private final double successDelta;
    private final double latencyDelta;

    public ScoreAdjustmentRules(EvolutionProperties.Learner learner) {
        List<Double> range = learner.getScoreClampRange();
        if (range == null || range.size() != 2 || range.get(0) > range.get(1)) {
            throw new IllegalArgumentException("score-clamp-range must be [min, max] with min <= max");
        }
        this.minScore = range.get(0);
        this.maxScore = range.get(1);
        this.suppressionEpsilon = learner.getSuppressionEpsilon();
        this.highSuccessRate = learner.getHighSuccessRate();
        this.lowSuccessRate = learner.getLowSuccessRate();
        this.fastResponseMs = learner.getFastResponseMs();
        this.slowResponseMs = learner.getSlowResponseMs();
        this.successDelta = learner.getSuccessDelta();
        this.latencyDelta = learner.getLatencyDelta();
    }

    public ScoreAdjustment evaluate(AggregatedMetric metric, double oldScore) {
        double successRate = metric.successRate();
        double delta = 0.0;
        List<String> reasons = new ArrayList<>();

        if (successRate > highSuccessRate) {
            delta += successDelta;
            reasons.add(String.format("success rate %.3f above %.2f (+%.1f)", successRate, highSuccessRate, successDelta));
        }
        if (successRate < lowSuccessRate) {
            delta -= successDelta;
            reasons.add(String.format("success rate %.3f below %.2f (-%.1f)", successRate, lowSuccessRate, successDelta));
        }
        if (metric.hasResponseTimes()) {
            double avg = metric.avgResponseTimeMs();
            if (avg < fastResponseMs) {
                delta += latencyDelta;
                reasons.add(String.format("avg response %.0fms under %.0fms (+%.1f)", avg, fastResponseMs, latencyDelta));
            }
            if (avg > slowResponseMs) {
                delta -= latencyDelta;
                reasons.add(String.format("avg response %.0fms over %.0fms (-%.1f)", avg, slowResponseMs, latencyDelta));
            }
        }

        double newScore = clamp(oldScore + delta);
        boolean significant = Math.abs(newScore - oldScore) - suppressionEpsilon > TOLERANCE;
        return new ScoreAdjustment(oldScore, newScore, delta, successRate, reasons, significant);
    }

    public double clamp(double score) {
        return Math.max(minScore, Math.min(maxScore, score));
    }
}
