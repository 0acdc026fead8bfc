package com.evobus.validation;

import com.evobus.config.EvolutionProperties;
import com.evobus.contract.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Derives validation-check weights from run history.
 *
 * <p>Effectiveness is the share of a check's runs in the window that passed. Checks with
 * fewer than {@code min-data-points} runs in their whole history get no weight; the rest
 * are normalized to sum to 1.0, falling back to equal weights when every score is 0.
 *
 * <p>Weights are a view over the history, never stored as truth; {@link #currentWeights()}
 * only caches the latest recalculation for the validation orchestrator.
 */
@Component
public class EffectivenessTracker {

    private static final Logger log = LoggerFactory.getLogger(EffectivenessTracker.class);

    private final ValidationCheckStore store;
    private final Clock clock;
    private final int minDataPoints;
    private final double improvementThreshold;
    private final AtomicReference<Map<String, Double>> latestWeights = new AtomicReference<>(Map.of());

    public EffectivenessTracker(ValidationCheckStore store, Clock clock, EvolutionProperties properties) {
        this.store = store;
        this.clock = clock;
        this.minDataPoints = properties.getEffectiveness().getMinDataPoints();
        this.improvementThreshold = properties.getEffectiveness().getImprovementThreshold();
    }

    public ValidationCheckRecord recordCheckRun(String checkId, CheckResult result, Long runtimeMs) {
        if (checkId == null || checkId.isBlank()) {
            throw new ValidationException("invalid_check_run", "check_id is required");
        }
        if (result == null) {
            throw new ValidationException("invalid_check_run", "result must be pass or fail");
        }
        if (runtimeMs != null && runtimeMs < 0) {
            throw new ValidationException("invalid_check_run", "runtime_ms must be >= 0");
        }
        ValidationCheckRecord record = new ValidationCheckRecord(checkId, result, runtimeMs, clock.instant());
        store.append(record);
        return record;
    }

    public Map<String, Double> getValidationWeights() {
        return getValidationWeights(TimeRange.LAST_WEEK);
    }

    public Map<String, Double> getValidationWeights(TimeRange timeRange) {
        Map<String, Double> eligible = new TreeMap<>();
        effectivenessScores(timeRange).forEach((checkId, score) -> {
            int dataPoints = store.findByCheck(checkId).size();
            if (dataPoints >= minDataPoints) {
                eligible.put(checkId, score);
            } else {
                log.debug("Check {} has {} data points (< {}), excluded from weights", checkId, dataPoints, minDataPoints);
            }
        });
        return normalize(eligible);
    }

    /** Pass proportion per check for runs inside the window. */
    public Map<String, Double> effectivenessScores(TimeRange timeRange) {
        Instant since = timeRange.since(clock.instant());
        return store.findSince(since).stream()
            .collect(Collectors.groupingBy(ValidationCheckRecord::checkId, TreeMap::new,
                Collectors.averagingDouble(r -> r.result() == CheckResult.PASS ? 1.0 : 0.0)));
    }

    public Optional<CheckPerformance> analyzeCheckPerformance(String checkId) {
        return analyzeCheckPerformance(checkId, TimeRange.LAST_WEEK);
    }

    /**
     * Effectiveness comes from the window; runtime and pass/fail counts from the check's
     * full history.
     *
     * @return empty when the check has no runs inside the window
     */
    public Optional<CheckPerformance> analyzeCheckPerformance(String checkId, TimeRange timeRange) {
        Double effectiveness = effectivenessScores(timeRange).get(checkId);
        if (effectiveness == null) {
            log.debug("No data for check {} in {}", checkId, timeRange.getValue());
            return Optional.empty();
        }

        List<ValidationCheckRecord> history = store.findByCheck(checkId);
        double avgRuntime = averageRuntime(history);
        long truePositives = history.stream().filter(r -> r.result() == CheckResult.PASS).count();
        long falsePositives = history.stream().filter(r -> r.result() == CheckResult.FAIL).count();
        double costBenefit = (avgRuntime == 0.0 || truePositives == 0) ? 0.0 : truePositives / (avgRuntime / 1000.0);

        return Optional.of(new CheckPerformance(
            checkId,
            effectiveness,
            truePositives,
            falsePositives,
            avgRuntime,
            costBenefit,
            recommendation(effectiveness, costBenefit, avgRuntime)
        ));
    }

    public List<ImprovementOpportunity> getImprovementOpportunities() {
        return getImprovementOpportunities(TimeRange.LAST_WEEK, improvementThreshold);
    }

    public List<ImprovementOpportunity> getImprovementOpportunities(TimeRange timeRange, double threshold) {
        List<ImprovementOpportunity> opportunities = new ArrayList<>();
        effectivenessScores(timeRange).forEach((checkId, score) -> {
            if (score >= threshold) {
                return;
            }
            analyzeCheckPerformance(checkId, timeRange).ifPresent(analysis -> opportunities.add(
                new ImprovementOpportunity(
                    checkId,
                    analysis.effectivenessScore(),
                    analysis.avgRuntimeMs(),
                    analysis.costBenefitRatio(),
                    issue(analysis.effectivenessScore(), analysis.avgRuntimeMs()),
                    analysis.recommendation(),
                    priority(analysis.effectivenessScore())
                )));
        });
        opportunities.sort(Comparator.comparingInt(ImprovementOpportunity::priority)
            .thenComparing(ImprovementOpportunity::checkId));
        return opportunities;
    }

    public TimeBudgetAnalysis getTimeBudgetAnalysis(TimeRange timeRange) {
        Instant since = timeRange.since(clock.instant());
        Map<String, List<ValidationCheckRecord>> byCheck = store.findSince(since).stream()
            .collect(Collectors.groupingBy(ValidationCheckRecord::checkId, TreeMap::new, Collectors.toList()));

        Map<String, Double> avgByCheck = new TreeMap<>();
        byCheck.forEach((checkId, runs) -> {
            OptionalDouble avg = runs.stream()
                .filter(r -> r.runtimeMs() != null)
                .mapToLong(ValidationCheckRecord::runtimeMs)
                .average();
            avg.ifPresent(value -> avgByCheck.put(checkId, value));
        });

        if (avgByCheck.isEmpty()) {
            return new TimeBudgetAnalysis(timeRange, null, List.of(), null, "Insufficient data for analysis");
        }

        double total = avgByCheck.values().stream().mapToDouble(Double::doubleValue).sum();
        List<TimeBudgetAnalysis.CheckTime> checks = avgByCheck.entrySet().stream()
            .map(e -> new TimeBudgetAnalysis.CheckTime(e.getKey(), e.getValue(), total == 0.0 ? 0.0 : e.getValue() / total))
            .sorted(Comparator.comparingDouble(TimeBudgetAnalysis.CheckTime::avgRuntimeMs).reversed())
            .collect(Collectors.toList());
        String bottleneck = total == 0.0 ? null : checks.get(0).checkId();
        return new TimeBudgetAnalysis(timeRange, total, checks, bottleneck,
            bottleneck == null ? "No measurable validation time" : bottleneck + " takes the largest share of validation time");
    }

    @Scheduled(
        initialDelayString = "${evolution.effectiveness.recalculate-interval-ms:86400000}",
        fixedDelayString = "${evolution.effectiveness.recalculate-interval-ms:86400000}"
    )
    public void scheduledRecalculation() {
        try {
            recalculateWeights();
        } catch (RuntimeException ex) {
            log.error("Validation weight recalculation failed", ex);
        }
    }

    /**
     * Recompute weights over the last week and publish them through
     * {@link #currentWeights()}.
     */
    public Map<String, Double> recalculateWeights() {
        Map<String, Double> weights = Map.copyOf(getValidationWeights(TimeRange.LAST_WEEK));
        latestWeights.set(weights);
        log.info("Recalculated validation weights for {} checks", weights.size());
        return weights;
    }

    public Map<String, Double> currentWeights() {
        return latestWeights.get();
    }

    private static Map<String, Double> normalize(Map<String, Double> scores) {
        if (scores.isEmpty()) {
            return scores;
        }
        double total = scores.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> weights = new TreeMap<>();
        if (total == 0.0) {
            double equal = 1.0 / scores.size();
            scores.keySet().forEach(checkId -> weights.put(checkId, equal));
        } else {
            scores.forEach((checkId, score) -> weights.put(checkId, score / total));
        }
        return weights;
    }

    private static double averageRuntime(List<ValidationCheckRecord> history) {
        return history.stream()
            .filter(r -> r.runtimeMs() != null)
            .mapToLong(ValidationCheckRecord::runtimeMs)
            .average()
            .orElse(0.0);
    }

    static String recommendation(double effectiveness, double costBenefit, double avgRuntime) {
        if (effectiveness < 0.50) {
            return "DISABLE - Low effectiveness (" + percent(effectiveness) + ")";
        }
        if (effectiveness < 0.70 && avgRuntime > 1000) {
            return "OPTIMIZE - Slow (" + Math.round(avgRuntime) + "ms) with low benefit";
        }
        if (effectiveness > 0.90 && costBenefit > 10.0) {
            return "KEEP - Excellent effectiveness and efficiency";
        }
        if (effectiveness > 0.80) {
            return "KEEP - Good effectiveness (" + percent(effectiveness) + ")";
        }
        return "REVIEW - Consider improving or replacing";
    }

    private static String issue(double effectiveness, double avgRuntime) {
        if (effectiveness < 0.50) {
            return "Low effectiveness (" + percent(effectiveness) + ") - many false positives";
        }
        if (effectiveness < 0.70 && avgRuntime > 1000) {
            return "High cost (" + Math.round(avgRuntime) + "ms) vs low benefit";
        }
        if (effectiveness < 0.70) {
            return "Below threshold effectiveness (" + percent(effectiveness) + ")";
        }
        return "Performance below optimal";
    }

    private static int priority(double effectiveness) {
        if (effectiveness < 0.50) {
            return 1;
        }
        return effectiveness < 0.70 ? 2 : 3;
    }

    private static String percent(double value) {
        return Math.round(value * 100) + "%";
    }
}
