package com.evobus.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds evolution.* from application.yml.
 *
 * <p>Every threshold used by the control loop lives here so a deployment can override it
 * without a rebuild. Defaults match the values the fleet runs with in production.
 */
@ConfigurationProperties(prefix = "evolution")
public class EvolutionProperties {

    /** Identity of this instance in the fleet, stamped on outbound messages. */
    private String instanceId = "instance_default";

    private Consensus consensus = new Consensus();
    private Rollback rollback = new Rollback();
    private Routing routing = new Routing();
    private Learner learner = new Learner();
    private ScoreUpdates scoreUpdates = new ScoreUpdates();
    private Analyzer analyzer = new Analyzer();
    private Metrics metrics = new Metrics();
    private Effectiveness effectiveness = new Effectiveness();
    private Safety safety = new Safety();

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    public Consensus getConsensus() {
        return consensus;
    }

    public void setConsensus(Consensus consensus) {
        this.consensus = consensus;
    }

    public Rollback getRollback() {
        return rollback;
    }

    public void setRollback(Rollback rollback) {
        this.rollback = rollback;
    }

    public Routing getRouting() {
        return routing;
    }

    public void setRouting(Routing routing) {
        this.routing = routing;
    }

    public Learner getLearner() {
        return learner;
    }

    public void setLearner(Learner learner) {
        this.learner = learner;
    }

    public ScoreUpdates getScoreUpdates() {
        return scoreUpdates;
    }

    public void setScoreUpdates(ScoreUpdates scoreUpdates) {
        this.scoreUpdates = scoreUpdates;
    }

    public Analyzer getAnalyzer() {
        return analyzer;
    }

    public void setAnalyzer(Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public Effectiveness getEffectiveness() {
        return effectiveness;
    }

    public void setEffectiveness(Effectiveness effectiveness) {
        this.effectiveness = effectiveness;
    }

    public Safety getSafety() {
        return safety;
    }

    public void setSafety(Safety safety) {
        this.safety = safety;
    }

    public static class Consensus {

        /** How long awaitConsensus blocks before giving up. */
        private long timeoutMs = 30_000L;

        /** Sleep between inbox checks while waiting. */
        private long pollIntervalMs = 500L;

        /** Cadence of the background drain of consensus-responses. */
        private long responseDrainIntervalMs = 2_000L;

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getResponseDrainIntervalMs() {
            return responseDrainIntervalMs;
        }

        public void setResponseDrainIntervalMs(long responseDrainIntervalMs) {
            this.responseDrainIntervalMs = responseDrainIntervalMs;
        }
    }

    public static class Rollback {

        private long pollIntervalMs = 5_000L;

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }
    }

    public static class Routing {

        private long pollIntervalMs = 5_000L;

        /** Upper bound of messages claimed per poll tick. 1 gives strictly sequential processing. */
        private int batchSize = 10;

        /** Consecutive failures after which the consumer halts and alerts. */
        private int maxConsecutiveErrors = 5;

        private long backoffBaseMs = 1_000L;
        private long backoffMaxMs = 30_000L;

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxConsecutiveErrors() {
            return maxConsecutiveErrors;
        }

        public void setMaxConsecutiveErrors(int maxConsecutiveErrors) {
            this.maxConsecutiveErrors = maxConsecutiveErrors;
        }

        public long getBackoffBaseMs() {
            return backoffBaseMs;
        }

        public void setBackoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
        }

        public long getBackoffMaxMs() {
            return backoffMaxMs;
        }

        public void setBackoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
        }
    }

    public static class Learner {

        private long intervalMs = 60_000L;

        /** Aggregates with fewer decisions than this are not scored. */
        private long minSampleThreshold = 100L;

        /** [min, max] bounds every learned score is clamped into. */
        private List<Double> scoreClampRange = new ArrayList<>(List.of(0.0, 5.0));

        /** Changes of this magnitude or smaller are not published. */
        private double suppressionEpsilon = 0.1;

        /** Score assumed for a (model, complexity) pair that has never been scored. */
        private double defaultScore = 2.5;

        private double highSuccessRate = 0.95;
        private double lowSuccessRate = 0.85;
        private double fastResponseMs = 500.0;
        private double slowResponseMs = 2_000.0;
        private double successDelta = 0.2;
        private double latencyDelta = 0.1;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getMinSampleThreshold() {
            return minSampleThreshold;
        }

        public void setMinSampleThreshold(long minSampleThreshold) {
            this.minSampleThreshold = minSampleThreshold;
        }

        public List<Double> getScoreClampRange() {
            return scoreClampRange;
        }

        public void setScoreClampRange(List<Double> scoreClampRange) {
            this.scoreClampRange = (scoreClampRange == null) ? new ArrayList<>(List.of(0.0, 5.0)) : scoreClampRange;
        }

        public double getSuppressionEpsilon() {
            return suppressionEpsilon;
        }

        public void setSuppressionEpsilon(double suppressionEpsilon) {
            this.suppressionEpsilon = suppressionEpsilon;
        }

        public double getDefaultScore() {
            return defaultScore;
        }

        public void setDefaultScore(double defaultScore) {
            this.defaultScore = defaultScore;
        }

        public double getHighSuccessRate() {
            return highSuccessRate;
        }

        public void setHighSuccessRate(double highSuccessRate) {
            this.highSuccessRate = highSuccessRate;
        }

        public double getLowSuccessRate() {
            return lowSuccessRate;
        }

        public void setLowSuccessRate(double lowSuccessRate) {
            this.lowSuccessRate = lowSuccessRate;
        }

        public double getFastResponseMs() {
            return fastResponseMs;
        }

        public void setFastResponseMs(double fastResponseMs) {
            this.fastResponseMs = fastResponseMs;
        }

        public double getSlowResponseMs() {
            return slowResponseMs;
        }

        public void setSlowResponseMs(double slowResponseMs) {
            this.slowResponseMs = slowResponseMs;
        }

        public double getSuccessDelta() {
            return successDelta;
        }

        public void setSuccessDelta(double successDelta) {
            this.successDelta = successDelta;
        }

        public double getLatencyDelta() {
            return latencyDelta;
        }

        public void setLatencyDelta(double latencyDelta) {
            this.latencyDelta = latencyDelta;
        }
    }

    public static class ScoreUpdates {

        /** Instances that always receive score updates, in addition to those seen in routing traffic. */
        private List<String> instances = new ArrayList<>();

        private int publishAttempts = 3;
        private long retryBackoffMs = 200L;

        /** Discovered instances silent for longer than this stop receiving updates; 0 keeps them forever. */
        private long instanceTtlMs = 86_400_000L;

        public List<String> getInstances() {
            return instances;
        }

        public void setInstances(List<String> instances) {
            this.instances = (instances == null) ? new ArrayList<>() : instances;
        }

        public int getPublishAttempts() {
            return publishAttempts;
        }

        public void setPublishAttempts(int publishAttempts) {
            this.publishAttempts = publishAttempts;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public long getInstanceTtlMs() {
            return instanceTtlMs;
        }

        public void setInstanceTtlMs(long instanceTtlMs) {
            this.instanceTtlMs = instanceTtlMs;
        }
    }

    public static class Analyzer {

        private double lowSuccessRate = 0.85;
        private double slowResponseMs = 5_000.0;

        public double getLowSuccessRate() {
            return lowSuccessRate;
        }

        public void setLowSuccessRate(double lowSuccessRate) {
            this.lowSuccessRate = lowSuccessRate;
        }

        public double getSlowResponseMs() {
            return slowResponseMs;
        }

        public void setSlowResponseMs(double slowResponseMs) {
            this.slowResponseMs = slowResponseMs;
        }
    }

    public static class Metrics {

        private long flushIntervalMs = 60_000L;

        /** Hard limit on buffered entries. Overflow drops the oldest entries. */
        private int bufferCapacity = 10_000;

        /** Recent values kept per (agent type, metric name) for local reads. */
        private int cacheDepth = 100;

        public long getFlushIntervalMs() {
            return flushIntervalMs;
        }

        public void setFlushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
        }

        public int getBufferCapacity() {
            return bufferCapacity;
        }

        public void setBufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
        }

        public int getCacheDepth() {
            return cacheDepth;
        }

        public void setCacheDepth(int cacheDepth) {
            this.cacheDepth = cacheDepth;
        }
    }

    public static class Effectiveness {

        /** Checks with fewer historical runs than this get no weight. */
        private int minDataPoints = 10;

        private double improvementThreshold = 0.70;
        private long recalculateIntervalMs = 86_400_000L;

        public int getMinDataPoints() {
            return minDataPoints;
        }

        public void setMinDataPoints(int minDataPoints) {
            this.minDataPoints = minDataPoints;
        }

        public double getImprovementThreshold() {
            return improvementThreshold;
        }

        public void setImprovementThreshold(double improvementThreshold) {
            this.improvementThreshold = improvementThreshold;
        }

        public long getRecalculateIntervalMs() {
            return recalculateIntervalMs;
        }

        public void setRecalculateIntervalMs(long recalculateIntervalMs) {
            this.recalculateIntervalMs = recalculateIntervalMs;
        }
    }

    public static class Safety {

        /** agent_type -> profile seeded into the registry at startup. */
        private Map<String, ProfileConfig> profiles = new LinkedHashMap<>();

        public Map<String, ProfileConfig> getProfiles() {
            return profiles;
        }

        public void setProfiles(Map<String, ProfileConfig> profiles) {
            this.profiles = (profiles == null) ? new LinkedHashMap<>() : profiles;
        }
    }

    public static class ProfileConfig {

        private double errorThreshold = 0.05;
        private boolean needsConsensus = false;
        private String maxBlastRadius = "low";
        private boolean autoRollback = true;
        private double successRate = 1.0;
        private double costFactor = 1.0;

        public double getErrorThreshold() {
            return errorThreshold;
        }

        public void setErrorThreshold(double errorThreshold) {
            this.errorThreshold = errorThreshold;
        }

        public boolean isNeedsConsensus() {
            return needsConsensus;
        }

        public void setNeedsConsensus(boolean needsConsensus) {
            this.needsConsensus = needsConsensus;
        }

        public String getMaxBlastRadius() {
            return maxBlastRadius;
        }

        public void setMaxBlastRadius(String maxBlastRadius) {
            this.maxBlastRadius = maxBlastRadius;
        }

        public boolean isAutoRollback() {
            return autoRollback;
        }

        public void setAutoRollback(boolean autoRollback) {
            this.autoRollback = autoRollback;
        }

        public double getSuccessRate() {
            return successRate;
        }

        public void setSuccessRate(double successRate) {
            this.successRate = successRate;
        }

        public double getCostFactor() {
            return costFactor;
        }

        public void setCostFactor(double costFactor) {
            this.costFactor = costFactor;
        }
    }
}
