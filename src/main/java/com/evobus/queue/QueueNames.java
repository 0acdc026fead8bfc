package com.evobus.queue;

public final class QueueNames {

    public static final String ROUTING_DECISIONS = "routing-decisions";
    public static final String AGENT_METRICS = "agent-metrics";
    public static final String CONSENSUS_REQUESTS = "consensus-requests";
    public static final String LEARNED_PATTERNS = "learned-patterns";
    public static final String PERFORMANCE_ADVISORIES = "performance-advisories";

    private static final String SCORE_UPDATES_PREFIX = "score-updates.";
    private static final String CONSENSUS_RESPONSES_PREFIX = "consensus-responses.";
    private static final String ROLLBACK_EVENTS_PREFIX = "rollback-events.";

    private QueueNames() {
    }

    /** Per-instance broadcast queue for learned score updates. */
    public static String scoreUpdates(String instanceId) {
        return SCORE_UPDATES_PREFIX + instanceId;
    }

    /**
     * Consensus decisions addressed to the instance that published the request. Each
     * instance reads only its own queue, so a decision is never consumed by a peer.
     */
    public static String consensusResponses(String instanceId) {
        return CONSENSUS_RESPONSES_PREFIX + instanceId;
    }

    /** Rollback requests for proposals owned by one instance. */
    public static String rollbackEvents(String instanceId) {
        return ROLLBACK_EVENTS_PREFIX + instanceId;
    }
}
