package com.evobus.contract;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Input checks for everything an agent or router hands to the control loop.
 * Each failure carries a stable error code next to a human-readable message.
 */
@Component
public class ChangeContractValidator {

    public static final double DEFAULT_SCORE = 5.0;
    public static final double MAX_SCORE = 10.0;

    public void validateChange(String agentType, Map<String, Object> change) {
        requireString(agentType, "invalid_agent_type", "agent_type is required");
        if (change == null) {
            throw new ValidationException("invalid_change", "change is required");
        }
        requireString(change.get("type"), "invalid_change", "change.type is required");
    }

    /**
     * Reads impact_score or risk_score from proposal metadata, defaulting to 5.0.
     * Impact may be 0; risk must be strictly positive since it divides the priority.
     */
    public double scoreOrDefault(Map<String, Object> metadata, String key) {
        if (metadata == null || metadata.get(key) == null) {
            return DEFAULT_SCORE;
        }
        double value = requireNumber(metadata.get(key), "invalid_" + key, key + " must be a number");
        boolean riskLike = "risk_score".equals(key);
        if (!Double.isFinite(value) || value > MAX_SCORE || value < 0.0 || (riskLike && value == 0.0)) {
            throw new ValidationException("invalid_" + key,
                key + " must be in " + (riskLike ? "(0, 10]" : "[0, 10]") + " but was " + value);
        }
        return value;
    }

    /** Declared blast radius of a change, or null when the agent did not declare one. */
    public BlastRadius blastRadius(Map<String, Object> metadata) {
        if (metadata == null || metadata.get("blast_radius") == null) {
            return null;
        }
        String raw = requireString(metadata.get("blast_radius"), "invalid_blast_radius",
            "metadata.blast_radius must be low, medium or high");
        try {
            return BlastRadius.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("invalid_blast_radius", ex.getMessage());
        }
    }

    public void validatePattern(String agentType, String category, Map<String, Object> pattern) {
        requireString(agentType, "invalid_agent_type", "agent_type is required");
        requireString(category, "invalid_pattern", "category is required");
        if (pattern == null || pattern.isEmpty()) {
            throw new ValidationException("invalid_pattern", "pattern must be a non-empty map");
        }
    }

    public void validateRoutingDecision(RoutingDecisionMessage decision) {
        if (decision == null) {
            throw new ValidationException("invalid_routing_decision", "routing decision is required");
        }
        requireString(decision.instanceId(), "invalid_routing_decision", "instance_id is required");
        requireString(decision.model(), "invalid_routing_decision", "model is required");
        if (decision.complexity() == null) {
            throw new ValidationException("invalid_routing_decision", "complexity is required");
        }
        if (decision.outcome() == null) {
            throw new ValidationException("invalid_routing_decision", "outcome is required");
        }
        if (decision.responseTimeMs() != null && decision.responseTimeMs() < 0) {
            throw new ValidationException("invalid_routing_decision", "response_time_ms must be >= 0");
        }
    }

    private String requireString(Object value, String errorCode, String message) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ValidationException(errorCode, message);
        }
        return text;
    }

    private double requireNumber(Object value, String errorCode, String message) {
        if (!(value instanceof Number number)) {
            throw new ValidationException(errorCode, message);
        }
        return number.doubleValue();
    }
}
