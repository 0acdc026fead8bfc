package com.evobus.proposal;

import com.evobus.safety.SafetyProfile;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One agent-initiated change tracked through safety, consensus and execution.
 *
 * Proposals are never deleted. Status changes go through {@link #transitionTo} so the
 * transition table in {@link ProposalStatus} is the only way to move one forward.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Proposal {

    private String id;
    private String agentType;
    private String agentId;
    private Map<String, Object> change;
    private Map<String, Object> metadata;
    private SafetyProfile safetyProfile;
    private double impactScore;
    private double riskScore;
    private ProposalStatus status;
    private Map<String, Object> consensusVotes;
    private Double consensusScore;
    private Map<String, Object> metricsBefore;
    private Map<String, Object> metricsAfter;
    private String rollbackReason;
    private String failureReason;
    private Instant createdAt;
    private Instant sentForConsensusAt;
    private Instant consensusDecidedAt;
    private Instant executionStartedAt;
    private Instant executionCompletedAt;
    private Instant rolledBackAt;
    private Instant updatedAt;

    public static Proposal create(String agentType,
                                  String agentId,
                                  Map<String, Object> change,
                                  Map<String, Object> metadata,
                                  SafetyProfile safetyProfile,
                                  double impactScore,
                                  double riskScore,
                                  Instant now) {
        Proposal proposal = new Proposal();
        proposal.id = "prp-" + UUID.randomUUID();
        proposal.agentType = agentType;
        proposal.agentId = agentId;
        proposal.change = new LinkedHashMap<>(change);
        proposal.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        proposal.safetyProfile = safetyProfile;
        proposal.impactScore = impactScore;
        proposal.riskScore = riskScore;
        proposal.status = ProposalStatus.PENDING;
        proposal.consensusVotes = new LinkedHashMap<>();
        proposal.createdAt = now;
        proposal.updatedAt = now;
        return proposal;
    }

    /**
     * (impact * success_rate) / (risk * cost_factor), read from the attached profile
     * snapshot on every call.
     */
    @JsonProperty("priority_score")
    public double getPriorityScore() {
        return (impactScore * safetyProfile.successRate()) / (riskScore * safetyProfile.costFactor());
    }

    public void transitionTo(ProposalStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target);
        }
        status = target;
        switch (target) {
            case SENT_FOR_CONSENSUS -> sentForConsensusAt = at;
            case CONSENSUS_REACHED, CONSENSUS_FAILED -> consensusDecidedAt = at;
            case EXECUTING -> executionStartedAt = at;
            case APPLIED, FAILED -> executionCompletedAt = at;
            case ROLLED_BACK -> rolledBackAt = at;
            case PENDING -> { }
        }
        updatedAt = at;
    }

    public Proposal copy() {
        Proposal c = new Proposal();
        c.id = id;
        c.agentType = agentType;
        c.agentId = agentId;
        c.change = change == null ? null : new LinkedHashMap<>(change);
        c.metadata = metadata == null ? null : new LinkedHashMap<>(metadata);
        c.safetyProfile = safetyProfile;
        c.impactScore = impactScore;
        c.riskScore = riskScore;
        c.status = status;
        c.consensusVotes = consensusVotes == null ? null : new LinkedHashMap<>(consensusVotes);
        c.consensusScore = consensusScore;
        c.metricsBefore = metricsBefore == null ? null : new LinkedHashMap<>(metricsBefore);
        c.metricsAfter = metricsAfter == null ? null : new LinkedHashMap<>(metricsAfter);
        c.rollbackReason = rollbackReason;
        c.failureReason = failureReason;
        c.createdAt = createdAt;
        c.sentForConsensusAt = sentForConsensusAt;
        c.consensusDecidedAt = consensusDecidedAt;
        c.executionStartedAt = executionStartedAt;
        c.executionCompletedAt = executionCompletedAt;
        c.rolledBackAt = rolledBackAt;
        c.updatedAt = updatedAt;
        return c;
    }

    public String getId() {
        return id;
    }

    public String getAgentType() {
        return agentType;
    }

    public String getAgentId() {
        return agentId;
    }

    public Map<String, Object> getChange() {
        return change;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public SafetyProfile getSafetyProfile() {
        return safetyProfile;
    }

    public double getImpactScore() {
        return impactScore;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public ProposalStatus getStatus() {
        return status;
    }

    public Map<String, Object> getConsensusVotes() {
        return consensusVotes;
    }

    public void setConsensusVotes(Map<String, Object> consensusVotes) {
        this.consensusVotes = consensusVotes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(consensusVotes);
    }

    public Double getConsensusScore() {
        return consensusScore;
    }

    public void setConsensusScore(Double consensusScore) {
        this.consensusScore = consensusScore;
    }

    public Map<String, Object> getMetricsBefore() {
        return metricsBefore;
    }

    public void setMetricsBefore(Map<String, Object> metricsBefore) {
        this.metricsBefore = metricsBefore;
    }

    public Map<String, Object> getMetricsAfter() {
        return metricsAfter;
    }

    public void setMetricsAfter(Map<String, Object> metricsAfter) {
        this.metricsAfter = metricsAfter;
    }

    public String getRollbackReason() {
        return rollbackReason;
    }

    public void setRollbackReason(String rollbackReason) {
        this.rollbackReason = rollbackReason;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getSentForConsensusAt() {
        return sentForConsensusAt;
    }

    public Instant getConsensusDecidedAt() {
        return consensusDecidedAt;
    }

    public Instant getExecutionStartedAt() {
        return executionStartedAt;
    }

    public Instant getExecutionCompletedAt() {
        return executionCompletedAt;
    }

    public Instant getRolledBackAt() {
        return rolledBackAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
