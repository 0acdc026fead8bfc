package com.evobus.coordinator;

import com.evobus.contract.BlastRadius;
import com.evobus.contract.ChangeContractValidator;
import com.evobus.contract.ValidationException;
import com.evobus.proposal.InvalidTransitionException;
import com.evobus.proposal.Proposal;
import com.evobus.proposal.ProposalNotFoundException;
import com.evobus.proposal.ProposalStatus;
import com.evobus.proposal.ProposalStore;
import com.evobus.queue.DurableQueue;
import com.evobus.queue.MessageCodec;
import com.evobus.queue.QueueNames;
import com.evobus.queue.QueueUnavailableException;
import com.evobus.safety.SafetyProfile;
import com.evobus.safety.SafetyProfileRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for agents that want to change themselves.
 *
 * Owns the proposal lifecycle: safety-profile gating, consensus hand-off and wait,
 * execution bookkeeping and rollback. All writes go through {@link ProposalStore#update}
 * so two callers racing on the same proposal see a consistent status.
 */
public class AgentCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AgentCoordinator.class);

    public static final String DEFAULT_ROLLBACK_REASON = "manual_rollback";

    private final ProposalStore proposalStore;
    private final SafetyProfileRegistry profileRegistry;
    private final ChangeContractValidator validator;
    private final DurableQueue queue;
    private final MessageCodec codec;
    private final ConsensusInbox consensusInbox;
    private final ChangeExecutor changeExecutor;
    private final List<RollbackListener> rollbackListeners;
    private final Clock clock;
    private final String instanceId;
    private final long defaultConsensusTimeoutMs;
    private final long consensusPollIntervalMs;

    public AgentCoordinator(ProposalStore proposalStore,
                            SafetyProfileRegistry profileRegistry,
                            ChangeContractValidator validator,
                            DurableQueue queue,
                            MessageCodec codec,
                            ConsensusInbox consensusInbox,
                            ChangeExecutor changeExecutor,
                            List<RollbackListener> rollbackListeners,
                            Clock clock,
                            String instanceId,
                            long defaultConsensusTimeoutMs,
                            long consensusPollIntervalMs) {
        this.proposalStore = proposalStore;
        this.profileRegistry = profileRegistry;
        this.validator = validator;
        this.queue = queue;
        this.codec = codec;
        this.consensusInbox = consensusInbox;
        this.changeExecutor = changeExecutor;
        this.rollbackListeners = List.copyOf(rollbackListeners);
        this.clock = clock;
        this.instanceId = instanceId;
        this.defaultConsensusTimeoutMs = defaultConsensusTimeoutMs;
        this.consensusPollIntervalMs = Math.max(1L, consensusPollIntervalMs);
    }

    public Proposal proposeChange(String agentType, Map<String, Object> change, Map<String, Object> metadata) {
        validator.validateChange(agentType, change);
        SafetyProfile profile = profileRegistry.getProfile(agentType);

        double impact = validator.scoreOrDefault(metadata, "impact_score");
        double risk = validator.scoreOrDefault(metadata, "risk_score");
        BlastRadius declared = validator.blastRadius(metadata);
        if (declared != null && declared.exceeds(profile.maxBlastRadius())) {
            throw new ValidationException("blast_radius_exceeded",
                "blast_radius " + declared.getValue() + " exceeds " + profile.maxBlastRadius().getValue()
                    + " allowed for agent_type " + agentType);
        }

        Instant now = clock.instant();
        Proposal proposal = Proposal.create(agentType, stringOrNull(metadata, "agent_id"), change, metadata,
            profile, impact, risk, now);
        proposal.setMetricsBefore(mapOrNull(metadata, "metrics_before"));

        if (!profile.needsConsensus()) {
            proposal.transitionTo(ProposalStatus.APPLIED, now);
            Proposal applied = proposalStore.save(proposal);
            log.info("Proposal {} applied without consensus agent_type={} change_type={}",
                applied.getId(), agentType, change.get("type"));
            return applied;
        }

        try {
            publishConsensusRequest(proposal, now);
        } catch (QueueUnavailableException ex) {
            // The fleet never saw the request.
            proposalStore.save(proposal);
            log.warn("Consensus request publish failed for proposal {}, left pending: {}",
                proposal.getId(), ex.getMessage());
            throw ex;
        }
        proposal.transitionTo(ProposalStatus.SENT_FOR_CONSENSUS, now);
        Proposal sent = proposalStore.save(proposal);
        log.info("Proposal {} sent for consensus agent_type={} priority={}",
            sent.getId(), agentType, String.format("%.3f", sent.getPriorityScore()));
        return sent;
    }

    public ConsensusOutcome awaitConsensus(String proposalId) {
        return awaitConsensus(proposalId, defaultConsensusTimeoutMs);
    }

    /**
     * Block until the fleet decides on the proposal or {@code timeoutMs} elapses. The
     * inbox is checked every poll interval with the thread sleeping in between.
     *
     * @throws ProposalNotFoundException immediately for unknown ids
     * @throws ConsensusTimeoutException when no decision arrived in time
     */
    public ConsensusOutcome awaitConsensus(String proposalId, long timeoutMs) {
        Proposal proposal = getProposal(proposalId);
        Optional<ConsensusOutcome> decided = decidedOutcome(proposal);
        if (decided.isPresent()) {
            return decided.get();
        }
        if (proposal.getStatus() != ProposalStatus.SENT_FOR_CONSENSUS) {
            throw new InvalidTransitionException(proposalId, proposal.getStatus(), ProposalStatus.CONSENSUS_REACHED);
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        while (true) {
            consensusInbox.drain();
            Optional<ConsensusResponse> response = consensusInbox.take(proposalId);
            if (response.isPresent()) {
                Proposal updated = applyDecision(proposalId, response.get());
                return decidedOutcome(updated).orElseThrow(() -> new InvalidTransitionException(
                    proposalId, updated.getStatus(), ProposalStatus.CONSENSUS_REACHED));
            }

            // Another thread may have applied the decision through the background drain.
            Proposal current = getProposal(proposalId);
            decided = decidedOutcome(current);
            if (decided.isPresent()) {
                return decided.get();
            }
            if (current.getStatus() == ProposalStatus.ROLLED_BACK) {
                throw new InvalidTransitionException(proposalId, current.getStatus(), ProposalStatus.CONSENSUS_REACHED);
            }

            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                log.warn("Consensus wait timed out for proposal {} after {}ms", proposalId, timeoutMs);
                throw new ConsensusTimeoutException(proposalId, timeoutMs);
            }
            try {
                Thread.sleep(Math.min(consensusPollIntervalMs, Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remainingNanos))));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ConsensusTimeoutException(proposalId, timeoutMs);
            }
        }
    }

    /**
     * Record every consensus response waiting in the inbox, including decisions that
     * arrive after their caller stopped waiting. A response whose proposal is not in the
     * store yet stays in the inbox until the consensus timeout has passed.
     *
     * @return number of proposals whose decision was recorded
     */
    public int collectConsensusResponses() {
        consensusInbox.drain();
        int recorded = 0;
        for (String proposalId : consensusInbox.waitingProposalIds()) {
            if (proposalStore.findById(proposalId).isEmpty()) {
                log.debug("Holding consensus response for unknown proposal {}", proposalId);
                continue;
            }
            Optional<ConsensusResponse> response = consensusInbox.take(proposalId);
            if (response.isEmpty()) {
                continue;
            }
            applyDecision(proposalId, response.get());
            recorded++;
        }
        consensusInbox.expireUnclaimed(clock.instant().minusMillis(defaultConsensusTimeoutMs));
        return recorded;
    }

    public ProposalStatus handleRollback(String proposalId) {
        return handleRollback(proposalId, DEFAULT_ROLLBACK_REASON);
    }

    /**
     * Force the proposal into rolled_back. Calling this again on a rolled back proposal
     * succeeds without touching it.
     *
     * @throws ProposalNotFoundException for unknown ids
     * @throws RollbackException when the store rejects the write
     */
    public ProposalStatus handleRollback(String proposalId, String reason) {
        String effectiveReason = (reason == null || reason.isBlank()) ? DEFAULT_ROLLBACK_REASON : reason;
        AtomicBoolean changed = new AtomicBoolean(false);
        AtomicReference<ProposalStatus> previous = new AtomicReference<>();
        Instant now = clock.instant();

        Proposal rolledBack;
        try {
            rolledBack = proposalStore.update(proposalId, p -> {
                if (p.getStatus() == ProposalStatus.ROLLED_BACK) {
                    return;
                }
                previous.set(p.getStatus());
                p.setRollbackReason(effectiveReason);
                p.transitionTo(ProposalStatus.ROLLED_BACK, now);
                changed.set(true);
            });
        } catch (ProposalNotFoundException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new RollbackException(proposalId, ex);
        }

        if (changed.get()) {
            log.info("Proposal {} rolled back from {} reason={}",
                proposalId, previous.get().getValue(), effectiveReason);
            notifyRollbackListeners(new RollbackListener.RollbackNotice(
                proposalId, rolledBack.getAgentType(), rolledBack.getAgentId(),
                effectiveReason, previous.get(), now));
        } else {
            log.debug("Proposal {} already rolled back", proposalId);
        }
        return ProposalStatus.ROLLED_BACK;
    }

    /**
     * Publish a learned pattern to the fleet. Delivery failures are logged and do not
     * reach the caller.
     */
    public void recordPattern(String agentType, String category, Map<String, Object> pattern) {
        validator.validatePattern(agentType, category, pattern);
        LearnedPattern message = new LearnedPattern(agentType, category, new LinkedHashMap<>(pattern),
            instanceId, clock.instant());
        try {
            queue.enqueue(QueueNames.LEARNED_PATTERNS, codec.encode(message));
            log.debug("Recorded pattern agent_type={} category={}", agentType, category);
        } catch (RuntimeException ex) {
            log.warn("Pattern publish failed agent_type={} category={}: {}", agentType, category, ex.getMessage());
        }
    }

    public ProposalStatus getChangeStatus(String proposalId) {
        return getProposal(proposalId).getStatus();
    }

    public Proposal getProposal(String proposalId) {
        return proposalStore.findById(proposalId)
            .orElseThrow(() -> new ProposalNotFoundException(proposalId));
    }

    public List<Proposal> listByStatus(ProposalStatus status) {
        return proposalStore.findByStatus(status);
    }

    /** Highest-priority approved proposal waiting for execution; ties go to the oldest. */
    public Optional<Proposal> nextProposal() {
        return proposalStore.findByStatus(ProposalStatus.CONSENSUS_REACHED).stream()
            .min(Comparator.comparingDouble(Proposal::getPriorityScore).reversed()
                .thenComparing(Proposal::getCreatedAt));
    }

    /**
     * Run the change behind a consensus_reached proposal and record whether it applied.
     */
    public Proposal executeApproved(String proposalId) {
        Proposal executing = proposalStore.update(proposalId,
            p -> p.transitionTo(ProposalStatus.EXECUTING, clock.instant()));
        log.info("Executing proposal {} agent_type={}", proposalId, executing.getAgentType());

        ChangeExecutor.ExecutionResult result;
        try {
            result = changeExecutor.execute(executing);
        } catch (RuntimeException ex) {
            log.error("Change executor threw for proposal {}", proposalId, ex);
            result = ChangeExecutor.ExecutionResult.failure(ex.getMessage());
        }

        ChangeExecutor.ExecutionResult outcome = result;
        try {
            Proposal finished = proposalStore.update(proposalId, p -> {
                if (outcome.success()) {
                    p.setMetricsAfter(new LinkedHashMap<>(outcome.metrics()));
                    p.transitionTo(ProposalStatus.APPLIED, clock.instant());
                } else {
                    p.setFailureReason(outcome.error());
                    p.transitionTo(ProposalStatus.FAILED, clock.instant());
                }
            });
            log.info("Proposal {} execution finished status={}", proposalId, finished.getStatus().getValue());
            return finished;
        } catch (InvalidTransitionException ex) {
            log.warn("Proposal {} changed state during execution: {}", proposalId, ex.getMessage());
            return getProposal(proposalId);
        }
    }

    /**
     * Attach post-change metrics. When the profile allows auto rollback and
     * {@code error_rate} is above its error threshold, the proposal is rolled back.
     */
    public Proposal reportExecutionMetrics(String proposalId, Map<String, Object> metrics) {
        Map<String, Object> snapshot = metrics == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metrics);
        Proposal updated = proposalStore.update(proposalId, p -> p.setMetricsAfter(snapshot));

        SafetyProfile profile = updated.getSafetyProfile();
        if (profile.autoRollback()
            && updated.getStatus() != ProposalStatus.ROLLED_BACK
            && snapshot.get("error_rate") instanceof Number errorRate
            && errorRate.doubleValue() > profile.errorThreshold()) {
            log.warn("Proposal {} error_rate {} above threshold {}, rolling back",
                proposalId, errorRate, profile.errorThreshold());
            handleRollback(proposalId, "error_rate " + errorRate + " exceeded threshold " + profile.errorThreshold());
            return getProposal(proposalId);
        }
        return updated;
    }

    private Proposal applyDecision(String proposalId, ConsensusResponse response) {
        Instant now = clock.instant();
        Proposal updated = proposalStore.update(proposalId, p -> {
            if (p.getStatus() != ProposalStatus.SENT_FOR_CONSENSUS && p.getStatus() != ProposalStatus.ROLLED_BACK) {
                return;
            }
            p.setConsensusVotes(response.votes());
            p.setConsensusScore(response.consensusScore());
            if (p.getStatus() == ProposalStatus.SENT_FOR_CONSENSUS) {
                p.transitionTo(response.decision() == ConsensusOutcome.APPROVED
                    ? ProposalStatus.CONSENSUS_REACHED
                    : ProposalStatus.CONSENSUS_FAILED, now);
            }
        });
        log.info("Consensus for proposal {} decision={} status={}",
            proposalId, response.decision().getValue(), updated.getStatus().getValue());
        return updated;
    }

    private Optional<ConsensusOutcome> decidedOutcome(Proposal proposal) {
        return switch (proposal.getStatus()) {
            case CONSENSUS_REACHED, EXECUTING -> Optional.of(ConsensusOutcome.APPROVED);
            case APPLIED, FAILED -> proposal.getConsensusDecidedAt() != null
                ? Optional.of(ConsensusOutcome.APPROVED)
                : Optional.empty();
            case CONSENSUS_FAILED -> Optional.of(ConsensusOutcome.REJECTED);
            case PENDING, SENT_FOR_CONSENSUS, ROLLED_BACK -> Optional.empty();
        };
    }

    private void publishConsensusRequest(Proposal proposal, Instant now) {
        ConsensusRequest request = new ConsensusRequest(
            proposal.getId(),
            proposal.getAgentType(),
            proposal.getChange(),
            proposal.getSafetyProfile(),
            proposal.getImpactScore(),
            proposal.getRiskScore(),
            proposal.getPriorityScore(),
            instanceId,
            now
        );
        queue.enqueue(QueueNames.CONSENSUS_REQUESTS, codec.encode(request));
    }

    private void notifyRollbackListeners(RollbackListener.RollbackNotice notice) {
        for (RollbackListener listener : rollbackListeners) {
            try {
                listener.onRollbackTriggered(notice);
            } catch (Exception ex) {
                log.warn("Rollback listener {} failed for proposal {}: {}",
                    listener.getClass().getSimpleName(), notice.proposalId(), ex.getMessage());
            }
        }
    }

    private static String stringOrNull(Map<String, Object> metadata, String key) {
        if (metadata == null) {
            return null;
        }
        Object value = metadata.get(key);
        return value instanceof String text && !text.isBlank() ? text : null;
    }

    private static Map<String, Object> mapOrNull(Map<String, Object> metadata, String key) {
        if (metadata == null || !(metadata.get(key) instanceof Map<?, ?> raw)) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
