package com.evobus.coordinator;

import com.evobus.contract.BlastRadius;
import com.evobus.contract.ChangeContractValidator;
import com.evobus.contract.ValidationException;
import com.evobus.proposal.InMemoryProposalStore;
import com.evobus.proposal.InvalidTransitionException;
import com.evobus.proposal.Proposal;
import com.evobus.proposal.ProposalNotFoundException;
import com.evobus.proposal.ProposalStatus;
import com.evobus.queue.DurableQueue;
import com.evobus.queue.MessageCodec;
import com.evobus.queue.QueueNames;
import com.evobus.queue.QueueUnavailableException;
import com.evobus.safety.SafetyProfile;
import com.evobus.safety.SafetyProfileRegistry;
import com.evobus.support.FlakyQueue;
import com.evobus.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class AgentCoordinatorTest {

    private static final String SAFE_AGENT = "documentation_agent";
    private static final String GATED_AGENT = "architecture_agent";
    private static final String INSTANCE = "instance-test";

    private FlakyQueue queue;
    private MessageCodec codec;
    private InMemoryProposalStore store;
    private SafetyProfileRegistry registry;
    private MutableClock clock;
    private List<RollbackListener.RollbackNotice> rollbackNotices;
    private ChangeExecutor executor;
    private ConsensusInbox inbox;
    private AgentCoordinator coordinator;

    @BeforeEach
    void setUp() {
        queue = new FlakyQueue();
        codec = new MessageCodec();
        store = new InMemoryProposalStore();
        registry = new SafetyProfileRegistry();
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        rollbackNotices = new CopyOnWriteArrayList<>();
        executor = proposal -> ChangeExecutor.ExecutionResult.success(Map.of("files_changed", 3));

        registry.registerProfile(new SafetyProfile(GATED_AGENT, 0.01, true, BlastRadius.HIGH, true, 0.95, 1.0));
        coordinator = coordinator();
    }

    @Nested
    @DisplayName("proposeChange")
    class ProposeChange {

        @Test
        @DisplayName("A change without a type is a validation error")
        void missingType_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> coordinator.proposeChange(SAFE_AGENT, Map.of("file", "README.md"), Map.of()));
            assertEquals("invalid_change", ex.getErrorCode());
            assertTrue(store.findAll().isEmpty());
        }

        @Test
        @DisplayName("Without consensus the proposal goes pending -> applied directly")
        void noConsensus_appliesDirectly() {
            Proposal proposal = coordinator.proposeChange(SAFE_AGENT, change("docs_update"), Map.of());

            assertEquals(ProposalStatus.APPLIED, proposal.getStatus());
            assertNull(proposal.getSentForConsensusAt());
            assertEquals(0, queue.depth(QueueNames.CONSENSUS_REQUESTS));
        }

        @Test
        void consensusProfile_publishesRequestAndWaits() {
            Proposal proposal = coordinator.proposeChange(GATED_AGENT, change("module_split"),
                Map.of("impact_score", 8.0, "risk_score", 2.0));

            assertEquals(ProposalStatus.SENT_FOR_CONSENSUS, proposal.getStatus());
            assertEquals(3.8, proposal.getPriorityScore(), 1e-9);

            List<DurableQueue.QueueMessage> requests = queue.dequeue(QueueNames.CONSENSUS_REQUESTS, 10);
            assertEquals(1, requests.size());
            Map<String, Object> request = codec.decodeMap(requests.get(0).payload());
            assertEquals(proposal.getId(), request.get("proposal_id"));
            assertEquals("module_split", ((Map<?, ?>) request.get("change")).get("type"));
            assertEquals(true, ((Map<?, ?>) request.get("safety_profile")).get("needs_consensus"));
        }

        @Test
        void missingScores_defaultToFive() {
            Proposal proposal = coordinator.proposeChange(SAFE_AGENT, change("docs_update"), null);

            assertEquals(5.0, proposal.getImpactScore());
            assertEquals(5.0, proposal.getRiskScore());
            assertEquals(1.0, proposal.getPriorityScore(), 1e-9);
        }

        @Test
        void zeroRisk_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> coordinator.proposeChange(SAFE_AGENT, change("docs_update"), Map.of("risk_score", 0)));
            assertEquals("invalid_risk_score", ex.getErrorCode());
        }

        @Test
        void blastRadiusAboveProfileLimit_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> coordinator.proposeChange(SAFE_AGENT, change("schema_change"), Map.of("blast_radius", "high")));
            assertEquals("blast_radius_exceeded", ex.getErrorCode());
        }

        @Test
        @DisplayName("A broker outage on the consensus request fails the call and leaves the proposal pending")
        void brokerOutage_leavesProposalPendingAndSurfaces() {
            queue.failEnqueueTo(QueueNames.CONSENSUS_REQUESTS);

            assertThrows(QueueUnavailableException.class,
                () -> coordinator.proposeChange(GATED_AGENT, change("module_split"), Map.of()));

            assertEquals(1, queue.failedEnqueues());
            List<Proposal> stored = store.findAll();
            assertEquals(1, stored.size());
            assertEquals(ProposalStatus.PENDING, stored.get(0).getStatus());
            assertNull(stored.get(0).getSentForConsensusAt());
            assertEquals(0, queue.depth(QueueNames.CONSENSUS_REQUESTS));
            assertTrue(store.findByStatus(ProposalStatus.SENT_FOR_CONSENSUS).isEmpty());
        }

        @Test
        @DisplayName("Each proposal is written to the store once, already in its final status")
        void proposal_isStoredInOneWrite() {
            List<ProposalStatus> saved = new CopyOnWriteArrayList<>();
            List<String> updated = new CopyOnWriteArrayList<>();
            store = new InMemoryProposalStore() {
                @Override
                public Proposal save(Proposal proposal) {
                    saved.add(proposal.getStatus());
                    return super.save(proposal);
                }

                @Override
                public Proposal update(String id, Consumer<Proposal> mutation) {
                    updated.add(id);
                    return super.update(id, mutation);
                }
            };
            coordinator = coordinator();

            coordinator.proposeChange(SAFE_AGENT, change("docs_update"), Map.of());
            coordinator.proposeChange(GATED_AGENT, change("module_split"), Map.of());

            assertEquals(List.of(ProposalStatus.APPLIED, ProposalStatus.SENT_FOR_CONSENSUS), saved);
            assertTrue(updated.isEmpty());
        }

        @Test
        @DisplayName("The safety profile is snapshotted at creation")
        void profileSnapshot_isNotReadLive() {
            Proposal proposal = coordinator.proposeChange(GATED_AGENT, change("module_split"), Map.of());

            registry.updateProfile(new SafetyProfile(GATED_AGENT, 0.5, false, BlastRadius.LOW, false, 0.5, 4.0));

            Proposal stored = coordinator.getProposal(proposal.getId());
            assertTrue(stored.getSafetyProfile().needsConsensus());
            assertEquals(0.95, stored.getSafetyProfile().successRate());
        }

        @Test
        void metadataCarriesAgentIdAndBaselineMetrics() {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("agent_id", "arch-7");
            metadata.put("metrics_before", Map.of("error_rate", 0.01));

            Proposal proposal = coordinator.proposeChange(GATED_AGENT, change("module_split"), metadata);

            assertEquals("arch-7", proposal.getAgentId());
            assertEquals(0.01, proposal.getMetricsBefore().get("error_rate"));
        }
    }

    @Nested
    @DisplayName("awaitConsensus")
    class AwaitConsensus {

        @Test
        @DisplayName("Unknown ids fail immediately instead of waiting out the timeout")
        void unknownId_failsFast() {
            long started = System.nanoTime();
            assertThrows(ProposalNotFoundException.class, () -> coordinator.awaitConsensus("prp-missing", 60_000));
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 5_000);
        }

        @Test
        void approval_movesToConsensusReached() {
            Proposal proposal = coordinator.proposeChange(GATED_AGENT, change("module_split"), Map.of());
            respond(proposal.getId(), "approved", 0.91);

            assertEquals(ConsensusOutcome.APPROVED, coordinator.awaitConsensus(proposal.getId(), 2_000));

            Proposal stored = coordinator.getProposal(proposal.getId());
            assertEquals(ProposalStatus.CONSENSUS_REACHED, stored.getStatus());
            assertEquals(0.91, stored.getConsensusScore());
            assertEquals("approve", stored.getConsensusVotes().get("agent-a"));
        }

        @Test
        @DisplayName("Rejection is an outcome, not an exception")
        void rejection_movesToConsensusFailed() {
            Proposal proposal = coordinator.proposeChange(GATED_AGENT, change("module_split"), Map.of());
            respond(proposal.getId(), "rejected", 0.2);

            assertEquals(ConsensusOutcome.REJECTED, coordinator.awaitConsensus(proposal.getId(), 2_000));
            assertEquals(ProposalStatus.CONSENSUS_FAILED, coordinator.getChangeStatus(proposal.getId()));
        }

        @Test
        void decisionArrivingDuringWait_isPickedUp() throws Exception {
            Proposal proposal = coordinator.proposeChange(GATED_AGENT, change("module_split"), Map.of());
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                Future<?> responder = pool.submit(() -> {
                    Thread.sleep(100);
                    respond(proposal.getId(), "approved", 0.9);
                    return null;
                });

                assertEquals(ConsensusOutcome.APPROVED, coordinator.awaitConsensus(proposal.getId(), 5_000));
                responder.get(1, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Timeout leaves the proposal waiting so a late decision still lands")
        void timeout_keepsProposalSentAndRecordsLateDecision() {
            Proposal proposal = coordinator.proposeChange(GATED_AGENT, change("module_split"), Map.of());

            assertThrows(ConsensusTimeoutException.class, () -> coordinator.awaitConsensus(proposal.getId(), 50));
            assertEquals(ProposalStatus.SENT_FOR_CONSENSUS, coordinator.getChangeStatus(proposal.getId()));

            respond(proposal.getId(), "approved", 0.88);
            assertEquals(1, coordinator.collectConsensusResponses());
            assertEquals(ProposalStatus.CONSENSUS_REACHED, coordinator.getChangeStatus(proposal.getId()));

            // A retry after the late decision returns without waiting.
            assertEquals(ConsensusOutcome.APPROVED, coordinator.awaitConsensus(proposal.getId(), 0));
        }

        @Test
        void proposalThatSkippedConsensus_cannotBeAwaited() {
            Proposal proposal = coordinator.proposeChange(SAFE_AGENT, change("docs_update"), Map.of());
            assertThrows(InvalidTransitionException.class, () -> coordinator.awaitConsensus(proposal.getId(), 100));
        }

        @Test
        void malformedResponse_isDiscarded() {
            queue.enqueue(QueueNames.consensusResponses(INSTANCE), "{not json");
            assertEquals(0, coordinator.collectConsensusResponses());
            assertEquals(0, queue.depth(QueueNames.consensusResponses(INSTANCE)));
        }

        @Test
        @DisplayName("Two instances sharing a broker each receive only their own decisions")
        void sharedBroker_decisionsReachTheOwningInstance() {
            InMemoryProposalStore peerStore = new InMemoryProposalStore();
            AgentCoordinator peer = new AgentCoordinator(peerStore, registry, new ChangeContractValidator(), queue,
                codec, new ConsensusInbox(queue, codec, clock, "instance-peer"), executor, List.of(), clock,
                "instance-peer", 30_000, 10);
            Proposal mine = coordinator.proposeChange(GATED_AGENT, change("module_split"), Map.of());
            Proposal theirs = peer.proposeChange(GATED_AGENT, change("module_split"), Map.of());

            List<DurableQueue.QueueMessage> requests = queue.dequeue(QueueNames.CONSENSUS_REQUESTS, 10);
            assertEquals(2, requests.size());
            for (DurableQueue.QueueMessage request : requests) {
                Map<String, Object> body = codec.decodeMap(request.payload());
                respondTo((String) body.get("instance_id"), (String) body.get("proposal_id"), "approved", 0.9);
            }

            assertEquals(1, coordinator.collectConsensusResponses());
            assertEquals(ProposalStatus.SENT_FOR_CONSENSUS, peer.getChangeStatus(theirs.getId()));

            assertEquals(ConsensusOutcome.APPROVED, peer.awaitConsensus(theirs.getId(), 2_000));
            assertEquals(ProposalStatus.CONSENSUS_REACHED, coordinator.getChangeStatus(mine.getId()));
            assertEquals(ProposalStatus.CONSENSUS_REACHED, peer.getChangeStatus(theirs.getId()));
        }

        @Test
        @DisplayName("A decision that arrives before its proposal is stored is held until it can be applied")
        void earlyResponse_isHeldUntilProposalExists() {
            respond("prp-not-yet", "approved", 0.9);

            assertEquals(0, coordinator.collectConsensusResponses());
            assertEquals(Set.of("prp-not-yet"), inbox.waitingProposalIds());
            assertEquals(0, queue.depth(QueueNames.consensusResponses(INSTANCE)));
        }

        @Test
        void unclaimedResponse_expiresAfterConsensusTimeout() {
            respond("prp-never", "approved", 0.9);
            assertEquals(0, coordinator.collectConsensusResponses());

            clock.advance(java.time.Duration.ofSeconds(31));
            assertEquals(0, coordinator.collectConsensusResponses());

            assertTrue(inbox.waitingProposalIds().isEmpty());
        }
    }

    @Nested
    @DisplayName("handleRollback")
    class HandleRollback {

        @Test
        @DisplayName("Rolling back twice succeeds both times and mutates once")
        void rollback_isIdempotent() {
            Proposal proposal = coordinator.proposeChange(SAFE_AGENT, change("docs_update"), Map.of());

            assertEquals(ProposalStatus.ROLLED_BACK, coordinator.handleRollback(proposal.getId(), "tests failing"));
            Proposal afterFirst = coordinator.getProposal(proposal.getId());

            clock.advance(java.time.Duration.ofMinutes(5));
            assertEquals(ProposalStatus.ROLLED_BACK, coordinator.handleRollback(proposal.getId(), "second call"));
            Proposal afterSecond = coordinator.getProposal(proposal.getId());

            assertEquals("tests failing", afterSecond.getRollbackReason());
            assertEquals(afterFirst.getRolledBackAt(), afterSecond.getRolledBackAt());
            assertEquals(afterFirst.getUpdatedAt(), afterSecond.getUpdatedAt());
            assertEquals(1, rollbackNotices.size());
            assertEquals(ProposalStatus.APPLIED, rollbackNotices.get(0).previousStatus());
        }

        @Test
        void rollback_ofUnknownId_isNotFound() {
            assertThrows(ProposalNotFoundException.class, () -> coordinator.handleRollback("prp-missing"));
        }

        @Test
        void rollback_whileWaitingForConsensus() {
            Proposal proposal = coordinator.proposeChange(GATED_AGENT, change("module_split"), Map.of());

            coordinator.handleRollback(proposal.getId());

            Proposal stored = coordinator.getProposal(proposal.getId());
            assertEquals(ProposalStatus.ROLLED_BACK, stored.getStatus());
            assertEquals(AgentCoordinator.DEFAULT_ROLLBACK_REASON, stored.getRollbackReason());
        }

        @Test
        void concurrentRollbacks_allSucceedAndNotifyOnce() throws Exception {
            Proposal proposal = coordinator.proposeChange(SAFE_AGENT, change("docs_update"), Map.of());
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<ProposalStatus>> results = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return coordinator.handleRollback(proposal.getId(), "race");
                    }));
                }
                start.countDown();
                for (Future<ProposalStatus> result : results) {
                    assertEquals(ProposalStatus.ROLLED_BACK, result.get(5, TimeUnit.SECONDS));
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(1, rollbackNotices.size());
        }

        @Test
        void failingListener_doesNotFailRollback() {
            coordinator = coordinator(List.of(
                notice -> { throw new IllegalStateException("agent offline"); },
                rollbackNotices::add));
            Proposal proposal = coordinator.proposeChange(SAFE_AGENT, change("docs_update"), Map.of());

            assertEquals(ProposalStatus.ROLLED_BACK, coordinator.handleRollback(proposal.getId()));
            assertEquals(1, rollbackNotices.size());
        }

        @Test
        void rollbackEventsQueue_drivesRollback() {
            Proposal proposal = coordinator.proposeChange(SAFE_AGENT, change("docs_update"), Map.of());
            RollbackEventListener listener = new RollbackEventListener(coordinator, queue, codec, INSTANCE);
            queue.enqueue(QueueNames.rollbackEvents(INSTANCE), codec.encode(Map.of("proposal_id", proposal.getId())));
            queue.enqueue(QueueNames.rollbackEvents(INSTANCE), codec.encode(Map.of("proposal_id", "prp-unknown")));
            queue.enqueue(QueueNames.rollbackEvents("instance-peer"), codec.encode(Map.of("proposal_id", "prp-peer")));

            assertEquals(1, listener.drain());

            Proposal stored = coordinator.getProposal(proposal.getId());
            assertEquals(ProposalStatus.ROLLED_BACK, stored.getStatus());
            assertEquals("guardian_triggered", stored.getRollbackReason());
            assertEquals(0, queue.depth(QueueNames.rollbackEvents(INSTANCE)));
            assertEquals(1, queue.depth(QueueNames.rollbackEvents("instance-peer")));
        }
    }

    @Nested
    @DisplayName("recordPattern")
    class RecordPattern {

        @Test
        void emptyPattern_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> coordinator.recordPattern(SAFE_AGENT, "naming", Map.of()));
            assertEquals("invalid_pattern", ex.getErrorCode());
        }

        @Test
        void pattern_isPublished() {
            coordinator.recordPattern(SAFE_AGENT, "naming", Map.of("prefer", "snake_case"));

            List<DurableQueue.QueueMessage> messages = queue.dequeue(QueueNames.LEARNED_PATTERNS, 10);
            assertEquals(1, messages.size());
            Map<String, Object> published = codec.decodeMap(messages.get(0).payload());
            assertEquals("naming", published.get("category"));
            assertEquals("instance-test", published.get("instance_id"));
        }

        @Test
        void brokerOutage_isNotSurfaced() {
            queue.failEnqueueTo(QueueNames.LEARNED_PATTERNS);
            assertDoesNotThrow(() -> coordinator.recordPattern(SAFE_AGENT, "naming", Map.of("prefer", "snake_case")));
        }
    }

    @Nested
    @DisplayName("Execution lifecycle")
    class Execution {

        @Test
        void nextProposal_picksHighestPriorityApproved() {
            Proposal low = approved(Map.of("impact_score", 2.0, "risk_score", 4.0));
            Proposal high = approved(Map.of("impact_score", 9.0, "risk_score", 1.0));

            assertEquals(high.getId(), coordinator.nextProposal().orElseThrow().getId());
            assertNotEquals(low.getId(), high.getId());
        }

        @Test
        void executeApproved_appliesAndStoresMetrics() {
            Proposal proposal = approved(Map.of());

            Proposal finished = coordinator.executeApproved(proposal.getId());

            assertEquals(ProposalStatus.APPLIED, finished.getStatus());
            assertEquals(3, finished.getMetricsAfter().get("files_changed"));
            assertNotNull(finished.getExecutionStartedAt());
        }

        @Test
        void failingExecutor_marksFailed() {
            executor = proposal -> { throw new IllegalStateException("merge conflict"); };
            coordinator = coordinator();
            Proposal proposal = approved(Map.of());

            Proposal finished = coordinator.executeApproved(proposal.getId());

            assertEquals(ProposalStatus.FAILED, finished.getStatus());
            assertEquals("merge conflict", finished.getFailureReason());
        }

        @Test
        void executeBeforeConsensus_isInvalid() {
            Proposal proposal = coordinator.proposeChange(GATED_AGENT, change("module_split"), Map.of());
            assertThrows(InvalidTransitionException.class, () -> coordinator.executeApproved(proposal.getId()));
        }

        @Test
        void errorRateAboveThreshold_triggersAutoRollback() {
            Proposal proposal = coordinator.proposeChange(SAFE_AGENT, change("docs_update"), Map.of());

            Proposal updated = coordinator.reportExecutionMetrics(proposal.getId(), Map.of("error_rate", 0.2));

            assertEquals(ProposalStatus.ROLLED_BACK, updated.getStatus());
            assertTrue(updated.getRollbackReason().contains("error_rate"));
            assertEquals(1, rollbackNotices.size());
        }

        @Test
        void errorRateWithinThreshold_keepsChange() {
            Proposal proposal = coordinator.proposeChange(SAFE_AGENT, change("docs_update"), Map.of());

            Proposal updated = coordinator.reportExecutionMetrics(proposal.getId(), Map.of("error_rate", 0.01));

            assertEquals(ProposalStatus.APPLIED, updated.getStatus());
            assertEquals(0.01, updated.getMetricsAfter().get("error_rate"));
        }
    }

    // ---- helpers ----

    private AgentCoordinator coordinator() {
        return coordinator(List.of(rollbackNotices::add));
    }

    private AgentCoordinator coordinator(List<RollbackListener> listeners) {
        inbox = new ConsensusInbox(queue, codec, clock, INSTANCE);
        return new AgentCoordinator(store, registry, new ChangeContractValidator(), queue, codec,
            inbox, executor, listeners, clock, INSTANCE, 30_000, 10);
    }

    private Map<String, Object> change(String type) {
        return Map.of("type", type, "target", "lib/core");
    }

    private void respond(String proposalId, String decision, double score) {
        respondTo(INSTANCE, proposalId, decision, score);
    }

    private void respondTo(String instanceId, String proposalId, String decision, double score) {
        Map<String, Object> response = Map.of(
            "proposal_id", proposalId,
            "decision", decision,
            "votes", Map.of("agent-a", "approve", "agent-b", decision.equals("approved") ? "approve" : "reject"),
            "consensus_score", score
        );
        queue.enqueue(QueueNames.consensusResponses(instanceId), codec.encode(response));
    }

    private Proposal approved(Map<String, Object> metadata) {
        Proposal proposal = coordinator.proposeChange(GATED_AGENT, change("module_split"), metadata);
        respond(proposal.getId(), "approved", 0.9);
        assertEquals(ConsensusOutcome.APPROVED, coordinator.awaitConsensus(proposal.getId(), 2_000));
        return coordinator.getProposal(proposal.getId());
    }
}
