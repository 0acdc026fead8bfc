package com.evobus.coordinator;

import com.evobus.config.EvolutionProperties;
import com.evobus.contract.ChangeContractValidator;
import com.evobus.proposal.ProposalStore;
import com.evobus.queue.DurableQueue;
import com.evobus.queue.MessageCodec;
import com.evobus.safety.SafetyProfileRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoordinatorConfiguration {

    @Bean
    public ConsensusInbox consensusInbox(DurableQueue queue, MessageCodec codec, Clock clock,
                                         EvolutionProperties properties) {
        return new ConsensusInbox(queue, codec, clock, properties.getInstanceId());
    }

    /**
     * Change executors and rollback listeners are supplied by the host agent runtime.
     * Without an executor, approved proposals fail instead of silently applying.
     */
    @Bean
    public AgentCoordinator agentCoordinator(ProposalStore proposalStore,
                                             SafetyProfileRegistry safetyProfileRegistry,
                                             ChangeContractValidator validator,
                                             DurableQueue queue,
                                             MessageCodec codec,
                                             ConsensusInbox consensusInbox,
                                             ObjectProvider<ChangeExecutor> changeExecutor,
                                             ObjectProvider<RollbackListener> rollbackListeners,
                                             Clock clock,
                                             EvolutionProperties properties) {
        return new AgentCoordinator(
            proposalStore,
            safetyProfileRegistry,
            validator,
            queue,
            codec,
            consensusInbox,
            changeExecutor.getIfAvailable(() -> ChangeExecutor.UNCONFIGURED),
            rollbackListeners.orderedStream().toList(),
            clock,
            properties.getInstanceId(),
            properties.getConsensus().getTimeoutMs(),
            properties.getConsensus().getPollIntervalMs()
        );
    }

    @Bean
    public RollbackEventListener rollbackEventListener(AgentCoordinator agentCoordinator,
                                                       DurableQueue queue,
                                                       MessageCodec codec,
                                                       EvolutionProperties properties) {
        return new RollbackEventListener(agentCoordinator, queue, codec, properties.getInstanceId());
    }
}
