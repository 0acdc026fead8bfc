package com.evobus.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Records consensus decisions nobody is actively waiting for.
 */
@Component
public class ConsensusResponseListener {

    private static final Logger log = LoggerFactory.getLogger(ConsensusResponseListener.class);

    private final AgentCoordinator coordinator;

    public ConsensusResponseListener(AgentCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Scheduled(
        initialDelayString = "${evolution.consensus.response-drain-interval-ms:2000}",
        fixedDelayString = "${evolution.consensus.response-drain-interval-ms:2000}"
    )
    public void tick() {
        try {
            int recorded = coordinator.collectConsensusResponses();
            if (recorded > 0) {
                log.info("Recorded {} consensus decisions", recorded);
            }
        } catch (RuntimeException ex) {
            log.error("Consensus response drain failed", ex);
        }
    }
}
