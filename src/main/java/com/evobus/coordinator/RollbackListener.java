package com.evobus.coordinator;

import com.evobus.proposal.ProposalStatus;

import java.time.Instant;

/**
 * Notified once per proposal when it is rolled back, so the owning agent can revert its
 * local state. Repeated rollbacks of the same proposal do not notify again.
 */
public interface RollbackListener {

    void onRollbackTriggered(RollbackNotice notice);

    record RollbackNotice(
        String proposalId,
        String agentType,
        String agentId,
        String reason,
        ProposalStatus previousStatus,
        Instant rolledBackAt
    ) {}
}
