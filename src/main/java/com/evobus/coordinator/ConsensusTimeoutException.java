package com.evobus.coordinator;

/**
 * No fleet decision arrived in time. The proposal stays sent_for_consensus so a late
 * decision is still recorded.
 */
public class ConsensusTimeoutException extends RuntimeException {

    private final String proposalId;

    public ConsensusTimeoutException(String proposalId, long timeoutMs) {
        super("no consensus decision for proposal " + proposalId + " within " + timeoutMs + "ms");
        this.proposalId = proposalId;
    }

    public String getProposalId() {
        return proposalId;
    }
}
