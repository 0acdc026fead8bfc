package com.evobus.coordinator;

public class RollbackException extends RuntimeException {

    private final String proposalId;

    public RollbackException(String proposalId, Throwable cause) {
        super("rollback failed for proposal " + proposalId + ": " + cause.getMessage(), cause);
        this.proposalId = proposalId;
    }

    public String getProposalId() {
        return proposalId;
    }
}
