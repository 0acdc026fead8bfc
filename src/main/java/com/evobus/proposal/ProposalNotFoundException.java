package com.evobus.proposal;

public class ProposalNotFoundException extends RuntimeException {

    private final String proposalId;

    public ProposalNotFoundException(String proposalId) {
        super("proposal not found: " + proposalId);
        this.proposalId = proposalId;
    }

    public String getProposalId() {
        return proposalId;
    }
}
