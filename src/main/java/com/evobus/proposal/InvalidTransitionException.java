package com.evobus.proposal;

public class InvalidTransitionException extends RuntimeException {

    private final String proposalId;
    private final ProposalStatus from;
    private final ProposalStatus to;

    public InvalidTransitionException(String proposalId, ProposalStatus from, ProposalStatus to) {
        super("proposal " + proposalId + " cannot move from " + from.getValue() + " to " + to.getValue());
        this.proposalId = proposalId;
        this.from = from;
        this.to = to;
    }

    public String getProposalId() {
        return proposalId;
    }

    public ProposalStatus getFrom() {
        return from;
    }

    public ProposalStatus getTo() {
        return to;
    }
}
