package com.evobus.proposal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Proposal lifecycle. Forward moves follow the table below; ROLLED_BACK can be forced
 * from every other state and is the only state nothing leaves.
 *
 * <pre>
 * pending -> sent_for_consensus -> consensus_reached -> executing -> applied | failed
 *                               -> consensus_failed
 * pending -> applied   (profile does not need consensus)
 * </pre>
 */
public enum ProposalStatus {
    PENDING("pending"),
    SENT_FOR_CONSENSUS("sent_for_consensus"),
    CONSENSUS_REACHED("consensus_reached"),
    CONSENSUS_FAILED("consensus_failed"),
    EXECUTING("executing"),
    APPLIED("applied"),
    FAILED("failed"),
    ROLLED_BACK("rolled_back");

    private final String value;

    ProposalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == APPLIED || this == FAILED || this == CONSENSUS_FAILED || this == ROLLED_BACK;
    }

    public Set<ProposalStatus> forwardTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(SENT_FOR_CONSENSUS, APPLIED);
            case SENT_FOR_CONSENSUS -> EnumSet.of(CONSENSUS_REACHED, CONSENSUS_FAILED);
            case CONSENSUS_REACHED -> EnumSet.of(EXECUTING);
            case EXECUTING -> EnumSet.of(APPLIED, FAILED);
            case CONSENSUS_FAILED, APPLIED, FAILED, ROLLED_BACK -> EnumSet.noneOf(ProposalStatus.class);
        };
    }

    public boolean canTransitionTo(ProposalStatus target) {
        if (target == ROLLED_BACK) {
            return this != ROLLED_BACK;
        }
        return forwardTransitions().contains(target);
    }

    @JsonCreator
    public static ProposalStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown proposal status: " + raw));
    }
}
