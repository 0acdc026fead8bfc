package com.evobus.coordinator;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Read from consensus-responses.<instance_id>. */
public record ConsensusResponse(
    @JsonProperty("proposal_id") String proposalId,
    @JsonProperty("decision") ConsensusOutcome decision,
    @JsonProperty("votes") Map<String, Object> votes,
    @JsonProperty("consensus_score") Double consensusScore
) {
}
