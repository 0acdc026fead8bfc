package com.evobus.api;

import com.evobus.coordinator.AgentCoordinator;
import com.evobus.coordinator.ConsensusOutcome;
import com.evobus.proposal.Proposal;
import com.evobus.proposal.ProposalStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/proposals")
public class ProposalController {

    private final AgentCoordinator coordinator;

    public ProposalController(AgentCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Proposal propose(@RequestBody ProposeChangeRequest request) {
        return coordinator.proposeChange(request.agentType(), request.change(), request.metadata());
    }

    @GetMapping
    public List<Proposal> list(@RequestParam(defaultValue = "pending") String status) {
        return coordinator.listByStatus(ProposalStatus.fromValue(status));
    }

    @GetMapping("/next")
    public Map<String, Object> next() {
        return coordinator.nextProposal()
            .<Map<String, Object>>map(p -> Map.of("proposal", p))
            .orElse(Map.of());
    }

    @GetMapping("/{id}")
    public Proposal get(@PathVariable String id) {
        return coordinator.getProposal(id);
    }

    @GetMapping("/{id}/status")
    public Map<String, Object> status(@PathVariable String id) {
        return Map.of(
            "proposal_id", id,
            "status", coordinator.getChangeStatus(id).getValue()
        );
    }

    @PostMapping("/{id}/consensus")
    public Map<String, Object> awaitConsensus(@PathVariable String id,
                                              @RequestParam(name = "timeout_ms", required = false) Long timeoutMs) {
        ConsensusOutcome outcome = timeoutMs == null
            ? coordinator.awaitConsensus(id)
            : coordinator.awaitConsensus(id, timeoutMs);
        return Map.of(
            "proposal_id", id,
            "decision", outcome.getValue(),
            "status", coordinator.getChangeStatus(id).getValue()
        );
    }

    @PostMapping("/{id}/execute")
    public Proposal execute(@PathVariable String id) {
        return coordinator.executeApproved(id);
    }

    @PostMapping("/{id}/metrics")
    public Proposal reportMetrics(@PathVariable String id, @RequestBody Map<String, Object> metrics) {
        return coordinator.reportExecutionMetrics(id, metrics);
    }

    @PostMapping("/{id}/rollback")
    public Map<String, Object> rollback(@PathVariable String id,
                                        @RequestBody(required = false) Map<String, Object> body) {
        Object reason = body == null ? null : body.get("reason");
        ProposalStatus status = coordinator.handleRollback(id, reason instanceof String text ? text : null);
        return Map.of(
            "proposal_id", id,
            "status", status.getValue()
        );
    }
}
