package com.evobus.coordinator;

import com.evobus.proposal.Proposal;

import java.util.Map;

/**
 * Performs the actual code mutation behind an approved proposal.
 */
public interface ChangeExecutor {

    /** Used when no executor bean is present: every execution fails. */
    ChangeExecutor UNCONFIGURED = proposal -> ExecutionResult.failure("no change executor configured");

    ExecutionResult execute(Proposal proposal);

    record ExecutionResult(boolean success, Map<String, Object> metrics, String error) {

        public static ExecutionResult success(Map<String, Object> metrics) {
            return new ExecutionResult(true, metrics == null ? Map.of() : metrics, null);
        }

        public static ExecutionResult failure(String error) {
            return new ExecutionResult(false, Map.of(), error);
        }
    }
}
