package com.evobus.contract;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChangeContractValidatorTest {

    private ChangeContractValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ChangeContractValidator();
    }

    @Nested
    @DisplayName("Change payloads")
    class Changes {

        @Test
        void blankAgentType_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validateChange(" ", Map.of("type", "refactor")));
            assertEquals("invalid_agent_type", ex.getErrorCode());
        }

        @Test
        void missingChange_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validateChange("refactor_agent", null));
            assertEquals("invalid_change", ex.getErrorCode());
        }

        @Test
        void nonStringType_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validateChange("refactor_agent", Map.of("type", 42)));
            assertEquals("invalid_change", ex.getErrorCode());
        }

        @Test
        void typedChange_passes() {
            assertDoesNotThrow(() -> validator.validateChange("refactor_agent", Map.of("type", "rename")));
        }
    }

    @Nested
    @DisplayName("Impact and risk scores")
    class Scores {

        @Test
        @DisplayName("Absent scores default to 5.0")
        void absent_defaultsToFive() {
            assertEquals(5.0, validator.scoreOrDefault(null, "impact_score"));
            assertEquals(5.0, validator.scoreOrDefault(Map.of(), "risk_score"));
        }

        @Test
        void impactOfZero_isAllowed() {
            assertEquals(0.0, validator.scoreOrDefault(Map.of("impact_score", 0), "impact_score"));
        }

        @Test
        void riskOfZero_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.scoreOrDefault(Map.of("risk_score", 0.0), "risk_score"));
            assertEquals("invalid_risk_score", ex.getErrorCode());
        }

        @Test
        void outOfRange_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.scoreOrDefault(Map.of("impact_score", 10.5), "impact_score"));
            assertEquals("invalid_impact_score", ex.getErrorCode());
        }

        @Test
        void nonFiniteScores_areRejected() {
            ValidationException nan = assertThrows(ValidationException.class,
                () -> validator.scoreOrDefault(Map.of("risk_score", Double.NaN), "risk_score"));
            assertEquals("invalid_risk_score", nan.getErrorCode());
            assertThrows(ValidationException.class,
                () -> validator.scoreOrDefault(Map.of("impact_score", Double.POSITIVE_INFINITY), "impact_score"));
        }

        @Test
        void nonNumeric_isRejected() {
            assertThrows(ValidationException.class,
                () -> validator.scoreOrDefault(Map.of("impact_score", "high"), "impact_score"));
        }
    }

    @Nested
    @DisplayName("Blast radius")
    class Blast {

        @Test
        void undeclared_isNull() {
            assertNull(validator.blastRadius(Map.of()));
        }

        @Test
        void parsesCaseInsensitively() {
            assertEquals(BlastRadius.MEDIUM, validator.blastRadius(Map.of("blast_radius", "Medium")));
        }

        @Test
        void unknownValue_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.blastRadius(Map.of("blast_radius", "galactic")));
            assertEquals("invalid_blast_radius", ex.getErrorCode());
        }
    }

    @Nested
    @DisplayName("Routing decisions")
    class RoutingDecisions {

        @Test
        void completeDecision_passes() {
            assertDoesNotThrow(() -> validator.validateRoutingDecision(decision("gpt-4o", 120L)));
        }

        @Test
        void missingModel_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validateRoutingDecision(decision(null, 120L)));
            assertEquals("invalid_routing_decision", ex.getErrorCode());
            assertTrue(ex.getMessage().contains("model"));
        }

        @Test
        void negativeResponseTime_isRejected() {
            assertThrows(ValidationException.class,
                () -> validator.validateRoutingDecision(decision("gpt-4o", -1L)));
        }
    }

    @Test
    void emptyPattern_isRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> validator.validatePattern("test_agent", "flaky_tests", new HashMap<>()));
        assertEquals("invalid_pattern", ex.getErrorCode());
    }

    // ---- helpers ----

    private static RoutingDecisionMessage decision(String model, Long responseTimeMs) {
        return new RoutingDecisionMessage("d-1", "instance-a", ComplexityLevel.COMPLEX, model, "openai", 4.2,
            RoutingOutcome.SUCCESS, responseTimeMs, List.of("code"), "quality", Instant.parse("2026-03-01T00:00:00Z"));
    }
}
