package com.evobus.safety;

import com.evobus.contract.BlastRadius;
import com.evobus.contract.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SafetyProfileRegistryTest {

    private SafetyProfileRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SafetyProfileRegistry();
    }

    @Test
    @DisplayName("Unregistered agent types get the conservative default profile")
    void unknownAgentType_getsDefaultProfile() {
        SafetyProfile profile = registry.getProfile("refactoring_agent");

        assertEquals("refactoring_agent", profile.agentType());
        assertEquals(0.05, profile.errorThreshold());
        assertFalse(profile.needsConsensus());
        assertEquals(BlastRadius.LOW, profile.maxBlastRadius());
        assertTrue(profile.autoRollback());
        assertFalse(registry.isRegistered("refactoring_agent"));
    }

    @Test
    void registeredProfile_isReturned() {
        registry.registerProfile(profile("architecture_agent", 0.01, true));

        SafetyProfile profile = registry.getProfile("architecture_agent");
        assertTrue(profile.needsConsensus());
        assertEquals(0.01, profile.errorThreshold());
    }

    @Test
    void errorThresholdAboveOne_isRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> registry.registerProfile(profile("x", 1.5, false)));
        assertEquals("error_threshold_out_of_range", ex.getErrorCode());
    }

    @Test
    void negativeErrorThreshold_isRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> registry.registerProfile(profile("x", -0.01, false)));
        assertEquals("error_threshold_out_of_range", ex.getErrorCode());
    }

    @Test
    void boundaryThresholds_areAccepted() {
        assertDoesNotThrow(() -> registry.registerProfile(profile("zero", 0.0, false)));
        assertDoesNotThrow(() -> registry.registerProfile(profile("one", 1.0, false)));
    }

    @Test
    void nonPositiveCostFactor_isRejected() {
        SafetyProfile bad = new SafetyProfile("x", 0.05, false, BlastRadius.LOW, true, 0.9, 0.0);
        ValidationException ex = assertThrows(ValidationException.class, () -> registry.registerProfile(bad));
        assertEquals("cost_factor_out_of_range", ex.getErrorCode());
    }

    @Test
    void updateProfile_replacesRegisteredProfile() {
        registry.registerProfile(profile("quality_agent", 0.05, false));

        registry.updateProfile(profile("quality_agent", 0.02, true));

        assertTrue(registry.getProfile("quality_agent").needsConsensus());
        assertEquals(0.02, registry.getProfile("quality_agent").errorThreshold());
    }

    @Test
    void updateProfile_validatesThreshold() {
        registry.registerProfile(profile("quality_agent", 0.05, false));

        assertThrows(ValidationException.class, () -> registry.updateProfile(profile("quality_agent", 2.0, false)));
        assertEquals(0.05, registry.getProfile("quality_agent").errorThreshold());
    }

    @Test
    void updateProfile_ofUnknownType_isRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> registry.updateProfile(profile("ghost", 0.05, false)));
        assertEquals("unknown_agent_type", ex.getErrorCode());
    }

    // ---- helpers ----

    private SafetyProfile profile(String agentType, double errorThreshold, boolean needsConsensus) {
        return new SafetyProfile(agentType, errorThreshold, needsConsensus, BlastRadius.MEDIUM, true, 0.95, 1.0);
    }
}
