package com.evobus.safety;

import com.evobus.contract.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-agent-type safety profiles. Unregistered agent types get
 * {@link SafetyProfile#defaults(String)}.
 */
public class SafetyProfileRegistry {

    private static final Logger log = LoggerFactory.getLogger(SafetyProfileRegistry.class);

    private final ConcurrentHashMap<String, SafetyProfile> profiles = new ConcurrentHashMap<>();

    public SafetyProfile getProfile(String agentType) {
        SafetyProfile registered = profiles.get(agentType);
        return registered != null ? registered : SafetyProfile.defaults(agentType);
    }

    public boolean isRegistered(String agentType) {
        return profiles.containsKey(agentType);
    }

    public SafetyProfile registerProfile(SafetyProfile profile) {
        validate(profile);
        profiles.put(profile.agentType(), profile);
        log.info("Registered safety profile agent_type={} needs_consensus={} max_blast_radius={}",
            profile.agentType(), profile.needsConsensus(), profile.maxBlastRadius().getValue());
        return profile;
    }

    public SafetyProfile updateProfile(SafetyProfile profile) {
        validate(profile);
        SafetyProfile replaced = profiles.computeIfPresent(profile.agentType(), (type, existing) -> profile);
        if (replaced == null) {
            throw new ValidationException("unknown_agent_type",
                "no registered safety profile for agent_type " + profile.agentType());
        }
        log.info("Updated safety profile agent_type={}", profile.agentType());
        return replaced;
    }

    public List<SafetyProfile> listProfiles() {
        List<SafetyProfile> all = new ArrayList<>(profiles.values());
        all.sort(Comparator.comparing(SafetyProfile::agentType));
        return all;
    }

    private void validate(SafetyProfile profile) {
        if (profile == null || profile.agentType() == null || profile.agentType().isBlank()) {
            throw new ValidationException("invalid_agent_type", "agent_type is required");
        }
        if (Double.isNaN(profile.errorThreshold()) || profile.errorThreshold() < 0.0 || profile.errorThreshold() > 1.0) {
            throw new ValidationException("error_threshold_out_of_range",
                "error_threshold must be in [0, 1] but was " + profile.errorThreshold());
        }
        if (profile.maxBlastRadius() == null) {
            throw new ValidationException("invalid_blast_radius", "max_blast_radius is required");
        }
        if (!(profile.successRate() > 0.0) || profile.successRate() > 1.0) {
            throw new ValidationException("success_rate_out_of_range",
                "success_rate must be in (0, 1] but was " + profile.successRate());
        }
        if (!(profile.costFactor() > 0.0)) {
            throw new ValidationException("cost_factor_out_of_range",
                "cost_factor must be > 0 but was " + profile.costFactor());
        }
    }
}
