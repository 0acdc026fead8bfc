package com.evobus.safety;

import com.evobus.config.EvolutionProperties;
import com.evobus.contract.BlastRadius;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SafetyConfiguration {

    /**
     * Registry seeded from evolution.safety.profiles. A malformed entry fails startup.
     */
    @Bean
    public SafetyProfileRegistry safetyProfileRegistry(EvolutionProperties properties) {
        SafetyProfileRegistry registry = new SafetyProfileRegistry();
        properties.getSafety().getProfiles().forEach((agentType, cfg) -> registry.registerProfile(
            new SafetyProfile(
                agentType,
                cfg.getErrorThreshold(),
                cfg.isNeedsConsensus(),
                BlastRadius.fromValue(cfg.getMaxBlastRadius()),
                cfg.isAutoRollback(),
                cfg.getSuccessRate(),
                cfg.getCostFactor()
            )));
        return registry;
    }
}
