package com.evobus.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the background loops (routing consumer, learner, metrics flush, consensus and
 * rollback drains). Tests switch it off with evolution.scheduling.enabled=false and drive
 * the loops by hand.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "evolution.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfiguration {
}
