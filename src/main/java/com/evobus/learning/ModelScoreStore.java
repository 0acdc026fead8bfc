package com.evobus.learning;

import com.evobus.contract.ComplexityLevel;
import com.evobus.routing.AggregateKey;

import java.util.Map;

/**
 * Authoritative learned routing score per (model, complexity).
 */
public interface ModelScoreStore {

    /** Current score, or the configured default for a pair never scored. */
    double currentScore(String model, ComplexityLevel complexity);

    void commit(String model, ComplexityLevel complexity, double score);

    Map<AggregateKey, Double> snapshot();
}
