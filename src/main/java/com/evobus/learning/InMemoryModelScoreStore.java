package com.evobus.learning;

import com.evobus.config.EvolutionProperties;
import com.evobus.contract.ComplexityLevel;
import com.evobus.routing.AggregateKey;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryModelScoreStore implements ModelScoreStore {

    private final double defaultScore;
    private final ConcurrentHashMap<AggregateKey, Double> scores = new ConcurrentHashMap<>();

    public InMemoryModelScoreStore(EvolutionProperties properties) {
        this.defaultScore = properties.getLearner().getDefaultScore();
    }

    @Override
    public double currentScore(String model, ComplexityLevel complexity) {
        return scores.getOrDefault(new AggregateKey(model, complexity), defaultScore);
    }

    @Override
    public void commit(String model, ComplexityLevel complexity, double score) {
        scores.put(new AggregateKey(model, complexity), score);
    }

    @Override
    public Map<AggregateKey, Double> snapshot() {
        return Map.copyOf(scores);
    }
}
