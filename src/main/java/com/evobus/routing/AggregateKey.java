package com.evobus.routing;

import com.evobus.contract.ComplexityLevel;

public record AggregateKey(String model, ComplexityLevel complexity) {

    @Override
    public String toString() {
        return model + "/" + complexity.getValue();
    }
}
