package com.evobus.learning;

import java.util.List;

public record PublishReport(List<String> delivered, List<String> failed) {

    public boolean fullyDelivered() {
        return failed.isEmpty();
    }
}
