package com.evobus.learning;

import java.util.List;

/**
 * Outcome of the delta rules for one aggregate.
 *
 * @param reasons one entry per rule that fired, in evaluation order
 * @param significant whether the change is large enough to publish
 */
public record ScoreAdjustment(
    double oldScore,
    double newScore,
    double totalDelta,
    double successRate,
    List<String> reasons,
    boolean significant
) {

    public String reason() {
        return reasons.isEmpty() ? "no rule applied" : String.join("; ", reasons);
    }
}
