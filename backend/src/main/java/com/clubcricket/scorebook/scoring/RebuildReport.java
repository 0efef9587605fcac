package com.clubcricket.scorebook.scoring;

import java.util.List;

/**
 * Outcome of replaying an innings' active log over its cached aggregate.
 *
 * @param corrections one entry per counter that differed, e.g. {@code totalRuns: 121 -> 119}
 */
public record RebuildReport(int inningsNumber, int activeEvents, List<String> corrections) {

    public boolean drifted() {
        return !corrections.isEmpty();
    }
}
