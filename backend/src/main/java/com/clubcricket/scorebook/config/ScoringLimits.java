package com.clubcricket.scorebook.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ScoringLimits {
    private final int maxOvers;
    private final int maxRunsPerBall;

    public ScoringLimits(@Value("${scorebook.match.max-overs:50}") int maxOvers,
                         @Value("${scorebook.delivery.max-runs:7}") int maxRunsPerBall) {
        this.maxOvers = maxOvers;
        this.maxRunsPerBall = maxRunsPerBall;
    }

    public int getMaxOvers() {
        return maxOvers;
    }

    /** Upper bound for both runs off the bat and extra runs on a single delivery. */
    public int getMaxRunsPerBall() {
        return maxRunsPerBall;
    }
}
