package com.clubcricket.scorebook.scoring;

import com.clubcricket.scorebook.model.BallEvent;

/**
 * @param resultSummary match result, only set when this delivery finished the second innings
 */
public record DeliveryOutcome(BallEvent event,
                              boolean overComplete,
                              boolean inningsEnded,
                              String resultSummary) {
}
