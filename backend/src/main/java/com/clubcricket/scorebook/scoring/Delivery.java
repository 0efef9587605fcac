package com.clubcricket.scorebook.scoring;

import com.clubcricket.scorebook.model.DismissalType;
import com.clubcricket.scorebook.model.ExtraType;

/**
 * What the scorer saw on one delivery, before it is validated and written to the log.
 */
public record Delivery(int runsOffBat,
                       boolean four,
                       boolean six,
                       ExtraType extraType,
                       int extraRuns,
                       boolean wicket,
                       DismissalType dismissalType,
                       String dismissedBatsman,
                       String fielderName,
                       String newBatsman) {

    public Delivery {
        if (extraType == null) extraType = ExtraType.NONE;
    }

    public static Delivery runs(int runs) {
        return new Delivery(runs, false, false, ExtraType.NONE, 0, false, null, null, null, null);
    }

    public static Delivery boundaryFour() {
        return new Delivery(4, true, false, ExtraType.NONE, 0, false, null, null, null, null);
    }

    public static Delivery boundarySix() {
        return new Delivery(6, false, true, ExtraType.NONE, 0, false, null, null, null, null);
    }

    public static Delivery extra(ExtraType type, int extraRuns) {
        return new Delivery(0, false, false, type, extraRuns, false, null, null, null, null);
    }

    public static Delivery noBall(int runsOffBat, int extraRuns) {
        return new Delivery(runsOffBat, false, false, ExtraType.NO_BALL, extraRuns, false, null, null, null, null);
    }

    public static Delivery wicket(DismissalType type, String dismissed, String fielder, String newBatsman) {
        return new Delivery(0, false, false, ExtraType.NONE, 0, true, type, dismissed, fielder, newBatsman);
    }

    /** Run out while completing {@code runs}; the batsmen may have crossed. */
    public static Delivery runOut(int runs, String dismissed, String fielder, String newBatsman) {
        return new Delivery(runs, false, false, ExtraType.NONE, 0, true, DismissalType.RUN_OUT, dismissed, fielder, newBatsman);
    }
}
