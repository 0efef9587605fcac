package com.clubcricket.scorebook.scoring;

public enum CreaseEnd {
    STRIKER,
    NON_STRIKER;

    /**
     * End the incoming batsman takes after a dismissal. The dismissed batsman's end is the one
     * they held when the ball was bowled; strike rotation on the same ball moves that end.
     * <pre>
     *   dismissed from   rotated   incoming batsman
     *   STRIKER          no        STRIKER
     *   STRIKER          yes       NON_STRIKER
     *   NON_STRIKER      no        NON_STRIKER
     *   NON_STRIKER      yes       STRIKER
     * </pre>
     */
    public static CreaseEnd incomingEnd(CreaseEnd dismissedFrom, boolean rotated) {
        return switch (dismissedFrom) {
            case STRIKER -> rotated ? NON_STRIKER : STRIKER;
            case NON_STRIKER -> rotated ? STRIKER : NON_STRIKER;
        };
    }
}
