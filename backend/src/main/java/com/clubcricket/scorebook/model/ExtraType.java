package com.clubcricket.scorebook.model;

public enum ExtraType {
    NONE,
    WIDE,
    NO_BALL,
    BYE,
    LEG_BYE,
    PENALTY;

    /** Wides and no-balls have to be re-bowled and never advance the ball count. */
    public boolean isLegal() {
        return this != WIDE && this != NO_BALL;
    }
}
