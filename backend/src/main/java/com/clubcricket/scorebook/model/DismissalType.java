package com.clubcricket.scorebook.model;

public enum DismissalType {
    BOWLED("bowled", true),
    CAUGHT("caught", true),
    LBW("lbw", true),
    RUN_OUT("run out", false),
    STUMPED("stumped", true),
    HIT_WICKET("hit wicket", true),
    RETIRED_HURT("retired hurt", false),
    OBSTRUCTING_THE_FIELD("obstructing the field", false),
    TIMED_OUT("timed out", true),
    HANDLED_THE_BALL("handled the ball", true);

    private final String label;
    private final boolean creditedToBowler;

    DismissalType(String label, boolean creditedToBowler) {
        this.label = label;
        this.creditedToBowler = creditedToBowler;
    }

    public String getLabel() { return label; }

    public boolean isCreditedToBowler() { return creditedToBowler; }
}
