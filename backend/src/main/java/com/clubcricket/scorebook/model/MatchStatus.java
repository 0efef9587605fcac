package com.clubcricket.scorebook.model;

public enum MatchStatus {
    TOSS,
    IN_PROGRESS,
    INNINGS_BREAK,
    COMPLETED,
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }
}
