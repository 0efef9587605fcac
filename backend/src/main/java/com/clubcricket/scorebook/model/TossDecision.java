package com.clubcricket.scorebook.model;

public enum TossDecision {
    BAT,
    BOWL
}
