package com.clubcricket.scorebook.model;

public enum InningsStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED
}
