package com.clubcricket.scorebook.exception;

public class IllegalStateTransitionException extends ScoringException {

    public IllegalStateTransitionException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "ILLEGAL_STATE_TRANSITION";
    }
}
