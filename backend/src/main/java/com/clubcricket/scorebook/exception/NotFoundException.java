package com.clubcricket.scorebook.exception;

public class NotFoundException extends ScoringException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "NOT_FOUND";
    }
}
