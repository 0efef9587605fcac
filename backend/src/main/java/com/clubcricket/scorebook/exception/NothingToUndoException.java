package com.clubcricket.scorebook.exception;

public class NothingToUndoException extends ScoringException {

    public NothingToUndoException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "NOTHING_TO_UNDO";
    }
}
