package com.clubcricket.scorebook.exception;

/** A delivery request that breaks a recording rule; rejected before anything is written. */
public class InvalidDeliveryException extends ScoringException {

    public InvalidDeliveryException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INVALID_DELIVERY";
    }
}
