package com.clubcricket.scorebook.exception;

/**
 * Base type for business-rule rejections raised by the scoring engine and match lifecycle.
 * None of these are transient; retrying the same request yields the same failure.
 */
public abstract class ScoringException extends RuntimeException {

    protected ScoringException(String message) {
        super(message);
    }

    /** Stable code the REST layer exposes to clients. */
    public abstract String getCode();
}
