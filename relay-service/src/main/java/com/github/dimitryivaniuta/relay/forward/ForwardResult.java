package com.github.dimitryivaniuta.relay.forward;

/**
 * Outcome of one delivery attempt. A value rather than an exception: every attempt
 * is recorded on the record whatever its outcome.
 */
public record ForwardResult(Outcome outcome, Integer statusCode, String error) {

    public enum Outcome { SUCCESS, TRANSIENT, PERMANENT }

    public static ForwardResult success(Integer statusCode) {
        return new ForwardResult(Outcome.SUCCESS, statusCode, null);
    }

    public static ForwardResult transientFailure(Integer statusCode, String error) {
        return new ForwardResult(Outcome.TRANSIENT, statusCode, error);
    }

    public static ForwardResult permanentFailure(Integer statusCode, String error) {
        return new ForwardResult(Outcome.PERMANENT, statusCode, error);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isTransient() {
        return outcome == Outcome.TRANSIENT;
    }
}
