package com.spectro.service;

public class ReductionException extends Exception {

    private final ReductionFailure failure;

    public ReductionException(ReductionFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ReductionException(ReductionFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public ReductionFailure getFailure() { return failure; }

    public int getExitCode() { return failure.exitCode; }
}
