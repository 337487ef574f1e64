package com.pgstash.orchestration.exception;

import lombok.Getter;

/**
 * A copy job failed. Carries the label of the job.
 */
@Getter
public class CopyFailureException extends RuntimeException {
    private final String label;

    public CopyFailureException(String label, Throwable cause) {
        super("Copy of '" + label + "' failed: " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.label = label;
    }
}
