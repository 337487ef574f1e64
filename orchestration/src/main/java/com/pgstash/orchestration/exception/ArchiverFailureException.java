package com.pgstash.orchestration.exception;

public class ArchiverFailureException extends RuntimeException {
    public ArchiverFailureException() {
    }

    public ArchiverFailureException(String message) {
        super(message);
    }

    public ArchiverFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArchiverFailureException(Throwable cause) {
        super(cause);
    }

    public ArchiverFailureException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
