package com.pgstash.catalog.exception;

public class LockFileBusyException extends RuntimeException {
    public LockFileBusyException() {
    }

    public LockFileBusyException(String message) {
        super(message);
    }

    public LockFileBusyException(String message, Throwable cause) {
        super(message, cause);
    }

    public LockFileBusyException(Throwable cause) {
        super(cause);
    }

    public LockFileBusyException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
