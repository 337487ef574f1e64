package com.pgstash.postgres.exception;

public class BackupStrategyException extends RuntimeException {
    public BackupStrategyException() {
    }

    public BackupStrategyException(String message) {
        super(message);
    }

    public BackupStrategyException(String message, Throwable cause) {
        super(message, cause);
    }

    public BackupStrategyException(Throwable cause) {
        super(cause);
    }

    public BackupStrategyException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
