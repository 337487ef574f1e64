package com.pgstash.postgres.exception;

import com.pgstash.configuration.exception.ConnectivityException;

public class PostgresConnectionException extends ConnectivityException {
    public PostgresConnectionException() {
    }

    public PostgresConnectionException(String message) {
        super(message);
    }

    public PostgresConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public PostgresConnectionException(Throwable cause) {
        super(cause);
    }

    public PostgresConnectionException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
