package com.pgstash.configuration.exception;

public class ConnectivityException extends RuntimeException {
    public ConnectivityException() {
    }

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConnectivityException(Throwable cause) {
        super(cause);
    }

    public ConnectivityException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
