package com.pgstash.orchestration.exception;

import lombok.Getter;

/**
 * An external command could not be started or exited with a code it is not allowed to.
 */
@Getter
public class CommandFailedException extends RuntimeException {
    private final Integer returnCode;
    private final String stdout;
    private final String stderr;

    public CommandFailedException(String message) {
        this(message, null, null, null);
    }

    public CommandFailedException(String message, Throwable cause) {
        super(message, cause);
        this.returnCode = null;
        this.stdout = null;
        this.stderr = null;
    }

    public CommandFailedException(String message, Integer returnCode, String stdout, String stderr) {
        super(message);
        this.returnCode = returnCode;
        this.stdout = stdout;
        this.stderr = stderr;
    }
}
