package com.pgstash.quarkusroot.command;

public class ExitCodes {
    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int LOCK_BUSY = 2;

    private ExitCodes() {
    }
}
