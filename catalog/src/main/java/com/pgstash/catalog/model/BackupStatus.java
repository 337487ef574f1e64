package com.pgstash.catalog.model;

public enum BackupStatus {
    STARTED,
    DONE,
    FAILED,
    EMPTY;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
