package com.pgstash.orchestration.model;

import com.pgstash.configuration.properties.predefined.PgStashProperties;

public enum ReuseMode {
    NONE,
    /**
     * Hard links unchanged files to the previous backup.
     */
    LINK,
    /**
     * Copies unchanged files from the previous backup.
     */
    COPY;

    public static ReuseMode from(PgStashProperties.ReuseBackupMode reuseBackupMode) {
        if (reuseBackupMode == null) {
            return NONE;
        }
        return switch (reuseBackupMode) {
            case OFF -> NONE;
            case LINK -> LINK;
            case COPY -> COPY;
        };
    }
}
