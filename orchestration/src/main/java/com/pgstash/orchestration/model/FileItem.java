package com.pgstash.orchestration.model;

import lombok.Value;

import java.time.ZonedDateTime;

/**
 * Entry of an {@code rsync --list-only} listing.
 */
@Value
public class FileItem {
    String mode;
    long size;
    ZonedDateTime date;
    String path;

    public boolean isDirectory() {
        return mode.startsWith("d");
    }
}
