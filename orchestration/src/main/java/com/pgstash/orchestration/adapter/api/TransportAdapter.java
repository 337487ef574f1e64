package com.pgstash.orchestration.adapter.api;

import com.pgstash.orchestration.model.CopyJob;

/**
 * Target of a backup copy. Implementations must allow concurrent calls for different destinations.
 */
public interface TransportAdapter {

    void copyDirectory(CopyJob job);

    void copyFile(CopyJob job);

    /**
     * Finalizes everything written so far.
     */
    void close();

    /**
     * Discards partial results after a failure. Must not throw.
     */
    void abort();
}
