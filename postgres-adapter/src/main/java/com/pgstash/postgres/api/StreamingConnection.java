package com.pgstash.postgres.api;

/**
 * Replication protocol connection, used to probe the server before starting a WAL receiver.
 */
public interface StreamingConnection extends AutoCloseable {

    /**
     * Connection string handed to the WAL receiver.
     */
    String getConnInfo();

    /**
     * @return {@code server_version_num}, or null when the replication connection is refused
     */
    Integer getServerVersion();

    /**
     * @return whether the server supports WAL streaming, or null when it can not be reached
     */
    Boolean isStreamingSupported();

    @Override
    void close();
}
