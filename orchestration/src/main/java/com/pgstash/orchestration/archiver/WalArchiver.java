package com.pgstash.orchestration.archiver;

import com.pgstash.orchestration.exception.ArchiverFailureException;

import java.util.Map;

/**
 * Delivers WAL files of one server into its WAL catalog.
 */
public interface WalArchiver {

    String getName();

    /**
     * Status of the remote side, computed once and cached until {@link #resetRemoteStatus()}.
     * Never throws: values that can not be determined are null.
     */
    Map<String, Object> getRemoteStatus();

    void resetRemoteStatus();

    void check(CheckStrategy checkStrategy);

    /**
     * Moves every file waiting in the incoming directory of this archiver into the WAL archive.
     *
     * @return number of files archived
     */
    int archive(boolean verbose);

    /**
     * Runs the WAL receiver in the foreground.
     */
    default void receiveWal() throws ArchiverFailureException {
        throw new ArchiverFailureException(getName() + " does not support WAL streaming");
    }
}
