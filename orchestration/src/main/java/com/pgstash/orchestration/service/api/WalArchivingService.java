package com.pgstash.orchestration.service.api;

import com.pgstash.orchestration.archiver.CheckStrategy;
import com.pgstash.orchestration.exception.ArchiverFailureException;

public interface WalArchivingService {

    /**
     * Archives the WAL files waiting for every archiver enabled on the server.
     *
     * @return number of files archived
     */
    int archiveWal(String serverName, boolean verbose);

    /**
     * Runs the WAL receiver of the server in the foreground until it stops.
     */
    void receiveWal(String serverName) throws ArchiverFailureException;

    /**
     * @return true when every check passed
     */
    boolean check(String serverName, CheckStrategy checkStrategy);
}
