package com.pgstash.orchestration.service.api;

import com.pgstash.catalog.exception.LockFileBusyException;

public interface CronService {

    /**
     * Runs the periodic maintenance of every configured server.
     *
     * @throws LockFileBusyException if another cron run holds the cron lock
     */
    void cron(boolean verbose) throws LockFileBusyException;
}
