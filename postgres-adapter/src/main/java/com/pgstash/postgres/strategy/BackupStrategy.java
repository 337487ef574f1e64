package com.pgstash.postgres.strategy;

import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.postgres.exception.BackupStrategyException;

/**
 * Brackets the copy of a base backup and records the consistency information in {@link BackupInfo}.
 */
public interface BackupStrategy {

    /**
     * Fills server metadata and the backup start position. No file may be copied before this returns.
     *
     * @throws BackupStrategyException if PostgreSQL refuses to start the backup
     */
    void startBackup(BackupInfo backupInfo) throws BackupStrategyException;

    /**
     * Fills the backup end position and label. Called only after every file was copied.
     *
     * @throws BackupStrategyException if PostgreSQL refuses to stop the backup
     */
    void stopBackup(BackupInfo backupInfo) throws BackupStrategyException;
}
