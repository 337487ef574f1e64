package com.pgstash.postgres.api;

import com.pgstash.catalog.model.ConfigFile;
import com.pgstash.catalog.model.Tablespace;
import com.pgstash.postgres.exception.PostgresConnectionException;
import com.pgstash.postgres.model.BackupStartResult;
import com.pgstash.postgres.model.BackupStopResult;

import java.util.List;
import java.util.Map;

/**
 * Regular (non replication) connection to a PostgreSQL server.
 * Every method may throw {@link PostgresConnectionException} when the server can not be queried.
 */
public interface PostgresConnection extends AutoCloseable {

    String getConnInfo();

    /**
     * @return value of {@code server_version_num}
     */
    int getServerVersion();

    /**
     * @return current value of the setting, or null if the server does not know it
     */
    String getSetting(String name);

    /**
     * Content of {@code pg_stat_archiver} plus the derived {@code is_archiving} and
     * {@code current_archived_wals_per_second} values.
     *
     * @return statistics, or null if the server version has no such view
     */
    Map<String, Object> getArchiverStats();

    String getDataDirectory();

    String getSystemId();

    long getXlogSegmentSize();

    boolean isInRecovery();

    /**
     * Tablespaces with a location, ordered by oid.
     */
    List<Tablespace> getTablespaces();

    /**
     * Main configuration, hba and ident files plus any included configuration file.
     */
    List<ConfigFile> getConfigurationFiles();

    /**
     * Starts a non-exclusive backup. The backup is bound to this session until {@link #stopConcurrentBackup()}.
     */
    BackupStartResult startConcurrentBackup(String label, boolean immediateCheckpoint);

    BackupStopResult stopConcurrentBackup();

    @Override
    void close();
}
