package com.pgstash.postgres.impl;

import com.pgstash.catalog.model.ConfigFile;
import com.pgstash.catalog.model.Tablespace;
import com.pgstash.postgres.api.PostgresConnection;
import com.pgstash.postgres.exception.BackupStrategyException;
import com.pgstash.postgres.exception.PostgresConnectionException;
import com.pgstash.postgres.model.BackupStartResult;
import com.pgstash.postgres.model.BackupStopResult;
import com.pgstash.postgres.util.ConnInfoUtils;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class JdbcPostgresConnection implements PostgresConnection {

    private static final String ARCHIVER_STATS_QUERY = "SELECT *, "
            + "current_setting('archive_mode') IN ('on', 'always') "
            + "AND (last_failed_wal IS NULL "
            + "OR last_failed_wal LIKE '%.history' "
            + "AND substring(last_failed_wal from 1 for 8) <= substring(last_archived_wal from 1 for 8) "
            + "OR last_failed_time <= last_archived_time) AS is_archiving, "
            + "CAST(archived_count AS NUMERIC) / EXTRACT(EPOCH FROM age(now(), stats_reset)) "
            + "AS current_archived_wals_per_second "
            + "FROM pg_stat_archiver";

    private static final String TABLESPACES_QUERY = "SELECT oid, spcname, pg_tablespace_location(oid) AS spclocation "
            + "FROM pg_tablespace "
            + "WHERE pg_tablespace_location(oid) != '' "
            + "ORDER BY oid";

    private static final String CONFIG_FILES_QUERY = "SELECT name, setting FROM pg_settings "
            + "WHERE name IN ('config_file', 'hba_file', 'ident_file')";

    private static final String INCLUDED_FILES_QUERY = "SELECT DISTINCT sourcefile FROM pg_settings "
            + "WHERE sourcefile IS NOT NULL AND sourcefile != current_setting('config_file') "
            + "ORDER BY sourcefile";

    private final String conninfo;
    private Connection connection;
    private Integer serverVersion;

    public JdbcPostgresConnection(String conninfo) {
        this.conninfo = conninfo;
    }

    @Override
    public String getConnInfo() {
        return conninfo;
    }

    @Override
    public synchronized int getServerVersion() {
        if (serverVersion == null) {
            serverVersion = Integer.parseInt(querySingleString("SHOW server_version_num"));
        }
        return serverVersion;
    }

    @Override
    public String getSetting(String name) {
        return querySingleString("SELECT setting FROM pg_settings WHERE name = ?", name);
    }

    @Override
    public Map<String, Object> getArchiverStats() {
        if (getServerVersion() < 90400) {
            return null;
        }
        try (PreparedStatement statement = getConnection().prepareStatement(ARCHIVER_STATS_QUERY);
             ResultSet resultSet = statement.executeQuery()) {
            if (!resultSet.next()) {
                return null;
            }
            Map<String, Object> stats = new LinkedHashMap<>();
            ResultSetMetaData metaData = resultSet.getMetaData();
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                stats.put(metaData.getColumnLabel(i), resultSet.getObject(i));
            }
            return stats;
        } catch (SQLException e) {
            throw new PostgresConnectionException("Failed to read pg_stat_archiver", e);
        }
    }

    @Override
    public String getDataDirectory() {
        return getSetting("data_directory");
    }

    @Override
    public String getSystemId() {
        return querySingleString("SELECT system_identifier::text FROM pg_control_system()");
    }

    @Override
    public long getXlogSegmentSize() {
        return Long.parseLong(querySingleString("SELECT pg_size_bytes(current_setting('wal_segment_size'))::text"));
    }

    @Override
    public boolean isInRecovery() {
        return Boolean.parseBoolean(querySingleString("SELECT pg_is_in_recovery()::text"));
    }

    @Override
    public List<Tablespace> getTablespaces() {
        List<Tablespace> tablespaces = new ArrayList<>();
        try (PreparedStatement statement = getConnection().prepareStatement(TABLESPACES_QUERY);
             ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                tablespaces.add(
                        Tablespace.builder()
                                .oid(resultSet.getLong("oid"))
                                .name(resultSet.getString("spcname"))
                                .location(resultSet.getString("spclocation"))
                                .build()
                );
            }
        } catch (SQLException e) {
            throw new PostgresConnectionException("Failed to list tablespaces", e);
        }
        return tablespaces;
    }

    @Override
    public List<ConfigFile> getConfigurationFiles() {
        List<ConfigFile> files = new ArrayList<>();
        try (PreparedStatement statement = getConnection().prepareStatement(CONFIG_FILES_QUERY);
             ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                ConfigFile.FileType fileType = switch (resultSet.getString("name")) {
                    case "config_file" -> ConfigFile.FileType.CONFIG_FILE;
                    case "hba_file" -> ConfigFile.FileType.HBA_FILE;
                    default -> ConfigFile.FileType.IDENT_FILE;
                };
                files.add(new ConfigFile(fileType, resultSet.getString("setting")));
            }
        } catch (SQLException e) {
            throw new PostgresConnectionException("Failed to read configuration file settings", e);
        }

        // reading sourcefile requires superuser or pg_read_all_settings
        try (PreparedStatement statement = getConnection().prepareStatement(INCLUDED_FILES_QUERY);
             ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                files.add(new ConfigFile(ConfigFile.FileType.INCLUDE, resultSet.getString(1)));
            }
        } catch (SQLException e) {
            log.warn("Unable to list included configuration files: {}", e.getMessage());
        }
        return files;
    }

    @Override
    public BackupStartResult startConcurrentBackup(String label, boolean immediateCheckpoint) {
        int version = getServerVersion();
        if (version < 90600) {
            throw new BackupStrategyException("Concurrent backup requires PostgreSQL 9.6 or newer, server version is " + version);
        }

        String query = version >= 150000
                ? "SELECT location::text, now() FROM pg_backup_start(?, ?) AS location"
                : "SELECT location::text, now() FROM pg_start_backup(?, ?, false) AS location";

        try (PreparedStatement statement = getConnection().prepareStatement(query)) {
            statement.setString(1, label);
            statement.setBoolean(2, immediateCheckpoint);
            try (ResultSet resultSet = statement.executeQuery()) {
                resultSet.next();
                return BackupStartResult.builder()
                        .location(resultSet.getString(1))
                        .timestamp(resultSet.getObject(2, OffsetDateTime.class))
                        .timeline(Integer.valueOf(querySingleString("SELECT timeline_id::text FROM pg_control_checkpoint()")))
                        .build();
            }
        } catch (SQLException e) {
            throw new BackupStrategyException("Failed to start backup", e);
        }
    }

    @Override
    public BackupStopResult stopConcurrentBackup() {
        int version = getServerVersion();
        String function;
        if (version >= 150000) {
            function = "pg_backup_stop(true)";
        } else if (version >= 100000) {
            function = "pg_stop_backup(false, true)";
        } else {
            function = "pg_stop_backup(false)";
        }

        try (PreparedStatement statement = getConnection().prepareStatement(
                "SELECT lsn::text, labelfile, spcmapfile, now() FROM " + function);
             ResultSet resultSet = statement.executeQuery()) {
            resultSet.next();
            return BackupStopResult.builder()
                    .location(resultSet.getString(1))
                    .backupLabel(resultSet.getString(2))
                    .tablespaceMap(resultSet.getString(3))
                    .timestamp(resultSet.getObject(4, OffsetDateTime.class))
                    .build();
        } catch (SQLException e) {
            throw new BackupStrategyException("Failed to stop backup", e);
        }
    }

    @Override
    public synchronized void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Failed to close PostgreSQL connection", e);
        }
        connection = null;
    }

    protected synchronized Connection getConnection() {
        try {
            if (connection == null || connection.isClosed()) {
                Map<String, String> parameters = ConnInfoUtils.parse(conninfo);
                connection = DriverManager.getConnection(
                        ConnInfoUtils.toJdbcUrl(parameters),
                        ConnInfoUtils.toJdbcProperties(parameters)
                );
            }
            return connection;
        } catch (SQLException e) {
            throw new PostgresConnectionException("Cannot connect to PostgreSQL server", e);
        }
    }

    private String querySingleString(String query, String... parameters) {
        try (PreparedStatement statement = getConnection().prepareStatement(query)) {
            for (int i = 0; i < parameters.length; i++) {
                statement.setString(i + 1, parameters[i]);
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getString(1) : null;
            }
        } catch (SQLException e) {
            throw new PostgresConnectionException("Failed to execute query: " + query, e);
        }
    }
}
