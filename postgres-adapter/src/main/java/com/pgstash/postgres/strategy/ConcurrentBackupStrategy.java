package com.pgstash.postgres.strategy;

import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.catalog.model.ConfigFile;
import com.pgstash.catalog.util.XlogUtils;
import com.pgstash.postgres.api.PostgresConnection;
import com.pgstash.postgres.exception.BackupStrategyException;
import com.pgstash.postgres.model.BackupStartResult;
import com.pgstash.postgres.model.BackupStopResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Non-exclusive backup API: {@code pg_backup_start}/{@code pg_backup_stop} on PostgreSQL 15+,
 * {@code pg_start_backup}/{@code pg_stop_backup} with {@code exclusive = false} on 9.6 to 14.
 * Start and stop must run on the same session.
 */
@Slf4j
public class ConcurrentBackupStrategy implements BackupStrategy {
    public static final String MODE = "concurrent";

    private final PostgresConnection postgres;
    private final boolean immediateCheckpoint;

    public ConcurrentBackupStrategy(PostgresConnection postgres, boolean immediateCheckpoint) {
        this.postgres = postgres;
        this.immediateCheckpoint = immediateCheckpoint;
    }

    @Override
    public void startBackup(BackupInfo backupInfo) throws BackupStrategyException {
        backupInfo.setMode(MODE);
        collectServerMetadata(backupInfo);

        String label = "PgStash backup " + backupInfo.getServerName() + " " + backupInfo.getBackupId();
        log.info("Starting backup '{}'{}", label, immediateCheckpoint ? " with immediate checkpoint" : "");
        BackupStartResult start = postgres.startConcurrentBackup(label, immediateCheckpoint);

        long segmentSize = backupInfo.getXlogSegmentSize();
        backupInfo.setTimeline(start.getTimeline());
        backupInfo.setBeginXlog(start.getLocation());
        backupInfo.setBeginWal(XlogUtils.walNameFromLsn(start.getTimeline(), start.getLocation(), segmentSize));
        backupInfo.setBeginOffset(XlogUtils.offsetFromLsn(start.getLocation(), segmentSize));
        backupInfo.setBeginTime(start.getTimestamp());
    }

    @Override
    public void stopBackup(BackupInfo backupInfo) throws BackupStrategyException {
        BackupStopResult stop = postgres.stopConcurrentBackup();
        if (stop.getBackupLabel() == null) {
            throw new BackupStrategyException("PostgreSQL returned no backup label for backup " + backupInfo.getBackupId());
        }

        long segmentSize = backupInfo.getXlogSegmentSize();
        backupInfo.setEndXlog(stop.getLocation());
        backupInfo.setEndWal(XlogUtils.walNameFromLsn(backupInfo.getTimeline(), stop.getLocation(), segmentSize));
        backupInfo.setEndOffset(XlogUtils.offsetFromLsn(stop.getLocation(), segmentSize));
        backupInfo.setEndTime(stop.getTimestamp());
        backupInfo.setBackupLabel(stop.getBackupLabel());
        log.info("Backup {} stopped at {}", backupInfo.getBackupId(), stop.getLocation());
    }

    private void collectServerMetadata(BackupInfo backupInfo) {
        backupInfo.setVersion(postgres.getServerVersion());
        backupInfo.setPgdata(postgres.getDataDirectory());
        backupInfo.setSystemId(postgres.getSystemId());
        backupInfo.setXlogSegmentSize(postgres.getXlogSegmentSize());
        backupInfo.setTablespaces(postgres.getTablespaces());

        List<String> includedFiles = new ArrayList<>();
        for (ConfigFile configFile : postgres.getConfigurationFiles()) {
            switch (configFile.getFileType()) {
                case CONFIG_FILE -> backupInfo.setConfigFile(configFile.getPath());
                case HBA_FILE -> backupInfo.setHbaFile(configFile.getPath());
                case IDENT_FILE -> backupInfo.setIdentFile(configFile.getPath());
                case INCLUDE -> includedFiles.add(configFile.getPath());
            }
        }
        if (!includedFiles.isEmpty()) {
            backupInfo.setIncludedFiles(includedFiles);
        }
    }
}
