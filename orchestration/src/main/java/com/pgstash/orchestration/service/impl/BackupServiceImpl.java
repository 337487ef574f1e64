package com.pgstash.orchestration.service.impl;

import com.pgstash.catalog.exception.LockFileBusyException;
import com.pgstash.catalog.lock.LockFile;
import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.catalog.model.BackupStatus;
import com.pgstash.catalog.model.CopyStats;
import com.pgstash.catalog.store.BackupCatalog;
import com.pgstash.configuration.properties.constant.PgStashConstants;
import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.adapter.impl.DirectTransportAdapter;
import com.pgstash.orchestration.command.ShellCommand;
import com.pgstash.orchestration.copy.BackupCopyController;
import com.pgstash.orchestration.copy.BackupCopyPlanner;
import com.pgstash.orchestration.model.ReuseMode;
import com.pgstash.orchestration.model.ServerContext;
import com.pgstash.orchestration.producers.ServerContextProducer;
import com.pgstash.orchestration.service.api.BackupService;
import com.pgstash.postgres.api.PostgresConnection;
import com.pgstash.postgres.strategy.BackupStrategy;
import com.pgstash.postgres.strategy.ConcurrentBackupStrategy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@ApplicationScoped
public class BackupServiceImpl implements BackupService {

    @Inject
    PgStashProperties pgStashProperties;

    @Inject
    ServerContextProducer serverContextProducer;

    @Inject
    ShellCommand shellCommand;

    @Inject
    BackupCopyPlanner backupCopyPlanner;

    @Override
    public BackupInfo backup(String serverName) {
        ServerContext serverContext = serverContextProducer.createServerContext(serverName);

        LockFile backupLock = new LockFile(
                serverContext.getPaths().getBackupLockFile(),
                serverContext.getLockTimeout(),
                serverContext.getLockRetryInterval()
        );
        if (!backupLock.tryAcquire()) {
            throw new LockFileBusyException("Another backup is running for server " + serverName);
        }

        try {
            return runBackup(serverContext);
        } finally {
            backupLock.release();
        }
    }

    private BackupInfo runBackup(ServerContext serverContext) {
        String serverName = serverContext.getServerName();
        PgStashProperties.ServerProperties properties = serverContext.getProperties();
        BackupCatalog backupCatalog = serverContext.getBackupCatalog();
        Optional<BackupInfo> previousBackup = backupCatalog.getLastBackup(BackupCatalog.DEFAULT_STATUS_FILTER);

        BackupInfo backupInfo = new BackupInfo(serverName, backupCatalog.newBackupId(LocalDateTime.now()));
        backupInfo.setStatus(BackupStatus.STARTED);
        Path backupDirectory = backupCatalog.getBackupDirectory(backupInfo.getBackupId());

        PostgresConnection postgres = serverContextProducer.createPostgresConnection(serverContext);

        try {
            createDirectory(backupDirectory);
            backupCatalog.save(backupInfo);
            log.info("Starting backup {} of server {}", backupInfo.getBackupId(), serverName);

            BackupStrategy strategy = new ConcurrentBackupStrategy(postgres, properties.immediateCheckpoint());
            strategy.startBackup(backupInfo);
            backupCatalog.save(backupInfo);

            BackupInfo reusable = previousBackup
                    .filter(previous -> isReusable(previous, backupInfo))
                    .orElse(null);
            ReuseMode reuseMode = reusable == null ? ReuseMode.NONE : ReuseMode.from(properties.reuseBackup());
            Path reuseDirectory = reuseMode == ReuseMode.NONE ? null : backupCatalog.getBackupDirectory(reusable.getBackupId());
            Instant safeHorizon = reuseMode == ReuseMode.NONE || reusable.getBeginTime() == null
                    ? null
                    : reusable.getBeginTime().toInstant();

            DirectTransportAdapter transportAdapter = new DirectTransportAdapter(
                    shellCommand,
                    properties.sshCommand().orElse(null),
                    properties.networkCompression(),
                    backupDirectory
            );
            BackupCopyController controller = new BackupCopyController(
                    transportAdapter,
                    pgStashProperties.copy().parallelJobs(),
                    reuseMode,
                    safeHorizon
            );
            Integer bwlimit = properties.bandwidthLimit().isPresent() ? properties.bandwidthLimit().getAsInt() : null;

            backupCopyPlanner.plan(backupInfo, controller, reuseDirectory, bwlimit);
            CopyStats copyStats = controller.copy();
            transportAdapter.close();
            backupInfo.setCopyStats(copyStats);

            strategy.stopBackup(backupInfo);
            writeBackupLabel(backupDirectory, backupInfo.getBackupLabel());

            backupInfo.setSize(FileUtils.sizeOfDirectory(backupDirectory.toFile()));
            backupInfo.setStatus(BackupStatus.DONE);
            backupCatalog.save(backupInfo);
            log.info("Backup {} of server {} completed", backupInfo.getBackupId(), serverName);
            return backupInfo;
        } catch (RuntimeException e) {
            log.error("Backup {} of server {} failed", backupInfo.getBackupId(), serverName, e);
            backupInfo.setError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            backupInfo.setStatus(BackupStatus.FAILED);
            backupCatalog.save(backupInfo);
            throw e;
        } finally {
            postgres.close();
        }
    }

    /**
     * Files of a previous backup can only be reused when it was taken from the same major version
     * with the same set of tablespaces.
     */
    boolean isReusable(BackupInfo previous, BackupInfo current) {
        if (!Objects.equals(previous.getMajorVersion(), current.getMajorVersion())) {
            log.warn("Backup {} was taken from a different PostgreSQL version, not reusing it", previous.getBackupId());
            return false;
        }
        if (!previous.getTablespaceOids().equals(current.getTablespaceOids())) {
            log.warn("Tablespaces changed since backup {}, not reusing it", previous.getBackupId());
            return false;
        }
        return true;
    }

    private static void writeBackupLabel(Path backupDirectory, String backupLabel) {
        Path labelFile = backupDirectory
                .resolve(PgStashConstants.BACKUP_DATA_DIRECTORY_NAME)
                .resolve(PgStashConstants.BACKUP_LABEL_FILE_NAME);
        try {
            Files.createDirectories(labelFile.getParent());
            Files.writeString(labelFile, backupLabel, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + labelFile, e);
        }
    }

    private static void createDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create backup directory " + directory, e);
        }
    }
}
