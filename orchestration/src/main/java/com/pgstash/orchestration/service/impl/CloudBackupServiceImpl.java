package com.pgstash.orchestration.service.impl;

import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.catalog.model.BackupStatus;
import com.pgstash.catalog.store.BackupCatalog;
import com.pgstash.catalog.store.BackupInfoFile;
import com.pgstash.configuration.properties.constant.PgStashConstants;
import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.adapter.api.CloudStorageAdapter;
import com.pgstash.orchestration.adapter.impl.CloudTarTransportAdapter;
import com.pgstash.orchestration.adapter.impl.S3CloudStorageAdapter;
import com.pgstash.orchestration.copy.BackupCopyController;
import com.pgstash.orchestration.copy.BackupCopyPlanner;
import com.pgstash.orchestration.model.CloudBackupRequest;
import com.pgstash.orchestration.model.CloudDestinationUrl;
import com.pgstash.orchestration.model.ReuseMode;
import com.pgstash.orchestration.producers.ServerContextProducer;
import com.pgstash.orchestration.service.api.CloudBackupService;
import com.pgstash.postgres.api.PostgresConnection;
import com.pgstash.postgres.strategy.BackupStrategy;
import com.pgstash.postgres.strategy.ConcurrentBackupStrategy;
import com.pgstash.postgres.util.ConnInfoUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Streams a base backup of a local PostgreSQL server into an S3 bucket as one tar per destination,
 * under {@code <url path>/<server>/base/<backup id>/}.
 */
@Slf4j
@ApplicationScoped
public class CloudBackupServiceImpl implements CloudBackupService {
    public static final int BACKUP_LABEL_MODE = 0600;

    @Inject
    PgStashProperties pgStashProperties;

    @Inject
    ServerContextProducer serverContextProducer;

    @Inject
    BackupCopyPlanner backupCopyPlanner;

    @Override
    public boolean testConnectivity(CloudBackupRequest request) {
        CloudStorageAdapter storageAdapter = createStorageAdapter(CloudDestinationUrl.parse(request.getDestinationUrl()), request);
        return storageAdapter.testConnectivity();
    }

    @Override
    public BackupInfo backup(CloudBackupRequest request) {
        CloudDestinationUrl destinationUrl = CloudDestinationUrl.parse(request.getDestinationUrl());
        CloudStorageAdapter storageAdapter = createStorageAdapter(destinationUrl, request);
        storageAdapter.setupBucket();

        String serverName = request.getServerName();
        String backupId = BackupCatalog.BACKUP_ID_FORMATTER.format(LocalDateTime.now());
        String keyPrefix = destinationUrl.buildKey(serverName, PgStashConstants.BASE_BACKUPS_DIRECTORY_NAME, backupId);

        BackupInfo backupInfo = new BackupInfo(serverName, backupId);
        if (request.getCompression() != null) {
            backupInfo.setCompression(request.getCompression().getCatalogName());
        }

        PostgresConnection postgres = serverContextProducer.createPostgresConnection(
                ConnInfoUtils.build(request.getHost(), request.getPort(), request.getUser())
        );
        CloudTarTransportAdapter transportAdapter = new CloudTarTransportAdapter(
                storageAdapter,
                keyPrefix,
                request.getCompression(),
                pgStashProperties.cloud().chunkSize()
        );

        RuntimeException failure = null;
        try {
            backupInfo.setStatus(BackupStatus.STARTED);
            log.info("Starting cloud backup {} of server {} into {}", backupId, serverName, destinationUrl.getUrl());

            BackupStrategy strategy = new ConcurrentBackupStrategy(postgres, request.isImmediateCheckpoint());
            strategy.startBackup(backupInfo);

            BackupCopyController controller = new BackupCopyController(
                    transportAdapter,
                    pgStashProperties.copy().parallelJobs(),
                    ReuseMode.NONE,
                    null
            );
            backupCopyPlanner.plan(backupInfo, controller, null, null);
            backupInfo.setCopyStats(controller.copy());

            strategy.stopBackup(backupInfo);
            addBackupLabel(transportAdapter, backupInfo);

            transportAdapter.close();
            backupInfo.setStatus(BackupStatus.DONE);
            log.info("Cloud backup {} of server {} completed", backupId, serverName);
            return backupInfo;
        } catch (RuntimeException e) {
            failure = e;
            log.error("Cloud backup {} of server {} failed", backupId, serverName, e);
            transportAdapter.abort();
            backupInfo.setError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            backupInfo.setStatus(BackupStatus.FAILED);
            throw e;
        } finally {
            try {
                uploadBackupInfo(transportAdapter, backupInfo);
            } catch (RuntimeException e) {
                if (failure == null) {
                    throw e;
                }
                failure.addSuppressed(e);
            } finally {
                postgres.close();
            }
        }
    }

    CloudStorageAdapter createStorageAdapter(CloudDestinationUrl destinationUrl, CloudBackupRequest request) {
        return S3CloudStorageAdapter.create(destinationUrl, request.getEncryption(), request.getProfile());
    }

    private void addBackupLabel(CloudTarTransportAdapter transportAdapter, BackupInfo backupInfo) {
        Path pgdata = Path.of(backupInfo.getPgdata());
        transportAdapter.addStream(
                PgStashConstants.BACKUP_LABEL_FILE_NAME,
                new ByteArrayInputStream(backupInfo.getBackupLabel().getBytes(StandardCharsets.UTF_8)),
                PgStashConstants.BACKUP_DATA_DIRECTORY_NAME,
                PgStashConstants.BACKUP_LABEL_FILE_NAME,
                BACKUP_LABEL_MODE,
                getOwnerAttribute(pgdata, "unix:uid"),
                getOwnerAttribute(pgdata, "unix:gid")
        );
    }

    private static void uploadBackupInfo(CloudTarTransportAdapter transportAdapter, BackupInfo backupInfo) {
        transportAdapter.uploadStream(
                PgStashConstants.BACKUP_INFO_FILE_NAME,
                new ByteArrayInputStream(BackupInfoFile.toText(backupInfo).getBytes(StandardCharsets.UTF_8)),
                PgStashConstants.BACKUP_INFO_FILE_NAME
        );
    }

    /**
     * @return owner id of the file, or null when the file system does not expose it
     */
    static Integer getOwnerAttribute(Path path, String attribute) {
        try {
            return (Integer) Files.getAttribute(path, attribute);
        } catch (IOException | UnsupportedOperationException | IllegalArgumentException e) {
            log.debug("Cannot read {} of {}", attribute, path, e);
            return null;
        }
    }
}
