package com.pgstash.configuration.producers;

import com.pgstash.configuration.exception.ConfigurationException;
import com.pgstash.configuration.model.ServerPaths;
import com.pgstash.configuration.properties.constant.PgStashConstants;
import com.pgstash.configuration.properties.predefined.PgStashProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Slf4j
@ApplicationScoped
public class ServerPathsProducer {

    @Inject
    PgStashProperties pgStashProperties;

    public PgStashProperties.ServerProperties getServerProperties(String serverName) {
        PgStashProperties.ServerProperties serverProperties = pgStashProperties.servers().get(serverName);
        if (serverProperties == null) {
            throw new ConfigurationException("Unknown server '" + serverName + "'");
        }
        return serverProperties;
    }

    public ServerPaths getServerPaths(String serverName) {
        PgStashProperties.ServerProperties serverProperties = getServerProperties(serverName);

        Path backupDirectory = serverProperties.backupDirectory()
                .map(Paths::get)
                .orElseGet(() -> getHomeDirectory().resolve(serverName));
        Path walsDirectory = backupDirectory.resolve(PgStashConstants.WALS_DIRECTORY_NAME);
        Path lockDirectory = getLockDirectory();

        return ServerPaths.builder()
                .serverName(serverName)
                .backupDirectory(backupDirectory)
                .baseBackupsDirectory(backupDirectory.resolve(PgStashConstants.BASE_BACKUPS_DIRECTORY_NAME))
                .walsDirectory(walsDirectory)
                .incomingWalsDirectory(backupDirectory.resolve(PgStashConstants.INCOMING_WALS_DIRECTORY_NAME))
                .streamingWalsDirectory(backupDirectory.resolve(PgStashConstants.STREAMING_WALS_DIRECTORY_NAME))
                .errorsDirectory(backupDirectory.resolve(PgStashConstants.ERRORS_DIRECTORY_NAME))
                .xlogDbFile(walsDirectory.resolve(PgStashConstants.XLOG_DB_FILE_NAME))
                .xlogDbLockFile(lockDirectory.resolve(String.format(PgStashConstants.XLOG_DB_LOCK_FILE_FORMAT, serverName)))
                .receiveWalLockFile(lockDirectory.resolve(String.format(PgStashConstants.RECEIVE_WAL_LOCK_FILE_FORMAT, serverName)))
                .archiveWalLockFile(lockDirectory.resolve(String.format(PgStashConstants.ARCHIVE_WAL_LOCK_FILE_FORMAT, serverName)))
                .backupLockFile(lockDirectory.resolve(String.format(PgStashConstants.BACKUP_LOCK_FILE_FORMAT, serverName)))
                .build();
    }

    public Path getHomeDirectory() {
        return Paths.get(pgStashProperties.home());
    }

    public Path getLockDirectory() {
        return pgStashProperties.lockDirectory()
                .map(Paths::get)
                .orElseGet(this::getHomeDirectory);
    }

    public Path getCronLockFile() {
        return getLockDirectory().resolve(PgStashConstants.CRON_LOCK_FILE_NAME);
    }

    /**
     * Creates every directory of the server layout that does not exist yet.
     */
    public void createDirectories(ServerPaths serverPaths) {
        try {
            Files.createDirectories(serverPaths.getBaseBackupsDirectory());
            Files.createDirectories(serverPaths.getWalsDirectory());
            Files.createDirectories(serverPaths.getIncomingWalsDirectory());
            Files.createDirectories(serverPaths.getStreamingWalsDirectory());
            Files.createDirectories(serverPaths.getErrorsDirectory());
            Files.createDirectories(getLockDirectory());
        } catch (IOException e) {
            log.error("Error while creating directories for server {}", serverPaths.getServerName(), e);
            throw new UncheckedIOException(e);
        }
    }
}
