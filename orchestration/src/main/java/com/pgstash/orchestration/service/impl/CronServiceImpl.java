package com.pgstash.orchestration.service.impl;

import com.pgstash.catalog.exception.LockFileBusyException;
import com.pgstash.catalog.lock.LockFile;
import com.pgstash.configuration.producers.ServerPathsProducer;
import com.pgstash.configuration.properties.constant.PgStashConstants;
import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.command.ShellCommand;
import com.pgstash.orchestration.model.ServerContext;
import com.pgstash.orchestration.producers.ServerContextProducer;
import com.pgstash.orchestration.service.api.CronService;
import com.pgstash.orchestration.service.api.WalArchivingService;
import com.pgstash.orchestration.util.ShellUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@ApplicationScoped
public class CronServiceImpl implements CronService {
    public static final String RECEIVE_WAL_SUBCOMMAND = "receive-wal";

    @Inject
    PgStashProperties pgStashProperties;

    @Inject
    ServerPathsProducer serverPathsProducer;

    @Inject
    ServerContextProducer serverContextProducer;

    @Inject
    WalArchivingService walArchivingService;

    @Inject
    ShellCommand shellCommand;

    @Override
    public void cron(boolean verbose) throws LockFileBusyException {
        LockFile cronLock = new LockFile(
                serverPathsProducer.getCronLockFile(),
                pgStashProperties.lock().timeout(),
                pgStashProperties.lock().retryInterval()
        );
        if (!cronLock.tryAcquire()) {
            throw new LockFileBusyException("Another cron is running");
        }

        try {
            for (String serverName : serverContextProducer.getServerNames()) {
                try {
                    runServerMaintenance(serverName, verbose);
                } catch (Exception e) {
                    log.error("Cron failed for server {}", serverName, e);
                }
            }
        } finally {
            cronLock.release();
        }
    }

    private void runServerMaintenance(String serverName, boolean verbose) {
        ServerContext serverContext = serverContextProducer.createServerContext(serverName);
        PgStashProperties.ServerProperties properties = serverContext.getProperties();

        if (properties.archiver() || properties.streamingArchiver()) {
            int archived = walArchivingService.archiveWal(serverName, verbose);
            log.debug("Cron archived {} WAL file(s) for server {}", archived, serverName);
        }

        if (properties.streamingArchiver()) {
            startReceiveWalIfIdle(serverContext);
        }
    }

    void startReceiveWalIfIdle(ServerContext serverContext) {
        String serverName = serverContext.getServerName();
        LockFile receiveWalLock = new LockFile(
                serverContext.getPaths().getReceiveWalLockFile(),
                serverContext.getLockTimeout(),
                serverContext.getLockRetryInterval()
        );

        if (!receiveWalLock.tryAcquire()) {
            log.debug("receive-wal is already running for server {}", serverName);
            return;
        }
        receiveWalLock.release();

        List<String> commandLine = new ArrayList<>(ShellUtils.split(pgStashProperties.cliCommand()));
        commandLine.add(RECEIVE_WAL_SUBCOMMAND);
        commandLine.add(serverName);

        Path logFile = serverPathsProducer.getHomeDirectory()
                .resolve(String.format(PgStashConstants.RECEIVE_WAL_LOG_FILE_FORMAT, serverName));

        log.info("Starting receive-wal for server {}", serverName);
        shellCommand.startInBackground(commandLine, logFile);
    }
}
