package com.pgstash.orchestration.service.impl;

import com.pgstash.orchestration.archiver.CheckStrategy;
import com.pgstash.orchestration.archiver.FileBasedWalArchiver;
import com.pgstash.orchestration.archiver.StreamingWalArchiver;
import com.pgstash.orchestration.archiver.WalArchiver;
import com.pgstash.orchestration.command.ShellCommand;
import com.pgstash.orchestration.exception.ArchiverFailureException;
import com.pgstash.orchestration.model.ServerContext;
import com.pgstash.orchestration.producers.ServerContextProducer;
import com.pgstash.orchestration.service.api.WalArchivingService;
import com.pgstash.postgres.api.PostgresConnection;
import com.pgstash.postgres.api.StreamingConnection;
import com.pgstash.postgres.exception.PostgresConnectionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@ApplicationScoped
public class WalArchivingServiceImpl implements WalArchivingService {
    public static final String POSTGRESQL_CHECK = "PostgreSQL";

    @Inject
    ServerContextProducer serverContextProducer;

    @Inject
    ShellCommand shellCommand;

    @Override
    public int archiveWal(String serverName, boolean verbose) {
        ServerContext serverContext = serverContextProducer.createServerContext(serverName);
        PostgresConnection postgres = serverContextProducer.createPostgresConnection(serverContext);
        StreamingConnection streaming = serverContextProducer.createStreamingConnection(serverContext);

        try {
            int archived = 0;
            for (WalArchiver archiver : getArchivers(serverContext, postgres, streaming)) {
                archived += archiver.archive(verbose);
            }
            return archived;
        } finally {
            postgres.close();
            streaming.close();
        }
    }

    @Override
    public void receiveWal(String serverName) throws ArchiverFailureException {
        ServerContext serverContext = serverContextProducer.createServerContext(serverName);
        if (!serverContext.getProperties().streamingArchiver()) {
            throw new ArchiverFailureException("Unable to start receive-wal process: streaming-archiver is off for server " + serverName);
        }

        StreamingConnection streaming = serverContextProducer.createStreamingConnection(serverContext);
        try {
            new StreamingWalArchiver(serverContext, streaming, shellCommand).receiveWal();
        } finally {
            streaming.close();
        }
    }

    @Override
    public boolean check(String serverName, CheckStrategy checkStrategy) {
        ServerContext serverContext = serverContextProducer.createServerContext(serverName);
        PostgresConnection postgres = serverContextProducer.createPostgresConnection(serverContext);
        StreamingConnection streaming = serverContextProducer.createStreamingConnection(serverContext);

        try {
            checkPostgres(serverName, postgres, checkStrategy);
            for (WalArchiver archiver : getArchivers(serverContext, postgres, streaming)) {
                archiver.check(checkStrategy);
            }
        } finally {
            postgres.close();
            streaming.close();
        }
        return !checkStrategy.hasError();
    }

    List<WalArchiver> getArchivers(ServerContext serverContext, PostgresConnection postgres, StreamingConnection streaming) {
        List<WalArchiver> archivers = new ArrayList<>();
        if (serverContext.getProperties().archiver()) {
            archivers.add(new FileBasedWalArchiver(serverContext, postgres));
        }
        if (serverContext.getProperties().streamingArchiver()) {
            archivers.add(new StreamingWalArchiver(serverContext, streaming, shellCommand));
        }
        return archivers;
    }

    private void checkPostgres(String serverName, PostgresConnection postgres, CheckStrategy checkStrategy) {
        try {
            postgres.getServerVersion();
            checkStrategy.result(serverName, POSTGRESQL_CHECK, true, null);
        } catch (PostgresConnectionException e) {
            log.debug("PostgreSQL of server {} is not reachable", serverName, e);
            checkStrategy.result(serverName, POSTGRESQL_CHECK, false, null);
        }
    }
}
