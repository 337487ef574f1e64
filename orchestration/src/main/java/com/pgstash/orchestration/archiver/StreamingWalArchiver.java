package com.pgstash.orchestration.archiver;

import com.pgstash.catalog.lock.LockFile;
import com.pgstash.catalog.util.XlogUtils;
import com.pgstash.orchestration.command.PgReceiveWal;
import com.pgstash.orchestration.command.ShellCommand;
import com.pgstash.orchestration.constant.CommandsConstants;
import com.pgstash.orchestration.exception.ArchiverFailureException;
import com.pgstash.orchestration.exception.CommandFailedException;
import com.pgstash.orchestration.model.ServerContext;
import com.pgstash.orchestration.util.ShellUtils;
import com.pgstash.postgres.api.StreamingConnection;
import com.pgstash.postgres.model.PostgresVersion;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Streaming replication: a pg_receivewal process writes WAL into the streaming directory.
 */
@Slf4j
public class StreamingWalArchiver extends AbstractWalArchiver {
    public static final String RECEIVER_INSTALLED = "pg_receivexlog_installed";
    public static final String RECEIVER_PATH = "pg_receivexlog_path";
    public static final String RECEIVER_VERSION = "pg_receivexlog_version";
    public static final String RECEIVER_COMPATIBLE = "pg_receivexlog_compatible";

    public static final String RECEIVER_CHECK = "pg_receivexlog";
    public static final String RECEIVER_COMPATIBLE_CHECK = "pg_receivexlog compatible";

    private static final PostgresVersion FIRST_RELAXED_VERSION = new PostgresVersion(9, 3);

    private final StreamingConnection streaming;
    private final ShellCommand shellCommand;

    public StreamingWalArchiver(ServerContext serverContext, StreamingConnection streaming, ShellCommand shellCommand) {
        super(serverContext);
        this.streaming = streaming;
        this.shellCommand = shellCommand;
    }

    @Override
    public String getName() {
        return "StreamingWalArchiver";
    }

    @Override
    protected Path getIncomingDirectory() {
        return serverContext.getPaths().getStreamingWalsDirectory();
    }

    /**
     * Segments still being received carry the {@code .partial} suffix.
     */
    @Override
    protected boolean isInProgress(Path file) {
        return XlogUtils.isPartialFile(file.getFileName().toString());
    }

    @Override
    protected Map<String, Object> fetchRemoteStatus() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(RECEIVER_COMPATIBLE, null);
        result.put(RECEIVER_INSTALLED, false);
        result.put(RECEIVER_PATH, null);
        result.put(RECEIVER_VERSION, null);

        Path executable = findReceiver();
        if (executable == null) {
            return result;
        }
        result.put(RECEIVER_INSTALLED, true);
        result.put(RECEIVER_PATH, executable.toString());

        PostgresVersion receiverVersion = new PgReceiveWal(shellCommand, executable).getVersion();
        if (receiverVersion == null) {
            return result;
        }
        result.put(RECEIVER_VERSION, receiverVersion.toString());

        Integer serverVersionNum = streaming.getServerVersion();
        if (serverVersionNum == null) {
            return result;
        }
        result.put(RECEIVER_COMPATIBLE, isCompatible(PostgresVersion.fromVersionNum(serverVersionNum), receiverVersion));
        return result;
    }

    /**
     * Before 9.3 the receiver must match the server exactly, later a receiver at least as recent as the server works.
     */
    static boolean isCompatible(PostgresVersion serverVersion, PostgresVersion receiverVersion) {
        if (serverVersion.compareTo(FIRST_RELAXED_VERSION) < 0 || receiverVersion.compareTo(FIRST_RELAXED_VERSION) < 0) {
            return serverVersion.equals(receiverVersion);
        }
        return receiverVersion.compareTo(serverVersion) >= 0;
    }

    @Override
    public void check(CheckStrategy checkStrategy) {
        String serverName = serverContext.getServerName();
        Map<String, Object> status = getRemoteStatus();

        boolean installed = Boolean.TRUE.equals(status.get(RECEIVER_INSTALLED));
        checkStrategy.result(serverName, RECEIVER_CHECK, installed, null);
        if (!installed) {
            return;
        }

        Integer serverVersionNum = streaming.getServerVersion();
        String hint = String.format(
                "PostgreSQL version: %s, pg_receivexlog version: %s",
                serverVersionNum == null ? "None" : PostgresVersion.fromVersionNum(serverVersionNum).toString(),
                status.get(RECEIVER_VERSION) == null ? "None" : status.get(RECEIVER_VERSION)
        );
        checkStrategy.result(serverName, RECEIVER_COMPATIBLE_CHECK, Boolean.TRUE.equals(status.get(RECEIVER_COMPATIBLE)), hint);
    }

    /**
     * Runs pg_receivewal in the foreground while holding the receive-wal lock of the server.
     */
    @Override
    public void receiveWal() throws ArchiverFailureException {
        String serverName = serverContext.getServerName();
        Map<String, Object> status = getRemoteStatus();

        if (!Boolean.TRUE.equals(status.get(RECEIVER_INSTALLED))) {
            throw new ArchiverFailureException("pg_receivexlog not present in $PATH");
        }
        if (!Boolean.TRUE.equals(status.get(RECEIVER_COMPATIBLE))) {
            throw new ArchiverFailureException("pg_receivexlog version not compatible with PostgreSQL server version");
        }

        Boolean streamingSupported = streaming.isStreamingSupported();
        if (streamingSupported == null) {
            throw new ArchiverFailureException("failed opening the PostgreSQL streaming connection for server " + serverName);
        }
        if (!streamingSupported) {
            throw new ArchiverFailureException("PostgreSQL version too old (< 9.2)");
        }

        LockFile lock = new LockFile(
                serverContext.getPaths().getReceiveWalLockFile(),
                serverContext.getLockTimeout(),
                serverContext.getLockRetryInterval()
        );
        if (!lock.tryAcquire()) {
            throw new ArchiverFailureException("Another receive-wal process is already running for server " + serverName);
        }

        try {
            Path streamingDirectory = getIncomingDirectory();
            Files.createDirectories(streamingDirectory);

            log.info("Starting receive-wal for server {}", serverName);
            new PgReceiveWal(shellCommand, Path.of(status.get(RECEIVER_PATH).toString()))
                    .receive(streaming.getConnInfo(), streamingDirectory, serverContext.getProperties().slotName().orElse(null));
        } catch (CommandFailedException e) {
            throw new ArchiverFailureException("pg_receivexlog terminated with error code: " + e.getReturnCode(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create streaming directory for server " + serverName, e);
        } finally {
            lock.release();
        }
    }

    Path findReceiver() {
        String pathPrefix = serverContext.getProperties().pathPrefix().orElse(null);
        for (String command : CommandsConstants.RECEIVE_WAL_COMMANDS) {
            Path executable = ShellUtils.which(command, pathPrefix);
            if (executable != null) {
                return executable;
            }
        }
        return null;
    }
}
