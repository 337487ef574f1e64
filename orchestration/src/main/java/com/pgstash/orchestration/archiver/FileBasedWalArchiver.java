package com.pgstash.orchestration.archiver;

import com.pgstash.orchestration.model.ServerContext;
import com.pgstash.postgres.api.PostgresConnection;
import com.pgstash.postgres.exception.PostgresConnectionException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Log shipping: PostgreSQL {@code archive_command} drops WAL files into the incoming directory.
 */
@Slf4j
public class FileBasedWalArchiver extends AbstractWalArchiver {
    public static final String ARCHIVE_MODE = "archive_mode";
    public static final String ARCHIVE_COMMAND = "archive_command";
    public static final String IS_ARCHIVING = "is_archiving";
    public static final String CONTINUOUS_ARCHIVING_CHECK = "continuous archiving";

    private static final Set<String> VALID_ARCHIVE_MODES = Set.of("on", "always");
    private static final String DISABLED_ARCHIVE_COMMAND = "(disabled)";

    private final PostgresConnection postgres;

    public FileBasedWalArchiver(ServerContext serverContext, PostgresConnection postgres) {
        super(serverContext);
        this.postgres = postgres;
    }

    @Override
    public String getName() {
        return "FileBasedWalArchiver";
    }

    @Override
    protected Path getIncomingDirectory() {
        return serverContext.getPaths().getIncomingWalsDirectory();
    }

    @Override
    protected Map<String, Object> fetchRemoteStatus() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ARCHIVE_MODE, null);
        result.put(ARCHIVE_COMMAND, null);

        try {
            result.put(ARCHIVE_MODE, postgres.getSetting(ARCHIVE_MODE));
            result.put(ARCHIVE_COMMAND, postgres.getSetting(ARCHIVE_COMMAND));
        } catch (PostgresConnectionException e) {
            log.warn("Error retrieving PostgreSQL status: {}", e.getMessage());
        }

        try {
            Map<String, Object> archiverStats = postgres.getArchiverStats();
            if (archiverStats != null) {
                result.putAll(archiverStats);
            }
        } catch (PostgresConnectionException e) {
            log.warn("Error retrieving pg_stat_archiver statistics: {}", e.getMessage());
        }
        return result;
    }

    @Override
    public void check(CheckStrategy checkStrategy) {
        String serverName = serverContext.getServerName();
        Map<String, Object> status = getRemoteStatus();

        Object archiveMode = status.get(ARCHIVE_MODE);
        Object archiveCommand = status.get(ARCHIVE_COMMAND);

        if (archiveMode == null && archiveCommand == null) {
            log.debug("PostgreSQL of server {} did not reply, skipping archiver checks", serverName);
            return;
        }

        if (archiveMode != null) {
            checkStrategy.result(
                    serverName,
                    ARCHIVE_MODE,
                    VALID_ARCHIVE_MODES.contains(archiveMode.toString()),
                    "please set it to 'on' or 'always'"
            );
        }

        if (archiveCommand != null && !archiveCommand.toString().isEmpty() && !DISABLED_ARCHIVE_COMMAND.equals(archiveCommand)) {
            checkStrategy.result(serverName, ARCHIVE_COMMAND, true, null);

            if (status.containsKey(IS_ARCHIVING)) {
                checkStrategy.result(serverName, CONTINUOUS_ARCHIVING_CHECK, Boolean.TRUE.equals(status.get(IS_ARCHIVING)), null);
            }
        } else {
            checkStrategy.result(serverName, ARCHIVE_COMMAND, false, "please set it accordingly to documentation");
        }
    }
}
