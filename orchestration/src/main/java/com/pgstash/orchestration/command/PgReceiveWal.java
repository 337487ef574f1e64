package com.pgstash.orchestration.command;

import com.pgstash.orchestration.constant.CommandsConstants;
import com.pgstash.orchestration.exception.CommandFailedException;
import com.pgstash.orchestration.model.CommandResult;
import com.pgstash.postgres.model.PostgresVersion;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * pg_receivewal (pg_receivexlog before PostgreSQL 10).
 */
@Slf4j
public class PgReceiveWal {
    private final ShellCommand shellCommand;
    private final Path executable;

    public PgReceiveWal(ShellCommand shellCommand, Path executable) {
        this.shellCommand = shellCommand;
        this.executable = executable;
    }

    public Path getExecutable() {
        return executable;
    }

    /**
     * @return version reported by {@code --version}, or null when it can not be determined
     */
    public PostgresVersion getVersion() {
        try {
            CommandResult result = shellCommand.runChecked(
                    List.of(executable.toString(), CommandsConstants.RECEIVE_WAL_VERSION_KEY),
                    null,
                    List.of(0)
            );
            return PostgresVersion.parse(result.getStdout());
        } catch (CommandFailedException e) {
            log.warn("Failed to get version of {}", executable, e);
            return null;
        }
    }

    /**
     * Streams WAL into {@code directory} until the server connection ends.
     */
    public CommandResult receive(String conninfo, Path directory, String slotName) throws CommandFailedException {
        List<String> line = new ArrayList<>();
        line.add(executable.toString());
        line.add(String.format(CommandsConstants.RECEIVE_WAL_DBNAME_FORMAT, conninfo));
        line.add(String.format(CommandsConstants.RECEIVE_WAL_DIRECTORY_FORMAT, directory));
        if (StringUtils.isNotBlank(slotName)) {
            line.add(String.format(CommandsConstants.RECEIVE_WAL_SLOT_FORMAT, slotName));
        }
        return shellCommand.runChecked(line, null, List.of(0));
    }
}
