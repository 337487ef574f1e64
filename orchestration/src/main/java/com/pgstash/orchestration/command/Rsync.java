package com.pgstash.orchestration.command;

import com.pgstash.orchestration.constant.CommandsConstants;
import com.pgstash.orchestration.exception.CommandFailedException;
import com.pgstash.orchestration.model.CommandResult;
import com.pgstash.orchestration.model.FileItem;
import com.pgstash.orchestration.util.ShellUtils;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * rsync invocation with a fixed set of options. Exit code 24 (vanished source files) counts as success.
 */
@Slf4j
public class Rsync {
    private static final Pattern LIST_LINE_PATTERN = Pattern.compile(
            "^([\\w-]{10})\\s+([\\d,]+)\\s+(\\d{4}/\\d{2}/\\d{2} \\d{2}:\\d{2}:\\d{2})\\s+(.*)$"
    );
    private static final DateTimeFormatter LIST_DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");

    private final ShellCommand shellCommand;
    private final List<String> commandLine;

    @Builder
    public Rsync(ShellCommand shellCommand,
                 String sshCommand,
                 boolean networkCompression,
                 List<String> args,
                 List<String> include,
                 List<String> exclude,
                 List<String> excludeAndProtect,
                 Integer bwlimit) {
        this.shellCommand = shellCommand;

        List<String> line = new ArrayList<>();
        line.add(CommandsConstants.RSYNC_COMMAND);

        if (StringUtils.isNotBlank(sshCommand)) {
            line.add(CommandsConstants.RSYNC_REMOTE_SHELL_KEY);
            line.add(remoteShell(sshCommand));
        }
        if (networkCompression) {
            line.add(CommandsConstants.RSYNC_COMPRESS_KEY);
        }
        line.addAll(ListUtils.emptyIfNull(args));
        for (String pattern : ListUtils.emptyIfNull(include)) {
            line.add(String.format(CommandsConstants.RSYNC_INCLUDE_FORMAT, pattern));
        }
        for (String pattern : ListUtils.emptyIfNull(exclude)) {
            line.add(String.format(CommandsConstants.RSYNC_EXCLUDE_FORMAT, pattern));
        }
        for (String pattern : ListUtils.emptyIfNull(excludeAndProtect)) {
            line.add(String.format(CommandsConstants.RSYNC_EXCLUDE_FORMAT, pattern));
            line.add(String.format(CommandsConstants.RSYNC_PROTECT_FORMAT, pattern));
        }
        if (bwlimit != null && bwlimit > 0) {
            line.add(String.format(CommandsConstants.RSYNC_BWLIMIT_FORMAT, bwlimit));
        }

        this.commandLine = Collections.unmodifiableList(line);
    }

    public List<String> getCommandLine() {
        return commandLine;
    }

    public CommandResult copy(String src, String dst, List<String> extraArgs) throws CommandFailedException {
        List<String> line = new ArrayList<>(commandLine);
        line.addAll(ListUtils.emptyIfNull(extraArgs));
        line.add(src);
        line.add(dst);
        return shellCommand.runChecked(line, null, CommandsConstants.RSYNC_ALLOWED_EXIT_CODES);
    }

    /**
     * Copies only the listed paths, relative to {@code src}, without recursing into directories.
     */
    public CommandResult copyFileList(String src, String dst, List<String> files, List<String> extraArgs) throws CommandFailedException {
        if (CollectionUtils.isEmpty(files)) {
            return CommandResult.builder().returnCode(0).stdout("").stderr("").build();
        }
        List<String> line = new ArrayList<>(commandLine);
        line.add(CommandsConstants.RSYNC_FILES_FROM_STDIN_KEY);
        line.add(CommandsConstants.RSYNC_NO_RECURSIVE_KEY);
        line.addAll(ListUtils.emptyIfNull(extraArgs));
        line.add(src);
        line.add(dst);
        String stdin = files.stream().collect(Collectors.joining("\n", "", "\n"));
        return shellCommand.runChecked(line, stdin, CommandsConstants.RSYNC_ALLOWED_EXIT_CODES);
    }

    /**
     * Recursively lists {@code src}. Dates are interpreted in the local time zone, as rsync prints them.
     */
    public List<FileItem> listFiles(String src) throws CommandFailedException {
        List<String> line = new ArrayList<>(commandLine);
        line.addAll(CommandsConstants.RSYNC_LIST_ARGS);
        line.add(src);
        CommandResult result = shellCommand.runChecked(line, null, CommandsConstants.RSYNC_ALLOWED_EXIT_CODES);
        return parseListing(result.getStdout(), ZoneId.systemDefault());
    }

    static List<FileItem> parseListing(String output, ZoneId zoneId) {
        List<FileItem> items = new ArrayList<>();
        for (String row : StringUtils.defaultString(output).split("\n")) {
            if (StringUtils.isBlank(row)) {
                continue;
            }
            Matcher matcher = LIST_LINE_PATTERN.matcher(row);
            if (!matcher.matches()) {
                log.debug("Skipping unexpected rsync listing line: {}", row);
                continue;
            }
            items.add(new FileItem(
                    matcher.group(1),
                    Long.parseLong(matcher.group(2).replace(",", "")),
                    LocalDateTime.parse(matcher.group(3), LIST_DATE_FORMATTER).atZone(zoneId),
                    matcher.group(4)
            ));
        }
        return items;
    }

    private static String remoteShell(String sshCommand) {
        List<String> tokens = ShellUtils.split(sshCommand);
        if (tokens.isEmpty()) {
            return sshCommand;
        }
        StringBuilder builder = new StringBuilder(tokens.get(0));
        for (String token : tokens.subList(1, tokens.size())) {
            builder.append(" '").append(token.replace("'", "'\\''")).append("'");
        }
        return builder.toString();
    }
}
