package com.pgstash.orchestration.constant;

import java.util.List;

public class CommandsConstants {
    public static final String RSYNC_COMMAND = "rsync";
    public static final List<String> RECEIVE_WAL_COMMANDS = List.of("pg_receivewal", "pg_receivexlog");

    public static final List<String> RSYNC_BASE_ARGS = List.of("-rLKpts", "--delete-excluded", "--inplace");
    public static final String RSYNC_ITEMIZE_CHANGES_KEY = "--itemize-changes";
    public static final String RSYNC_CHECKSUM_KEY = "--checksum";
    public static final String RSYNC_FILES_FROM_STDIN_KEY = "--files-from=-";
    public static final String RSYNC_NO_RECURSIVE_KEY = "--no-r";
    public static final String RSYNC_IGNORE_MISSING_ARGS_KEY = "--ignore-missing-args";
    public static final List<String> RSYNC_LIST_ARGS = List.of("--no-human-readable", "--list-only", "-r");
    public static final String RSYNC_REMOTE_SHELL_KEY = "-e";
    public static final String RSYNC_COMPRESS_KEY = "-z";
    public static final String RSYNC_LINK_DEST_FORMAT = "--link-dest=%s";
    public static final String RSYNC_COPY_DEST_FORMAT = "--copy-dest=%s";
    public static final String RSYNC_BWLIMIT_FORMAT = "--bwlimit=%d";
    public static final String RSYNC_INCLUDE_FORMAT = "--include=%s";
    public static final String RSYNC_EXCLUDE_FORMAT = "--exclude=%s";
    public static final String RSYNC_PROTECT_FORMAT = "--filter=P_%s";
    /**
     * 24 means some source files vanished during the transfer, which is expected on a running server.
     */
    public static final List<Integer> RSYNC_ALLOWED_EXIT_CODES = List.of(0, 24);

    public static final String RECEIVE_WAL_VERSION_KEY = "--version";
    public static final String RECEIVE_WAL_DBNAME_FORMAT = "--dbname=%s";
    public static final String RECEIVE_WAL_DIRECTORY_FORMAT = "--directory=%s";
    public static final String RECEIVE_WAL_SLOT_FORMAT = "--slot=%s";

    private CommandsConstants() {
    }
}
