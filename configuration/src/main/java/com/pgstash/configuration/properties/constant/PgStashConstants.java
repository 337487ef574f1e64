package com.pgstash.configuration.properties.constant;

public class PgStashConstants {
    public static final String BASE_BACKUPS_DIRECTORY_NAME = "base";
    public static final String WALS_DIRECTORY_NAME = "wals";
    public static final String INCOMING_WALS_DIRECTORY_NAME = "incoming";
    public static final String STREAMING_WALS_DIRECTORY_NAME = "streaming";
    public static final String ERRORS_DIRECTORY_NAME = "errors";

    public static final String XLOG_DB_FILE_NAME = "xlog.db";
    public static final String BACKUP_INFO_FILE_NAME = "backup.info";
    public static final String BACKUP_DATA_DIRECTORY_NAME = "data";
    public static final String BACKUP_LABEL_FILE_NAME = "backup_label";

    public static final String CRON_LOCK_FILE_NAME = ".cron.lock";
    public static final String XLOG_DB_LOCK_FILE_FORMAT = ".%s-xlogdb.lock";
    public static final String RECEIVE_WAL_LOCK_FILE_FORMAT = ".%s-receive-wal.lock";
    public static final String ARCHIVE_WAL_LOCK_FILE_FORMAT = ".%s-archive-wal.lock";
    public static final String BACKUP_LOCK_FILE_FORMAT = ".%s-backup.lock";

    public static final String RECEIVE_WAL_LOG_FILE_FORMAT = "%s-receive-wal.log";

    private PgStashConstants() {
    }
}
