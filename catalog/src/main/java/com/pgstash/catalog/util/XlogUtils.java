package com.pgstash.catalog.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for PostgreSQL WAL file names.
 * A segment name is made of three 8 digit hex numbers: timeline, log id and segment id.
 */
public class XlogUtils {
    public static final int WAL_SEGMENT_NAME_LENGTH = 24;
    public static final int HASH_DIR_LENGTH = 16;

    public static final Pattern ANY_XLOG_FILE_PATTERN = Pattern.compile(
            "^([\\dA-Fa-f]{8})(?:([\\dA-Fa-f]{8})([\\dA-Fa-f]{8})(?:\\.[\\dA-Fa-f]{8}\\.backup|\\.partial)?|\\.history)$"
    );
    public static final Pattern WAL_SEGMENT_PATTERN = Pattern.compile("^[\\dA-Fa-f]{24}$");
    public static final Pattern BACKUP_LABEL_FILE_PATTERN = Pattern.compile("^[\\dA-Fa-f]{24}\\.[\\dA-Fa-f]{8}\\.backup$");
    public static final Pattern PARTIAL_FILE_PATTERN = Pattern.compile("^[\\dA-Fa-f]{24}\\.partial$");
    public static final Pattern HISTORY_FILE_PATTERN = Pattern.compile("^[\\dA-Fa-f]{8}\\.history$");

    public static boolean isAnyXlogFile(String name) {
        return name != null && ANY_XLOG_FILE_PATTERN.matcher(name).matches();
    }

    public static boolean isWalFile(String name) {
        return name != null && WAL_SEGMENT_PATTERN.matcher(name).matches();
    }

    public static boolean isBackupLabelFile(String name) {
        return name != null && BACKUP_LABEL_FILE_PATTERN.matcher(name).matches();
    }

    public static boolean isPartialFile(String name) {
        return name != null && PARTIAL_FILE_PATTERN.matcher(name).matches();
    }

    public static boolean isHistoryFile(String name) {
        return name != null && HISTORY_FILE_PATTERN.matcher(name).matches();
    }

    /**
     * Directory, relative to the WAL archive root, where the file is stored.
     *
     * @param name any valid xlog file name
     * @return first 16 characters of a segment name, or empty string for history files
     * @throws IllegalArgumentException if the name is not a valid xlog file name
     */
    public static String hashDir(String name) {
        Matcher matcher = ANY_XLOG_FILE_PATTERN.matcher(name);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a valid xlog file name: " + name);
        }
        if (matcher.group(2) == null) {
            return "";
        }
        return name.substring(0, HASH_DIR_LENGTH);
    }

    /**
     * Splits a segment name in timeline, log id and segment id.
     */
    public static long[] decodeSegmentName(String name) {
        Matcher matcher = ANY_XLOG_FILE_PATTERN.matcher(name);
        if (!matcher.matches() || matcher.group(2) == null) {
            throw new IllegalArgumentException("Not a valid WAL segment name: " + name);
        }
        return new long[]{
                Long.parseLong(matcher.group(1), 16),
                Long.parseLong(matcher.group(2), 16),
                Long.parseLong(matcher.group(3), 16)
        };
    }

    public static String encodeSegmentName(long timeline, long logId, long segmentId) {
        return String.format("%08X%08X%08X", timeline, logId, segmentId);
    }

    /**
     * Name of the segment containing the given LSN, for example {@code 0/3000028}.
     */
    public static String walNameFromLsn(long timeline, String lsn, long segmentSize) {
        String[] parts = lsn.split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Not a valid LSN: " + lsn);
        }
        long logId = Long.parseLong(parts[0], 16);
        long offset = Long.parseLong(parts[1], 16);
        return encodeSegmentName(timeline, logId, offset / segmentSize);
    }

    /**
     * Offset of the given LSN inside its segment.
     */
    public static long offsetFromLsn(String lsn, long segmentSize) {
        String[] parts = lsn.split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Not a valid LSN: " + lsn);
        }
        return Long.parseLong(parts[1], 16) % segmentSize;
    }

    private XlogUtils() {
    }
}
