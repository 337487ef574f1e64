package com.pgstash.postgres.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PostgreSQL version reduced to what matters for compatibility: major and minor number.
 * From version 10 on the major number alone identifies a release and the minor number is kept as 0.
 */
@Getter
@EqualsAndHashCode
public class PostgresVersion implements Comparable<PostgresVersion> {
    private static final Pattern VERSION_PATTERN = Pattern.compile("(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?");

    private final int major;
    private final int minor;

    public PostgresVersion(int major, int minor) {
        this.major = major;
        this.minor = major >= 10 ? 0 : minor;
    }

    /**
     * Parses the first version number found in the text, for example
     * {@code pg_receivewal (PostgreSQL) 15.4} or {@code 9.4.5}. Patch level is ignored.
     *
     * @return the version or null when the text has none
     */
    public static PostgresVersion parse(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = VERSION_PATTERN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        int major = Integer.parseInt(matcher.group(1));
        int minor = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
        return new PostgresVersion(major, minor);
    }

    /**
     * @param versionNum value of {@code server_version_num}, for example 90605 or 150004
     */
    public static PostgresVersion fromVersionNum(int versionNum) {
        if (versionNum >= 100000) {
            return new PostgresVersion(versionNum / 10000, 0);
        }
        return new PostgresVersion(versionNum / 10000, versionNum / 100 % 100);
    }

    public boolean isBefore(int major, int minor) {
        return compareTo(new PostgresVersion(major, minor)) < 0;
    }

    @Override
    public int compareTo(PostgresVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        return Integer.compare(minor, other.minor);
    }

    /**
     * {@code 9.6} or {@code 15}, as used in tablespace directory names.
     */
    @Override
    public String toString() {
        return major >= 10 ? String.valueOf(major) : major + "." + minor;
    }
}
