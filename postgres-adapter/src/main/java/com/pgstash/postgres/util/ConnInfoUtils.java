package com.pgstash.postgres.util;

import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * libpq connection strings ({@code key=value} pairs separated by spaces) and their JDBC equivalent.
 */
public class ConnInfoUtils {
    public static final String DEFAULT_HOST = "localhost";
    public static final String DEFAULT_PORT = "5432";
    public static final String DEFAULT_DATABASE = "postgres";

    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private static final Map<String, String> LIBPQ_TO_JDBC_PROPERTIES = Map.of(
            "user", "user",
            "password", "password",
            "sslmode", "sslmode",
            "sslcert", "sslcert",
            "sslkey", "sslkey",
            "sslrootcert", "sslrootcert",
            "application_name", "ApplicationName",
            "connect_timeout", "connectTimeout",
            "options", "options"
    );

    /**
     * Quotes a value for use in a connection string. Values without whitespace are returned as they are.
     */
    public static String quote(String value) {
        if (StringUtils.isEmpty(value)) {
            return "''";
        }
        if (!WHITESPACE.matcher(value).find()) {
            return value;
        }
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /**
     * Builds a connection string from the given host, port and user; null or empty parts are left out.
     */
    public static String build(String host, String port, String user) {
        Map<String, String> parts = new LinkedHashMap<>();
        if (StringUtils.isNotEmpty(host)) {
            parts.put("host", host);
        }
        if (StringUtils.isNotEmpty(port)) {
            parts.put("port", port);
        }
        if (StringUtils.isNotEmpty(user)) {
            parts.put("user", user);
        }
        return format(parts);
    }

    public static String format(Map<String, String> parameters) {
        return parameters.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + quote(entry.getValue()))
                .collect(Collectors.joining(" "));
    }

    /**
     * @throws IllegalArgumentException on a malformed connection string
     */
    public static Map<String, String> parse(String conninfo) {
        Map<String, String> result = new LinkedHashMap<>();
        if (conninfo == null) {
            return result;
        }

        int i = 0;
        int length = conninfo.length();
        while (i < length) {
            while (i < length && Character.isWhitespace(conninfo.charAt(i))) {
                i++;
            }
            if (i >= length) {
                break;
            }

            int keyStart = i;
            while (i < length && conninfo.charAt(i) != '=' && !Character.isWhitespace(conninfo.charAt(i))) {
                i++;
            }
            String key = conninfo.substring(keyStart, i);
            while (i < length && Character.isWhitespace(conninfo.charAt(i))) {
                i++;
            }
            if (i >= length || conninfo.charAt(i) != '=' || key.isEmpty()) {
                throw new IllegalArgumentException("Missing '=' after '" + key + "' in connection info string");
            }
            i++;
            while (i < length && Character.isWhitespace(conninfo.charAt(i))) {
                i++;
            }

            StringBuilder value = new StringBuilder();
            if (i < length && conninfo.charAt(i) == '\'') {
                i++;
                boolean closed = false;
                while (i < length) {
                    char c = conninfo.charAt(i);
                    if (c == '\\' && i + 1 < length) {
                        value.append(conninfo.charAt(i + 1));
                        i += 2;
                    } else if (c == '\'') {
                        closed = true;
                        i++;
                        break;
                    } else {
                        value.append(c);
                        i++;
                    }
                }
                if (!closed) {
                    throw new IllegalArgumentException("Unterminated quoted string in connection info string");
                }
            } else {
                while (i < length && !Character.isWhitespace(conninfo.charAt(i))) {
                    char c = conninfo.charAt(i);
                    if (c == '\\' && i + 1 < length) {
                        value.append(conninfo.charAt(i + 1));
                        i += 2;
                    } else {
                        value.append(c);
                        i++;
                    }
                }
            }
            result.put(key, value.toString());
        }
        return result;
    }

    /**
     * JDBC URL for the given connection string, for example {@code jdbc:postgresql://pg01:5432/postgres}.
     */
    public static String toJdbcUrl(Map<String, String> parameters) {
        String host = parameters.getOrDefault("host", DEFAULT_HOST);
        String port = parameters.getOrDefault("port", DEFAULT_PORT);
        String database = parameters.getOrDefault("dbname", parameters.getOrDefault("user", DEFAULT_DATABASE));

        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    /**
     * Driver properties for the given connection string. Keywords without a JDBC counterpart are dropped.
     */
    public static Properties toJdbcProperties(Map<String, String> parameters) {
        Properties properties = new Properties();
        parameters.forEach((key, value) -> {
            String jdbcKey = LIBPQ_TO_JDBC_PROPERTIES.get(key);
            if (jdbcKey != null) {
                properties.setProperty(jdbcKey, value);
            }
        });
        return properties;
    }

    private ConnInfoUtils() {
    }
}
