package com.pgstash.postgres.impl;

import com.pgstash.postgres.api.StreamingConnection;
import com.pgstash.postgres.util.ConnInfoUtils;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.Properties;

@Slf4j
public class JdbcStreamingConnection implements StreamingConnection {
    private static final int MIN_STREAMING_VERSION = 90200;

    private final String conninfo;
    private Connection connection;
    private boolean probed;
    private Integer serverVersion;

    public JdbcStreamingConnection(String conninfo) {
        this.conninfo = conninfo;
    }

    @Override
    public String getConnInfo() {
        return conninfo;
    }

    @Override
    public synchronized Integer getServerVersion() {
        if (!probed) {
            probed = true;
            serverVersion = probeServerVersion();
        }
        return serverVersion;
    }

    @Override
    public Boolean isStreamingSupported() {
        Integer version = getServerVersion();
        if (version == null) {
            return null;
        }
        return version >= MIN_STREAMING_VERSION;
    }

    @Override
    public synchronized void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Failed to close replication connection", e);
        }
        connection = null;
    }

    private Integer probeServerVersion() {
        try {
            Map<String, String> parameters = ConnInfoUtils.parse(conninfo);
            Properties properties = ConnInfoUtils.toJdbcProperties(parameters);
            properties.setProperty("replication", "true");
            properties.setProperty("preferQueryMode", "simple");
            properties.setProperty("assumeMinServerVersion", "9.4");

            connection = DriverManager.getConnection(ConnInfoUtils.toJdbcUrl(parameters), properties);

            DatabaseMetaData metaData = connection.getMetaData();
            int major = metaData.getDatabaseMajorVersion();
            int minor = metaData.getDatabaseMinorVersion();
            return major >= 10 ? major * 10000 + minor : major * 10000 + minor * 100;
        } catch (SQLException | IllegalArgumentException e) {
            log.warn("Replication connection to PostgreSQL failed: {}", e.getMessage());
            return null;
        }
    }
}
