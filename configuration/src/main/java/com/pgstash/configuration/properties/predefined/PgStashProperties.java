package com.pgstash.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

@ConfigMapping(prefix = "pgstash")
public interface PgStashProperties {

    /**
     * Base directory for backups, WAL archives and lock files of every server.
     */
    @WithDefault("/var/lib/pgstash")
    String home();

    /**
     * Directory holding lock files. Defaults to {@link #home()}.
     */
    Optional<String> lockDirectory();

    /**
     * Command used by cron to spawn background receive-wal processes.
     */
    @WithDefault("pgstash")
    String cliCommand();

    LockProperties lock();

    CopyProperties copy();

    CloudProperties cloud();

    Map<String, ServerProperties> servers();

    interface LockProperties {
        @WithDefault("PT10S")
        Duration timeout();

        @WithDefault("PT0.1S")
        Duration retryInterval();
    }

    interface CopyProperties {
        @WithDefault("1")
        int parallelJobs();
    }

    interface CloudProperties {
        // 10 << 21
        @WithDefault("20971520")
        long chunkSize();
    }

    interface ServerProperties {

        Optional<String> description();

        /**
         * libpq-style connection string, for example {@code host=pg01 user=postgres dbname=postgres}.
         */
        String conninfo();

        /**
         * Connection string for the replication protocol. Defaults to {@link #conninfo()}.
         */
        Optional<String> streamingConninfo();

        /**
         * Command used by rsync to reach the PostgreSQL host, for example {@code ssh postgres@pg01}.
         */
        Optional<String> sshCommand();

        @WithDefault("true")
        boolean archiver();

        @WithDefault("false")
        boolean streamingArchiver();

        Optional<String> backupDirectory();

        Optional<CompressionType> compression();

        @WithDefault("off")
        ReuseBackupMode reuseBackup();

        @WithDefault("false")
        boolean networkCompression();

        /**
         * Bandwidth limit in KBPS passed to rsync.
         */
        OptionalInt bandwidthLimit();

        /**
         * Directory searched before PATH when looking for PostgreSQL client binaries.
         */
        Optional<String> pathPrefix();

        @WithDefault("false")
        boolean immediateCheckpoint();

        Optional<String> slotName();
    }

    enum CompressionType {
        GZIP("gzip"),
        BZIP2("bzip2");

        private final String catalogName;

        CompressionType(String catalogName) {
            this.catalogName = catalogName;
        }

        public String getCatalogName() {
            return catalogName;
        }
    }

    enum ReuseBackupMode {
        OFF,
        LINK,
        COPY
    }
}
