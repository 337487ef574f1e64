package com.pgstash.orchestration.constant;

import java.util.List;

public class PostgresPlumbingConstants {

    /**
     * Files and directory contents PostgreSQL itself skips in base backups. Applies to PGDATA and tablespaces.
     */
    public static final List<String> EXCLUDE_LIST = List.of(
            "pgsql_tmp*",
            "postgresql.auto.conf.tmp",
            "current_logfiles.tmp",
            "pg_internal.init",
            "postmaster.pid",
            "postmaster.opts",
            "recovery.conf",
            "standby.signal",
            "pg_dynshmem/*",
            "pg_notify/*",
            "pg_replslot/*",
            "pg_serial/*",
            "pg_stat_tmp/*",
            "pg_snapshots/*",
            "pg_subtrans/*"
    );

    /**
     * Paths of PGDATA never copied with the data directory. pg_control is copied last by a separate job.
     */
    public static final List<String> PGDATA_EXCLUDE_LIST = List.of(
            "/pg_log/*",
            "/log/*",
            "/pg_xlog/*",
            "/pg_wal/*",
            "/global/pg_control"
    );

    public static final String PG_CONTROL_PATH = "global/pg_control";
    public static final String TABLESPACE_LINK_FORMAT = "/pg_tblspc/%d";
    public static final String TABLESPACE_INCLUDE_FORMAT = "/PG_%s_*";

    private PostgresPlumbingConstants() {
    }
}
