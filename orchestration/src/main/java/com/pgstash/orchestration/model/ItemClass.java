package com.pgstash.orchestration.model;

/**
 * Kind of a copy job. Phases run in declaration order.
 */
public enum ItemClass {
    TABLESPACE,
    PGDATA,
    CONTROL,
    CONFIG
}
