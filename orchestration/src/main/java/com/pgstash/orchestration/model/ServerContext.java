package com.pgstash.orchestration.model;

import com.pgstash.catalog.store.BackupCatalog;
import com.pgstash.catalog.store.WalCatalog;
import com.pgstash.configuration.model.ServerPaths;
import com.pgstash.configuration.properties.predefined.PgStashProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Everything a command needs to work on one configured server.
 */
@Value
@Builder
public class ServerContext {
    String serverName;
    PgStashProperties.ServerProperties properties;
    ServerPaths paths;
    WalCatalog walCatalog;
    BackupCatalog backupCatalog;
    Duration lockTimeout;
    Duration lockRetryInterval;
}
