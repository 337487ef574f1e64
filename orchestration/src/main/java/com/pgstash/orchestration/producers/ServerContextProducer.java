package com.pgstash.orchestration.producers;

import com.pgstash.catalog.store.BackupCatalog;
import com.pgstash.catalog.store.WalCatalog;
import com.pgstash.configuration.model.ServerPaths;
import com.pgstash.configuration.producers.ServerPathsProducer;
import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.model.ServerContext;
import com.pgstash.postgres.api.PostgresConnection;
import com.pgstash.postgres.api.StreamingConnection;
import com.pgstash.postgres.impl.JdbcPostgresConnection;
import com.pgstash.postgres.impl.JdbcStreamingConnection;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
@ApplicationScoped
public class ServerContextProducer {

    @Inject
    PgStashProperties pgStashProperties;

    @Inject
    ServerPathsProducer serverPathsProducer;

    public List<String> getServerNames() {
        List<String> names = new ArrayList<>(pgStashProperties.servers().keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Builds the context of a configured server and creates its directory layout.
     */
    public ServerContext createServerContext(String serverName) {
        PgStashProperties.ServerProperties serverProperties = serverPathsProducer.getServerProperties(serverName);
        ServerPaths serverPaths = serverPathsProducer.getServerPaths(serverName);
        serverPathsProducer.createDirectories(serverPaths);

        PgStashProperties.LockProperties lockProperties = pgStashProperties.lock();

        return ServerContext.builder()
                .serverName(serverName)
                .properties(serverProperties)
                .paths(serverPaths)
                .walCatalog(new WalCatalog(
                        serverPaths.getXlogDbFile(),
                        serverPaths.getXlogDbLockFile(),
                        lockProperties.timeout(),
                        lockProperties.retryInterval()
                ))
                .backupCatalog(new BackupCatalog(serverPaths.getBaseBackupsDirectory()))
                .lockTimeout(lockProperties.timeout())
                .lockRetryInterval(lockProperties.retryInterval())
                .build();
    }

    public PostgresConnection createPostgresConnection(ServerContext serverContext) {
        return new JdbcPostgresConnection(serverContext.getProperties().conninfo());
    }

    public PostgresConnection createPostgresConnection(String conninfo) {
        return new JdbcPostgresConnection(conninfo);
    }

    public StreamingConnection createStreamingConnection(ServerContext serverContext) {
        PgStashProperties.ServerProperties properties = serverContext.getProperties();
        return new JdbcStreamingConnection(properties.streamingConninfo().orElse(properties.conninfo()));
    }
}
