package com.pgstash.orchestration.service.impl;

import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.archiver.CheckOutputStrategy;
import com.pgstash.orchestration.archiver.FileBasedWalArchiver;
import com.pgstash.orchestration.archiver.StreamingWalArchiver;
import com.pgstash.orchestration.command.ShellCommand;
import com.pgstash.orchestration.exception.ArchiverFailureException;
import com.pgstash.orchestration.model.CheckResult;
import com.pgstash.orchestration.model.ServerContext;
import com.pgstash.orchestration.model.ServerContextFixture;
import com.pgstash.orchestration.producers.ServerContextProducer;
import com.pgstash.postgres.api.PostgresConnection;
import com.pgstash.postgres.api.StreamingConnection;
import com.pgstash.postgres.exception.PostgresConnectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalArchivingServiceImplTest {

    @TempDir
    Path home;

    @Mock
    private ServerContextProducer serverContextProducer;

    @Mock
    private ShellCommand shellCommand;

    @Mock
    private PgStashProperties.ServerProperties properties;

    @Mock
    private PostgresConnection postgres;

    @Mock
    private StreamingConnection streaming;

    @InjectMocks
    private WalArchivingServiceImpl service;

    private ServerContext context;

    @BeforeEach
    void setUp() {
        context = ServerContextFixture.serverContext(home, "main", properties);
    }

    @Test
    void archiveWalSumsEveryEnabledArchiver() throws IOException {
        givenConnections();
        when(properties.archiver()).thenReturn(true);
        when(properties.streamingArchiver()).thenReturn(true);
        write(context.getPaths().getIncomingWalsDirectory().resolve("000000010000000000000001"));
        write(context.getPaths().getStreamingWalsDirectory().resolve("000000010000000000000002"));

        int archived = service.archiveWal("main", false);

        assertThat(archived).isEqualTo(2);
        assertThat(context.getWalCatalog().readAll()).hasSize(2);
        verify(postgres).close();
        verify(streaming).close();
    }

    @Test
    void archiversFollowConfiguration() {
        when(properties.archiver()).thenReturn(false);
        when(properties.streamingArchiver()).thenReturn(true);

        assertThat(service.getArchivers(context, postgres, streaming))
                .singleElement()
                .isInstanceOf(StreamingWalArchiver.class);
    }

    @Test
    void receiveWalNeedsStreamingArchiver() {
        when(serverContextProducer.createServerContext("main")).thenReturn(context);

        assertThatThrownBy(() -> service.receiveWal("main"))
                .isInstanceOf(ArchiverFailureException.class)
                .hasMessageContaining("streaming-archiver is off");
        verify(serverContextProducer, never()).createStreamingConnection(any(ServerContext.class));
    }

    @Test
    void checkReportsUnreachablePostgres() {
        givenConnections();
        when(postgres.getServerVersion()).thenThrow(new PostgresConnectionException("connection refused"));
        CheckOutputStrategy strategy = new CheckOutputStrategy(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        boolean healthy = service.check("main", strategy);

        assertThat(healthy).isFalse();
        assertThat(strategy.getCheckResults())
                .extracting(CheckResult::getCheckName)
                .containsExactly(WalArchivingServiceImpl.POSTGRESQL_CHECK);
        verify(postgres).close();
        verify(streaming).close();
    }

    @Test
    void checkRunsArchiverChecks() {
        givenConnections();
        when(properties.archiver()).thenReturn(true);
        when(postgres.getServerVersion()).thenReturn(150004);
        when(postgres.getSetting(FileBasedWalArchiver.ARCHIVE_MODE)).thenReturn("on");
        when(postgres.getSetting(FileBasedWalArchiver.ARCHIVE_COMMAND)).thenReturn("rsync -a %p backup:/incoming/%f");
        CheckOutputStrategy strategy = new CheckOutputStrategy(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        boolean healthy = service.check("main", strategy);

        assertThat(healthy).isTrue();
        assertThat(strategy.getCheckResults())
                .extracting(CheckResult::getCheckName)
                .containsExactly(
                        WalArchivingServiceImpl.POSTGRESQL_CHECK,
                        FileBasedWalArchiver.ARCHIVE_MODE,
                        FileBasedWalArchiver.ARCHIVE_COMMAND
                );
    }

    private void givenConnections() {
        when(serverContextProducer.createServerContext("main")).thenReturn(context);
        when(serverContextProducer.createPostgresConnection(context)).thenReturn(postgres);
        when(serverContextProducer.createStreamingConnection(context)).thenReturn(streaming);
    }

    private static void write(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "wal");
    }
}
