package com.pgstash.orchestration.archiver;

import com.pgstash.catalog.lock.LockFile;
import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.command.ShellCommand;
import com.pgstash.orchestration.exception.ArchiverFailureException;
import com.pgstash.orchestration.exception.CommandFailedException;
import com.pgstash.orchestration.model.CheckResult;
import com.pgstash.orchestration.model.CommandResult;
import com.pgstash.orchestration.model.ServerContext;
import com.pgstash.orchestration.model.ServerContextFixture;
import com.pgstash.postgres.api.StreamingConnection;
import com.pgstash.postgres.model.PostgresVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StreamingWalArchiverTest {
    private static final Path RECEIVER = Path.of("/usr/lib/postgresql/15/bin/pg_receivewal");
    private static final String CONNINFO = "host=pg01 user=streaming_pgstash replication=true";

    @TempDir
    Path home;

    @Mock
    private PgStashProperties.ServerProperties properties;

    @Mock
    private StreamingConnection streaming;

    @Mock
    private ShellCommand shellCommand;

    private ServerContext context;

    @BeforeEach
    void setUp() {
        context = ServerContextFixture.serverContext(home, "main", properties);
    }

    @Test
    void compatibilityRules() {
        assertThat(StreamingWalArchiver.isCompatible(new PostgresVersion(9, 2), new PostgresVersion(9, 2))).isTrue();
        assertThat(StreamingWalArchiver.isCompatible(new PostgresVersion(9, 2), new PostgresVersion(9, 3))).isFalse();
        assertThat(StreamingWalArchiver.isCompatible(new PostgresVersion(9, 6), new PostgresVersion(10, 0))).isTrue();
        assertThat(StreamingWalArchiver.isCompatible(new PostgresVersion(15, 0), new PostgresVersion(14, 0))).isFalse();
        assertThat(StreamingWalArchiver.isCompatible(new PostgresVersion(15, 0), new PostgresVersion(15, 0))).isTrue();
    }

    @Test
    void newerReceiverServesOlderServerFromNineThree() {
        assertThat(StreamingWalArchiver.isCompatible(new PostgresVersion(9, 3), new PostgresVersion(9, 5))).isTrue();
        assertThat(StreamingWalArchiver.isCompatible(new PostgresVersion(9, 5), new PostgresVersion(9, 3))).isFalse();
        assertThat(StreamingWalArchiver.isCompatible(new PostgresVersion(9, 5), new PostgresVersion(9, 2))).isFalse();
    }

    @Test
    void patchLevelDoesNotMatter() {
        assertThat(StreamingWalArchiver.isCompatible(PostgresVersion.fromVersionNum(90405), PostgresVersion.parse("9.4.4"))).isTrue();
    }

    @Test
    void compatibilityIsUnknownWhenServerVersionIsUnavailable() {
        receiverVersion("pg_receivewal (PostgreSQL) 15.4");
        when(streaming.getServerVersion()).thenReturn(null);

        Map<String, Object> status = archiver(RECEIVER).getRemoteStatus();

        assertThat(status)
                .containsEntry(StreamingWalArchiver.RECEIVER_INSTALLED, true)
                .containsEntry(StreamingWalArchiver.RECEIVER_VERSION, "15")
                .containsEntry(StreamingWalArchiver.RECEIVER_COMPATIBLE, null);
    }

    @Test
    void partialSegmentsAreLeftInPlace() throws IOException {
        Path streamingDirectory = context.getPaths().getStreamingWalsDirectory();
        Files.createDirectories(streamingDirectory);
        Files.writeString(streamingDirectory.resolve("000000010000000000000001"), "complete");
        Files.writeString(streamingDirectory.resolve("000000010000000000000002.partial"), "in progress");

        int archived = archiver(null).archive(false);

        assertThat(archived).isEqualTo(1);
        assertThat(streamingDirectory.resolve("000000010000000000000002.partial")).exists();
        assertThat(context.getPaths().getWalsDirectory().resolve("0000000100000000/000000010000000000000001")).exists();
    }

    @Test
    void checkReportsMissingReceiver() {
        CheckOutputStrategy strategy = new CheckOutputStrategy(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        archiver(null).check(strategy);

        assertThat(strategy.getCheckResults())
                .singleElement()
                .extracting(CheckResult::getCheckName, CheckResult::isStatus)
                .containsExactly(StreamingWalArchiver.RECEIVER_CHECK, false);
    }

    @Test
    void checkReportsCompatibleReceiver() {
        receiverVersion("pg_receivewal (PostgreSQL) 15.4");
        when(streaming.getServerVersion()).thenReturn(150004);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        CheckOutputStrategy strategy = new CheckOutputStrategy(new PrintStream(output, true, StandardCharsets.UTF_8));

        archiver(RECEIVER).check(strategy);

        assertThat(strategy.hasError()).isFalse();
        assertThat(output.toString(StandardCharsets.UTF_8))
                .contains("\tpg_receivexlog: OK")
                .contains("\tpg_receivexlog compatible: OK");
    }

    @Test
    void checkReportsVersionsWhenIncompatible() {
        receiverVersion("pg_receivewal (PostgreSQL) 14.9");
        when(streaming.getServerVersion()).thenReturn(150004);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        CheckOutputStrategy strategy = new CheckOutputStrategy(new PrintStream(output, true, StandardCharsets.UTF_8));

        archiver(RECEIVER).check(strategy);

        assertThat(output.toString(StandardCharsets.UTF_8))
                .contains("\tpg_receivexlog compatible: FAILED (PostgreSQL version: 15, pg_receivexlog version: 14)");
    }

    @Test
    void receiveWalRequiresReceiver() {
        assertThatThrownBy(() -> archiver(null).receiveWal())
                .isInstanceOf(ArchiverFailureException.class)
                .hasMessage("pg_receivexlog not present in $PATH");
    }

    @Test
    void receiveWalRequiresCompatibleReceiver() {
        receiverVersion("pg_receivexlog (PostgreSQL) 9.2.4");
        when(streaming.getServerVersion()).thenReturn(90605);

        assertThatThrownBy(() -> archiver(RECEIVER).receiveWal())
                .isInstanceOf(ArchiverFailureException.class)
                .hasMessage("pg_receivexlog version not compatible with PostgreSQL server version");
    }

    @Test
    void receiveWalRequiresStreamingSupport() {
        receiverVersion("pg_receivewal (PostgreSQL) 15.4");
        when(streaming.getServerVersion()).thenReturn(150004);
        when(streaming.isStreamingSupported()).thenReturn(false);

        assertThatThrownBy(() -> archiver(RECEIVER).receiveWal())
                .isInstanceOf(ArchiverFailureException.class)
                .hasMessage("PostgreSQL version too old (< 9.2)");
    }

    @Test
    void receiveWalRunsReceiverWithSlot() {
        receiverVersion("pg_receivewal (PostgreSQL) 15.4");
        when(streaming.getServerVersion()).thenReturn(150004);
        when(streaming.isStreamingSupported()).thenReturn(true);
        when(streaming.getConnInfo()).thenReturn(CONNINFO);
        when(properties.slotName()).thenReturn(Optional.of("pgstash"));
        Path streamingDirectory = context.getPaths().getStreamingWalsDirectory();
        List<String> expectedLine = List.of(
                RECEIVER.toString(),
                "--dbname=" + CONNINFO,
                "--directory=" + streamingDirectory,
                "--slot=pgstash"
        );
        when(shellCommand.runChecked(eq(expectedLine), isNull(), eq(List.of(0))))
                .thenReturn(CommandResult.builder().returnCode(0).stdout("").stderr("").build());

        archiver(RECEIVER).receiveWal();

        verify(shellCommand).runChecked(eq(expectedLine), isNull(), eq(List.of(0)));
        assertThat(streamingDirectory).isDirectory();
        LockFile lock = new LockFile(context.getPaths().getReceiveWalLockFile(), ServerContextFixture.LOCK_TIMEOUT, ServerContextFixture.LOCK_RETRY_INTERVAL);
        assertThat(lock.tryAcquire()).isTrue();
        lock.release();
    }

    @Test
    void receiverFailureCarriesExitCode() {
        when(streaming.getServerVersion()).thenReturn(150004);
        when(streaming.isStreamingSupported()).thenReturn(true);
        when(streaming.getConnInfo()).thenReturn(CONNINFO);
        when(shellCommand.runChecked(anyList(), isNull(), eq(List.of(0))))
                .thenAnswer(invocation -> {
                    List<String> line = invocation.getArgument(0);
                    if (line.contains("--version")) {
                        return CommandResult.builder().returnCode(0).stdout("pg_receivewal (PostgreSQL) 15.4").stderr("").build();
                    }
                    throw new CommandFailedException("pg_receivewal failed", 1, "", "connection lost");
                });

        assertThatThrownBy(() -> archiver(RECEIVER).receiveWal())
                .isInstanceOf(ArchiverFailureException.class)
                .hasMessage("pg_receivexlog terminated with error code: 1");
    }

    @Test
    void receiveWalRefusesWhenAlreadyRunning() {
        receiverVersion("pg_receivewal (PostgreSQL) 15.4");
        when(streaming.getServerVersion()).thenReturn(150004);
        when(streaming.isStreamingSupported()).thenReturn(true);
        LockFile lock = new LockFile(context.getPaths().getReceiveWalLockFile(), ServerContextFixture.LOCK_TIMEOUT, ServerContextFixture.LOCK_RETRY_INTERVAL);
        assertThat(lock.tryAcquire()).isTrue();

        try {
            assertThatThrownBy(() -> archiver(RECEIVER).receiveWal())
                    .isInstanceOf(ArchiverFailureException.class)
                    .hasMessageContaining("Another receive-wal process");
        } finally {
            lock.release();
        }
    }

    private void receiverVersion(String versionOutput) {
        when(shellCommand.runChecked(eq(List.of(RECEIVER.toString(), "--version")), isNull(), eq(List.of(0))))
                .thenReturn(CommandResult.builder().returnCode(0).stdout(versionOutput).stderr("").build());
    }

    private StreamingWalArchiver archiver(Path receiver) {
        return new StreamingWalArchiver(context, streaming, shellCommand) {
            @Override
            Path findReceiver() {
                return receiver;
            }
        };
    }
}
