package com.pgstash.orchestration.service.impl;

import com.pgstash.catalog.exception.LockFileBusyException;
import com.pgstash.catalog.lock.LockFile;
import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.catalog.model.BackupStatus;
import com.pgstash.catalog.model.Tablespace;
import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.command.ShellCommand;
import com.pgstash.orchestration.copy.BackupCopyController;
import com.pgstash.orchestration.copy.BackupCopyPlanner;
import com.pgstash.orchestration.model.ServerContext;
import com.pgstash.orchestration.model.ServerContextFixture;
import com.pgstash.orchestration.producers.ServerContextProducer;
import com.pgstash.postgres.api.PostgresConnection;
import com.pgstash.postgres.exception.PostgresConnectionException;
import com.pgstash.postgres.model.BackupStartResult;
import com.pgstash.postgres.model.BackupStopResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackupServiceImplTest {
    private static final OffsetDateTime BEGIN = OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.UTC);
    private static final String LABEL = "START WAL LOCATION: 0/4000028 (file 000000010000000000000004)\n";

    @TempDir
    Path home;

    @Mock
    private PgStashProperties pgStashProperties;

    @Mock
    private PgStashProperties.CopyProperties copyProperties;

    @Mock
    private PgStashProperties.ServerProperties properties;

    @Mock
    private ServerContextProducer serverContextProducer;

    @Mock
    private ShellCommand shellCommand;

    @Mock
    private BackupCopyPlanner backupCopyPlanner;

    @Mock
    private PostgresConnection postgres;

    @InjectMocks
    private BackupServiceImpl service;

    private ServerContext context;

    @BeforeEach
    void setUp() {
        context = ServerContextFixture.serverContext(home, "main", properties);
    }

    @Nested
    class Backup {

        @BeforeEach
        void setUp() {
            when(serverContextProducer.createServerContext("main")).thenReturn(context);
            when(serverContextProducer.createPostgresConnection(context)).thenReturn(postgres);
            when(pgStashProperties.copy()).thenReturn(copyProperties);
            when(copyProperties.parallelJobs()).thenReturn(2);
            when(postgres.getServerVersion()).thenReturn(150004);
            when(postgres.getDataDirectory()).thenReturn("/var/lib/postgresql/15/main");
            when(postgres.getXlogSegmentSize()).thenReturn(16777216L);
            when(postgres.startConcurrentBackup(anyString(), anyBoolean()))
                    .thenReturn(new BackupStartResult("0/4000028", 1, BEGIN));
        }

        @Test
        void completedBackupIsCatalogedWithLabel() {
            when(postgres.stopConcurrentBackup())
                    .thenReturn(new BackupStopResult("0/5000100", LABEL, null, BEGIN.plusMinutes(5)));

            BackupInfo backupInfo = service.backup("main");

            assertThat(backupInfo.getStatus()).isEqualTo(BackupStatus.DONE);
            assertThat(backupInfo.getBeginWal()).isEqualTo("000000010000000000000004");
            assertThat(backupInfo.getEndWal()).isEqualTo("000000010000000000000005");
            assertThat(backupInfo.getCopyStats().getNumberOfWorkers()).isEqualTo(2);

            Path backupDirectory = context.getBackupCatalog().getBackupDirectory(backupInfo.getBackupId());
            assertThat(backupDirectory.resolve("data/backup_label")).hasContent(LABEL);
            assertThat(context.getBackupCatalog().getBackup(backupInfo.getBackupId()))
                    .get()
                    .extracting(BackupInfo::getStatus)
                    .isEqualTo(BackupStatus.DONE);
            verify(backupCopyPlanner).plan(any(BackupInfo.class), any(BackupCopyController.class), isNull(), isNull());
            verify(postgres).close();
        }

        @Test
        void failedBackupIsCatalogedWithError() {
            when(postgres.stopConcurrentBackup()).thenThrow(new PostgresConnectionException("server closed the connection"));

            assertThatThrownBy(() -> service.backup("main"))
                    .isInstanceOf(PostgresConnectionException.class);

            List<BackupInfo> failed = context.getBackupCatalog().getAvailableBackups(EnumSet.of(BackupStatus.FAILED));
            assertThat(failed).singleElement()
                    .extracting(BackupInfo::getError)
                    .isEqualTo("server closed the connection");
            verify(postgres).close();

            LockFile lock = new LockFile(context.getPaths().getBackupLockFile(), ServerContextFixture.LOCK_TIMEOUT, ServerContextFixture.LOCK_RETRY_INTERVAL);
            assertThat(lock.tryAcquire()).isTrue();
            lock.release();
        }
    }

    @Test
    void concurrentBackupIsRefused() {
        when(serverContextProducer.createServerContext("main")).thenReturn(context);
        LockFile lock = new LockFile(context.getPaths().getBackupLockFile(), ServerContextFixture.LOCK_TIMEOUT, ServerContextFixture.LOCK_RETRY_INTERVAL);
        lock.tryAcquire();
        try {
            assertThatThrownBy(() -> service.backup("main"))
                    .isInstanceOf(LockFileBusyException.class);
        } finally {
            lock.release();
        }
        verifyNoInteractions(backupCopyPlanner);
    }

    @Test
    void unreachableServerReleasesBackupLock() {
        when(serverContextProducer.createServerContext("main")).thenReturn(context);
        when(serverContextProducer.createPostgresConnection(context))
                .thenThrow(new PostgresConnectionException("connection refused"));

        assertThatThrownBy(() -> service.backup("main"))
                .isInstanceOf(PostgresConnectionException.class);

        LockFile lock = new LockFile(context.getPaths().getBackupLockFile(), ServerContextFixture.LOCK_TIMEOUT, ServerContextFixture.LOCK_RETRY_INTERVAL);
        assertThat(lock.tryAcquire()).isTrue();
        lock.release();
        verifyNoInteractions(backupCopyPlanner);
    }

    @Test
    void reuseNeedsSameMajorVersionAndTablespaces() {
        BackupInfo previous = backupInfo("20240501T100000", 150002, 16387L);

        assertThat(service.isReusable(previous, backupInfo("20240502T100000", 150004, 16387L))).isTrue();
        assertThat(service.isReusable(previous, backupInfo("20240502T100000", 160001, 16387L))).isFalse();
        assertThat(service.isReusable(previous, backupInfo("20240502T100000", 150004, 16388L))).isFalse();
    }

    private static BackupInfo backupInfo(String backupId, int version, long tablespaceOid) {
        BackupInfo backupInfo = new BackupInfo("main", backupId);
        backupInfo.setVersion(version);
        backupInfo.setTablespaces(List.of(new Tablespace(tablespaceOid, "tbs", "/srv/tbs")));
        return backupInfo;
    }
}
