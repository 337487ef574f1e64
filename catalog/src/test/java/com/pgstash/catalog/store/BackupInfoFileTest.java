package com.pgstash.catalog.store;

import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.catalog.model.BackupStatus;
import com.pgstash.catalog.model.CopyStats;
import com.pgstash.catalog.model.Tablespace;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackupInfoFileTest {

    @TempDir
    Path dir;

    @Test
    void saveThenLoadReproducesEveryField() {
        BackupInfo info = fullBackupInfo();
        Path file = dir.resolve("20240102T030405/backup.info");

        BackupInfoFile.save(info, file);
        BackupInfo loaded = BackupInfoFile.load(file);

        assertThat(loaded).isEqualTo(info);
        assertThat(BackupInfoFile.toText(loaded)).isEqualTo(BackupInfoFile.toText(info));
    }

    @Test
    void nullFieldsAreNotWritten() {
        BackupInfo info = new BackupInfo("main", "20240102T030405");
        info.setStatus(BackupStatus.STARTED);

        assertThat(BackupInfoFile.toText(info)).isEqualTo(
                "backup_id=20240102T030405\n"
                        + "server_name=main\n"
                        + "status=STARTED\n"
        );
    }

    @Test
    void multiLineValuesStayOnOneLine() {
        BackupInfo info = fullBackupInfo();

        String text = BackupInfoFile.toText(info);

        assertThat(text.lines()).allMatch(line -> line.contains("="));
        assertThat(text.lines().count()).isEqualTo(BackupInfoFile.fieldNames().size());
    }

    @Test
    void errorIsFlattenedToOneLine() {
        BackupInfo info = new BackupInfo("main", "20240102T030405");
        info.setError("copy failed\nrsync: connection unexpectedly closed");

        BackupInfo loaded = BackupInfoFile.fromText(BackupInfoFile.toText(info));

        assertThat(loaded.getError()).isEqualTo("copy failed rsync: connection unexpectedly closed");
    }

    @Test
    void unknownFieldIsRejected() throws Exception {
        Path file = dir.resolve("backup.info");
        Files.writeString(file, "backup_id=20240102T030405\nfavourite_colour=blue\n");

        assertThatThrownBy(() -> BackupInfoFile.load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("favourite_colour");
    }

    @Test
    void lineWithoutSeparatorIsRejected() {
        assertThatThrownBy(() -> BackupInfoFile.fromText("status DONE\n"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static BackupInfo fullBackupInfo() {
        BackupInfo info = new BackupInfo("main", "20240102T030405");
        info.setStatus(BackupStatus.DONE);
        info.setMode("rsync-concurrent");
        info.setPgdata("/var/lib/postgresql/data");
        info.setTablespaces(List.of(
                new Tablespace(16387, "tbs1", "/srv/tbs1"),
                new Tablespace(16405, "tbs2", "/var/lib/postgresql/data/tbs2")
        ));
        info.setVersion(150004);
        info.setTimeline(1);
        info.setSystemId("7212458924381592347");
        info.setXlogSegmentSize(16777216L);
        info.setBeginWal("000000010000000000000004");
        info.setEndWal("000000010000000000000005");
        info.setBeginXlog("0/4000028");
        info.setEndXlog("0/5000100");
        info.setBeginOffset(40L);
        info.setEndOffset(256L);
        info.setBeginTime(OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.UTC));
        info.setEndTime(OffsetDateTime.of(2024, 1, 2, 3, 9, 17, 0, ZoneOffset.ofHours(2)));
        info.setConfigFile("/etc/postgresql/postgresql.conf");
        info.setHbaFile("/etc/postgresql/pg_hba.conf");
        info.setIdentFile("/etc/postgresql/pg_ident.conf");
        info.setIncludedFiles(List.of("/etc/postgresql/conf.d/extra.conf"));
        info.setBackupLabel("START WAL LOCATION: 0/4000028 (file 000000010000000000000004)\nCHECKPOINT LOCATION: 0/4000060\n");
        info.setCopyStats(CopyStats.builder()
                .copyTime(12.5)
                .numberOfWorkers(2)
                .jobTimes(Map.of("pgdata", 10.0))
                .build());
        info.setCompression("gzip");
        info.setError("rsync failed with code 23");
        info.setSize(123456789L);
        return info;
    }
}
