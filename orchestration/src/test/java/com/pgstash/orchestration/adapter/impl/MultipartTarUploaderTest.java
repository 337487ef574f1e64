package com.pgstash.orchestration.adapter.impl;

import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.exception.UploadException;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MultipartTarUploaderTest {

    private static final long SMALL_CHUNK = 4096;
    private static final long TAR_BLOCK_CHUNK = 10239;

    private final InMemoryCloudStorageAdapter storage = new InMemoryCloudStorageAdapter();

    @TempDir
    Path dir;

    @Test
    void splitsLargeArchiveIntoParts() throws IOException {
        byte[] content = randomBytes(50_000);
        Path file = Files.write(dir.resolve("16385"), content);

        // the archive is a little over 50 KB of 512 byte records, cut into parts of exactly 20 records
        MultipartTarUploader uploader = new MultipartTarUploader(storage, "main/base/1/data.tar", null, TAR_BLOCK_CHUNK);
        uploader.addPath(file, "base/16384/16385");
        uploader.close();

        assertThat(storage.partCounts.get("main/base/1/data.tar")).isEqualTo(6);
        assertThat(uploader.getParts()).extracting("partNumber").containsExactly(1, 2, 3, 4, 5, 6);
        List<Integer> sizes = storage.partSizes.get("main/base/1/data.tar");
        assertThat(sizes).hasSize(6);
        assertThat(sizes.subList(0, 5)).containsOnly(10240);
        assertThat(sizes.stream().mapToInt(Integer::intValue).sum()).isEqualTo(storage.objects.get("main/base/1/data.tar").length);
        Map<String, byte[]> entries = readTar(storage.objects.get("main/base/1/data.tar"), false);
        assertThat(entries).containsOnlyKeys("base/16384/16385");
        assertThat(entries.get("base/16384/16385")).isEqualTo(content);
    }

    @Test
    void emptyArchiveIsUploadedAsOnePart() {
        MultipartTarUploader uploader = new MultipartTarUploader(storage, "empty.tar", null, 1024 * 1024);

        uploader.close();

        assertThat(storage.partCounts.get("empty.tar")).isEqualTo(1);
        assertThat(storage.objects.get("empty.tar")).isNotEmpty();
    }

    @Test
    void compressesWithGzip() throws IOException {
        MultipartTarUploader uploader = new MultipartTarUploader(storage, "data.tar.gz", PgStashProperties.CompressionType.GZIP, SMALL_CHUNK);
        uploader.addBytes("START WAL LOCATION: 0/4000028\n".getBytes(StandardCharsets.UTF_8), "backup_label", 0600, 999, 998);
        uploader.close();

        byte[] object = storage.objects.get("data.tar.gz");
        assertThat(object[0]).isEqualTo((byte) 0x1f);
        assertThat(object[1]).isEqualTo((byte) 0x8b);

        try (TarArchiveInputStream tar = new TarArchiveInputStream(new GzipCompressorInputStream(new ByteArrayInputStream(object)))) {
            TarArchiveEntry entry = tar.getNextEntry();
            assertThat(entry.getName()).isEqualTo("backup_label");
            assertThat(entry.getMode() & 07777).isEqualTo(0600);
            assertThat(entry.getLongUserId()).isEqualTo(999L);
            assertThat(entry.getLongGroupId()).isEqualTo(998L);
            assertThat(IOUtils.toString(tar, StandardCharsets.UTF_8)).isEqualTo("START WAL LOCATION: 0/4000028\n");
        }
    }

    @Test
    void storesSymbolicLinksAsLinks() throws IOException {
        Path target = Files.createDirectories(dir.resolve("target"));
        Path link = Files.createSymbolicLink(dir.resolve("16387"), target);

        MultipartTarUploader uploader = new MultipartTarUploader(storage, "links.tar", null, SMALL_CHUNK);
        uploader.addPath(link, "pg_tblspc/16387");
        uploader.close();

        try (TarArchiveInputStream tar = new TarArchiveInputStream(new ByteArrayInputStream(storage.objects.get("links.tar")))) {
            TarArchiveEntry entry = tar.getNextEntry();
            assertThat(entry.isSymbolicLink()).isTrue();
            assertThat(entry.getLinkName()).isEqualTo(target.toString());
        }
    }

    @Test
    void failedPartAbortsUpload() throws IOException {
        storage.failOnPart = 2;
        Path file = Files.write(dir.resolve("big"), randomBytes(50_000));
        MultipartTarUploader uploader = new MultipartTarUploader(storage, "broken.tar", null, SMALL_CHUNK);

        assertThatThrownBy(() -> {
            uploader.addPath(file, "big");
            uploader.close();
        }).isInstanceOf(UploadException.class);
        uploader.abort();

        assertThat(storage.abortedKeys).containsExactly("broken.tar");
        assertThat(storage.objects).doesNotContainKey("broken.tar");
        assertThat(storage.pendingUploads).isEmpty();
    }

    @Test
    void writesAfterAbortNeverStartANewUpload() throws IOException {
        MultipartTarUploader uploader = new MultipartTarUploader(storage, "data.tar", null, SMALL_CHUNK);
        uploader.addBytes(randomBytes(50_000), "base/1/1259", null, null, null);

        uploader.abort();

        assertThatThrownBy(() -> uploader.addBytes(randomBytes(50_000), "base/1/1260", null, null, null))
                .isInstanceOf(UploadException.class)
                .hasMessageContaining("aborted");
        assertThatThrownBy(() -> uploader.addPath(Files.write(dir.resolve("late"), randomBytes(10)), "late"))
                .isInstanceOf(UploadException.class);
        assertThat(storage.pendingUploads).isEmpty();
        assertThat(storage.abortedKeys).containsExactly("data.tar");
    }

    @Test
    void writesAfterCloseAreRejected() {
        MultipartTarUploader uploader = new MultipartTarUploader(storage, "done.tar", null, SMALL_CHUNK);
        uploader.close();

        assertThatThrownBy(() -> uploader.addBytes(new byte[]{1}, "late", null, null, null))
                .isInstanceOf(UploadException.class)
                .hasMessageContaining("closed");
        assertThat(storage.partCounts.get("done.tar")).isEqualTo(1);
        assertThat(storage.pendingUploads).isEmpty();
    }

    static Map<String, byte[]> readTar(byte[] archive, boolean directories) throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (InputStream inputStream = new ByteArrayInputStream(archive);
             TarArchiveInputStream tar = new TarArchiveInputStream(inputStream)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (entry.isDirectory() && !directories) {
                    continue;
                }
                entries.put(entry.getName(), IOUtils.toByteArray(tar));
            }
        }
        return entries;
    }

    private static byte[] randomBytes(int size) {
        byte[] bytes = new byte[size];
        new Random(42).nextBytes(bytes);
        return bytes;
    }
}
