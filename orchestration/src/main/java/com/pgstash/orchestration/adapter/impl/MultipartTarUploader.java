package com.pgstash.orchestration.adapter.impl;

import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.adapter.api.CloudStorageAdapter;
import com.pgstash.orchestration.exception.UploadException;
import com.pgstash.orchestration.model.UploadedPart;
import com.pgstash.orchestration.util.CompressionIOUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarConstants;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.apache.commons.io.IOUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A tar archive written straight into an S3 multipart upload. At most one chunk plus one write is kept in memory.
 * Methods are synchronized, so jobs sharing a destination may add entries concurrently.
 */
@Slf4j
public class MultipartTarUploader {
    private final CloudStorageAdapter storageAdapter;
    private final String key;
    private final long chunkSize;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final List<UploadedPart> parts = new ArrayList<>();
    private final TarArchiveOutputStream tar;

    private String uploadId;
    private int counter = 1;
    private boolean closed;
    private boolean aborted;

    public MultipartTarUploader(CloudStorageAdapter storageAdapter, String key, PgStashProperties.CompressionType compression, long chunkSize) {
        this.storageAdapter = storageAdapter;
        this.key = key;
        this.chunkSize = chunkSize;

        OutputStream target = new ChunkingOutputStream();
        if (compression != null) {
            try {
                target = new CompressorStreamFactory()
                        .createCompressorOutputStream(CompressionIOUtils.toCompressorName(compression.getCatalogName()), target);
            } catch (CompressorException e) {
                throw new UploadException("Failed to set up " + compression + " compression for " + key, e);
            }
        }

        this.tar = new TarArchiveOutputStream(target);
        this.tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
        this.tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
    }

    public String getKey() {
        return key;
    }

    /**
     * Adds a file, a directory (without its content) or a symbolic link.
     */
    public synchronized void addPath(Path path, String entryName) throws IOException {
        ensureOpen(entryName);
        TarArchiveEntry entry;
        if (Files.isSymbolicLink(path)) {
            entry = new TarArchiveEntry(entryName, TarConstants.LF_SYMLINK);
            entry.setLinkName(Files.readSymbolicLink(path).toString());
            entry.setModTime(Files.getLastModifiedTime(path, LinkOption.NOFOLLOW_LINKS));
            tar.putArchiveEntry(entry);
            tar.closeArchiveEntry();
            return;
        }

        entry = new TarArchiveEntry(path, entryName);
        tar.putArchiveEntry(entry);
        if (Files.isRegularFile(path)) {
            // the size in the header is fixed: growth is cut, shrinkage is zero padded and repaired by WAL replay
            long copied;
            try (InputStream inputStream = Files.newInputStream(path)) {
                copied = IOUtils.copyLarge(inputStream, tar, 0, entry.getSize());
            }
            if (copied < entry.getSize()) {
                log.warn("File {} shrank while being archived", path);
                byte[] padding = new byte[8192];
                for (long remaining = entry.getSize() - copied; remaining > 0; remaining -= padding.length) {
                    tar.write(padding, 0, (int) Math.min(padding.length, remaining));
                }
            }
        }
        tar.closeArchiveEntry();
    }

    public synchronized void addBytes(byte[] content, String entryName, Integer mode, Integer uid, Integer gid) throws IOException {
        ensureOpen(entryName);
        TarArchiveEntry entry = new TarArchiveEntry(entryName);
        entry.setSize(content.length);
        entry.setModTime(System.currentTimeMillis());
        if (mode != null) {
            entry.setMode(mode);
        }
        if (uid != null) {
            entry.setUserId(uid);
        }
        if (gid != null) {
            entry.setGroupId(gid);
        }
        tar.putArchiveEntry(entry);
        tar.write(content);
        tar.closeArchiveEntry();
    }

    public synchronized List<UploadedPart> getParts() {
        return Collections.unmodifiableList(new ArrayList<>(parts));
    }

    /**
     * Finishes the archive, uploads the remaining bytes and completes the upload.
     * On failure the upload is aborted.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            tar.close();
            if (buffer.size() > 0 || parts.isEmpty()) {
                uploadBuffer();
            }
            storageAdapter.completeMultipartUpload(key, uploadId, parts);
            log.info("Uploaded {} in {} part(s)", key, parts.size());
        } catch (IOException | RuntimeException e) {
            abort();
            throw e instanceof UploadException ? (UploadException) e : new UploadException("Failed to upload " + key, e);
        }
    }

    /**
     * Aborts the upload. Later writes fail with {@link UploadException} and never start a new upload.
     */
    public synchronized void abort() {
        closed = true;
        aborted = true;
        buffer.reset();
        if (uploadId != null) {
            log.warn("Aborting upload of {}", key);
            storageAdapter.abortMultipartUpload(key, uploadId);
            uploadId = null;
        }
    }

    private void ensureOpen(String entryName) {
        if (closed) {
            throw new UploadException("Cannot add " + entryName + " to " + key + ": the upload is " + (aborted ? "aborted" : "closed"));
        }
    }

    private void uploadBuffer() {
        if (aborted) {
            throw new UploadException("Upload of " + key + " was aborted");
        }
        if (uploadId == null) {
            uploadId = storageAdapter.createMultipartUpload(key);
        }
        byte[] data = buffer.toByteArray();
        parts.add(storageAdapter.uploadPart(key, uploadId, counter, data, data.length));
        log.debug("Uploaded part {} of {} ({} bytes)", counter, key, data.length);
        counter++;
        buffer.reset();
    }

    /**
     * Sink of the tar stream. Flushing never uploads; a part is sent only once the buffer went past the chunk size.
     */
    private class ChunkingOutputStream extends OutputStream {

        @Override
        public void write(int b) {
            uploadIfFull();
            buffer.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) {
            uploadIfFull();
            buffer.write(b, off, len);
        }

        @Override
        public void flush() {
            // parts are only cut by size
        }

        @Override
        public void close() {
            // the owning uploader completes the upload
        }

        private void uploadIfFull() {
            if (buffer.size() > chunkSize) {
                uploadBuffer();
            }
        }
    }
}
