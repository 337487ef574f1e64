package com.pgstash.orchestration.adapter.impl;

import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.adapter.api.CloudStorageAdapter;
import com.pgstash.orchestration.adapter.api.TransportAdapter;
import com.pgstash.orchestration.copy.PathFilter;
import com.pgstash.orchestration.exception.UploadException;
import com.pgstash.orchestration.model.CopyJob;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Streams every destination ({@code data}, one per tablespace oid) into its own tar archive in the object store.
 */
@Slf4j
public class CloudTarTransportAdapter implements TransportAdapter {
    private final CloudStorageAdapter storageAdapter;
    private final String keyPrefix;
    private final PgStashProperties.CompressionType compression;
    private final long chunkSize;

    private final Map<String, MultipartTarUploader> uploaders = new LinkedHashMap<>();
    private boolean aborted;

    /**
     * @param keyPrefix key of the backup directory, for example {@code path/main/base/20240101T120000}
     */
    public CloudTarTransportAdapter(CloudStorageAdapter storageAdapter, String keyPrefix, PgStashProperties.CompressionType compression, long chunkSize) {
        this.storageAdapter = storageAdapter;
        this.keyPrefix = keyPrefix.startsWith("/") ? keyPrefix.substring(1) : keyPrefix;
        this.compression = compression;
        this.chunkSize = chunkSize;
    }

    @Override
    public void copyDirectory(CopyJob job) {
        List<String> exclude = new ArrayList<>(job.getExclude());
        exclude.addAll(job.getExcludeAndProtect());
        uploadDirectory(job.getLabel(), Path.of(job.getSrc()), job.getDst(), exclude, job.getInclude());
    }

    @Override
    public void copyFile(CopyJob job) {
        addFile(job.getLabel(), Path.of(job.getSrc()), job.getDst(), job.getPath(), job.isOptional());
    }

    /**
     * Adds the tree under {@code src} to the {@code dst} archive. Directories rejected by the filter are not descended.
     */
    public void uploadDirectory(String label, Path src, String dst, List<String> exclude, List<String> include) {
        log.info("Uploading directory {} ({} -> {})", label, src, dst);
        MultipartTarUploader uploader = getUploader(dst);
        PathFilter filter = new PathFilter(exclude, include);

        try {
            Files.walkFileTree(src, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                    String entryName = toEntryName(src, dir);
                    boolean root = dir.equals(src);
                    if (!filter.isAllowed(entryName, true)) {
                        return root ? FileVisitResult.CONTINUE : FileVisitResult.SKIP_SUBTREE;
                    }
                    uploader.addPath(dir, entryName);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    String entryName = toEntryName(src, file);
                    if (filter.isAllowed(entryName, false)) {
                        log.debug("Uploading {}", entryName);
                        uploader.addPath(file, entryName);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    if (exc instanceof NoSuchFileException) {
                        log.debug("{} vanished during the upload", file);
                        return FileVisitResult.CONTINUE;
                    }
                    throw exc;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to upload " + src, e);
        }
    }

    /**
     * Adds a single file under the name {@code path}. A missing optional file is skipped.
     */
    public void addFile(String label, Path src, String dst, String path, boolean optional) {
        log.info("Uploading file {} ({} -> {}:{})", label, src, dst, path);
        if (optional && !Files.exists(src)) {
            log.debug("Optional file {} does not exist, skipping", src);
            return;
        }
        try {
            getUploader(dst).addPath(src, path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to upload " + src, e);
        }
    }

    public void addStream(String label, InputStream stream, String dst, String path, Integer mode, Integer uid, Integer gid) {
        log.info("Uploading stream {} ({}:{})", label, dst, path);
        try {
            getUploader(dst).addBytes(IOUtils.toByteArray(stream), path, mode, uid, gid);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to upload " + label, e);
        }
    }

    /**
     * Uploads a standalone object next to the archives, for example {@code backup.info}.
     */
    public void uploadStream(String label, InputStream stream, String dst) throws UploadException {
        log.info("Uploading object {} ({})", label, dst);
        try {
            storageAdapter.uploadObject(keyPrefix.isEmpty() ? dst : keyPrefix + "/" + dst, IOUtils.toByteArray(stream));
        } catch (IOException e) {
            throw new UploadException("Failed to read " + label, e);
        }
    }

    @Override
    public void close() {
        List<MultipartTarUploader> toClose;
        synchronized (uploaders) {
            toClose = new ArrayList<>(uploaders.values());
            uploaders.clear();
        }
        for (int i = 0; i < toClose.size(); i++) {
            try {
                toClose.get(i).close();
            } catch (RuntimeException e) {
                toClose.subList(i + 1, toClose.size()).forEach(MultipartTarUploader::abort);
                throw e;
            }
        }
    }

    @Override
    public void abort() {
        List<MultipartTarUploader> toAbort;
        synchronized (uploaders) {
            aborted = true;
            toAbort = new ArrayList<>(uploaders.values());
            uploaders.clear();
        }
        for (MultipartTarUploader uploader : toAbort) {
            uploader.abort();
        }
    }

    String buildKey(String dst) {
        String name;
        if (compression == PgStashProperties.CompressionType.GZIP) {
            name = dst + ".tar.gz";
        } else if (compression == PgStashProperties.CompressionType.BZIP2) {
            name = dst + ".tar.bz2";
        } else {
            name = dst + ".tar";
        }
        return keyPrefix.isEmpty() ? name : keyPrefix + "/" + name;
    }

    private MultipartTarUploader getUploader(String dst) {
        synchronized (uploaders) {
            if (aborted) {
                throw new UploadException("Transport to " + keyPrefix + " was aborted, refusing to upload " + dst);
            }
            return uploaders.computeIfAbsent(dst, key -> new MultipartTarUploader(storageAdapter, buildKey(key), compression, chunkSize));
        }
    }

    private static String toEntryName(Path root, Path path) {
        if (root.equals(path)) {
            return ".";
        }
        return root.relativize(path).toString().replace('\\', '/');
    }
}
