package com.pgstash.orchestration.archiver;

import com.pgstash.catalog.exception.LockFileBusyException;
import com.pgstash.catalog.lock.LockFile;
import com.pgstash.catalog.model.WalFileInfo;
import com.pgstash.catalog.store.WalCatalog;
import com.pgstash.catalog.util.CompressionUtils;
import com.pgstash.catalog.util.XlogUtils;
import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.exception.ArchiverFailureException;
import com.pgstash.orchestration.model.ServerContext;
import com.pgstash.orchestration.util.CompressionIOUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ingestion of WAL files shared by the archivers: validation, quarantine, optional compression,
 * move into the hash directory and one catalog record per file.
 */
@Slf4j
public abstract class AbstractWalArchiver implements WalArchiver {
    private static final DateTimeFormatter ERROR_STAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");

    protected final ServerContext serverContext;

    private Map<String, Object> remoteStatus;

    protected AbstractWalArchiver(ServerContext serverContext) {
        this.serverContext = serverContext;
    }

    /**
     * Directory this archiver takes WAL files from.
     */
    protected abstract Path getIncomingDirectory();

    protected abstract Map<String, Object> fetchRemoteStatus();

    /**
     * Whether a file of the incoming directory is still being written and must be left alone.
     */
    protected boolean isInProgress(Path file) {
        return false;
    }

    @Override
    public synchronized Map<String, Object> getRemoteStatus() {
        if (remoteStatus == null) {
            remoteStatus = fetchRemoteStatus();
        }
        return remoteStatus;
    }

    @Override
    public synchronized void resetRemoteStatus() {
        remoteStatus = null;
    }

    @Override
    public int archive(boolean verbose) {
        List<Path> batch = getNextBatch();
        if (batch.isEmpty()) {
            log.debug("No WAL files to archive in {} for server {}", getIncomingDirectory(), serverContext.getServerName());
            return 0;
        }

        LockFile lock = new LockFile(
                serverContext.getPaths().getArchiveWalLockFile(),
                serverContext.getLockTimeout(),
                serverContext.getLockRetryInterval()
        );
        if (!lock.tryAcquire()) {
            throw new ArchiverFailureException("Another archive-wal process is already running for server " + serverContext.getServerName());
        }

        int archived = 0;
        try (WalCatalog.Writer writer = serverContext.getWalCatalog().openWriter()) {
            log.info("Found {} WAL file(s) to archive for server {} ({})", batch.size(), serverContext.getServerName(), getName());
            for (Path file : batch) {
                try {
                    if (archiveFile(file, writer)) {
                        archived++;
                        if (verbose) {
                            log.info("\t{}", file.getFileName());
                        }
                    }
                } catch (Exception e) {
                    log.error("Failed to archive {} for server {}. It will be retried on the next run.", file.getFileName(), serverContext.getServerName(), e);
                }
            }
        } catch (LockFileBusyException e) {
            throw new ArchiverFailureException("WAL catalog of server " + serverContext.getServerName() + " is busy", e);
        } finally {
            lock.release();
        }

        log.info("Archived {} WAL file(s) for server {}", archived, serverContext.getServerName());
        return archived;
    }

    List<Path> getNextBatch() {
        Path incoming = getIncomingDirectory();
        if (!Files.isDirectory(incoming)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(incoming)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> !isInProgress(file))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + incoming, e);
        }
    }

    /**
     * @return true if the file was added to the archive, false if it was quarantined
     */
    boolean archiveFile(Path file, WalCatalog.Writer writer) throws IOException {
        String name = file.getFileName().toString();

        if (!XlogUtils.isAnyXlogFile(name)) {
            log.warn("Unexpected file {} found in {}, moving it to the errors directory", name, getIncomingDirectory());
            quarantine(file, "unknown");
            return false;
        }

        Path destination = serverContext.getPaths().getWalsDirectory().resolve(relativeArchivePath(name));

        if (Files.exists(destination)) {
            if (sameContent(file, destination)) {
                log.info("WAL file {} is already archived, moving the copy to the errors directory as duplicate", name);
                quarantine(file, "duplicate");
            } else {
                log.warn("WAL file {} is already archived with different content, moving it to the errors directory", name);
                quarantine(file, "error");
            }
            return false;
        }

        Files.createDirectories(destination.getParent());

        String compression = CompressionUtils.identifyCompression(file);
        PgStashProperties.CompressionType configured = serverContext.getProperties().compression().orElse(null);

        if (compression == null && configured != null) {
            CompressionIOUtils.compressAndMove(file, destination, configured.getCatalogName());
        } else {
            move(file, destination);
        }

        WalFileInfo walFileInfo = WalFileInfo.fromFile(destination, null);
        writer.append(walFileInfo);
        log.debug("Archived {} ({} bytes, compression {})", name, walFileInfo.getSize(), walFileInfo.getCompression());
        return true;
    }

    static String relativeArchivePath(String name) {
        String hashDir = XlogUtils.hashDir(name);
        return hashDir.isEmpty() ? name : hashDir + "/" + name;
    }

    private void quarantine(Path file, String suffix) throws IOException {
        Path errors = serverContext.getPaths().getErrorsDirectory();
        Files.createDirectories(errors);
        String stamp = ERROR_STAMP_FORMATTER.format(ZonedDateTime.now(ZoneOffset.UTC));
        move(file, errors.resolve(file.getFileName() + "." + stamp + "." + suffix));
    }

    private static boolean sameContent(Path incoming, Path archived) throws IOException {
        try (InputStream left = CompressionIOUtils.openDecompressed(incoming, CompressionUtils.identifyCompression(incoming));
             InputStream right = CompressionIOUtils.openDecompressed(archived, CompressionUtils.identifyCompression(archived))) {
            return IOUtils.contentEquals(left, right);
        }
    }

    private static void move(Path source, Path destination) throws IOException {
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, destination);
        }
    }
}
