package com.pgstash.catalog.store;

import com.pgstash.catalog.exception.LockFileBusyException;
import com.pgstash.catalog.lock.LockFile;
import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.catalog.model.WalFileInfo;
import com.pgstash.catalog.util.XlogUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only ledger of archived WAL files ({@code xlog.db}), one {@link WalFileInfo} per line.
 * Writers hold the server xlog.db lock; readers do not lock.
 */
@Slf4j
public class WalCatalog {

    private final Path xlogDbFile;
    private final Path lockFile;
    private final Duration lockTimeout;
    private final Duration lockRetryInterval;

    public WalCatalog(Path xlogDbFile, Path lockFile, Duration lockTimeout, Duration lockRetryInterval) {
        this.xlogDbFile = xlogDbFile;
        this.lockFile = lockFile;
        this.lockTimeout = lockTimeout;
        this.lockRetryInterval = lockRetryInterval;
    }

    /**
     * Acquires the catalog lock and opens the catalog for appending.
     *
     * @throws LockFileBusyException if the lock is still busy after the configured timeout
     */
    public Writer openWriter() throws LockFileBusyException {
        LockFile lock = new LockFile(lockFile, lockTimeout, lockRetryInterval);
        lock.acquireOrThrow();
        try {
            Files.createDirectories(xlogDbFile.getParent());
            FileChannel channel = FileChannel.open(
                    xlogDbFile,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.APPEND
            );
            return new Writer(channel, lock);
        } catch (IOException e) {
            lock.release();
            throw new UncheckedIOException("Failed to open WAL catalog " + xlogDbFile, e);
        }
    }

    /**
     * Lazily reads the catalog in append order. The returned stream must be closed.
     */
    public Stream<WalFileInfo> stream() {
        if (!Files.exists(xlogDbFile)) {
            return Stream.empty();
        }
        try {
            return Files.lines(xlogDbFile, StandardCharsets.UTF_8)
                    .filter(StringUtils::isNotBlank)
                    .map(WalFileInfo::fromXlogDbLine);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read WAL catalog " + xlogDbFile, e);
        }
    }

    public List<WalFileInfo> readAll() {
        try (Stream<WalFileInfo> entries = stream()) {
            return entries.collect(Collectors.toList());
        }
    }

    /**
     * WAL files needed by a backup, bounded by the next DONE backup of {@code backupCatalog} if there is one.
     */
    public List<WalFileInfo> getWalUntilNextBackup(BackupCatalog backupCatalog, BackupInfo backup, boolean includeHistory) {
        BackupInfo nextBackup = backupCatalog.getNextBackup(backup.getBackupId(), BackupCatalog.DEFAULT_STATUS_FILTER)
                .orElse(null);
        return getWalUntilNextBackup(backup, nextBackup, includeHistory);
    }

    /**
     * WAL files needed by a backup: entries named in {@code [backup.beginWal, nextBackup.beginWal)},
     * or up to the end of the catalog when there is no next backup, in catalog order.
     * History files are added regardless of range when {@code includeHistory} is set.
     */
    public List<WalFileInfo> getWalUntilNextBackup(BackupInfo backup, BackupInfo nextBackup, boolean includeHistory) {
        if (backup.getBeginWal() == null) {
            return Collections.emptyList();
        }
        String begin = backup.getBeginWal();
        String end = nextBackup == null ? null : nextBackup.getBeginWal();

        try (Stream<WalFileInfo> entries = stream()) {
            return entries
                    .filter(entry -> {
                        if (XlogUtils.isHistoryFile(entry.getName())) {
                            return includeHistory;
                        }
                        if (entry.getName().compareTo(begin) < 0) {
                            return false;
                        }
                        return end == null || entry.getName().compareTo(end) < 0;
                    })
                    .collect(Collectors.toList());
        }
    }

    public Path getXlogDbFile() {
        return xlogDbFile;
    }

    /**
     * Appender bound to the held catalog lock. Closing fsyncs the catalog and then releases the lock.
     */
    public static class Writer implements AutoCloseable {
        private final FileChannel channel;
        private final LockFile lock;

        private Writer(FileChannel channel, LockFile lock) {
            this.channel = channel;
            this.lock = lock;
        }

        public void append(WalFileInfo walFileInfo) {
            ByteBuffer buffer = ByteBuffer.wrap(walFileInfo.toXlogDbLine().getBytes(StandardCharsets.UTF_8));
            try {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append " + walFileInfo.getName() + " to WAL catalog", e);
            }
        }

        @Override
        public void close() {
            try {
                channel.force(true);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to sync WAL catalog", e);
            } finally {
                try {
                    channel.close();
                } catch (IOException e) {
                    log.warn("Failed to close WAL catalog", e);
                }
                lock.release();
            }
        }
    }
}
