package com.pgstash.catalog.lock;

import com.pgstash.catalog.exception.LockFileBusyException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

/**
 * Exclusive advisory lock backed by a file. Acquisition reports busy instead of throwing,
 * unless the caller asks for it with {@link #acquireOrThrow()}.
 */
@Slf4j
public class LockFile implements AutoCloseable {

    private final Path path;
    private final Duration timeout;
    private final Duration retryInterval;

    private FileChannel channel;
    private FileLock lock;

    public LockFile(Path path, Duration timeout, Duration retryInterval) {
        this.path = path;
        this.timeout = timeout;
        this.retryInterval = retryInterval;
    }

    /**
     * Tries to acquire the lock once, without waiting.
     *
     * @return true if the lock is now held
     */
    public synchronized boolean tryAcquire() {
        if (lock != null) {
            return true;
        }

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        } catch (IOException e) {
            closeChannel();
            throw new UncheckedIOException("Failed to open lock file " + path, e);
        }

        if (lock == null) {
            closeChannel();
            return false;
        }
        return true;
    }

    /**
     * Tries to acquire the lock, polling until the configured timeout elapses.
     *
     * @return true if the lock is now held, false if it stayed busy
     */
    public boolean acquire() {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (tryAcquire()) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(retryInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    public void acquireOrThrow() throws LockFileBusyException {
        if (!acquire()) {
            throw new LockFileBusyException("Lock file " + path + " is busy");
        }
    }

    public synchronized boolean isHeld() {
        return lock != null;
    }

    public synchronized void release() {
        if (lock != null) {
            try {
                lock.release();
            } catch (IOException e) {
                log.warn("Failed to release lock {}", path, e);
            }
            lock = null;
        }
        closeChannel();
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() {
        release();
    }

    private void closeChannel() {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close lock file {}", path, e);
        }
        channel = null;
    }
}
