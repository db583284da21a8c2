package io.surfworks.entitlement.lifecycle;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link JobLock} on an OS file lock, so separate processes sharing the lock
 * file exclude each other. A second holder inside the same JVM also counts
 * as held.
 */
public class FileJobLock implements JobLock {

    private static final Logger LOG = Logger.getLogger(FileJobLock.class.getName());

    public static final String DEFAULT_LOCK_FILE = "entitlement-auto-validate.lock";

    private static final long POLL_MILLIS = 50;

    private final Path lockFile;

    public FileJobLock(Path lockFile) {
        this.lockFile = lockFile;
    }

    /**
     * Lock file {@value #DEFAULT_LOCK_FILE} inside {@code dir}.
     */
    public static FileJobLock inDirectory(Path dir) {
        return new FileJobLock(dir.resolve(DEFAULT_LOCK_FILE));
    }

    @Override
    public Optional<Lease> tryLock(Duration timeout) throws IOException, InterruptedException {
        Path parent = lockFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                FileLock lock = acquire(channel);
                if (lock != null) {
                    LOG.fine("Acquired job lock " + lockFile);
                    return Optional.of(() -> release(lock, channel));
                }
                if (System.nanoTime() >= deadline) {
                    closeChannel(channel);
                    return Optional.empty();
                }
                Thread.sleep(POLL_MILLIS);
            }
        } catch (IOException | InterruptedException | RuntimeException e) {
            closeChannel(channel);
            throw e;
        }
    }

    private static FileLock acquire(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            return null;
        }
    }

    private void release(FileLock lock, FileChannel channel) {
        try {
            lock.release();
        } catch (IOException e) {
            LOG.log(Level.FINE, "Error releasing job lock " + lockFile, e);
        }
        closeChannel(channel);
    }

    private void closeChannel(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            LOG.log(Level.FINE, "Error closing job lock channel " + lockFile, e);
        }
    }
}
