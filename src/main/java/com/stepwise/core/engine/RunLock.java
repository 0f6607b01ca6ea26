package com.stepwise.core.engine;

import com.stepwise.core.StepwiseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive lock on a state directory, held for the duration of a run.
 * The OS releases it if the process dies, so a crashed run never leaves it stuck.
 */
public final class RunLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunLock.class);

    public static final String LOCK_FILE = "run.lock";

    private final FileChannel channel;
    private final FileLock lock;

    private RunLock(FileChannel channel, FileLock lock) {
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * The lock could not be taken, usually because another run holds it.
     */
    public static class LockUnavailableException extends StepwiseException {
        public LockUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * @throws LockUnavailableException if another process holds the lock
     */
    public static RunLock acquire(Path stateDir) {
        Path lockFile = stateDir.resolve(LOCK_FILE);
        FileChannel channel = null;
        try {
            Files.createDirectories(stateDir);
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                throw new LockUnavailableException("Another run holds " + lockFile, null);
            }
            log.debug("Acquired run lock {}", lockFile);
            return new RunLock(channel, lock);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new LockUnavailableException("Failed to lock " + lockFile, e);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new LockUnavailableException("Another run in this process holds " + lockFile, e);
        }
    }

    @Override
    public void close() {
        try {
            lock.release();
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to release run lock", e);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure", e);
        }
    }
}
