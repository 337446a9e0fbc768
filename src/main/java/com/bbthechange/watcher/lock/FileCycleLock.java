package com.bbthechange.watcher.lock;

import com.bbthechange.watcher.exception.LockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cycle lock backed by an OS advisory lock on a file.
 * The OS drops the lock when the holding process dies, so a crashed runner never blocks the next one.
 *
 * POSIX locks belong to the process, and closing any descriptor for the file releases them all.
 * A path already held anywhere in this JVM is therefore refused without opening a second channel.
 */
public class FileCycleLock implements CycleLock {

    private static final Logger logger = LoggerFactory.getLogger(FileCycleLock.class);

    // Locks held by this JVM, keyed by normalized absolute path
    private static final Map<Path, FileLock> HELD_PATHS = new ConcurrentHashMap<>();

    private final Path lockFile;
    private final Path lockKey;
    private final Map<String, FileLock> held = new ConcurrentHashMap<>();

    public FileCycleLock(Path lockFile) {
        this.lockFile = lockFile;
        this.lockKey = lockFile.toAbsolutePath().normalize();
    }

    @Override
    public Optional<LockToken> tryAcquire() {
        synchronized (HELD_PATHS) {
            if (HELD_PATHS.containsKey(lockKey)) {
                logger.info("Lock {} is already held by this process", lockFile);
                return Optional.empty();
            }

            FileChannel channel = null;
            try {
                Path parent = lockKey.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                channel = FileChannel.open(lockKey, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                FileLock fileLock = channel.tryLock();
                if (fileLock == null) {
                    // Nothing in this JVM holds the file, so closing cannot drop a lock of ours
                    logger.info("Lock {} is held by another process", lockFile);
                    closeQuietly(channel);
                    return Optional.empty();
                }

                String owner = UUID.randomUUID().toString();
                HELD_PATHS.put(lockKey, fileLock);
                held.put(owner, fileLock);
                logger.debug("Acquired file lock {}", lockFile);
                return Optional.of(new LockToken(lockFile.toString(), owner, Instant.now()));

            } catch (OverlappingFileLockException e) {
                // Locked through a channel this class does not track; leave ours open so that lock survives
                throw new LockException("Lock file " + lockFile + " is locked elsewhere in this process", e);
            } catch (IOException e) {
                closeQuietly(channel);
                throw new LockException("Failed to open lock file " + lockFile, e);
            }
        }
    }

    @Override
    public void release(LockToken token) {
        if (token == null) {
            return;
        }
        FileLock fileLock = held.remove(token.owner());
        if (fileLock == null) {
            return;
        }
        synchronized (HELD_PATHS) {
            HELD_PATHS.remove(lockKey, fileLock);
            try {
                fileLock.release();
                logger.debug("Released file lock {}", lockFile);
            } catch (IOException e) {
                logger.warn("Failed to release file lock {}: {}", lockFile, e.getMessage());
            } finally {
                closeQuietly(fileLock.channel());
            }
        }
    }

    private void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Failed to close lock file channel {}: {}", lockFile, e.getMessage());
        }
    }
}
