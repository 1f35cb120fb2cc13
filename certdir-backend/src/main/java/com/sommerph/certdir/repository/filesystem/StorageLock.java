package com.sommerph.certdir.repository.filesystem;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Exclusive write lock on a storage root, held for the duration of one logical merge.
 *
 * <p>File locks are held per JVM, so threads of the same process first serialize on an in-memory
 * lock for the root and only then take the advisory lock on {@code <root>/.lock} that excludes
 * other processes. Both acquisitions block without a timeout. The handle must be closed by the
 * thread that acquired it, typically in a try-with-resources block.
 */
@Slf4j
public final class StorageLock implements AutoCloseable {

    static final String LOCK_FILENAME = ".lock";

    private static final ConcurrentHashMap<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final ReentrantLock processLock;
    private final FileChannel channel;
    private final FileLock fileLock;
    private boolean released;

    private StorageLock(ReentrantLock processLock, FileChannel channel, FileLock fileLock) {
        this.processLock = processLock;
        this.channel = channel;
        this.fileLock = fileLock;
    }

    public static StorageLock acquire(Path root) throws IOException {
        Path directory = root.toAbsolutePath().normalize();
        ReentrantLock processLock = PROCESS_LOCKS.computeIfAbsent(directory, d -> new ReentrantLock());
        if (processLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Storage lock for " + directory + " is already held by this thread");
        }
        processLock.lock();
        FileChannel channel = null;
        try {
            channel = FileChannel.open(directory.resolve(LOCK_FILENAME), CREATE, WRITE);
            FileLock fileLock = channel.lock();
            log.debug("Acquired storage lock on {}", directory);
            return new StorageLock(processLock, channel, fileLock);
        } catch (IOException | RuntimeException e) {
            if (channel != null) {
                try {
                    channel.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            processLock.unlock();
            throw e;
        }
    }

    public boolean isValid() {
        return !released && fileLock.isValid();
    }

    /**
     * Whether this handle is still valid and was acquired by the calling thread.
     */
    public boolean isHeldByCurrentThread() {
        return isValid() && processLock.isHeldByCurrentThread();
    }

    @Override
    public void close() throws IOException {
        if (released) {
            return;
        }
        released = true;
        try {
            // closing the channel releases the file lock as well
            channel.close();
        } finally {
            processLock.unlock();
        }
    }

}
