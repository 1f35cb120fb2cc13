package com.sommerph.certdir.repository.filesystem;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Crash-safe primitives. A file or symlink only ever appears under its final name fully formed.
 */
@Slf4j
public final class AtomicFiles {

    public static final Set<PosixFilePermission> INTERNAL_PERMISSIONS = PosixFilePermissions.fromString("rw-rw----");
    public static final Set<PosixFilePermission> PUBLIC_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private AtomicFiles() {
    }

    /**
     * Writes {@code content} to a randomly named file in {@code tmpDir}, forces it to disk, applies
     * {@code permissions} and renames it onto {@code target}. {@code tmpDir} must be on the same
     * filesystem as {@code target}.
     */
    public static void writeThenPublish(Path tmpDir, byte[] content, Path target,
                                        Set<PosixFilePermission> permissions) throws IOException {
        Path tmpFile = Files.createTempFile(tmpDir, "key", null);
        try {
            try (FileChannel channel = FileChannel.open(tmpFile, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            setPermissions(tmpFile, permissions);
            Files.createDirectories(target.getParent());
            Files.move(tmpFile, target, ATOMIC_MOVE, REPLACE_EXISTING);
        } finally {
            cleanUp(tmpFile);
        }
    }

    /**
     * Like {@link Files#createSymbolicLink}, but replaces an existing {@code link} atomically
     * instead of failing. The new link is created in a fresh directory next to the destination
     * and renamed over it.
     */
    public static void replaceSymlink(Path target, Path link) throws IOException {
        Path linkDir = Files.createDirectories(link.getParent());
        Path tmpDir = Files.createTempDirectory(linkDir, "link");
        Path tmpLink = tmpDir.resolve("link");
        try {
            Files.createSymbolicLink(tmpLink, target);
            Files.move(tmpLink, link, ATOMIC_MOVE);
        } finally {
            cleanUp(tmpLink);
            cleanUp(tmpDir);
        }
    }

    private static void setPermissions(Path path, Set<PosixFilePermission> permissions) throws IOException {
        if (Files.getFileStore(path).supportsFileAttributeView(PosixFileAttributeView.class)) {
            Files.setPosixFilePermissions(path, permissions);
        } else {
            log.debug("Filesystem of {} has no POSIX permissions, keeping defaults", path);
        }
    }

    private static void cleanUp(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to remove temporary {}", path, e);
        }
    }

}
