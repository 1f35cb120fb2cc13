package com.sommerph.certdir.repository.filesystem;

import com.sommerph.certdir.exception.PathConfinementViolation;
import com.sommerph.certdir.model.Email;
import com.sommerph.certdir.model.Fingerprint;
import com.sommerph.certdir.model.Identifier;
import com.sommerph.certdir.model.IndexKind;
import com.sommerph.certdir.model.KeyId;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deterministic mapping between identifiers and paths below the internal and external roots.
 *
 * <pre>
 * internal/full/&lt;shard(fpr)&gt;
 * internal/quarantined/&lt;fpr&gt;
 * external/pub/&lt;shard(fpr)&gt;
 * external/links/by-fpr/&lt;shard(fpr)&gt;
 * external/links/by-keyid/&lt;shard(keyid)&gt;
 * external/links/by-email/&lt;shard(urlencoded email)&gt;
 * </pre>
 *
 * A shard splits a string into {@code s[0..2]/s[2..4]/s[4..]}. The reverse mapping concatenates
 * the last three components of a path, so it works both on record paths and on link targets.
 */
@Slf4j
@Getter
public class StorageLayout {

    private static final int SHARD_COMPONENTS = 3;

    private final Path internalRoot;
    private final Path externalRoot;
    private final Path tmpDir;

    private final Path fullDir;
    private final Path quarantinedDir;
    private final Path publishedDir;
    private final Map<IndexKind, Path> linkDirs = new EnumMap<>(IndexKind.class);

    private final Path internalRealRoot;
    private final Path externalRealRoot;

    public StorageLayout(Path internalRoot, Path externalRoot, Path tmpDir) throws IOException {
        this.internalRoot = internalRoot.toAbsolutePath().normalize();
        this.externalRoot = externalRoot.toAbsolutePath().normalize();
        this.tmpDir = tmpDir.toAbsolutePath().normalize();
        Files.createDirectories(this.tmpDir);

        this.fullDir = Files.createDirectories(this.internalRoot.resolve("full"));
        this.quarantinedDir = Files.createDirectories(this.internalRoot.resolve("quarantined"));
        this.publishedDir = Files.createDirectories(this.externalRoot.resolve("pub"));

        Path linksDir = this.externalRoot.resolve("links");
        for (IndexKind kind : IndexKind.values()) {
            linkDirs.put(kind, Files.createDirectories(linksDir.resolve(kind.getDirectoryName())));
        }

        this.internalRealRoot = this.internalRoot.toRealPath();
        this.externalRealRoot = this.externalRoot.toRealPath();

        log.info("Opened certificate directory");
        log.info("Internal root: {}", this.internalRoot);
        log.info("External root: {}", this.externalRoot);
        log.info("Scratch directory: {}", this.tmpDir);
    }

    /**
     * Layout with {@code base/keys} as internal and external root and {@code base/tmp} as scratch
     * directory.
     */
    public static StorageLayout fromBase(Path baseDir) throws IOException {
        Path keysDir = baseDir.resolve("keys");
        return new StorageLayout(keysDir, keysDir, baseDir.resolve("tmp"));
    }

    public Path getLinkDir(IndexKind kind) {
        return linkDirs.get(kind);
    }

    public Path fingerprintToPathFull(Fingerprint fingerprint) {
        return fullDir.resolve(split(fingerprint.toString()));
    }

    public Path fingerprintToPathQuarantined(Fingerprint fingerprint) {
        return quarantinedDir.resolve(fingerprint.toString());
    }

    public Path fingerprintToPathPublished(Fingerprint fingerprint) {
        return publishedDir.resolve(split(fingerprint.toString()));
    }

    /**
     * Path of the published record relative to the external root, e.g. {@code pub/AB/CD/EF01...}.
     */
    public Path publishedRelative(Fingerprint fingerprint) {
        return externalRoot.relativize(fingerprintToPathPublished(fingerprint));
    }

    public Path linkPath(Identifier identifier) {
        return getLinkDir(identifier.getIndexKind()).resolve(split(entryName(identifier)));
    }

    /**
     * The symlink content of the index entry for {@code identifier} pointing at the published
     * record of {@code primary}: relative to the entry's directory.
     */
    public Path linkTarget(Identifier identifier, Fingerprint primary) {
        return linkPath(identifier).getParent().relativize(fingerprintToPathPublished(primary));
    }

    /**
     * Verifies that {@code path} lies below the external root, or below the internal root when
     * {@code allowInternal} is set. Once the path exists its real path is checked against the real
     * roots as well, so an index entry cannot lead out of the store.
     */
    public void requireConfined(Path path, boolean allowInternal) {
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(externalRoot) && !(allowInternal && normalized.startsWith(internalRoot))) {
            throw new PathConfinementViolation(path);
        }
        if (Files.exists(normalized)) {
            Path real;
            try {
                real = normalized.toRealPath();
            } catch (IOException e) {
                // vanished between the two calls, the subsequent read reports it as absent
                return;
            }
            if (!real.startsWith(externalRealRoot) && !(allowInternal && real.startsWith(internalRealRoot))) {
                throw new PathConfinementViolation(real);
            }
        }
    }

    static String entryName(Identifier identifier) {
        if (identifier.getIndexKind() == IndexKind.BY_EMAIL) {
            return URLEncoder.encode(identifier.toString(), StandardCharsets.UTF_8);
        }
        return identifier.toString();
    }

    static Path split(String name) {
        Path path = name.length() > 4
                ? Path.of(name.substring(0, 2), name.substring(2, 4), name.substring(4))
                : Path.of(name);
        for (Path component : path) {
            String s = component.toString();
            if (s.equals(".") || s.equals("..")) {
                throw new IllegalArgumentException("Refusing to map '" + name + "' onto a relative path component");
            }
        }
        return path;
    }

    static String merge(Path path) {
        List<String> components = new ArrayList<>();
        path.forEach(component -> components.add(component.toString()));
        int from = Math.max(0, components.size() - SHARD_COMPONENTS);
        return String.join("", components.subList(from, components.size()));
    }

    public static Optional<Fingerprint> pathToFingerprint(Path path) {
        return Fingerprint.parse(merge(path));
    }

    public static Optional<KeyId> pathToKeyId(Path path) {
        return KeyId.parse(merge(path));
    }

    public static Optional<Email> pathToEmail(Path path) {
        String decoded;
        try {
            decoded = URLDecoder.decode(merge(path), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return Email.parse(decoded);
    }

    /**
     * Returns the primary fingerprint behind any record or index entry path. Follows at most one
     * symlink: an index entry is resolved through its target, anything else through its own path.
     */
    public static Optional<Fingerprint> pathToPrimary(Path path) {
        if (Files.isSymbolicLink(path)) {
            try {
                return pathToFingerprint(Files.readSymbolicLink(path));
            } catch (IOException e) {
                log.debug("Could not read link {}", path, e);
                return Optional.empty();
            }
        }
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return Optional.empty();
        }
        return pathToFingerprint(path);
    }

}
