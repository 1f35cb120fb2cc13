package com.sommerph.certdir.repository.filesystem;

import com.sommerph.certdir.exception.CertificateStoreException;
import com.sommerph.certdir.exception.IdentifierCollisionException;
import com.sommerph.certdir.exception.MalformedPathException;
import com.sommerph.certdir.model.Fingerprint;
import com.sommerph.certdir.model.Identifier;
import com.sommerph.certdir.repository.IndexStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotLinkException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Index entries are symlinks below {@code external/links/<kind>} whose targets are relative paths
 * to published records.
 */
@Slf4j
public class FilesystemIndexStore implements IndexStore {

    private final StorageLayout layout;
    private final boolean dryRun;

    public FilesystemIndexStore(StorageLayout layout, boolean dryRun) {
        this.layout = layout;
        this.dryRun = dryRun;
    }

    @Override
    public void link(Identifier identifier, Fingerprint primary) {
        Path link = layout.linkPath(identifier);
        Path target = layout.linkTarget(identifier, primary);
        layout.requireConfined(link, false);

        if (dryRun) {
            log.debug("Dry run, not linking {} to {}", identifier, primary);
            return;
        }
        if (readLink(link).filter(target::equals).isPresent()) {
            log.debug("{} already links to {}", identifier, primary);
            return;
        }

        log.info("Link {} {} to {}", identifier.getIndexKind().getDirectoryName(), identifier, primary);
        try {
            AtomicFiles.replaceSymlink(target, link);
        } catch (IOException e) {
            log.error("Failed to link {} to {}", link, target, e);
            throw new CertificateStoreException("Failed to link " + link, e);
        }
    }

    @Override
    public void unlink(Identifier identifier, Fingerprint primary) {
        Path link = layout.linkPath(identifier);
        Path expected = layout.linkTarget(identifier, primary);
        layout.requireConfined(link, false);

        if (dryRun) {
            log.debug("Dry run, not unlinking {} from {}", identifier, primary);
            return;
        }
        Optional<Path> current = readLink(link);
        if (current.isEmpty()) {
            log.debug("No link for {}, nothing to unlink", identifier);
            return;
        }
        if (!current.get().equals(expected)) {
            log.debug("{} points to {}, not to {}; keeping it", identifier, current.get(), primary);
            return;
        }

        log.info("Unlink {} {} from {}", identifier.getIndexKind().getDirectoryName(), identifier, primary);
        try {
            Files.deleteIfExists(link);
        } catch (IOException e) {
            log.error("Failed to unlink {}", link, e);
            throw new CertificateStoreException("Failed to unlink " + link, e);
        }
    }

    @Override
    public void linkFingerprint(Fingerprint subkey, Fingerprint primary) {
        link(subkey, primary);
        link(subkey.toKeyId(), primary);
    }

    @Override
    public void unlinkFingerprint(Fingerprint subkey, Fingerprint primary) {
        unlink(subkey, primary);
        unlink(subkey.toKeyId(), primary);
    }

    @Override
    public Optional<Fingerprint> checkLinkFingerprint(Fingerprint subkey, Fingerprint primary) {
        boolean fingerprintLinked = checkLink(subkey, primary);
        boolean keyIdLinked = checkLink(subkey.toKeyId(), primary);
        if (!fingerprintLinked || !keyIdLinked) {
            return Optional.of(subkey);
        }
        return Optional.empty();
    }

    @Override
    public boolean checkLink(Identifier identifier, Fingerprint primary) {
        Path expected = layout.publishedRelative(primary);
        Path link = layout.linkPath(identifier);
        Path actual;
        try {
            actual = link.toRealPath();
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            log.error("Failed to resolve {}", link, e);
            throw new CertificateStoreException("Failed to resolve " + link, e);
        }
        if (!actual.endsWith(expected)) {
            log.info("{} points to a different key for {} (expected {} to be suffix of {})",
                    identifier.getIndexKind().getDirectoryName(), identifier, expected, actual);
            throw new IdentifierCollisionException(identifier, expected, actual);
        }
        return true;
    }

    @Override
    public Optional<Fingerprint> lookupPrimaryFingerprint(Identifier identifier) {
        Optional<Path> target = readLink(layout.linkPath(identifier));
        if (target.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(StorageLayout.pathToFingerprint(target.get())
                .orElseThrow(() -> new MalformedPathException(target.get())));
    }

    @Override
    public Optional<Path> lookupPath(Identifier identifier) {
        Path link = layout.linkPath(identifier);
        layout.requireConfined(link, false);
        if (!Files.exists(link)) {
            return Optional.empty();
        }
        return Optional.of(layout.getExternalRoot().relativize(link));
    }

    @Override
    public boolean exists(Identifier identifier) {
        Path link = layout.linkPath(identifier);
        layout.requireConfined(link, false);
        return Files.exists(link);
    }

    private Optional<Path> readLink(Path link) {
        try {
            return Optional.of(Files.readSymbolicLink(link));
        } catch (NoSuchFileException | NotLinkException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.error("Failed to read link {}", link, e);
            throw new CertificateStoreException("Failed to read link " + link, e);
        }
    }

}
