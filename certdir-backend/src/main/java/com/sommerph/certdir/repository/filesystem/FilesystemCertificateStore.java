package com.sommerph.certdir.repository.filesystem;

import com.sommerph.certdir.exception.CertificateStoreException;
import com.sommerph.certdir.model.Fingerprint;
import com.sommerph.certdir.model.Identifier;
import com.sommerph.certdir.model.RecordHandle;
import com.sommerph.certdir.model.Tier;
import com.sommerph.certdir.repository.CertificateStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

@Slf4j
public class FilesystemCertificateStore implements CertificateStore {

    @Getter
    private final StorageLayout layout;
    private final boolean dryRun;

    public FilesystemCertificateStore(StorageLayout layout, boolean dryRun) {
        this.layout = layout;
        this.dryRun = dryRun;
    }

    @Override
    public StorageLock lock() {
        try {
            return StorageLock.acquire(layout.getInternalRoot());
        } catch (IOException e) {
            log.error("Failed to lock {}", layout.getInternalRoot(), e);
            throw new CertificateStoreException("Failed to lock " + layout.getInternalRoot(), e);
        }
    }

    @Override
    public RecordHandle write(Tier tier, Fingerprint fingerprint, byte[] content) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(content, "content");
        Path target = pathFor(tier, fingerprint);
        layout.requireConfined(target, tier != Tier.PUBLISHED);

        if (dryRun) {
            log.debug("Dry run, not writing {} record for {}", tier, fingerprint);
            return new RecordHandle(tier, fingerprint, target, false);
        }

        log.info("Write {} record for {}", tier, fingerprint);
        try {
            AtomicFiles.writeThenPublish(layout.getTmpDir(), content, target, permissionsFor(tier));
        } catch (IOException e) {
            log.error("Failed to write {} record for {} to {}", tier, fingerprint, target, e);
            throw new CertificateStoreException("Failed to write record to " + target, e);
        }
        return new RecordHandle(tier, fingerprint, target, true);
    }

    @Override
    public Optional<byte[]> read(Tier tier, Fingerprint fingerprint) {
        return readFromPath(pathFor(tier, fingerprint), tier != Tier.PUBLISHED);
    }

    @Override
    public Optional<byte[]> readByIndex(Identifier identifier) {
        return readFromPath(layout.linkPath(identifier), false);
    }

    @Override
    public boolean exists(Tier tier, Fingerprint fingerprint) {
        return Files.exists(pathFor(tier, fingerprint));
    }

    private Optional<byte[]> readFromPath(Path path, boolean allowInternal) {
        layout.requireConfined(path, allowInternal);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            log.debug("{} disappeared while reading", path);
            return Optional.empty();
        } catch (IOException e) {
            log.error("Failed to read {}", path, e);
            throw new CertificateStoreException("Failed to read " + path, e);
        }
    }

    private Path pathFor(Tier tier, Fingerprint fingerprint) {
        return switch (tier) {
            case FULL -> layout.fingerprintToPathFull(fingerprint);
            case QUARANTINED -> layout.fingerprintToPathQuarantined(fingerprint);
            case PUBLISHED -> layout.fingerprintToPathPublished(fingerprint);
        };
    }

    private static Set<PosixFilePermission> permissionsFor(Tier tier) {
        return tier == Tier.PUBLISHED ? AtomicFiles.PUBLIC_PERMISSIONS : AtomicFiles.INTERNAL_PERMISSIONS;
    }

}
