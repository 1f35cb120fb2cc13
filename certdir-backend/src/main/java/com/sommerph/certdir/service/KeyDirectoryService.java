package com.sommerph.certdir.service;

import com.sommerph.certdir.exception.IdentifierCollisionException;
import com.sommerph.certdir.model.Certificate;
import com.sommerph.certdir.model.ConsistencyReport;
import com.sommerph.certdir.model.Email;
import com.sommerph.certdir.model.Fingerprint;
import com.sommerph.certdir.model.Identifier;
import com.sommerph.certdir.model.KeyId;
import com.sommerph.certdir.model.RecordHandle;
import com.sommerph.certdir.model.Tier;
import com.sommerph.certdir.repository.CertificateStore;
import com.sommerph.certdir.repository.IndexStore;
import com.sommerph.certdir.repository.filesystem.StorageLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for the merge logic and the front end. Writes and links must run under
 * {@link #lock()}; lookups need no lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeyDirectoryService {

    private final CertificateStore certificateStore;
    private final IndexStore indexStore;
    private final ConsistencyChecker consistencyChecker;
    private final CertificateParser certificateParser;

    public StorageLock lock() {
        return certificateStore.lock();
    }

    public RecordHandle writeFull(Fingerprint fingerprint, byte[] content) {
        return certificateStore.write(Tier.FULL, fingerprint, content);
    }

    public RecordHandle writePublished(Fingerprint fingerprint, byte[] content) {
        return certificateStore.write(Tier.PUBLISHED, fingerprint, content);
    }

    public RecordHandle writeQuarantined(Fingerprint fingerprint, byte[] content) {
        return certificateStore.write(Tier.QUARANTINED, fingerprint, content);
    }

    public void link(Identifier identifier, Fingerprint primary) {
        indexStore.link(identifier, primary);
    }

    public void unlink(Identifier identifier, Fingerprint primary) {
        indexStore.unlink(identifier, primary);
    }

    public void linkFingerprint(Fingerprint subkey, Fingerprint primary) {
        indexStore.linkFingerprint(subkey, primary);
    }

    public void unlinkFingerprint(Fingerprint subkey, Fingerprint primary) {
        indexStore.unlinkFingerprint(subkey, primary);
    }

    public Optional<Fingerprint> checkLinkFingerprint(Fingerprint subkey, Fingerprint primary) {
        return indexStore.checkLinkFingerprint(subkey, primary);
    }

    /**
     * Stores both tiers of a certificate and links its signing-capable keys and its emails.
     * Every key and email is checked for collisions before anything is written, so a merge that
     * read the previous records under {@code lock} can index the result under the same lock.
     *
     * @param lock the storage lock, held by the calling thread
     * @return the keys whose links were missing and have been created
     * @throws IdentifierCollisionException if a key or email is indexed for another certificate
     */
    public List<Fingerprint> indexCertificate(StorageLock lock, Certificate certificate, byte[] fullRecord,
                                              byte[] publishedRecord) {
        requireHeld(lock);
        Fingerprint primary = certificate.getPrimaryFingerprint();
        log.info("Index certificate {}", primary);

        List<Fingerprint> missing = new ArrayList<>();
        for (Fingerprint fingerprint : certificate.getSigningCapableFingerprints()) {
            indexStore.checkLinkFingerprint(fingerprint, primary).ifPresent(missing::add);
        }
        List<Email> unlinkedEmails = new ArrayList<>();
        for (Email email : certificate.getEmails()) {
            if (!indexStore.checkLink(email, primary)) {
                unlinkedEmails.add(email);
            }
        }

        certificateStore.write(Tier.FULL, primary, fullRecord);
        certificateStore.write(Tier.PUBLISHED, primary, publishedRecord);
        for (Fingerprint fingerprint : missing) {
            indexStore.linkFingerprint(fingerprint, primary);
        }
        for (Email email : unlinkedEmails) {
            indexStore.link(email, primary);
        }
        return missing;
    }

    /**
     * Removes every link that still points at {@code certificate}. The stored records are kept.
     *
     * @param lock the storage lock, held by the calling thread
     */
    public void unindexCertificate(StorageLock lock, Certificate certificate) {
        requireHeld(lock);
        Fingerprint primary = certificate.getPrimaryFingerprint();
        log.info("Unindex certificate {}", primary);
        for (Email email : certificate.getEmails()) {
            indexStore.unlink(email, primary);
        }
        for (Fingerprint fingerprint : certificate.getKeyFingerprints()) {
            indexStore.unlinkFingerprint(fingerprint, primary);
        }
    }

    public Optional<Fingerprint> lookupPrimaryFingerprint(Identifier identifier) {
        return indexStore.lookupPrimaryFingerprint(identifier);
    }

    public Optional<Path> lookupPath(Identifier identifier) {
        return indexStore.lookupPath(identifier);
    }

    public Optional<byte[]> byFingerprintFull(Fingerprint fingerprint) {
        return certificateStore.read(Tier.FULL, fingerprint);
    }

    public Optional<byte[]> byPrimaryFingerprint(Fingerprint fingerprint) {
        return certificateStore.read(Tier.PUBLISHED, fingerprint);
    }

    public Optional<byte[]> byFingerprint(Fingerprint fingerprint) {
        return certificateStore.readByIndex(fingerprint);
    }

    public Optional<byte[]> byKeyId(KeyId keyId) {
        return certificateStore.readByIndex(keyId);
    }

    public Optional<byte[]> byEmail(Email email) {
        return certificateStore.readByIndex(email);
    }

    public ConsistencyReport checkConsistency() {
        return consistencyChecker.check(certificateParser);
    }

    private static void requireHeld(StorageLock lock) {
        if (lock == null || !lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("The storage lock must be held by the calling thread");
        }
    }

}
