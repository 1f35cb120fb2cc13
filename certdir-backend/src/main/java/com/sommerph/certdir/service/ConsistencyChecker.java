package com.sommerph.certdir.service;

import com.sommerph.certdir.exception.CertificateStoreException;
import com.sommerph.certdir.exception.ConsistencyViolationException;
import com.sommerph.certdir.exception.ConsistencyViolationException.Violation;
import com.sommerph.certdir.model.Certificate;
import com.sommerph.certdir.model.ConsistencyReport;
import com.sommerph.certdir.model.Email;
import com.sommerph.certdir.model.Fingerprint;
import com.sommerph.certdir.model.IndexKind;
import com.sommerph.certdir.model.KeyId;
import com.sommerph.certdir.model.Tier;
import com.sommerph.certdir.repository.CertificateStore;
import com.sommerph.certdir.repository.IndexStore;
import com.sommerph.certdir.repository.filesystem.StorageLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read-only verification of the published store against the three link trees.
 *
 * <p>Walks {@code pub} and checks that every record lives under its own fingerprint and that all
 * its signing-capable keys and emails are linked to it. Then walks every link tree and checks that
 * each entry names a key or email of the certificate it points to. The first violation aborts the pass;
 * nothing is repaired. This may take a long time on a large store and is meant for audits, not for
 * the request path.
 */
@Slf4j
@RequiredArgsConstructor
public class ConsistencyChecker {

    private final StorageLayout layout;
    private final CertificateStore certificateStore;
    private final IndexStore indexStore;

    @FunctionalInterface
    private interface EntryCheck {
        void verify(Path path, Certificate certificate, Fingerprint primary);
    }

    public ConsistencyReport check(CertificateParser parser) {
        log.info("Check consistency of {}", layout.getExternalRoot());
        // cache of all certificates seen in this pass
        Map<Fingerprint, Certificate> certificates = new HashMap<>();

        ConsistencyReport report = new ConsistencyReport();
        report.setPublishedRecords(
                walk(layout.getPublishedDir(), certificates, parser, this::checkPublished));
        report.setFingerprintLinks(
                walk(layout.getLinkDir(IndexKind.BY_FINGERPRINT), certificates, parser, this::checkFingerprintLink));
        report.setKeyIdLinks(
                walk(layout.getLinkDir(IndexKind.BY_KEYID), certificates, parser, this::checkKeyIdLink));
        report.setEmailLinks(
                walk(layout.getLinkDir(IndexKind.BY_EMAIL), certificates, parser, this::checkEmailLink));
        report.setCompletedAt(Instant.now());

        log.info("Store is consistent: {} published records, {} fingerprint, {} key id and {} email links",
                report.getPublishedRecords(), report.getFingerprintLinks(), report.getKeyIdLinks(),
                report.getEmailLinks());
        return report;
    }

    private void checkPublished(Path path, Certificate certificate, Fingerprint primary) {
        if (!path.equals(layout.fingerprintToPathPublished(primary))) {
            throw violation(Violation.PATH_MISMATCH, path,
                    path + " is not the canonical location of " + primary);
        }
        if (!certificate.getPrimaryFingerprint().equals(primary)) {
            throw violation(Violation.PATH_MISMATCH, path, String.format(
                    "%s points to the wrong certificate, expected %s but found %s",
                    path, primary, certificate.getPrimaryFingerprint()));
        }

        for (Fingerprint fingerprint : certificate.getSigningCapableFingerprints()) {
            Optional<Fingerprint> missing = indexStore.checkLinkFingerprint(fingerprint, primary);
            if (missing.isPresent()) {
                throw violation(Violation.MISSING_KEY_LINK, path, String.format(
                        "Missing link to key %s for sub %s", primary, missing.get()));
            }
        }

        for (Email email : certificate.getEmails()) {
            if (!indexStore.checkLink(email, primary)) {
                throw violation(Violation.MISSING_EMAIL_LINK, path, String.format(
                        "Missing link to key %s for email %s", primary, email));
            }
        }
    }

    private void checkFingerprintLink(Path path, Certificate certificate, Fingerprint primary) {
        Fingerprint fingerprint = StorageLayout.pathToFingerprint(path)
                .orElseThrow(() -> malformed(path));
        if (!certificate.getKeyFingerprints().contains(fingerprint)) {
            throw violation(Violation.FOREIGN_KEY_LINK, path, String.format(
                    "%s points to the wrong certificate, %s does not contain the (sub)key %s",
                    path, primary, fingerprint));
        }
    }

    private void checkKeyIdLink(Path path, Certificate certificate, Fingerprint primary) {
        KeyId keyId = StorageLayout.pathToKeyId(path)
                .orElseThrow(() -> malformed(path));
        boolean found = certificate.getKeyFingerprints().stream()
                .map(Fingerprint::toKeyId)
                .anyMatch(keyId::equals);
        if (!found) {
            throw violation(Violation.FOREIGN_KEY_LINK, path, String.format(
                    "%s points to the wrong certificate, %s does not contain the (sub)key %s",
                    path, primary, keyId));
        }
    }

    private void checkEmailLink(Path path, Certificate certificate, Fingerprint primary) {
        Email email = StorageLayout.pathToEmail(path)
                .orElseThrow(() -> malformed(path));
        if (!certificate.getEmails().contains(email)) {
            throw violation(Violation.FOREIGN_EMAIL_LINK, path, String.format(
                    "%s points to the wrong certificate, %s does not contain the email %s",
                    path, primary, email));
        }
    }

    private long walk(Path directory, Map<Fingerprint, Certificate> certificates,
                      CertificateParser parser, EntryCheck check) {
        long entries = 0;
        try (Stream<Path> paths = Files.walk(directory)) {
            Iterator<Path> iterator = paths.iterator();
            while (iterator.hasNext()) {
                Path path = iterator.next();
                if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }

                // the owning certificate, derived from the path alone
                Fingerprint primary = StorageLayout.pathToPrimary(path)
                        .orElseThrow(() -> malformed(path));
                Certificate certificate = load(primary, certificates, parser)
                        .orElseThrow(() -> violation(Violation.BROKEN_LINK, path, String.format(
                                "Broken link %s: no such key %s", path, primary)));

                check.verify(path, certificate, primary);
                entries++;
            }
        } catch (IOException e) {
            log.error("Failed to walk {}", directory, e);
            throw new CertificateStoreException("Failed to walk " + directory, e);
        } catch (UncheckedIOException e) {
            log.error("Failed to walk {}", directory, e.getCause());
            throw new CertificateStoreException("Failed to walk " + directory, e.getCause());
        }
        return entries;
    }

    private Optional<Certificate> load(Fingerprint primary, Map<Fingerprint, Certificate> certificates,
                                       CertificateParser parser) {
        Certificate cached = certificates.get(primary);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Certificate> loaded = certificateStore.read(Tier.PUBLISHED, primary).map(parser::parse);
        loaded.ifPresent(certificate -> certificates.put(primary, certificate));
        return loaded;
    }

    private static ConsistencyViolationException malformed(Path path) {
        return violation(Violation.MALFORMED_PATH, path, "Malformed path: " + path);
    }

    private static ConsistencyViolationException violation(Violation violation, Path path, String message) {
        log.warn("Consistency check failed: {}", message);
        return new ConsistencyViolationException(violation, path, message);
    }

}
