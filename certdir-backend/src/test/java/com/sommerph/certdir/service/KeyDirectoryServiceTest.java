package com.sommerph.certdir.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.certdir.exception.IdentifierCollisionException;
import com.sommerph.certdir.model.Email;
import com.sommerph.certdir.model.Fingerprint;
import com.sommerph.certdir.repository.filesystem.FilesystemCertificateStore;
import com.sommerph.certdir.repository.filesystem.FilesystemIndexStore;
import com.sommerph.certdir.repository.filesystem.StorageLayout;
import com.sommerph.certdir.repository.filesystem.StorageLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.sommerph.certdir.service.CertificateFixture.fingerprint;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyDirectoryServiceTest {

    @TempDir
    Path base;

    private KeyDirectoryService service;

    private CertificateFixture alice;

    @BeforeEach
    void setUp() throws IOException {
        StorageLayout layout = StorageLayout.fromBase(base);
        FilesystemCertificateStore store = new FilesystemCertificateStore(layout, false);
        FilesystemIndexStore index = new FilesystemIndexStore(layout, false);
        service = new KeyDirectoryService(store, index, new ConsistencyChecker(layout, store, index),
                new JsonCertificateParser());

        alice = CertificateFixture.of(1)
                .signingSubkey(2)
                .otherSubkey(3)
                .email("alice@example.org");
    }

    private List<Fingerprint> index(CertificateFixture fixture) throws IOException {
        try (StorageLock lock = service.lock()) {
            return service.indexCertificate(lock, fixture.toCertificate(), full(fixture), fixture.toJson());
        }
    }

    private void unindex(CertificateFixture fixture) throws IOException {
        try (StorageLock lock = service.lock()) {
            service.unindexCertificate(lock, fixture.toCertificate());
        }
    }

    private static byte[] full(CertificateFixture fixture) {
        return ("full " + fixture.getPrimary()).getBytes(StandardCharsets.UTF_8);
    }

    private static void assertRecord(Optional<byte[]> actual, byte[] expected) {
        assertThat(actual).hasValueSatisfying(read -> assertThat(read).isEqualTo(expected));
    }

    @Test
    void indexedCertificateIsReachableThroughEveryIndex() throws IOException {
        List<Fingerprint> linked = index(alice);

        assertThat(linked).containsExactlyInAnyOrder(fingerprint(1), fingerprint(2));

        byte[] published = alice.toJson();
        assertRecord(service.byPrimaryFingerprint(fingerprint(1)), published);
        assertRecord(service.byFingerprintFull(fingerprint(1)), full(alice));
        assertRecord(service.byFingerprint(fingerprint(2)), published);
        assertRecord(service.byKeyId(fingerprint(2).toKeyId()), published);
        assertRecord(service.byEmail(new Email("alice@example.org")), published);
        assertThat(service.lookupPrimaryFingerprint(fingerprint(2).toKeyId())).contains(fingerprint(1));
    }

    @Test
    void keysWithoutSigningCapabilityAreNotLinked() throws IOException {
        index(alice);

        assertThat(service.byFingerprint(fingerprint(3))).isEmpty();
        assertThat(service.byKeyId(fingerprint(3).toKeyId())).isEmpty();
        assertThat(service.lookupPath(fingerprint(3))).isEmpty();
    }

    @Test
    void reindexingLinksNothingNew() throws IOException {
        index(alice);

        assertThat(index(alice)).isEmpty();
        assertThat(service.checkConsistency().getPublishedRecords()).isEqualTo(1);
    }

    @Test
    void newSubkeyIsLinkedOnReindex() throws IOException {
        index(alice);

        assertThat(index(alice.signingSubkey(4))).containsExactly(fingerprint(4));
        assertRecord(service.byKeyId(fingerprint(4).toKeyId()), alice.toJson());
    }

    @Test
    void collisionAbortsBeforeAnythingIsWritten() throws IOException {
        index(alice);
        CertificateFixture bob = CertificateFixture.of(10)
                .signingSubkey(2)
                .email("bob@example.org");

        assertThatThrownBy(() -> index(bob)).isInstanceOf(IdentifierCollisionException.class);

        assertThat(service.byPrimaryFingerprint(fingerprint(10))).isEmpty();
        assertThat(service.byFingerprintFull(fingerprint(10))).isEmpty();
        assertThat(service.byEmail(new Email("bob@example.org"))).isEmpty();
        assertThat(service.lookupPrimaryFingerprint(fingerprint(2))).contains(fingerprint(1));
        assertThat(service.checkConsistency().getPublishedRecords()).isEqualTo(1);
    }

    @Test
    void emailClaimedByAnotherCertificateIsACollision() throws IOException {
        alice.email("shared@example.org");
        index(alice);
        CertificateFixture bob = CertificateFixture.of(10)
                .email("bob@example.org")
                .email("shared@example.org");

        assertThatThrownBy(() -> index(bob))
                .isInstanceOf(IdentifierCollisionException.class)
                .satisfies(e -> assertThat(((IdentifierCollisionException) e).getIdentifier())
                        .isEqualTo(new Email("shared@example.org")));

        assertThat(service.lookupPrimaryFingerprint(new Email("shared@example.org"))).contains(fingerprint(1));
        assertThat(service.byPrimaryFingerprint(fingerprint(10))).isEmpty();
        assertThat(service.byEmail(new Email("bob@example.org"))).isEmpty();
    }

    @Test
    void emailCanMoveOnceTheOldCertificateReleasesIt() throws IOException {
        index(alice);
        CertificateFixture bob = CertificateFixture.of(10).email("alice@example.org");

        try (StorageLock lock = service.lock()) {
            service.unlink(new Email("alice@example.org"), fingerprint(1));
            service.indexCertificate(lock, bob.toCertificate(), full(bob), bob.toJson());
        }

        assertThat(service.lookupPrimaryFingerprint(new Email("alice@example.org"))).contains(fingerprint(10));
    }

    @Test
    void mergeReadsAndIndexesUnderOneLock() throws IOException {
        index(alice);

        try (StorageLock lock = service.lock()) {
            byte[] previous = service.byPrimaryFingerprint(fingerprint(1)).orElseThrow();
            CertificateFixture merged = new ObjectMapper().readValue(previous, CertificateFixture.class)
                    .signingSubkey(4);

            assertThat(service.indexCertificate(lock, merged.toCertificate(), full(merged), merged.toJson()))
                    .containsExactly(fingerprint(4));
        }

        assertThat(service.lookupPrimaryFingerprint(fingerprint(4))).contains(fingerprint(1));
    }

    @Test
    void indexingRequiresTheLock() throws IOException {
        StorageLock released = service.lock();
        released.close();

        assertThatThrownBy(() -> service.indexCertificate(released, alice.toCertificate(), full(alice),
                alice.toJson())).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> service.unindexCertificate(null, alice.toCertificate()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(service.byPrimaryFingerprint(fingerprint(1))).isEmpty();
    }

    @Test
    void lockIsReleasedAfterACollision() throws IOException {
        index(alice);
        CertificateFixture bob = CertificateFixture.of(10).signingSubkey(2);
        assertThatThrownBy(() -> index(bob)).isInstanceOf(IdentifierCollisionException.class);

        try (StorageLock lock = service.lock()) {
            assertThat(lock.isValid()).isTrue();
        }
    }

    @Test
    void unindexRemovesLinksButKeepsRecords() throws IOException {
        index(alice);

        unindex(alice);

        assertThat(service.byEmail(new Email("alice@example.org"))).isEmpty();
        assertThat(service.byFingerprint(fingerprint(2))).isEmpty();
        assertThat(service.byKeyId(fingerprint(1).toKeyId())).isEmpty();
        assertRecord(service.byPrimaryFingerprint(fingerprint(1)), alice.toJson());
        assertRecord(service.byFingerprintFull(fingerprint(1)), full(alice));
    }

    @Test
    void unindexKeepsLinksThatMovedToAnotherCertificate() throws IOException {
        index(alice);
        CertificateFixture bob = CertificateFixture.of(10).email("bob@example.org");
        index(bob);
        try (StorageLock ignored = service.lock()) {
            service.link(new Email("alice@example.org"), fingerprint(10));
        }

        unindex(alice);

        assertThat(service.lookupPrimaryFingerprint(new Email("alice@example.org"))).contains(fingerprint(10));
    }

    @Test
    void quarantinedRecordsAreNotIndexed() {
        service.writeQuarantined(fingerprint(5), new byte[] {5});

        assertThat(service.byPrimaryFingerprint(fingerprint(5))).isEmpty();
        assertThat(service.byFingerprint(fingerprint(5))).isEmpty();
    }

    @Test
    void indexingWaitsForTheLockHolder() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<List<Fingerprint>> pending;
            try (StorageLock ignored = service.lock()) {
                pending = executor.submit(() -> index(alice));
                assertThatThrownBy(() -> pending.get(300, TimeUnit.MILLISECONDS))
                        .isInstanceOf(TimeoutException.class);
                assertThat(service.byPrimaryFingerprint(fingerprint(1))).isEmpty();
            }
            assertThat(pending.get(10, TimeUnit.SECONDS)).hasSize(2);
        } finally {
            executor.shutdownNow();
        }
    }

}
