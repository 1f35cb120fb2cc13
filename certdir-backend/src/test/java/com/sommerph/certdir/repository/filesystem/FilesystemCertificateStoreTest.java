package com.sommerph.certdir.repository.filesystem;

import com.sommerph.certdir.exception.PathConfinementViolation;
import com.sommerph.certdir.model.Email;
import com.sommerph.certdir.model.Fingerprint;
import com.sommerph.certdir.model.RecordHandle;
import com.sommerph.certdir.model.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilesystemCertificateStoreTest {

    private static final Fingerprint FPR = new Fingerprint("CBCD8F030588653EEDD7E2659B7DD433F254904A");

    @TempDir
    Path base;

    private StorageLayout layout;
    private FilesystemCertificateStore store;

    @BeforeEach
    void setUp() throws IOException {
        layout = StorageLayout.fromBase(base);
        store = new FilesystemCertificateStore(layout, false);
    }

    @Test
    void writeThenReadEachTier() {
        for (Tier tier : Tier.values()) {
            byte[] content = ("record in " + tier).getBytes(StandardCharsets.UTF_8);

            RecordHandle handle = store.write(tier, FPR, content);

            assertThat(handle.isWritten()).isTrue();
            assertThat(handle.getTier()).isEqualTo(tier);
            assertThat(store.read(tier, FPR)).hasValueSatisfying(read -> assertThat(read).isEqualTo(content));
            assertThat(store.exists(tier, FPR)).isTrue();
        }
        assertThat(store.write(Tier.QUARANTINED, FPR, new byte[0]).getPath())
                .isEqualTo(layout.getQuarantinedDir().resolve(FPR.toString()));
    }

    @Test
    void secondWriteReplacesTheFirst() {
        store.write(Tier.FULL, FPR, "a long first version of the record".getBytes(StandardCharsets.UTF_8));
        store.write(Tier.FULL, FPR, "v2".getBytes(StandardCharsets.UTF_8));

        assertThat(store.read(Tier.FULL, FPR)).hasValueSatisfying(
                read -> assertThat(new String(read, StandardCharsets.UTF_8)).isEqualTo("v2"));
    }

    @Test
    void tiersHaveTheirOwnPermissions() throws IOException {
        store.write(Tier.FULL, FPR, new byte[] {1});
        store.write(Tier.PUBLISHED, FPR, new byte[] {1});

        assertThat(PosixFilePermissions.toString(
                Files.getPosixFilePermissions(layout.fingerprintToPathFull(FPR)))).isEqualTo("rw-rw----");
        assertThat(PosixFilePermissions.toString(
                Files.getPosixFilePermissions(layout.fingerprintToPathPublished(FPR)))).isEqualTo("rw-r--r--");
    }

    @Test
    void missingRecordsAreEmpty() {
        assertThat(store.read(Tier.PUBLISHED, FPR)).isEmpty();
        assertThat(store.readByIndex(new Email("alice@example.org"))).isEmpty();
        assertThat(store.exists(Tier.FULL, FPR)).isFalse();
    }

    @Test
    void readByIndexFollowsTheLink() throws IOException {
        byte[] content = "published".getBytes(StandardCharsets.UTF_8);
        store.write(Tier.PUBLISHED, FPR, content);
        Email email = new Email("alice@example.org");
        AtomicFiles.replaceSymlink(layout.linkTarget(email, FPR), layout.linkPath(email));

        assertThat(store.readByIndex(email)).hasValueSatisfying(read -> assertThat(read).isEqualTo(content));
    }

    @Test
    void linkLeadingOutOfTheStoreIsFatal() throws IOException {
        Path outside = Files.write(base.resolve("secret"), new byte[] {42});
        Email email = new Email("mallory@example.org");
        AtomicFiles.replaceSymlink(outside, layout.linkPath(email));

        assertThatThrownBy(() -> store.readByIndex(email)).isInstanceOf(PathConfinementViolation.class);
    }

    @Test
    void dryRunDoesNotTouchTheFilesystem() throws IOException {
        FilesystemCertificateStore dryRun = new FilesystemCertificateStore(layout, true);

        for (Tier tier : Tier.values()) {
            RecordHandle handle = dryRun.write(tier, FPR, new byte[] {1});
            assertThat(handle.isWritten()).isFalse();
            assertThat(dryRun.read(tier, FPR)).isEmpty();
        }
        try (Stream<Path> tmp = Files.list(layout.getTmpDir())) {
            assertThat(tmp).isEmpty();
        }
    }

    @Test
    void readersNeverObserveTornRecords() throws Exception {
        byte[] small = new byte[256 * 1024];
        byte[] large = new byte[1024 * 1024];
        Arrays.fill(small, (byte) 'a');
        Arrays.fill(large, (byte) 'b');
        store.write(Tier.PUBLISHED, FPR, small);

        AtomicBoolean done = new AtomicBoolean();
        List<String> failures = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            Runnable reader = () -> {
                while (!done.get()) {
                    byte[] read = store.read(Tier.PUBLISHED, FPR).orElse(null);
                    if (read == null) {
                        failures.add("record vanished");
                    } else if (!Arrays.equals(read, small) && !Arrays.equals(read, large)) {
                        failures.add("torn read of " + read.length + " bytes");
                    }
                }
            };
            Future<?> first = executor.submit(reader);
            Future<?> second = executor.submit(reader);

            for (int i = 0; i < 40; i++) {
                store.write(Tier.PUBLISHED, FPR, i % 2 == 0 ? large : small);
            }
            done.set(true);
            first.get(30, TimeUnit.SECONDS);
            second.get(30, TimeUnit.SECONDS);
        } finally {
            done.set(true);
            executor.shutdownNow();
        }

        assertThat(failures).isEmpty();
    }

}
