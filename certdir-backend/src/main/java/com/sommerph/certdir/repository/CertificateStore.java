package com.sommerph.certdir.repository;

import com.sommerph.certdir.model.Fingerprint;
import com.sommerph.certdir.model.Identifier;
import com.sommerph.certdir.model.RecordHandle;
import com.sommerph.certdir.model.Tier;
import com.sommerph.certdir.repository.filesystem.StorageLock;

import java.util.Optional;

public interface CertificateStore {

    /**
     * Blocks until the store-wide write lock is held. Every write and (un)link must happen while
     * holding it.
     */
    StorageLock lock();

    RecordHandle write(Tier tier, Fingerprint fingerprint, byte[] content);

    Optional<byte[]> read(Tier tier, Fingerprint fingerprint);

    /**
     * Follows the index entry of {@code identifier} to the published record it points at.
     */
    Optional<byte[]> readByIndex(Identifier identifier);

    boolean exists(Tier tier, Fingerprint fingerprint);

}
