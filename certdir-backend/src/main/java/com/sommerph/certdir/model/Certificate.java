package com.sommerph.certdir.model;

import java.util.Set;

/**
 * Read-only view of an already parsed certificate, limited to what the storage engine needs to
 * maintain and verify the indices.
 */
public interface Certificate {

    Fingerprint getPrimaryFingerprint();

    /**
     * Fingerprints of the primary key and all subkeys.
     */
    Set<Fingerprint> getKeyFingerprints();

    /**
     * Fingerprints of the keys that are certification- or signing-capable. These are the keys that
     * get by-fingerprint and by-keyid entries.
     */
    Set<Fingerprint> getSigningCapableFingerprints();

    /**
     * Email addresses of the user ids in this certificate.
     */
    Set<Email> getEmails();

    boolean isRevoked();

}
