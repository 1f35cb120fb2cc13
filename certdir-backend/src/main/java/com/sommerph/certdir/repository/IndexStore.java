package com.sommerph.certdir.repository;

import com.sommerph.certdir.model.Fingerprint;
import com.sommerph.certdir.model.Identifier;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Mapping from secondary identifiers to the published record of a primary certificate.
 * Entries are replaced atomically and are only ever removed by the certificate they point at.
 */
public interface IndexStore {

    void link(Identifier identifier, Fingerprint primary);

    void unlink(Identifier identifier, Fingerprint primary);

    /**
     * Links both the by-fingerprint and the by-keyid entry of {@code subkey}.
     */
    void linkFingerprint(Fingerprint subkey, Fingerprint primary);

    void unlinkFingerprint(Fingerprint subkey, Fingerprint primary);

    /**
     * Checks the by-fingerprint and by-keyid entries of {@code subkey} before linking them.
     *
     * @return {@code subkey} if at least one of its entries is missing, empty if both exist
     * @throws com.sommerph.certdir.exception.IdentifierCollisionException if an entry resolves to
     *         another certificate
     */
    Optional<Fingerprint> checkLinkFingerprint(Fingerprint subkey, Fingerprint primary);

    /**
     * Checks the entry of {@code identifier} before linking it to {@code primary}. An entry that
     * does not resolve to a record counts as absent.
     *
     * @return whether the entry already resolves to the published record of {@code primary}
     * @throws com.sommerph.certdir.exception.IdentifierCollisionException if the entry resolves to
     *         another certificate
     */
    boolean checkLink(Identifier identifier, Fingerprint primary);

    Optional<Fingerprint> lookupPrimaryFingerprint(Identifier identifier);

    /**
     * Path of the entry relative to the external root, if it resolves to a record.
     */
    Optional<Path> lookupPath(Identifier identifier);

    boolean exists(Identifier identifier);

}
