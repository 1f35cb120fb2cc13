package com.sommerph.certdir.model;

import lombok.EqualsAndHashCode;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A v4 OpenPGP fingerprint in its canonical form: 40 upper-case hex characters.
 */
@EqualsAndHashCode
public final class Fingerprint implements Identifier, Comparable<Fingerprint> {

    private static final Pattern HEX_40 = Pattern.compile("[0-9A-F]{40}");

    private final String hex;

    public Fingerprint(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Fingerprint must not be null");
        }
        String canonical = hex.replace(" ", "").toUpperCase(Locale.ROOT);
        if (!HEX_40.matcher(canonical).matches()) {
            throw new IllegalArgumentException("Not a fingerprint: " + hex);
        }
        this.hex = canonical;
    }

    public static Optional<Fingerprint> parse(String hex) {
        try {
            return Optional.of(new Fingerprint(hex));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public KeyId toKeyId() {
        return new KeyId(hex.substring(hex.length() - 16));
    }

    @Override
    public IndexKind getIndexKind() {
        return IndexKind.BY_FINGERPRINT;
    }

    @Override
    public int compareTo(Fingerprint other) {
        return hex.compareTo(other.hex);
    }

    @Override
    public String toString() {
        return hex;
    }

}
