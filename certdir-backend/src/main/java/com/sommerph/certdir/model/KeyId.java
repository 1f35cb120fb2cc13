package com.sommerph.certdir.model;

import lombok.EqualsAndHashCode;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The 64-bit key id of a v4 key, i.e. the last 16 hex characters of its fingerprint.
 */
@EqualsAndHashCode
public final class KeyId implements Identifier, Comparable<KeyId> {

    private static final Pattern HEX_16 = Pattern.compile("[0-9A-F]{16}");

    private final String hex;

    public KeyId(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("KeyId must not be null");
        }
        String canonical = hex.toUpperCase(Locale.ROOT);
        if (!HEX_16.matcher(canonical).matches()) {
            throw new IllegalArgumentException("Not a key id: " + hex);
        }
        this.hex = canonical;
    }

    public static Optional<KeyId> parse(String hex) {
        try {
            return Optional.of(new KeyId(hex));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @Override
    public IndexKind getIndexKind() {
        return IndexKind.BY_KEYID;
    }

    @Override
    public int compareTo(KeyId other) {
        return hex.compareTo(other.hex);
    }

    @Override
    public String toString() {
        return hex;
    }

}
