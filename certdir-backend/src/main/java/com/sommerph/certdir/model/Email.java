package com.sommerph.certdir.model;

import lombok.EqualsAndHashCode;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A canonical (trimmed, lower-case) email address as found in a user id.
 */
@EqualsAndHashCode
public final class Email implements Identifier, Comparable<Email> {

    private static final Pattern ADDRESS = Pattern.compile("[^\\s@<>]+@[^\\s@<>]+");

    private final String address;

    public Email(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Email must not be null");
        }
        String canonical = address.trim().toLowerCase(Locale.ROOT);
        if (!ADDRESS.matcher(canonical).matches()) {
            throw new IllegalArgumentException("Not an email address: " + address);
        }
        int at = canonical.indexOf('@');
        String local = canonical.substring(0, at);
        String domain = canonical.substring(at + 1);
        if (!isDotAtom(local) || !isDotAtom(domain) || !domain.contains(".")) {
            throw new IllegalArgumentException("Not an email address: " + address);
        }
        this.address = canonical;
    }

    public static Optional<Email> parse(String address) {
        try {
            return Optional.of(new Email(address));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static boolean isDotAtom(String part) {
        return !part.startsWith(".") && !part.endsWith(".") && !part.contains("..");
    }

    @Override
    public IndexKind getIndexKind() {
        return IndexKind.BY_EMAIL;
    }

    @Override
    public int compareTo(Email other) {
        return address.compareTo(other.address);
    }

    @Override
    public String toString() {
        return address;
    }

}
