package com.sommerph.certdir.exception;

import com.sommerph.certdir.model.Identifier;
import lombok.Getter;

import java.nio.file.Path;

/**
 * An index entry already resolves to a different primary certificate than the one it is being
 * claimed for. Requires manual intervention.
 */
@Getter
public class IdentifierCollisionException extends CertificateStoreException {

    private final Identifier identifier;
    private final Path expected;
    private final Path actual;

    public IdentifierCollisionException(Identifier identifier, Path expected, Path actual) {
        super(String.format("%s collision for %s: expected %s to be a suffix of %s",
                identifier.getIndexKind().getDirectoryName(), identifier, expected, actual));
        this.identifier = identifier;
        this.expected = expected;
        this.actual = actual;
    }

}
