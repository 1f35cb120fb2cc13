package com.sommerph.certdir.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class ConsistencyViolationException extends CertificateStoreException {

    public enum Violation {
        MALFORMED_PATH,
        PATH_MISMATCH,
        MISSING_KEY_LINK,
        MISSING_EMAIL_LINK,
        BROKEN_LINK,
        FOREIGN_KEY_LINK,
        FOREIGN_EMAIL_LINK
    }

    private final Violation violation;
    private final Path path;

    public ConsistencyViolationException(Violation violation, Path path, String message) {
        super(message);
        this.violation = violation;
        this.path = path;
    }

}
