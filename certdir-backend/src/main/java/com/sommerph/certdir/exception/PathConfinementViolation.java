package com.sommerph.certdir.exception;

import java.nio.file.Path;

/**
 * A resolved path escaped the storage roots. This indicates a bug or a hostile identifier that
 * slipped past validation and is never meant to be handled.
 */
public class PathConfinementViolation extends Error {

    public PathConfinementViolation(Path path) {
        super("Attempted to access file outside expected dirs: " + path);
    }

}
