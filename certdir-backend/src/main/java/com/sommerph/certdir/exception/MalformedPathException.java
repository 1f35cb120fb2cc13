package com.sommerph.certdir.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class MalformedPathException extends CertificateStoreException {

    private final Path path;

    public MalformedPathException(Path path) {
        super("Malformed path: " + path);
        this.path = path;
    }

}
