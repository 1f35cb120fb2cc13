package com.sommerph.certdir.exception;

public class CertificateParseException extends CertificateStoreException {

    public CertificateParseException(String message) {
        super(message);
    }

    public CertificateParseException(String message, Throwable cause) {
        super(message, cause);
    }

}
