package com.sommerph.certdir.exception;

/**
 * Base class for failures of the certificate storage engine. Plain I/O failures are wrapped in
 * this type with the offending path in the message.
 */
public class CertificateStoreException extends RuntimeException {

    public CertificateStoreException(String message) {
        super(message);
    }

    public CertificateStoreException(String message, Throwable cause) {
        super(message, cause);
    }

}
