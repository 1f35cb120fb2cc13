package com.sommerph.certdir.service;

import com.sommerph.certdir.model.Certificate;

/**
 * Turns a stored record back into the certificate capability the engine verifies indices against.
 */
public interface CertificateParser {

    /**
     * @throws com.sommerph.certdir.exception.CertificateParseException if {@code record} is not a
     *         certificate
     */
    Certificate parse(byte[] record);

}
