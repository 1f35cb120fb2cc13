package com.sommerph.certdir.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class CertificateSummary implements Certificate {

    Fingerprint primaryFingerprint;

    @Singular
    Set<Fingerprint> keyFingerprints;

    @Singular
    Set<Fingerprint> signingCapableFingerprints;

    @Singular
    Set<Email> emails;

    boolean revoked;

}
