package com.sommerph.certdir.service.openpgp;

import com.sommerph.certdir.exception.CertificateParseException;
import com.sommerph.certdir.model.Certificate;
import com.sommerph.certdir.model.CertificateSummary;
import com.sommerph.certdir.model.Email;
import com.sommerph.certdir.model.Fingerprint;
import com.sommerph.certdir.service.CertificateParser;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.bcpg.SignatureSubpacketTags;
import org.bouncycastle.bcpg.sig.KeyFlags;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPSignature;
import org.bouncycastle.openpgp.PGPSignatureSubpacketVector;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.operator.bc.BcKeyFingerprintCalculator;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Optional;

/**
 * Reads an armored or binary OpenPGP public key ring into the capability the storage engine needs.
 */
@Slf4j
@Component
public class OpenPgpCertificateParser implements CertificateParser {

    private static final int SIGNING_FLAGS = KeyFlags.CERTIFY_OTHER | KeyFlags.SIGN_DATA;

    @Override
    public Certificate parse(byte[] record) {
        PGPPublicKeyRing ring;
        try (InputStream in = PGPUtil.getDecoderStream(new ByteArrayInputStream(record))) {
            ring = new PGPPublicKeyRing(in, new BcKeyFingerprintCalculator());
        } catch (IOException | RuntimeException e) {
            throw new CertificateParseException("Failed to parse OpenPGP certificate", e);
        }

        PGPPublicKey primaryKey = ring.getPublicKey();
        Fingerprint primary = fingerprintOf(primaryKey)
                .orElseThrow(() -> new CertificateParseException(
                        "Unsupported primary key version " + primaryKey.getVersion()));

        CertificateSummary.CertificateSummaryBuilder builder = CertificateSummary.builder()
                .primaryFingerprint(primary)
                .revoked(primaryKey.hasRevocation());

        Iterator<PGPPublicKey> keys = ring.getPublicKeys();
        while (keys.hasNext()) {
            PGPPublicKey key = keys.next();
            Optional<Fingerprint> fingerprint = fingerprintOf(key);
            if (fingerprint.isEmpty()) {
                log.debug("Skipping key {} of {} with version {}", Long.toHexString(key.getKeyID()), primary,
                        key.getVersion());
                continue;
            }
            builder.keyFingerprint(fingerprint.get());
            if (isSigningCapable(key, primaryKey.getKeyID())) {
                builder.signingCapableFingerprint(fingerprint.get());
            }
        }

        Iterator<String> userIds = primaryKey.getUserIDs();
        while (userIds.hasNext()) {
            String userId = userIds.next();
            Optional<Email> email = emailOf(userId);
            if (email.isPresent()) {
                builder.email(email.get());
            } else {
                log.debug("User id '{}' of {} has no usable email address", userId, primary);
            }
        }
        return builder.build();
    }

    static Optional<Email> emailOf(String userId) {
        int open = userId.lastIndexOf('<');
        int close = userId.lastIndexOf('>');
        if (open >= 0 && close > open) {
            return Email.parse(userId.substring(open + 1, close));
        }
        return Email.parse(userId);
    }

    private static Optional<Fingerprint> fingerprintOf(PGPPublicKey key) {
        return Fingerprint.parse(Hex.toHexString(key.getFingerprint()));
    }

    // A primary key without key flags can always certify; a subkey without them is not used for signing.
    private static boolean isSigningCapable(PGPPublicKey key, long primaryKeyId) {
        Iterator<PGPSignature> signatures = key.isMasterKey()
                ? key.getSignatures()
                : key.getSignaturesOfType(PGPSignature.SUBKEY_BINDING);

        boolean foundFlags = false;
        int flags = 0;
        while (signatures.hasNext()) {
            PGPSignature signature = signatures.next();
            if (signature.getKeyID() != primaryKeyId || !isSelfSignature(signature)) {
                continue;
            }
            PGPSignatureSubpacketVector hashed = signature.getHashedSubPackets();
            if (hashed != null && hashed.hasSubpacket(SignatureSubpacketTags.KEY_FLAGS)) {
                foundFlags = true;
                flags |= hashed.getKeyFlags();
            }
        }
        if (!foundFlags) {
            return key.isMasterKey();
        }
        return (flags & SIGNING_FLAGS) != 0;
    }

    private static boolean isSelfSignature(PGPSignature signature) {
        switch (signature.getSignatureType()) {
            case PGPSignature.DEFAULT_CERTIFICATION:
            case PGPSignature.NO_CERTIFICATION:
            case PGPSignature.CASUAL_CERTIFICATION:
            case PGPSignature.POSITIVE_CERTIFICATION:
            case PGPSignature.DIRECT_KEY:
            case PGPSignature.SUBKEY_BINDING:
                return true;
            default:
                return false;
        }
    }

}
