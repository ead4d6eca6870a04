package com.mux.sdk.key;

import com.mux.sdk.crypto.KeyFormatException;
import com.mux.sdk.crypto.PemUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Turns {@link KeyMaterial} into a {@link KeyHandle}.
 *
 * <ul>
 *     <li>pre-parsed handles are returned unchanged;</li>
 *     <li>text is trimmed and accepted as PEM, or base64-decoded and accepted if the result is PEM;</li>
 *     <li>bytes holding PEM text are read as text, any other bytes as a DER PKCS#1 RSA key.</li>
 * </ul>
 * PKCS#1 keys are rewrapped as PKCS#8; every import targets RSA (the RS256 key family).
 */
public final class KeyNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(KeyNormalizer.class);
    private static final String IMPORT_ALGORITHM = "RSA";

    private KeyNormalizer() {
    }

    public static CompletableFuture<KeyHandle> resolvePrivateKey(KeyDefaults defaults,
                                                                 KeyOptions options,
                                                                 Executor executor) {
        return KeyResolver.resolveKeyMaterial(defaults, options, executor)
                .thenApply(KeyNormalizer::normalize);
    }

    public static KeyHandle normalize(KeyMaterial material) {
        if (material instanceof KeyMaterial.PreParsedHandle preParsed) {
            return preParsed.handle();
        }
        if (material instanceof KeyMaterial.RawBytes raw) {
            return fromBytes(raw);
        }
        if (material instanceof KeyMaterial.TextPem text) {
            return fromPem(toPem(text.text()));
        }
        throw new KeyFormatException();
    }

    private static KeyHandle fromBytes(KeyMaterial.RawBytes raw) {
        if (raw.looksLikePem()) {
            LOGGER.debug("Key bytes hold PEM text");
            return fromPem(toPem(new String(raw.bytes(), StandardCharsets.UTF_8)));
        }
        LOGGER.debug("Importing key bytes as PKCS#1 DER");
        byte[] pkcs8;
        try {
            pkcs8 = PemUtils.pkcs1ToPkcs8(raw.bytes());
        } catch (RuntimeException e) {
            throw new KeyFormatException(e);
        }
        return importPkcs8(pkcs8);
    }

    static String toPem(String text) {
        String trimmed = text.trim();
        if (PemUtils.isPem(trimmed)) {
            return trimmed;
        }
        try {
            String decoded = new String(Base64.getMimeDecoder().decode(trimmed), StandardCharsets.UTF_8).trim();
            if (PemUtils.isPem(decoded)) {
                LOGGER.debug("Key text is base64-encoded PEM");
                return decoded;
            }
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Key text is neither PEM nor base64");
        }
        throw new KeyFormatException();
    }

    private static KeyHandle fromPem(String pem) {
        byte[] der;
        try {
            if (PemUtils.isPkcs1(pem)) {
                LOGGER.debug("Converting PKCS#1 PEM to PKCS#8");
                der = PemUtils.pkcs1ToPkcs8(PemUtils.unwrapPem(pem));
            } else if (PemUtils.PKCS8_TYPE.equals(PemUtils.pemType(pem))) {
                der = PemUtils.unwrapPem(pem);
            } else {
                throw new KeyFormatException();
            }
        } catch (KeyFormatException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KeyFormatException(e);
        }
        return importPkcs8(der);
    }

    private static KeyHandle importPkcs8(byte[] pkcs8Der) {
        try {
            PrivateKey key = KeyFactory.getInstance(IMPORT_ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(pkcs8Der));
            return KeyHandle.of(key);
        } catch (GeneralSecurityException e) {
            throw new KeyFormatException(e);
        }
    }
}
