package com.mux.sdk.crypto;

import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.pkcs.RSAPrivateKey;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;

import java.io.IOException;
import java.util.Base64;

public final class PemUtils {
    public static final String PEM_PREFIX = "-----BEGIN";
    public static final String PKCS1_PREFIX = "-----BEGIN RSA PRIVATE";
    public static final String PKCS8_TYPE = "PRIVATE KEY";

    private PemUtils() {}

    public static String toPem(String type, byte[] der) {
        String base64 = Base64.getMimeEncoder(64, new byte[]{'\n'}).encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + base64 + "\n-----END " + type + "-----";
    }

    public static String toPkcs8Pem(byte[] pkcs8Der) {
        return toPem(PKCS8_TYPE, pkcs8Der);
    }

    public static boolean isPem(String text) {
        return text != null && text.startsWith(PEM_PREFIX);
    }

    public static boolean isPkcs1(String pem) {
        return pem != null && pem.startsWith(PKCS1_PREFIX);
    }

    /**
     * Returns the type label of the first PEM block, e.g. {@code RSA PRIVATE KEY}.
     */
    public static String pemType(String pem) {
        if (!isPem(pem)) {
            throw new IllegalArgumentException("Not a PEM block");
        }
        int start = PEM_PREFIX.length() + 1;
        int end = pem.indexOf("-----", start);
        if (end < 0) {
            throw new IllegalArgumentException("Unterminated PEM header");
        }
        return pem.substring(start, end).trim();
    }

    /**
     * Strips the armor lines of the first PEM block and decodes its base64 body. Blocks after the
     * first {@code -----END} line, such as an appended certificate, are ignored.
     */
    public static byte[] unwrapPem(String pem) {
        StringBuilder body = new StringBuilder();
        for (String line : pem.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("-----END")) {
                break;
            }
            if (trimmed.isEmpty() || trimmed.startsWith("-----")) {
                continue;
            }
            body.append(trimmed);
        }
        return Base64.getDecoder().decode(body.toString());
    }

    /**
     * Wraps a PKCS#1 {@code RSAPrivateKey} structure into a PKCS#8 {@code PrivateKeyInfo}.
     *
     * @throws IllegalArgumentException if the bytes are not a PKCS#1 RSA private key
     */
    public static byte[] pkcs1ToPkcs8(byte[] pkcs1Der) {
        RSAPrivateKey rsaKey;
        try {
            rsaKey = RSAPrivateKey.getInstance(pkcs1Der);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Not a PKCS#1 RSA private key", e);
        }
        AlgorithmIdentifier algorithm = new AlgorithmIdentifier(PKCSObjectIdentifiers.rsaEncryption, DERNull.INSTANCE);
        try {
            return new PrivateKeyInfo(algorithm, rsaKey).getEncoded();
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to encode PKCS#8 key", e);
        }
    }
}
