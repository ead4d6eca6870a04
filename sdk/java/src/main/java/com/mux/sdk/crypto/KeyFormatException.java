package com.mux.sdk.crypto;

/**
 * Raised when private key material is present but cannot be read as a PEM string,
 * a base64-encoded PEM, PKCS#1 DER bytes or a pre-parsed key.
 */
public final class KeyFormatException extends CryptoException {
    public static final String MESSAGE = "Specified signing key must be either a valid PKCS1 or PKCS8 PEM string, "
            + "a base64-encoded PEM, or a pre-parsed private key";

    public KeyFormatException() {
        super("import", MESSAGE);
    }

    public KeyFormatException(Throwable cause) {
        super("import", MESSAGE, cause);
    }
}
