package com.mux.sdk.crypto;

/**
 * Failure reported by the JWS signer, e.g. an algorithm that does not match the key type.
 * The signer's own exception is kept as the cause.
 */
public final class SigningException extends CryptoException {
    public SigningException(String message) {
        super("sign", message);
    }

    public SigningException(String message, Throwable cause) {
        super("sign", message, cause);
    }
}
