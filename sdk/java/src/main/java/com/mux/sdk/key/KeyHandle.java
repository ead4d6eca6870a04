package com.mux.sdk.key;

import java.security.PrivateKey;
import java.util.Objects;

/**
 * Parsed private key ready for signing. A handle can be created once and reused across many
 * signing calls; it never renders the key material in {@link #toString()}.
 */
public final class KeyHandle {
    private final PrivateKey privateKey;

    private KeyHandle(PrivateKey privateKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
    }

    public static KeyHandle of(PrivateKey privateKey) {
        return new KeyHandle(privateKey);
    }

    /**
     * The underlying key, for use by JWS signers only.
     */
    public PrivateKey privateKey() {
        return privateKey;
    }

    public String getAlgorithm() {
        return privateKey.getAlgorithm();
    }

    @Override
    public String toString() {
        return "KeyHandle[" + privateKey.getAlgorithm() + "]";
    }
}
