package com.mux.sdk.key;

/**
 * Client-level signing defaults, usually populated from {@code MUX_SIGNING_KEY} and
 * {@code MUX_PRIVATE_KEY}. Must not change while signing calls are in flight.
 */
public interface KeyDefaults {
    String getJwtSigningKey();

    KeyMaterial getJwtPrivateKey();
}
