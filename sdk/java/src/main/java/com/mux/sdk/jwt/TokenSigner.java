package com.mux.sdk.jwt;

import com.mux.sdk.key.KeyHandle;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jwt.JWTClaimsSet;

/**
 * Produces a compact JWS from a claim set, a protected header and a key.
 */
@FunctionalInterface
public interface TokenSigner {
    /**
     * @throws com.mux.sdk.crypto.SigningException if the key cannot sign with the header's algorithm
     */
    String sign(JWTClaimsSet claims, JWSHeader header, KeyHandle key);
}
