package com.mux.sdk.jwt;

import com.mux.sdk.crypto.SigningException;
import com.mux.sdk.key.KeyHandle;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import java.security.PrivateKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.RSAPrivateKey;

/**
 * {@link TokenSigner} backed by Nimbus JOSE+JWT. The algorithm is not checked against the key
 * type up front; Nimbus rejects mismatches when signing.
 */
public final class NimbusTokenSigner implements TokenSigner {

    @Override
    public String sign(JWTClaimsSet claims, JWSHeader header, KeyHandle key) {
        SignedJWT jwt = new SignedJWT(header, claims);
        try {
            jwt.sign(createSigner(key.privateKey()));
        } catch (JOSEException | IllegalArgumentException e) {
            throw new SigningException("Failed to sign token with " + header.getAlgorithm() + ": " + e.getMessage(), e);
        }
        return jwt.serialize();
    }

    private static JWSSigner createSigner(PrivateKey privateKey) throws JOSEException {
        if (privateKey instanceof RSAPrivateKey) {
            return new RSASSASigner(privateKey);
        }
        if (privateKey instanceof ECPrivateKey ecPrivateKey) {
            return new ECDSASigner(ecPrivateKey);
        }
        throw new SigningException("Unsupported private key type " + privateKey.getAlgorithm());
    }
}
