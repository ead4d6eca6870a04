package com.mux.sdk.jwt;

import com.mux.sdk.crypto.SigningException;
import com.mux.sdk.key.KeyHandle;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jwt.JWTClaimsSet;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Assembles claims and protected header for one token and hands them to a {@link TokenSigner}.
 * Holds no per-call state, so one instance may sign concurrently.
 */
public final class TokenBuilder {
    private final TokenSigner signer;
    private final Clock clock;

    public TokenBuilder() {
        this(new NimbusTokenSigner(), Clock.systemUTC());
    }

    public TokenBuilder(TokenSigner signer, Clock clock) {
        this.signer = Objects.requireNonNull(signer, "signer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Signs {@code payload} merged with {@code kid} and the standard claims set on {@code options}.
     * Failures, including those of the signer, complete the returned future exceptionally.
     */
    public CompletableFuture<String> sign(Map<String, ?> payload, KeyHandle key, SigningOptions options) {
        try {
            return CompletableFuture.completedFuture(signNow(payload, key, options));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    String signNow(Map<String, ?> payload, KeyHandle key, SigningOptions options) {
        Objects.requireNonNull(key, "key");
        SigningOptions effective = options != null ? options : SigningOptions.defaults();
        JWTClaimsSet claims = buildClaims(payload, effective, clock.instant());
        return signer.sign(claims, buildHeader(effective), key);
    }

    static JWTClaimsSet buildClaims(Map<String, ?> payload, SigningOptions options, Instant now) {
        JWTClaimsSet.Builder claims = new JWTClaimsSet.Builder();
        if (payload != null) {
            payload.forEach(claims::claim);
        }
        if (options.getKid() != null && !options.getKid().isEmpty()) {
            claims.claim("kid", options.getKid());
        }
        for (StandardClaim claim : StandardClaim.values()) {
            claim.apply(options, claims, now);
        }
        return claims.build();
    }

    static JWSHeader buildHeader(SigningOptions options) {
        String algorithm = options.getAlgorithm() != null && !options.getAlgorithm().isEmpty()
                ? options.getAlgorithm()
                : SigningOptions.DEFAULT_ALGORITHM;
        try {
            return new JWSHeader(JWSAlgorithm.parse(algorithm));
        } catch (IllegalArgumentException e) {
            throw new SigningException("Cannot sign with algorithm " + algorithm + ": " + e.getMessage(), e);
        }
    }
}
