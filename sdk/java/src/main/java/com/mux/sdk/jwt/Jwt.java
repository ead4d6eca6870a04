package com.mux.sdk.jwt;

import com.mux.sdk.key.KeyDefaults;
import com.mux.sdk.key.KeyHandle;
import com.mux.sdk.key.KeyMaterial;
import com.mux.sdk.key.KeyNormalizer;
import com.mux.sdk.key.KeyOptions;
import com.mux.sdk.key.KeyResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Signs playback, DRM license and viewer count tokens with the client's (or per-call) signing key.
 */
public final class Jwt {
    private static final Logger LOGGER = LoggerFactory.getLogger(Jwt.class);

    private final KeyDefaults defaults;
    private final TokenBuilder tokenBuilder;
    private final Executor executor;

    public Jwt(KeyDefaults defaults, TokenBuilder tokenBuilder, Executor executor) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.tokenBuilder = Objects.requireNonNull(tokenBuilder, "tokenBuilder");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Signs an arbitrary payload. The resolved signing key id becomes the {@code kid} claim unless
     * {@code options} already names one.
     */
    public CompletableFuture<String> sign(Map<String, ?> payload, SigningOptions options) {
        SigningOptions effective = options != null ? options : SigningOptions.defaults();
        String keyId;
        try {
            keyId = KeyResolver.resolveKeyId(defaults, effective);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        SigningOptions tokenOptions = effective.getKid() != null ? effective : effective.toBuilder().kid(keyId).build();
        return resolveKey(effective)
                .thenCompose(key -> tokenBuilder.sign(payload, key, tokenOptions));
    }

    public CompletableFuture<String> signPlaybackId(String playbackId) {
        return signPlaybackId(playbackId, TokenType.VIDEO, JwtSignOptions.defaults());
    }

    public CompletableFuture<String> signPlaybackId(String playbackId, TokenType type, JwtSignOptions options) {
        return signSubject(playbackId, type.getAudience(), options);
    }

    /**
     * Signs one token per requested type with a single key lookup. The result keeps the request order.
     */
    public CompletableFuture<Map<TokenType, String>> signPlaybackIds(String playbackId,
                                                                    List<TokenRequest> requests,
                                                                    JwtSignOptions options) {
        Objects.requireNonNull(requests, "requests");
        JwtSignOptions effective = options != null ? options : JwtSignOptions.defaults();
        String keyId;
        try {
            keyId = KeyResolver.resolveKeyId(defaults, effective);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return resolveKey(effective).thenApply(key -> {
            Map<TokenType, String> tokens = new LinkedHashMap<>();
            for (TokenRequest request : requests) {
                Map<String, Object> params = request.params() != null ? request.params() : effective.getParams();
                LOGGER.debug("Signing {} token for playback id {} with key {}", request.type(), playbackId, keyId);
                tokens.put(request.type(), tokenBuilder.signNow(params, key,
                        tokenOptions(keyId, playbackId, request.type().getAudience(), effective)));
            }
            return tokens;
        });
    }

    public CompletableFuture<String> signDrmLicense(String playbackId, JwtSignOptions options) {
        return signPlaybackId(playbackId, TokenType.DRM_LICENSE, options);
    }

    public CompletableFuture<String> signViewerCounts(String id, ViewerCountType type, JwtSignOptions options) {
        return signSubject(id, type.getAudience(), options);
    }

    /**
     * Parses key material once so it can be passed as {@code keySecret} to many calls.
     *
     * @throws com.mux.sdk.crypto.KeyFormatException if the material is not a supported key format
     */
    public KeyHandle importKey(KeyMaterial material) {
        return KeyNormalizer.normalize(material);
    }

    public KeyHandle importKey(String pem) {
        return importKey(KeyMaterial.text(pem));
    }

    private CompletableFuture<String> signSubject(String subject, String audience, JwtSignOptions options) {
        JwtSignOptions effective = options != null ? options : JwtSignOptions.defaults();
        String keyId;
        try {
            keyId = KeyResolver.resolveKeyId(defaults, effective);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        LOGGER.debug("Signing {} token for {} with key {}", audience, subject, keyId);
        SigningOptions tokenOptions = tokenOptions(keyId, subject, audience, effective);
        return resolveKey(effective)
                .thenCompose(key -> tokenBuilder.sign(effective.getParams(), key, tokenOptions));
    }

    private CompletableFuture<KeyHandle> resolveKey(KeyOptions options) {
        try {
            return KeyNormalizer.resolvePrivateKey(defaults, options, executor);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static SigningOptions tokenOptions(String keyId, String subject, String audience, JwtSignOptions options) {
        return SigningOptions.builder()
                .kid(keyId)
                .subject(subject)
                .audience(audience)
                .expiresIn(options.getExpiration())
                .algorithm(SigningOptions.DEFAULT_ALGORITHM)
                .build();
    }
}
