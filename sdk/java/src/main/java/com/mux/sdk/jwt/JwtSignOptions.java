package com.mux.sdk.jwt;

import com.mux.sdk.key.KeyHandle;
import com.mux.sdk.key.KeyMaterial;
import com.mux.sdk.key.KeyOptions;

import java.nio.file.Path;
import java.security.PrivateKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options shared by the playback signing helpers on {@link Jwt}.
 */
public final class JwtSignOptions implements KeyOptions {
    public static final String DEFAULT_EXPIRATION = "7d";

    private final String keyId;
    private final KeyMaterial keySecret;
    private final Path keyFilePath;
    private final ClaimTime expiration;
    private final Map<String, Object> params;

    private JwtSignOptions(Builder builder) {
        this.keyId = builder.keyId;
        this.keySecret = builder.keySecret;
        this.keyFilePath = builder.keyFilePath;
        this.expiration = builder.expiration;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
    }

    @Override
    public String getKeyId() {
        return keyId;
    }

    @Override
    public KeyMaterial getKeySecret() {
        return keySecret;
    }

    @Override
    public Path getKeyFilePath() {
        return keyFilePath;
    }

    public ClaimTime getExpiration() {
        return expiration;
    }

    /**
     * Extra claims merged into every token, e.g. {@code time} or {@code width} for thumbnails.
     */
    public Map<String, Object> getParams() {
        return params;
    }

    public static JwtSignOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String keyId;
        private KeyMaterial keySecret;
        private Path keyFilePath;
        private ClaimTime expiration = ClaimTime.in(DEFAULT_EXPIRATION);
        private final Map<String, Object> params = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder keyId(String keyId) {
            this.keyId = keyId;
            return this;
        }

        public Builder keySecret(KeyMaterial keySecret) {
            this.keySecret = keySecret;
            return this;
        }

        public Builder keySecret(String keySecret) {
            return keySecret(keySecret != null ? KeyMaterial.text(keySecret) : null);
        }

        public Builder keySecret(byte[] keySecret) {
            return keySecret(keySecret != null ? KeyMaterial.bytes(keySecret) : null);
        }

        public Builder keySecret(KeyHandle keySecret) {
            return keySecret(keySecret != null ? KeyMaterial.handle(keySecret) : null);
        }

        public Builder keySecret(PrivateKey keySecret) {
            return keySecret(keySecret != null ? KeyMaterial.of(keySecret) : null);
        }

        public Builder keyFilePath(Path keyFilePath) {
            this.keyFilePath = keyFilePath;
            return this;
        }

        /**
         * {@code null} restores the default {@code 7d}.
         */
        public Builder expiration(String span) {
            this.expiration = ClaimTime.in(span != null ? span : DEFAULT_EXPIRATION);
            return this;
        }

        public Builder expiration(Duration expiration) {
            this.expiration = ClaimTime.in(expiration);
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiration = ClaimTime.at(expiresAt);
            return this;
        }

        public Builder param(String name, Object value) {
            this.params.put(name, value);
            return this;
        }

        public Builder params(Map<String, ?> params) {
            this.params.putAll(params);
            return this;
        }

        public JwtSignOptions build() {
            return new JwtSignOptions(this);
        }
    }
}
