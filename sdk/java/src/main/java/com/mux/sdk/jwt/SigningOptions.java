package com.mux.sdk.jwt;

import com.mux.sdk.key.KeyHandle;
import com.mux.sdk.key.KeyMaterial;
import com.mux.sdk.key.KeyOptions;

import java.nio.file.Path;
import java.security.PrivateKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Options for a single {@link TokenBuilder#sign} call. Standard claims that are not set are left
 * out of the token entirely.
 */
public final class SigningOptions implements KeyOptions {
    public static final String DEFAULT_ALGORITHM = "RS256";

    private final String keyId;
    private final KeyMaterial keySecret;
    private final Path keyFilePath;
    private final String algorithm;
    private final String issuer;
    private final String subject;
    private final List<String> audience;
    private final ClaimTime notBefore;
    private final ClaimTime expiresIn;
    private final String kid;

    private SigningOptions(Builder builder) {
        this.keyId = builder.keyId;
        this.keySecret = builder.keySecret;
        this.keyFilePath = builder.keyFilePath;
        this.algorithm = builder.algorithm;
        this.issuer = builder.issuer;
        this.subject = builder.subject;
        this.audience = builder.audience;
        this.notBefore = builder.notBefore;
        this.expiresIn = builder.expiresIn;
        this.kid = builder.kid;
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

    public String getAlgorithm() {
        return algorithm;
    }

    public String getIssuer() {
        return issuer;
    }

    public String getSubject() {
        return subject;
    }

    public List<String> getAudience() {
        return audience;
    }

    public ClaimTime getNotBefore() {
        return notBefore;
    }

    public ClaimTime getExpiresIn() {
        return expiresIn;
    }

    /**
     * Value of the {@code kid} claim placed in the token body.
     */
    public String getKid() {
        return kid;
    }

    public static SigningOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.keyId = keyId;
        builder.keySecret = keySecret;
        builder.keyFilePath = keyFilePath;
        builder.algorithm = algorithm;
        builder.issuer = issuer;
        builder.subject = subject;
        builder.audience = audience;
        builder.notBefore = notBefore;
        builder.expiresIn = expiresIn;
        builder.kid = kid;
        return builder;
    }

    public static final class Builder {
        private String keyId;
        private KeyMaterial keySecret;
        private Path keyFilePath;
        private String algorithm;
        private String issuer;
        private String subject;
        private List<String> audience;
        private ClaimTime notBefore;
        private ClaimTime expiresIn;
        private String kid;

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

        public Builder algorithm(String algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder audience(String... audience) {
            return audience(audience != null ? Arrays.asList(audience) : null);
        }

        public Builder audience(List<String> audience) {
            this.audience = audience != null ? List.copyOf(audience) : null;
            return this;
        }

        public Builder notBefore(ClaimTime notBefore) {
            this.notBefore = notBefore;
            return this;
        }

        public Builder notBefore(String span) {
            return notBefore(span != null ? ClaimTime.in(span) : null);
        }

        public Builder notBefore(Instant notBefore) {
            return notBefore(notBefore != null ? ClaimTime.at(notBefore) : null);
        }

        public Builder expiresIn(ClaimTime expiresIn) {
            this.expiresIn = expiresIn;
            return this;
        }

        public Builder expiresIn(String span) {
            return expiresIn(span != null ? ClaimTime.in(span) : null);
        }

        public Builder expiresIn(Duration expiresIn) {
            return expiresIn(expiresIn != null ? ClaimTime.in(expiresIn) : null);
        }

        public Builder expiresAt(Instant expiresAt) {
            return expiresIn(expiresAt != null ? ClaimTime.at(expiresAt) : null);
        }

        public Builder kid(String kid) {
            this.kid = kid;
            return this;
        }

        public SigningOptions build() {
            return new SigningOptions(this);
        }
    }
}
