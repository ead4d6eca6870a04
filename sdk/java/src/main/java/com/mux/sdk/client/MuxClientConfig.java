package com.mux.sdk.client;

import com.mux.sdk.key.KeyDefaults;
import com.mux.sdk.key.KeyHandle;
import com.mux.sdk.key.KeyMaterial;
import com.mux.sdk.key.KeyResolver;

import java.net.URI;
import java.security.PrivateKey;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

public final class MuxClientConfig implements KeyDefaults {
    public static final String TOKEN_ID_ENV = "MUX_TOKEN_ID";
    public static final String TOKEN_SECRET_ENV = "MUX_TOKEN_SECRET";
    public static final String BASE_URL_ENV = "MUX_BASE_URL";
    public static final URI DEFAULT_BASE_URI = URI.create("https://api.mux.com");

    private final String tokenId;
    private final String tokenSecret;
    private final URI baseUri;
    private final String jwtSigningKey;
    private final KeyMaterial jwtPrivateKey;
    private final Executor executor;
    private final Clock clock;

    private MuxClientConfig(Builder builder) {
        this.tokenId = builder.tokenId;
        this.tokenSecret = builder.tokenSecret;
        this.baseUri = builder.baseUri;
        this.jwtSigningKey = builder.jwtSigningKey;
        this.jwtPrivateKey = builder.jwtPrivateKey;
        this.executor = builder.executor;
        this.clock = builder.clock;
    }

    public String getTokenId() {
        return tokenId;
    }

    public String getTokenSecret() {
        return tokenSecret;
    }

    public URI getBaseUri() {
        return baseUri;
    }

    @Override
    public String getJwtSigningKey() {
        return jwtSigningKey;
    }

    @Override
    public KeyMaterial getJwtPrivateKey() {
        return jwtPrivateKey;
    }

    public Executor getExecutor() {
        return executor;
    }

    public Clock getClock() {
        return clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Starts a builder from {@code MUX_*} variables. Blank values are ignored; anything set on the
     * returned builder afterwards takes precedence.
     */
    public static Builder fromEnvironment(Map<String, String> env) {
        Builder builder = new Builder();
        String tokenId = value(env, TOKEN_ID_ENV);
        if (tokenId != null) {
            builder.tokenId(tokenId);
        }
        String tokenSecret = value(env, TOKEN_SECRET_ENV);
        if (tokenSecret != null) {
            builder.tokenSecret(tokenSecret);
        }
        String baseUrl = value(env, BASE_URL_ENV);
        if (baseUrl != null) {
            builder.baseUri(URI.create(baseUrl));
        }
        String signingKey = value(env, KeyResolver.SIGNING_KEY_ENV);
        if (signingKey != null) {
            builder.jwtSigningKey(signingKey);
        }
        String privateKey = value(env, KeyResolver.PRIVATE_KEY_ENV);
        if (privateKey != null) {
            builder.jwtPrivateKey(privateKey);
        }
        return builder;
    }

    private static String value(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? null : value;
    }

    public static final class Builder {
        private String tokenId;
        private String tokenSecret;
        private URI baseUri = DEFAULT_BASE_URI;
        private String jwtSigningKey;
        private KeyMaterial jwtPrivateKey;
        private Executor executor = ForkJoinPool.commonPool();
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder tokenId(String tokenId) {
            this.tokenId = tokenId;
            return this;
        }

        public Builder tokenSecret(String tokenSecret) {
            this.tokenSecret = tokenSecret;
            return this;
        }

        public Builder baseUri(URI baseUri) {
            this.baseUri = baseUri;
            return this;
        }

        public Builder jwtSigningKey(String jwtSigningKey) {
            this.jwtSigningKey = jwtSigningKey;
            return this;
        }

        public Builder jwtPrivateKey(KeyMaterial jwtPrivateKey) {
            this.jwtPrivateKey = jwtPrivateKey;
            return this;
        }

        public Builder jwtPrivateKey(String jwtPrivateKey) {
            return jwtPrivateKey(jwtPrivateKey != null ? KeyMaterial.text(jwtPrivateKey) : null);
        }

        public Builder jwtPrivateKey(byte[] jwtPrivateKey) {
            return jwtPrivateKey(jwtPrivateKey != null ? KeyMaterial.bytes(jwtPrivateKey) : null);
        }

        public Builder jwtPrivateKey(KeyHandle jwtPrivateKey) {
            return jwtPrivateKey(jwtPrivateKey != null ? KeyMaterial.handle(jwtPrivateKey) : null);
        }

        public Builder jwtPrivateKey(PrivateKey jwtPrivateKey) {
            return jwtPrivateKey(jwtPrivateKey != null ? KeyMaterial.of(jwtPrivateKey) : null);
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public MuxClientConfig build() {
            Objects.requireNonNull(baseUri, "baseUri");
            Objects.requireNonNull(executor, "executor");
            Objects.requireNonNull(clock, "clock");
            return new MuxClientConfig(this);
        }
    }
}
