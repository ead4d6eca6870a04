package com.mux.sdk.client;

import com.mux.sdk.jwt.Jwt;
import com.mux.sdk.jwt.NimbusTokenSigner;
import com.mux.sdk.jwt.TokenBuilder;
import com.mux.sdk.jwt.TokenSigner;

import java.util.Objects;

/**
 * Entry point of the SDK. Configuration is fixed at construction and shared read-only by all calls.
 */
public final class MuxClient {
    private final MuxClientConfig config;
    private final Jwt jwt;

    public MuxClient(MuxClientConfig config) {
        this(config, new NimbusTokenSigner());
    }

    public MuxClient(MuxClientConfig config, TokenSigner signer) {
        this.config = Objects.requireNonNull(config, "config");
        this.jwt = new Jwt(config, new TokenBuilder(signer, config.getClock()), config.getExecutor());
    }

    public static MuxClient fromEnvironment() {
        return new MuxClient(MuxClientConfig.fromEnvironment().build());
    }

    public MuxClientConfig getConfig() {
        return config;
    }

    public Jwt jwt() {
        return jwt;
    }
}
