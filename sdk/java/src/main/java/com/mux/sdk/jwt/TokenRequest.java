package com.mux.sdk.jwt;

import java.util.Map;
import java.util.Objects;

/**
 * One entry of {@link Jwt#signPlaybackIds}: the token type and, optionally, claims used only
 * for that token instead of {@link JwtSignOptions#getParams()}.
 */
public record TokenRequest(TokenType type, Map<String, Object> params) {
    public TokenRequest {
        Objects.requireNonNull(type, "type");
        params = params != null ? Map.copyOf(params) : null;
    }

    public static TokenRequest of(TokenType type) {
        return new TokenRequest(type, null);
    }

    public static TokenRequest of(TokenType type, Map<String, Object> params) {
        return new TokenRequest(type, params);
    }
}
