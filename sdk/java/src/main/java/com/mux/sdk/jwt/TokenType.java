package com.mux.sdk.jwt;

/**
 * Kinds of playback tokens, with the audience code each one carries and the name used when
 * several tokens are signed together.
 */
public enum TokenType {
    VIDEO("v", "playback-token"),
    THUMBNAIL("t", "thumbnail-token"),
    GIF("g", "gif-token"),
    STORYBOARD("s", "storyboard-token"),
    STATS("playback_id", "stats-token"),
    DRM_LICENSE("d", "drm-token");

    private final String audience;
    private final String tokenName;

    TokenType(String audience, String tokenName) {
        this.audience = audience;
        this.tokenName = tokenName;
    }

    public String getAudience() {
        return audience;
    }

    public String getTokenName() {
        return tokenName;
    }
}
