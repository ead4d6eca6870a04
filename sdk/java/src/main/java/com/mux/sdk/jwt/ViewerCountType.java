package com.mux.sdk.jwt;

public enum ViewerCountType {
    VIDEO("video_id"),
    ASSET("asset_id"),
    PLAYBACK("playback_id"),
    LIVE_STREAM("live_stream_id");

    private final String audience;

    ViewerCountType(String audience) {
        this.audience = audience;
    }

    public String getAudience() {
        return audience;
    }
}
