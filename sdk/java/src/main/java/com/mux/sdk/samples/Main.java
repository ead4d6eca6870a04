package com.mux.sdk.samples;

import com.mux.sdk.client.MuxClient;
import com.mux.sdk.jwt.JwtSignOptions;
import com.mux.sdk.jwt.JwtUtils;
import com.mux.sdk.jwt.TokenRequest;
import com.mux.sdk.jwt.TokenType;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Signs playback and thumbnail tokens for a playback id using MUX_SIGNING_KEY and MUX_PRIVATE_KEY.
 */
public final class Main {
    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: Main <playback-id> [expiration]");
            System.exit(2);
        }
        String playbackId = args[0];
        String expiration = args.length > 1 ? args[1] : JwtSignOptions.DEFAULT_EXPIRATION;

        MuxClient client = MuxClient.fromEnvironment();
        JwtSignOptions options = JwtSignOptions.builder()
                .expiration(expiration)
                .build();

        Map<TokenType, String> tokens = client.jwt()
                .signPlaybackIds(playbackId, List.of(
                        TokenRequest.of(TokenType.VIDEO),
                        TokenRequest.of(TokenType.THUMBNAIL, Map.of("time", 10, "width", 640))
                ), options)
                .get(30, TimeUnit.SECONDS);

        for (Map.Entry<TokenType, String> entry : tokens.entrySet()) {
            System.out.printf("%s: %s%n", entry.getKey().getTokenName(), entry.getValue());
        }
        System.out.printf("Signed for subject %s%n", JwtUtils.extractSubject(tokens.get(TokenType.VIDEO)));
    }
}
