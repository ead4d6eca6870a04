package com.mux.sdk.jwt;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Base64;
import java.util.Map;

/**
 * Reads the segments of a compact JWT without verifying its signature.
 */
public final class JwtUtils {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private JwtUtils() {
    }

    public static Map<String, Object> decodeHeader(String jwt) {
        return decodeSegment(split(jwt)[0], "header");
    }

    public static Map<String, Object> decodeClaims(String jwt) {
        return decodeSegment(split(jwt)[1], "payload");
    }

    public static String extractSubject(String jwt) {
        Object sub = decodeClaims(jwt).get("sub");
        if (sub == null || sub.toString().isBlank()) {
            throw new IllegalArgumentException("JWT does not contain sub claim");
        }
        return sub.toString();
    }

    private static String[] split(String jwt) {
        if (jwt == null || jwt.isBlank()) {
            throw new IllegalArgumentException("JWT must not be null or empty");
        }
        String[] parts = jwt.split("\\.");
        if (parts.length < 2) {
            throw new IllegalArgumentException("Invalid JWT format");
        }
        return parts;
    }

    private static Map<String, Object> decodeSegment(String segment, String name) {
        try {
            byte[] decoded = Base64.getUrlDecoder().decode(normalize(segment));
            return OBJECT_MAPPER.readValue(decoded, MAP_TYPE);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to parse JWT " + name, e);
        }
    }

    private static String normalize(String value) {
        int padding = 4 - (value.length() % 4);
        if (padding == 4) {
            return value;
        }
        StringBuilder builder = new StringBuilder(value);
        for (int i = 0; i < padding; i++) {
            builder.append('=');
        }
        return builder.toString();
    }
}
