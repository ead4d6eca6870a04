package com.mux.sdk.key;

import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.util.Arrays;
import java.util.Objects;

/**
 * Private key material as supplied by a caller or by client configuration, before it is
 * normalized into a {@link KeyHandle}. The shape is decided once, when the material enters the SDK,
 * through the factory methods below; {@link KeyNormalizer} rejects any other implementation.
 */
public interface KeyMaterial {

    static KeyMaterial text(String text) {
        return new TextPem(text);
    }

    static KeyMaterial bytes(byte[] bytes) {
        return new RawBytes(bytes);
    }

    static KeyMaterial handle(KeyHandle handle) {
        return new PreParsedHandle(handle);
    }

    static KeyMaterial of(PrivateKey privateKey) {
        return new PreParsedHandle(KeyHandle.of(privateKey));
    }

    /**
     * PEM text, or base64 of PEM text.
     */
    record TextPem(String text) implements KeyMaterial {
        public TextPem {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String toString() {
            return "TextPem[redacted]";
        }
    }

    /**
     * DER encoded PKCS#1 key, or the bytes of a PEM file.
     */
    record RawBytes(byte[] bytes) implements KeyMaterial {
        public RawBytes {
            Objects.requireNonNull(bytes, "bytes");
            bytes = bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        boolean looksLikePem() {
            byte[] prefix = "-----BEGIN".getBytes(StandardCharsets.US_ASCII);
            int offset = 0;
            while (offset < bytes.length && Character.isWhitespace(bytes[offset])) {
                offset++;
            }
            if (bytes.length - offset < prefix.length) {
                return false;
            }
            for (int i = 0; i < prefix.length; i++) {
                if (bytes[offset + i] != prefix[i]) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RawBytes other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "RawBytes[" + bytes.length + " bytes]";
        }
    }

    record PreParsedHandle(KeyHandle handle) implements KeyMaterial {
        public PreParsedHandle {
            Objects.requireNonNull(handle, "handle");
        }
    }
}
