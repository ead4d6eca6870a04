package com.mux.sdk.key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Picks the signing key id and the private key source for one signing call.
 *
 * <p>Key id: explicit option, then the client's {@code jwtSigningKey}. Key material: explicit
 * {@code keySecret}, then {@code keyFilePath}, then the client's {@code jwtPrivateKey}. Exactly one
 * source is consulted; a present but unusable source never falls back to a later one.
 */
public final class KeyResolver {
    public static final String SIGNING_KEY_ENV = "MUX_SIGNING_KEY";
    public static final String PRIVATE_KEY_ENV = "MUX_PRIVATE_KEY";

    static final String MISSING_KEY_ID = "Signing key required; pass a keyId option to jwt().sign*(), "
            + "a jwtSigningKey option to MuxClientConfig, or set the " + SIGNING_KEY_ENV + " environment variable";
    static final String MISSING_PRIVATE_KEY = "Private key required; pass a keySecret or keyFilePath option to "
            + "jwt().sign*(), a jwtPrivateKey option to MuxClientConfig, or set the " + PRIVATE_KEY_ENV
            + " environment variable";

    private static final Logger LOGGER = LoggerFactory.getLogger(KeyResolver.class);

    private KeyResolver() {
    }

    public static String resolveKeyId(KeyDefaults defaults, KeyOptions options) {
        String keyId = options != null ? options.getKeyId() : null;
        if (isPresent(keyId)) {
            return keyId;
        }
        keyId = defaults != null ? defaults.getJwtSigningKey() : null;
        if (isPresent(keyId)) {
            return keyId;
        }
        throw new ConfigurationException(MISSING_KEY_ID);
    }

    /**
     * Returns the raw key material from the first present source. A {@code keyFilePath} is read as
     * UTF-8 text on {@code executor}; a failed read completes the future with the original
     * {@link IOException}.
     */
    public static CompletableFuture<KeyMaterial> resolveKeyMaterial(KeyDefaults defaults,
                                                                    KeyOptions options,
                                                                    Executor executor) {
        if (options != null && isPresent(options.getKeySecret())) {
            LOGGER.debug("Using private key passed as keySecret");
            return CompletableFuture.completedFuture(options.getKeySecret());
        }
        if (options != null && options.getKeyFilePath() != null) {
            return readKeyFile(options.getKeyFilePath(), executor);
        }
        if (defaults != null && isPresent(defaults.getJwtPrivateKey())) {
            LOGGER.debug("Using client jwtPrivateKey");
            return CompletableFuture.completedFuture(defaults.getJwtPrivateKey());
        }
        return CompletableFuture.failedFuture(new ConfigurationException(MISSING_PRIVATE_KEY));
    }

    private static CompletableFuture<KeyMaterial> readKeyFile(Path path, Executor executor) {
        LOGGER.debug("Reading private key from {}", path);
        CompletableFuture<KeyMaterial> future = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                future.complete(KeyMaterial.text(Files.readString(path, StandardCharsets.UTF_8)));
            } catch (IOException | RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }

    // empty text counts as no key, like an empty key id
    private static boolean isPresent(KeyMaterial material) {
        if (material instanceof KeyMaterial.TextPem text) {
            return !text.text().isEmpty();
        }
        return material != null;
    }
}
