package com.mux.sdk.key;

import java.nio.file.Path;

/**
 * Per-call key selection. Any of the values may be {@code null}.
 */
public interface KeyOptions {
    String getKeyId();

    KeyMaterial getKeySecret();

    Path getKeyFilePath();
}
