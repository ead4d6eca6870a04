package com.mux.sdk.key;

/**
 * Neither the call nor the client configuration supplies a required signing value.
 */
public final class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }
}
