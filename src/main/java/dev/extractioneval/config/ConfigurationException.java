package dev.extractioneval.config;

import javax.annotation.Nullable;

/**
 * Thrown when evaluation settings are invalid: an unknown comparator identifier, a negative or
 * non-numeric weight, a malformed weight document.
 *
 * <p>Raised while a session is configured or before any field of a document is compared.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
