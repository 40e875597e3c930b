package com.aerarisk.core.config;

/**
 * Raised when required configuration is absent or invalid.
 *
 * <p>
 * Always thrown before any population data is read.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
