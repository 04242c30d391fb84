package net.relaytrace.Config;

/**
 * Thrown when a tracing configuration is invalid. Raised at build or startup time so a
 * bad configuration fails fast instead of silently misbehaving.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
