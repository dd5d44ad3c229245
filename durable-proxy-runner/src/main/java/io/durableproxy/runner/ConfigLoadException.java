package io.durableproxy.runner;

/**
 * Thrown when the runner configuration cannot be loaded: missing file, invalid YAML, or a missing
 * required key.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
