package io.sheetcompiler.core.config;

/**
 * Thrown when converter configuration cannot be loaded: missing file, invalid YAML, or a
 * value the converter rejects.
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
