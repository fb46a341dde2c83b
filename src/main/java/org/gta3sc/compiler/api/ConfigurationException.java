package org.gta3sc.compiler.api;

/**
 * Raised when configuration input (dialect settings, command definitions, model tables)
 * is malformed. It is raised before any translation unit starts and is handled by the
 * driver of the run, never by the diagnostics engine.
 */
public class ConfigurationException extends RuntimeException {

    /**
     * @param message The detail message, naming the offending file or path.
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * @param message The detail message, naming the offending file or path.
     * @param cause   The underlying parse or I/O failure.
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
