package glow.navigator.config;

/**
 * Settings could not be read or are missing a required artifact type.
 */
public class SettingsException extends RuntimeException {

    public SettingsException(String message) {
        super(message);
    }

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
