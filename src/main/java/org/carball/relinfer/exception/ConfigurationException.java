package org.carball.relinfer.exception;

/**
 * Invalid or missing configuration. Fatal: raised before any output is produced.
 */
public class ConfigurationException extends RelationshipInferenceException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
