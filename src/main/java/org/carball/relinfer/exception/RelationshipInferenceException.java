package org.carball.relinfer.exception;

public class RelationshipInferenceException extends RuntimeException {

    public RelationshipInferenceException(String message) {
        super(message);
    }

    public RelationshipInferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
