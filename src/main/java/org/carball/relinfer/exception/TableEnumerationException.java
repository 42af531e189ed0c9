package org.carball.relinfer.exception;

/**
 * The data source could not list its tables. Fatal for the whole analysis.
 */
public class TableEnumerationException extends RelationshipInferenceException {

    public TableEnumerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
