package org.carball.relinfer.exception;

/**
 * A single query against the data source failed. Callers analysing one candidate
 * catch it and record the failure on that candidate.
 */
public class DataSourceException extends RelationshipInferenceException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
