package com.di.compliance.exception;

/**
 * Root of the pipeline's unchecked exceptions.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
