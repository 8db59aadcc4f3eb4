package com.di.compliance.exception;

/**
 * The document could not be read or recorded in the registry. Fatal to the document.
 */
public class DocumentRegistrationException extends IngestionException {

    public DocumentRegistrationException(String message) {
        super(message);
    }

    public DocumentRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
