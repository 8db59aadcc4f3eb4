package com.di.compliance.exception;

import lombok.Getter;

import java.util.Locale;

/**
 * No rows could be derived from a document. Fatal to the document, never to the batch.
 */
@Getter
public class ExtractionException extends IngestionException {

    public enum Reason {
        /** Bytes cannot be opened or decoded at all. */
        UNREADABLE,
        /** Neither filename nor content identifies the record type. */
        UNCLASSIFIABLE,
        /** Classification is ambiguous or too few fields were found. */
        LOW_CONFIDENCE,
        /** No extractor is registered for the declared source kind. */
        UNSUPPORTED_SOURCE
    }

    private final Reason reason;
    private final String filename;

    public ExtractionException(Reason reason, String filename, String message) {
        super(format(reason, filename, message));
        this.reason = reason;
        this.filename = filename;
    }

    public ExtractionException(Reason reason, String filename, String message, Throwable cause) {
        super(format(reason, filename, message), cause);
        this.reason = reason;
        this.filename = filename;
    }

    private static String format(Reason reason, String filename, String message) {
        return String.format("%s document '%s': %s", reason.name().toLowerCase(Locale.ROOT).replace('_', '-'), filename, message);
    }
}
