package com.di.compliance.model;

import java.util.Locale;

/**
 * Declared origin of a raw document. Determines which extractor turns it into rows.
 */
public enum SourceKind {

    /** Delimited text (CSV/TSV, optionally gzip-compressed). */
    TABULAR,
    /** Generated or scanned reports (PDF, plain text) read through labeled-field patterns. */
    UNSTRUCTURED,
    /** Operator-entered spreadsheets exported as delimited text. */
    MANUAL;

    /**
     * Infers the kind from a filename extension, or {@code null} when the extension is not recognised.
     */
    public static SourceKind fromFilename(String filename) {
        if (filename == null) {
            return null;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".csv") || lower.endsWith(".csv.gz") || lower.endsWith(".tsv")
                || lower.endsWith(".tsv.gz")) {
            return TABULAR;
        }
        if (lower.endsWith(".pdf") || lower.endsWith(".txt")) {
            return UNSTRUCTURED;
        }
        return null;
    }
}
