package com.di.compliance.pipeline;

/**
 * Result of one extracted row. {@code reason} is set for rejected rows only.
 */
public record RowOutcome(Kind kind, Long recordId, String reason) {

    public enum Kind {
        /** Written by this run. */
        INSERTED,
        /** Natural key already persisted; counted as succeeded. */
        ALREADY_PRESENT,
        REJECTED
    }

    static RowOutcome inserted(long recordId) {
        return new RowOutcome(Kind.INSERTED, recordId, null);
    }

    static RowOutcome alreadyPresent(long recordId) {
        return new RowOutcome(Kind.ALREADY_PRESENT, recordId, null);
    }

    static RowOutcome rejected(String reason) {
        return new RowOutcome(Kind.REJECTED, null, reason);
    }

    public boolean succeeded() {
        return kind != Kind.REJECTED;
    }
}
