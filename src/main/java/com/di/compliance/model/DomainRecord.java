package com.di.compliance.model;

/**
 * A typed, normalized business record ready for persistence.
 */
public interface DomainRecord {

    RecordType getRecordType();

    /** Business-unique identifier used for row-level idempotency. */
    String getNaturalKey();

    Long getDocumentId();

    void setDocumentId(Long documentId);
}
