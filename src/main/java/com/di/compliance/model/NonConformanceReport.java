package com.di.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Non-conformance report (NCR).
 *
 * <p>{@link #linkedInspectionKey} is the inspection's natural key as it appeared in the source;
 * {@link #linkedInspectionId} is the resolved row identity, or null when that inspection has not
 * been ingested (yet).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NonConformanceReport implements DomainRecord {

    private Long          id;
    private String        ncrId;
    private Long          documentId;

    // ---- soft reference ----------------------------------------------------
    private String        linkedInspectionKey;
    private Long          linkedInspectionId;

    private String        site;
    private String        supplier;
    private String        partNumber;
    private String        partDescription;
    private NcrSeverity   severity;
    private NcrStatus     status;
    private String        description;
    private String        rootCause;
    private String        correctiveAction;

    // ---- lifecycle ---------------------------------------------------------
    private LocalDateTime openedAt;
    private LocalDateTime reviewedAt;
    private LocalDateTime closedAt;

    @Override
    public RecordType getRecordType() {
        return RecordType.NCR;
    }

    @Override
    public String getNaturalKey() {
        return ncrId;
    }
}
