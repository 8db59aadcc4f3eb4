package com.di.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Domain model for the {@code documents} table.
 *
 * <p>One row per distinct content checksum. Created on first sighting of the checksum and
 * never mutated afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRecord {

    private Long       id;
    private SourceKind sourceKind;
    private String     filename;
    private String     storagePath;
    private String     checksum;
    private Long       sizeBytes;
    private Instant    receivedAt;

    /** JSON object text. */
    private String     metadata;
}
