package com.di.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Domain model for the {@code processing_runs} table: one audit record per attempted stage.
 *
 * <p>Inserted as {@link RunStatus#RUNNING} when the stage starts and finalized exactly once
 * with its terminal status, counters and finish time. Finalized rows are never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingRun {

    private Long            id;

    /** Null when the stage failed before a document could be registered. */
    private Long            documentId;
    private ProcessingStage stage;
    private RunStatus       status;
    private String          errorMessage;

    // ---- row counters ------------------------------------------------------
    private int             rowsAttempted;
    private int             rowsSucceeded;
    private int             rowsFailed;

    // ---- timestamps --------------------------------------------------------
    private Instant         startedAt;
    private Instant         finishedAt;

    /** JSON object text. */
    private String          metadata;
}
