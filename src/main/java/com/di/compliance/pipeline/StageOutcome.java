package com.di.compliance.pipeline;

import com.di.compliance.model.ProcessingRun;
import com.di.compliance.model.ProcessingStage;
import com.di.compliance.model.RunStatus;

/**
 * Caller-facing view of one finalized processing run.
 */
public record StageOutcome(long runId, ProcessingStage stage, RunStatus status,
                           int rowsAttempted, int rowsSucceeded, int rowsFailed, String errorMessage) {

    static StageOutcome of(ProcessingRun run) {
        return new StageOutcome(run.getId(), run.getStage(), run.getStatus(),
                run.getRowsAttempted(), run.getRowsSucceeded(), run.getRowsFailed(), run.getErrorMessage());
    }
}
