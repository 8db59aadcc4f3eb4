package com.di.compliance.tracking;

import com.di.compliance.config.IngestionProperties;
import com.di.compliance.model.ProcessingRun;
import com.di.compliance.model.ProcessingStage;
import com.di.compliance.model.RunStatus;
import com.di.compliance.util.ErrorCategory;
import com.di.compliance.util.JsonMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;

/**
 * Writes the audit trail: one {@code processing_runs} row per attempted stage.
 *
 * <p>Runs are written outside any document transaction, so the record of a stage survives the
 * rollback of that stage's data. A run is inserted as RUNNING by {@link #start} and finalized exactly
 * once by {@link #complete}, {@link #fail} or {@link #rollBack}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunTracker {

    private final ProcessingRunRepository runs;
    private final IngestionProperties properties;

    public StageRun start(ProcessingStage stage, Long documentId) {
        Instant now = Instant.now();
        long id = runs.insertStarted(documentId, stage, now);
        IngestionProperties.ErrorDigest bounds = properties.getErrorDigest();
        log.debug("[RUN] started runId={} stage={} documentId={}", id, stage, documentId);
        return new StageRun(id, stage, documentId, now, new ErrorDigest(bounds.getMaxEntries(), bounds.getMaxLength()));
    }

    /**
     * Finalizes a row-oriented stage with the status its counters imply.
     */
    public ProcessingRun complete(StageRun run) {
        RunStatus status = RunStatus.fromCounters(run.getSucceeded(), run.getFailed());
        return finish(run, status, run.getDigest().render());
    }

    /**
     * Finalizes a stage that failed as a whole (nothing could be derived from the document).
     */
    public ProcessingRun fail(StageRun run, Throwable cause) {
        ErrorCategory category = ErrorCategory.categorize(cause);
        run.putMetadata("errorCategory", category.name());
        run.getDigest().addFirst(message(cause));
        return finish(run, RunStatus.FAILED, run.getDigest().render());
    }

    /**
     * Finalizes a stage whose transaction was rolled back: nothing it wrote survives.
     */
    public ProcessingRun rollBack(StageRun run, Throwable cause) {
        ErrorCategory category = ErrorCategory.categorize(cause);
        run.putMetadata("errorCategory", category.name());
        run.putMetadata("rolledBack", true);
        run.rollBack("Rolled back after " + category.getName().toLowerCase(Locale.ROOT) + ": " + message(cause));
        return finish(run, RunStatus.FAILED, run.getDigest().render());
    }

    private ProcessingRun finish(StageRun run, RunStatus status, String errorMessage) {
        run.markFinalized();
        ProcessingRun record = ProcessingRun.builder()
                .id(run.getRunId())
                .documentId(run.getDocumentId())
                .stage(run.getStage())
                .status(status)
                .errorMessage(errorMessage)
                .rowsAttempted(run.getAttempted())
                .rowsSucceeded(run.getSucceeded())
                .rowsFailed(run.getFailed())
                .startedAt(run.getStartedAt())
                .finishedAt(Instant.now())
                .metadata(JsonMetadata.toJson(run.getMetadata()))
                .build();
        if (!runs.finalizeRun(record)) {
            throw new IllegalStateException("Processing run " + run.getRunId() + " was already finalized");
        }
        log.info("[RUN] runId={} documentId={} stage={} status={} attempted={} succeeded={} failed={}",
                record.getId(), record.getDocumentId(), record.getStage(), status,
                record.getRowsAttempted(), record.getRowsSucceeded(), record.getRowsFailed());
        return record;
    }

    private static String message(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
