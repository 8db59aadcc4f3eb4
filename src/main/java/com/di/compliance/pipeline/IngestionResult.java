package com.di.compliance.pipeline;

import com.di.compliance.model.ProcessingStage;
import com.di.compliance.model.RunStatus;

import java.util.List;
import java.util.Optional;

/**
 * What happened to one document: its identity, one outcome per recorded stage in pipeline order,
 * the row counters of the PERSIST stage and the error digest of the stage that decided the result.
 *
 * @param documentId null when registration failed
 * @param isNew      false for a checksum that was already registered
 */
public record IngestionResult(String filename, Long documentId, boolean isNew, List<StageOutcome> stages) {

    public IngestionResult {
        stages = List.copyOf(stages);
    }

    /**
     * Status of the last recorded stage; a document that stops early ends on its failed stage.
     */
    public RunStatus status() {
        return stages.isEmpty() ? RunStatus.FAILED : stages.get(stages.size() - 1).status();
    }

    public Optional<StageOutcome> stage(ProcessingStage stage) {
        return stages.stream().filter(s -> s.stage() == stage).findFirst();
    }

    public int rowsAttempted() {
        return stage(ProcessingStage.PERSIST).map(StageOutcome::rowsAttempted).orElse(0);
    }

    public int rowsSucceeded() {
        return stage(ProcessingStage.PERSIST).map(StageOutcome::rowsSucceeded).orElse(0);
    }

    public int rowsFailed() {
        return stage(ProcessingStage.PERSIST).map(StageOutcome::rowsFailed).orElse(0);
    }

    public String errorDigest() {
        return stages.isEmpty() ? null : stages.get(stages.size() - 1).errorMessage();
    }
}
