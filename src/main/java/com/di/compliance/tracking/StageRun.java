package com.di.compliance.tracking;

import com.di.compliance.model.ProcessingStage;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-flight state of one started stage: row counters, failure digest and metadata, accumulated by
 * a single worker until {@link RunTracker} finalizes the run.
 */
@Getter
public class StageRun {

    private final long runId;
    private final ProcessingStage stage;
    private final Instant startedAt;
    private final ErrorDigest digest;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private Long documentId;
    private int attempted;
    private int succeeded;
    private int failed;
    private boolean finalized;

    StageRun(long runId, ProcessingStage stage, Long documentId, Instant startedAt, ErrorDigest digest) {
        this.runId = runId;
        this.stage = stage;
        this.documentId = documentId;
        this.startedAt = startedAt;
        this.digest = digest;
    }

    public void attempt() {
        attempted++;
    }

    public void succeed() {
        succeeded++;
    }

    public void fail(String reason) {
        failed++;
        digest.add(reason);
    }

    public void setDocumentId(Long documentId) {
        this.documentId = documentId;
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * Discards the success count after a rollback: every attempted row is now a failure.
     */
    void rollBack(String reason) {
        digest.addFirst(reason);
        succeeded = 0;
        failed = attempted;
    }

    void markFinalized() {
        if (finalized) {
            throw new IllegalStateException("Run " + runId + " (" + stage + ") already finalized");
        }
        finalized = true;
    }
}
