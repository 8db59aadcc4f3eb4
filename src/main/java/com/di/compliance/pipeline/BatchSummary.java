package com.di.compliance.pipeline;

import com.di.compliance.model.RunStatus;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Totals of one folder batch. Filled by a single caller thread after each document is awaited.
 */
@Getter
@ToString(exclude = "results")
public class BatchSummary {

    private int documents;
    private int newDocuments;
    private int knownDocuments;
    private int succeeded;
    private int partial;
    private int failed;
    private int timedOut;

    private long rowsAttempted;
    private long rowsSucceeded;
    private long rowsFailed;

    private final List<IngestionResult> results = new ArrayList<>();
    private final List<String> timedOutFiles = new ArrayList<>();

    void add(IngestionResult result) {
        documents++;
        results.add(result);
        if (result.documentId() != null) {
            if (result.isNew()) {
                newDocuments++;
            } else {
                knownDocuments++;
            }
        }
        RunStatus status = result.status();
        switch (status) {
            case SUCCESS -> succeeded++;
            case PARTIAL -> partial++;
            default -> failed++;
        }
        rowsAttempted += result.rowsAttempted();
        rowsSucceeded += result.rowsSucceeded();
        rowsFailed += result.rowsFailed();
    }

    /** Document whose worker did not answer within the timeout; it may still finish on its own. */
    void addTimedOut(String filename) {
        documents++;
        timedOut++;
        timedOutFiles.add(filename);
    }

    /** Document that failed outside the stage tracking (for example an unreadable path). */
    void addFailed() {
        documents++;
        failed++;
    }

    public List<IngestionResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public List<String> getTimedOutFiles() {
        return Collections.unmodifiableList(timedOutFiles);
    }
}
