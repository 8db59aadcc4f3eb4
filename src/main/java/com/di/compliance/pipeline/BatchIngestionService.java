package com.di.compliance.pipeline;

import com.di.compliance.config.IngestionProperties;
import com.di.compliance.exception.IngestionException;
import com.di.compliance.model.ProcessingStage;
import com.di.compliance.source.InboundFolderScanner;
import com.di.compliance.source.RawDocument;
import com.di.compliance.tracking.RunTracker;
import com.di.compliance.tracking.StageRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ingests a set of documents on the worker pool, one document per task.
 *
 * <p>Documents do not share state beyond the store, so they run in parallel; rows within a document
 * stay in source order because one worker owns the whole document. The caller waits for each document
 * with the configured timeout, measured from the moment it starts waiting for that document. A
 * document that exceeds it is abandoned: its worker is not interrupted and still finalizes its runs.
 */
@Slf4j
@Service
public class BatchIngestionService {

    private final IngestionOrchestrator orchestrator;
    private final InboundFolderScanner scanner;
    private final ExecutorService executor;
    private final RunTracker runTracker;
    private final IngestionProperties properties;

    public BatchIngestionService(IngestionOrchestrator orchestrator,
                                 InboundFolderScanner scanner,
                                 @Qualifier("ingestionExecutor") ExecutorService executor,
                                 RunTracker runTracker,
                                 IngestionProperties properties) {
        this.orchestrator = orchestrator;
        this.scanner = scanner;
        this.executor = executor;
        this.runTracker = runTracker;
        this.properties = properties;
    }

    /**
     * Scans the configured inbound folder and ingests every matching file.
     */
    public BatchSummary ingestFolder() {
        return ingestPaths(scanner.scan());
    }

    public BatchSummary ingestFolder(Path folder) {
        return ingestPaths(scanner.scan(folder));
    }

    private BatchSummary ingestPaths(List<Path> paths) {
        List<RawDocument> documents = new ArrayList<>(paths.size());
        int unusable = 0;
        for (Path path : paths) {
            try {
                documents.add(RawDocument.ofPath(path));
            } catch (IllegalArgumentException e) {
                log.error("[BATCH] skipping file={}: {}", path, e.getMessage());
                StageRun receive = runTracker.start(ProcessingStage.RECEIVE, null);
                receive.putMetadata("filename", path.getFileName().toString());
                receive.putMetadata("path", path.toAbsolutePath().toString());
                runTracker.fail(receive, e);
                unusable++;
            }
        }
        BatchSummary summary = ingestAll(documents);
        for (int i = 0; i < unusable; i++) {
            summary.addFailed();
        }
        return summary;
    }

    public BatchSummary ingestAll(List<RawDocument> documents) {
        long timeoutMillis = properties.getDocumentTimeout().toMillis();
        log.info("[BATCH] start documents={} timeoutMs={}", documents.size(), timeoutMillis);

        List<CompletableFuture<IngestionResult>> futures = new ArrayList<>(documents.size());
        for (RawDocument document : documents) {
            futures.add(CompletableFuture.supplyAsync(() -> orchestrator.ingest(document), executor));
        }

        BatchSummary summary = new BatchSummary();
        for (int i = 0; i < futures.size(); i++) {
            String filename = documents.get(i).filename();
            try {
                summary.add(futures.get(i).get(timeoutMillis, TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                log.error("[BATCH] document abandoned after {} ms file={}", timeoutMillis, filename);
                summary.addTimedOut(filename);
            } catch (ExecutionException e) {
                log.error("[BATCH] document failed outside stage tracking file={}", filename, e.getCause());
                summary.addFailed();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IngestionException("Batch interrupted while waiting for " + filename, e);
            }
        }

        log.info("[BATCH] done {}", summary);
        return summary;
    }
}
