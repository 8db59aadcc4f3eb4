package com.di.compliance.pipeline;

import com.di.compliance.config.IngestionProperties;
import com.di.compliance.exception.ExtractionException;
import com.di.compliance.extract.DocumentExtractor;
import com.di.compliance.extract.ExtractedRow;
import com.di.compliance.extract.ExtractorRegistry;
import com.di.compliance.model.ProcessingRun;
import com.di.compliance.model.ProcessingStage;
import com.di.compliance.model.RecordType;
import com.di.compliance.persist.TransactionScopes;
import com.di.compliance.registry.DocumentRegistry;
import com.di.compliance.registry.Registration;
import com.di.compliance.source.RawDocument;
import com.di.compliance.tracking.RunTracker;
import com.di.compliance.tracking.StageRun;
import com.di.compliance.util.ErrorCategory;
import com.di.compliance.util.MdcPropagation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Drives one document through RECEIVE, PARSE and PERSIST and writes a processing run for each
 * stage it reaches.
 *
 * <ul>
 *   <li>RECEIVE: checksum registration. Any failure ends the document with a FAILED run and no document id.</li>
 *   <li>PARSE: extractor selection and classification. Any failure ends the document with zero rows attempted.</li>
 *   <li>PERSIST: normalize, validate and insert row by row in source order, in one transaction. Row
 *       failures are counted; any other exception rolls the transaction back and every attempted row
 *       is reported as failed.</li>
 * </ul>
 *
 * Exceptions never leave {@link #ingest} for document-level failures, so one bad document cannot stop
 * a batch. Only a failure to write the audit trail itself propagates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionOrchestrator {

    private final DocumentRegistry registry;
    private final ExtractorRegistry extractors;
    private final RowProcessor rowProcessor;
    private final RunTracker runTracker;
    private final TransactionScopes transactions;
    private final IngestionProperties properties;

    public IngestionResult ingest(RawDocument document) {
        String filename = document.filename();
        List<StageOutcome> stages = new ArrayList<>();

        try (MDC.MDCCloseable ignored = MdcPropagation.documentScope(filename)) {
            log.info("[PIPELINE] ingest file={} sourceKind={} path={}",
                    filename, document.sourceKind(), document.storagePath());

            // ---- RECEIVE ---------------------------------------------------
            StageRun receive = runTracker.start(ProcessingStage.RECEIVE, null);
            receive.putMetadata("filename", filename);
            receive.putMetadata("sourceKind", document.sourceKind().name());
            Registration registration;
            try {
                registration = registry.register(document);
            } catch (RuntimeException e) {
                log.error("[PIPELINE] registration failed file={} category={}",
                        filename, ErrorCategory.categorize(e), e);
                stages.add(StageOutcome.of(runTracker.fail(receive, e)));
                return new IngestionResult(filename, null, false, stages);
            }
            long documentId = registration.documentId();
            MdcPropagation.setDocumentId(documentId);
            receive.setDocumentId(documentId);
            receive.putMetadata("duplicate", !registration.isNew());
            receive.putMetadata("checksum", registration.checksum());
            stages.add(StageOutcome.of(runTracker.complete(receive)));

            if (!registration.isNew() && properties.isSkipKnownDocuments()) {
                StageRun skipped = runTracker.start(ProcessingStage.PERSIST, documentId);
                skipped.putMetadata("skipped", "already-registered");
                stages.add(StageOutcome.of(runTracker.complete(skipped)));
                log.info("[PIPELINE] known document skipped file={} documentId={}", filename, documentId);
                return new IngestionResult(filename, documentId, false, stages);
            }

            // ---- PARSE -----------------------------------------------------
            StageRun parse = runTracker.start(ProcessingStage.PARSE, documentId);
            parse.putMetadata("filename", filename);
            parse.putMetadata("sourceKind", document.sourceKind().name());
            Stream<ExtractedRow> rows;
            try {
                DocumentExtractor extractor = extractors.getExtractor(document.sourceKind(), filename);
                parse.putMetadata("extractor", extractor.getClass().getSimpleName());
                rows = extractor.extract(document);
            } catch (ExtractionException e) {
                parse.putMetadata("reason", e.getReason().name());
                log.error("[PIPELINE] extraction failed file={} reason={}: {}", filename, e.getReason(), e.getMessage());
                stages.add(StageOutcome.of(runTracker.fail(parse, e)));
                return new IngestionResult(filename, documentId, registration.isNew(), stages);
            } catch (RuntimeException e) {
                log.error("[PIPELINE] extractor failed file={} category={}",
                        filename, ErrorCategory.categorize(e), e);
                stages.add(StageOutcome.of(runTracker.fail(parse, e)));
                return new IngestionResult(filename, documentId, registration.isNew(), stages);
            }
            stages.add(StageOutcome.of(runTracker.complete(parse)));

            // ---- NORMALIZE + VALIDATE + PERSIST ----------------------------
            stages.add(StageOutcome.of(persist(rows, documentId, filename)));

            IngestionResult result = new IngestionResult(filename, documentId, registration.isNew(), stages);
            log.info("[PIPELINE] done file={} documentId={} new={} status={} attempted={} succeeded={} failed={}",
                    filename, documentId, result.isNew(), result.status(),
                    result.rowsAttempted(), result.rowsSucceeded(), result.rowsFailed());
            return result;
        } finally {
            MdcPropagation.clearDocumentId();
        }
    }

    private ProcessingRun persist(Stream<ExtractedRow> rows, long documentId, String filename) {
        StageRun run = runTracker.start(ProcessingStage.PERSIST, documentId);
        run.putMetadata("filename", filename);
        PersistTally tally = new PersistTally();

        try (rows) {
            transactions.getDocument().executeWithoutResult(status ->
                    rows.forEachOrdered(row -> {
                        run.attempt();
                        if (row.recordType() != null) {
                            tally.recordTypes.add(row.recordType());
                        }
                        RowOutcome outcome = rowProcessor.process(row, documentId);
                        switch (outcome.kind()) {
                            case INSERTED -> {
                                tally.inserted++;
                                run.succeed();
                            }
                            case ALREADY_PRESENT -> {
                                tally.alreadyPresent++;
                                run.succeed();
                            }
                            case REJECTED -> run.fail(outcome.reason());
                        }
                    }));
        } catch (RuntimeException e) {
            log.error("[PIPELINE] persist rolled back file={} category={} after {} row(s)",
                    filename, ErrorCategory.categorize(e), run.getAttempted(), e);
            tally.writeTo(run);
            return runTracker.rollBack(run, e);
        }
        tally.writeTo(run);
        return runTracker.complete(run);
    }

    /**
     * Split of the succeeded rows, kept for the run metadata.
     */
    private static final class PersistTally {
        private final Set<RecordType> recordTypes = EnumSet.noneOf(RecordType.class);
        private int inserted;
        private int alreadyPresent;

        void writeTo(StageRun run) {
            run.putMetadata("recordTypes", recordTypes.stream().map(Enum::name).toList());
            run.putMetadata("inserted", inserted);
            run.putMetadata("alreadyPresent", alreadyPresent);
        }
    }
}
