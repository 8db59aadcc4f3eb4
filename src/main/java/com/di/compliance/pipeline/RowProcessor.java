package com.di.compliance.pipeline;

import com.di.compliance.extract.ExtractedRow;
import com.di.compliance.model.DomainRecord;
import com.di.compliance.model.NonConformanceReport;
import com.di.compliance.model.RecordType;
import com.di.compliance.normalize.NormalizationException;
import com.di.compliance.normalize.RecordNormalizer;
import com.di.compliance.persist.DomainRecordWriter;
import com.di.compliance.persist.TransactionScopes;
import com.di.compliance.validate.RowValidator;
import com.di.compliance.validate.ValidationProblem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Takes one extracted row through validate, normalize, idempotency check, back-reference
 * resolution and insert.
 *
 * <p>Row-level conditions come back as a {@link RowOutcome#rejected rejected} outcome. Anything else
 * (lost connection, failed statement outside a constraint) propagates and is fatal to the document.
 * Must be called inside the document transaction; the insert runs in a nested savepoint so a
 * constraint violation discards only this row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RowProcessor {

    private final RowValidator validator;
    private final RecordNormalizer normalizer;
    private final DomainRecordWriter writer;
    private final TransactionScopes transactions;

    public RowOutcome process(ExtractedRow row, long documentId) {
        int position = row.position();

        List<ValidationProblem> problems = validator.validate(row);
        if (!problems.isEmpty()) {
            return reject(position, RowValidator.describe(problems));
        }

        DomainRecord record;
        try {
            record = normalizer.normalize(row);
        } catch (NormalizationException e) {
            return reject(position, String.format("Row %d: %s", position, e.getMessage()));
        }

        problems = validator.validate(record, position);
        if (!problems.isEmpty()) {
            return reject(position, RowValidator.describe(problems));
        }

        Optional<Long> existing = writer.findExisting(record);
        if (existing.isPresent()) {
            log.debug("[PIPELINE] row={} {} {} already ingested id={}",
                    position, record.getRecordType(), record.getNaturalKey(), existing.get());
            return RowOutcome.alreadyPresent(existing.get());
        }

        if (record instanceof NonConformanceReport ncr && ncr.getLinkedInspectionKey() != null) {
            Long inspectionId = writer.resolve(RecordType.INSPECTION, ncr.getLinkedInspectionKey()).orElse(null);
            ncr.setLinkedInspectionId(inspectionId);
            if (inspectionId == null) {
                log.debug("[PIPELINE] row={} ncr={} references inspection {} not ingested yet",
                        position, ncr.getNcrId(), ncr.getLinkedInspectionKey());
            }
        }

        record.setDocumentId(documentId);
        try {
            Long id = transactions.getRow().execute(status -> writer.insert(record));
            return RowOutcome.inserted(id);
        } catch (DataIntegrityViolationException e) {
            return reject(position, String.format("Row %d: Persistence failed for %s '%s': %s",
                    position, record.getRecordType(), record.getNaturalKey(),
                    e.getMostSpecificCause().getMessage()));
        }
    }

    private static RowOutcome reject(int position, String reason) {
        log.warn("[PIPELINE] row={} rejected: {}", position, reason);
        return RowOutcome.rejected(reason);
    }
}
