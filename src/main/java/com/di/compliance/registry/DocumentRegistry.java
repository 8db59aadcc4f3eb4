package com.di.compliance.registry;

import com.di.compliance.exception.DocumentRegistrationException;
import com.di.compliance.model.DocumentRecord;
import com.di.compliance.model.SourceKind;
import com.di.compliance.source.RawDocument;
import com.di.compliance.util.JsonMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Idempotency boundary of the pipeline: one {@code documents} row per content checksum.
 *
 * <p>Registration is a single-statement insert, so it either commits completely or not at all.
 * The unique checksum constraint serialises concurrent registrations of the same bytes; the
 * worker that loses the race resolves the winner's row by lookup. Unrelated checksums never
 * contend on the same row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentRegistry {

    private final DocumentRepository documents;
    private final ChecksumCalculator checksums;

    /**
     * Registers in-memory bytes.
     */
    public Registration register(byte[] rawBytes, SourceKind sourceKind, String filename) {
        return register(RawDocument.ofBytes(filename, sourceKind, rawBytes));
    }

    /**
     * Computes the checksum of the document and records it exactly once.
     *
     * @return the document identity, with {@code isNew=false} when the checksum was already registered
     * @throws DocumentRegistrationException when the bytes cannot be read or the row cannot be written
     */
    public Registration register(RawDocument document) {
        ContentDigest digest = digest(document);

        try {
            var existing = documents.findByChecksum(digest.checksum());
            if (existing.isPresent()) {
                log.info("[REGISTRY] known document file={} id={} checksum={}",
                        document.filename(), existing.get().getId(), abbreviate(digest.checksum()));
                return new Registration(existing.get().getId(), false, digest.checksum(), digest.sizeBytes());
            }

            DocumentRecord record = DocumentRecord.builder()
                    .sourceKind(document.sourceKind())
                    .filename(document.filename())
                    .storagePath(document.storagePath())
                    .checksum(digest.checksum())
                    .sizeBytes(digest.sizeBytes())
                    .receivedAt(Instant.now())
                    .metadata(JsonMetadata.toJson(metadataFor(document)))
                    .build();
            try {
                long id = documents.insert(record);
                log.info("[REGISTRY] registered file={} id={} bytes={} checksum={}",
                        document.filename(), id, digest.sizeBytes(), abbreviate(digest.checksum()));
                return new Registration(id, true, digest.checksum(), digest.sizeBytes());
            } catch (DuplicateKeyException race) {
                long id = documents.findByChecksum(digest.checksum())
                        .map(DocumentRecord::getId)
                        .orElseThrow(() -> new DocumentRegistrationException(
                                "Checksum reported as duplicate but not found: " + digest.checksum(), race));
                log.info("[REGISTRY] lost registration race file={} id={}", document.filename(), id);
                return new Registration(id, false, digest.checksum(), digest.sizeBytes());
            }
        } catch (DataAccessException e) {
            throw new DocumentRegistrationException(
                    "Failed to register document " + document.filename() + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private ContentDigest digest(RawDocument document) {
        try (InputStream in = document.content().openStream()) {
            return checksums.digest(in);
        } catch (IOException e) {
            throw new DocumentRegistrationException(
                    "Failed to read document " + document.filename() + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> metadataFor(RawDocument document) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("originalFilename", document.filename());
        int dot = document.filename().lastIndexOf('.');
        if (dot >= 0) {
            metadata.put("extension", document.filename().substring(dot + 1).toLowerCase(Locale.ROOT));
        }
        return metadata;
    }

    private static String abbreviate(String checksum) {
        return checksum.length() > 12 ? checksum.substring(0, 12) : checksum;
    }
}
