package com.di.compliance.extract;

import com.di.compliance.config.IngestionProperties;
import com.di.compliance.exception.ExtractionException;
import com.di.compliance.model.RecordType;
import com.di.compliance.model.SourceKind;
import com.di.compliance.source.RawDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Single field mapping inferred from the text of a generated or scanned report.
 *
 * <p>Steps: read the full text, classify the record type, apply the labeled patterns of that type,
 * then check confidence. An extraction is accepted only with a natural key and at least
 * {@code compliance.ingestion.unstructured.minimum-fields} non-blank fields (natural key included).
 * The natural key falls back to the filename stem ({@code NCR-2024-017.pdf}) when no label carries it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnstructuredTextExtractor implements DocumentExtractor {

    /** Letters, digits, dashes and underscores with at least one digit: looks like a business key. */
    private static final Pattern KEY_LIKE_STEM = Pattern.compile("(?=.*\\d)[A-Za-z0-9][A-Za-z0-9_-]*");

    private final TextReader textReader;
    private final DocumentClassifier classifier;
    private final IngestionProperties properties;

    @Override
    public Set<SourceKind> supportedKinds() {
        return Set.of(SourceKind.UNSTRUCTURED);
    }

    @Override
    public Stream<ExtractedRow> extract(RawDocument document) {
        String filename = document.filename();
        String text = textReader.read(document);
        IngestionProperties.Unstructured limits = properties.getUnstructured();

        boolean hasPrefix = DocumentClassifier.byFilenamePrefix(filename) != null;
        if (!hasPrefix && text.strip().length() < limits.getMinimumTextLength()) {
            throw new ExtractionException(ExtractionException.Reason.LOW_CONFIDENCE, filename,
                    String.format("insufficient text extracted (%d chars)", text.strip().length()));
        }

        RecordType type = classifier.classify(filename, text);
        Map<String, String> fields = new LinkedHashMap<>();
        String keyField = type.getNaturalKeyField();
        fields.put(keyField, null);
        fields.putAll(LabeledFieldPatterns.extract(type, text));

        if (fields.get(keyField) == null) {
            String stem = stem(filename);
            if (KEY_LIKE_STEM.matcher(stem).matches()) {
                fields.put(keyField, stem);
            }
        }
        if (fields.get(keyField) == null) {
            throw new ExtractionException(ExtractionException.Reason.LOW_CONFIDENCE, filename,
                    "no " + keyField + " found in text or filename");
        }

        long found = fields.values().stream().filter(v -> v != null && !v.isBlank()).count();
        if (found < limits.getMinimumFields()) {
            throw new ExtractionException(ExtractionException.Reason.LOW_CONFIDENCE, filename,
                    String.format("only %d field(s) found, %d required", found, limits.getMinimumFields()));
        }

        log.info("[EXTRACT] unstructured file={} recordType={} fields={}", filename, type, found);
        return Stream.of(new ExtractedRow(1, type, fields));
    }

    static String stem(String filename) {
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String name = filename.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
