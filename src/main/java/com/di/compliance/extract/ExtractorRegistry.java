package com.di.compliance.extract;

import com.di.compliance.exception.ExtractionException;
import com.di.compliance.model.SourceKind;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of {@link DocumentExtractor} beans keyed by the source kinds they support.
 *
 * <p>Each source kind must be claimed by exactly one extractor; a second claim fails start-up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractorRegistry {

    private final List<DocumentExtractor> extractors;

    private Map<SourceKind, DocumentExtractor> extractorsByKind;

    /**
     * Discovers, validates and registers all extractors. Called after dependency injection.
     */
    @PostConstruct
    void initialize() {
        if (extractors == null || extractors.isEmpty()) {
            log.warn("No DocumentExtractor beans found. Registry will be empty.");
            extractorsByKind = Collections.emptyMap();
            return;
        }

        Map<SourceKind, List<DocumentExtractor>> grouped = new EnumMap<>(SourceKind.class);
        for (DocumentExtractor extractor : extractors) {
            Set<SourceKind> kinds = extractor.supportedKinds();
            if (kinds == null || kinds.isEmpty()) {
                throw new IllegalStateException(String.format(
                        "Extractor %s declares no supported source kinds", extractor.getClass().getName()));
            }
            kinds.forEach(kind -> grouped.computeIfAbsent(kind, k -> new ArrayList<>()).add(extractor));
            log.info("  - Extractor: {} (kinds={})", extractor.getClass().getSimpleName(), kinds);
        }

        validateNoDuplicates(grouped);

        Map<SourceKind, DocumentExtractor> byKind = new EnumMap<>(SourceKind.class);
        grouped.forEach((kind, list) -> byKind.put(kind, list.get(0)));
        extractorsByKind = Collections.unmodifiableMap(byKind);
        log.info("[EXTRACT] registered extractors for kinds {}", extractorsByKind.keySet());
    }

    /**
     * @throws ExtractionException with reason {@code UNSUPPORTED_SOURCE} when no extractor claims the kind
     */
    public DocumentExtractor getExtractor(SourceKind kind, String filename) {
        DocumentExtractor extractor = kind == null ? null : extractorsByKind.get(kind);
        if (extractor == null) {
            throw new ExtractionException(ExtractionException.Reason.UNSUPPORTED_SOURCE, filename,
                    String.format("no extractor for source kind %s. Available kinds: %s", kind, extractorsByKind.keySet()));
        }
        return extractor;
    }

    public Set<SourceKind> getRegisteredKinds() {
        return extractorsByKind.keySet();
    }

    private static void validateNoDuplicates(Map<SourceKind, List<DocumentExtractor>> grouped) {
        String detail = grouped.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> String.format("'%s' -> [%s]", e.getKey(), e.getValue().stream()
                        .map(x -> x.getClass().getName())
                        .collect(Collectors.joining(", "))))
                .collect(Collectors.joining(" ; "));
        if (!detail.isEmpty()) {
            throw new IllegalStateException("Duplicate DocumentExtractor source kinds detected: " + detail);
        }
    }
}
