package com.di.compliance.extract;

import com.di.compliance.model.SourceKind;
import com.di.compliance.source.RawDocument;

import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns a raw document into field mappings. Implementations share this contract so that
 * everything downstream is format-agnostic.
 *
 * <p>{@link #extract} opens the document eagerly: failure to open, decode or classify it is thrown
 * from the call itself as an {@link com.di.compliance.exception.ExtractionException}. Rows are then
 * produced lazily in source order. The returned stream holds resources and must be closed.
 * Extracting the same bytes again yields the same sequence.
 */
public interface DocumentExtractor {

    /** Source kinds this extractor handles. */
    Set<SourceKind> supportedKinds();

    Stream<ExtractedRow> extract(RawDocument document);
}
