package com.di.compliance.extract;

import com.di.compliance.model.RecordType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One semi-structured field mapping produced by an extractor.
 *
 * @param position   1-based row number (header excluded) used in error messages
 * @param recordType entity the row describes; null when a per-row type cell was missing or unknown
 * @param fields     field name to raw text, in source column order
 */
public record ExtractedRow(int position, RecordType recordType, Map<String, String> fields) {

    public ExtractedRow {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Raw text of a field, or null when absent.
     */
    public String get(String field) {
        return fields.get(field);
    }

    public boolean hasValue(String field) {
        String value = fields.get(field);
        return value != null && !value.isBlank();
    }

    public String naturalKey() {
        return recordType == null ? null : get(recordType.getNaturalKeyField());
    }
}
