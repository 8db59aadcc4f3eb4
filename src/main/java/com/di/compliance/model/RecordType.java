package com.di.compliance.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Business entity a row describes, with its natural key and the fields a row must carry
 * before it is normalized.
 */
public enum RecordType {

    INSPECTION("inspection_id", "inspection",
            List.of("inspection_id", "site", "inspection_date", "result")),
    NCR("ncr_id", "ncr",
            List.of("ncr_id", "site", "severity", "status", "description", "opened_at")),
    MAINTENANCE("event_id", "maintenance",
            List.of("event_id", "site", "machine_id", "event_date"));

    private final String naturalKeyField;
    private final String filenameHint;
    private final List<String> requiredFields;

    RecordType(String naturalKeyField, String filenameHint, List<String> requiredFields) {
        this.naturalKeyField = naturalKeyField;
        this.filenameHint = filenameHint;
        this.requiredFields = requiredFields;
    }

    public String getNaturalKeyField() {
        return naturalKeyField;
    }

    public List<String> getRequiredFields() {
        return requiredFields;
    }

    /**
     * Detects the record type from a tabular filename ({@code inspections_2024.csv} → INSPECTION).
     * A hint that starts the file name wins ({@code ncr_inspection_links.csv} → NCR); otherwise exactly
     * one hint may appear anywhere in the name. Several non-leading hints are ambiguous and give empty.
     */
    public static Optional<RecordType> fromFilename(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String name = filename.substring(slash + 1).toLowerCase(Locale.ROOT);

        RecordType contained = null;
        int hits = 0;
        for (RecordType type : values()) {
            if (name.startsWith(type.filenameHint)) {
                return Optional.of(type);
            }
            if (name.contains(type.filenameHint)) {
                contained = type;
                hits++;
            }
        }
        return hits == 1 ? Optional.of(contained) : Optional.empty();
    }

    /**
     * Parses a per-row {@code record_type} cell. Accepts the constant name and a few common spellings.
     */
    public static Optional<RecordType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String key = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (key) {
            case "INSPECTION", "INSPECTIONS", "INS" -> Optional.of(INSPECTION);
            case "NCR", "NCRS", "NON_CONFORMANCE", "NON_CONFORMANCE_REPORT" -> Optional.of(NCR);
            case "MAINTENANCE", "MAINTENANCE_EVENT", "MNT", "WORK_ORDER" -> Optional.of(MAINTENANCE);
            default -> Optional.empty();
        };
    }
}
