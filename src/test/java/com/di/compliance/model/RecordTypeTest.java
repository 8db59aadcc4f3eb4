package com.di.compliance.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordType Tests")
class RecordTypeTest {

    // ============================================================================
    // fromFilename
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
        "inspections_q1.csv, INSPECTION",
        "ncr_log.csv, NCR",
        "maintenance.tsv.gz, MAINTENANCE",
        "ncr_inspection_links.csv, NCR",
        "inspection_ncr_links.csv, INSPECTION",
        "maintenance_inspection_plan.csv, MAINTENANCE",
        "q1_inspections.csv, INSPECTION",
        "/data/raw/ncr/2024_NCR_export.csv, NCR"
    })
    @DisplayName("Leading hint wins, otherwise a single hint anywhere")
    void testFromFilename(String filename, RecordType expected) {
        assertEquals(Optional.of(expected), RecordType.fromFilename(filename));
    }

    @ParameterizedTest
    @ValueSource(strings = {"export.csv", "q1_ncr_inspection_links.csv", "inspections/export.csv"})
    @DisplayName("No hint or several non-leading hints name no type")
    void testFromFilename_NoType(String filename) {
        assertTrue(RecordType.fromFilename(filename).isEmpty());
    }

    @Test
    @DisplayName("Null filename names no type")
    void testFromFilename_Null() {
        assertTrue(RecordType.fromFilename(null).isEmpty());
    }

    // ============================================================================
    // fromLabel
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
        "inspection, INSPECTION",
        "Non-Conformance, NCR",
        "work order, MAINTENANCE"
    })
    @DisplayName("Record type cells accept common spellings")
    void testFromLabel(String label, RecordType expected) {
        assertEquals(Optional.of(expected), RecordType.fromLabel(label));
    }
}
