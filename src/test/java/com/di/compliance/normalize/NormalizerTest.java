package com.di.compliance.normalize;

import com.di.compliance.model.InspectionResult;
import com.di.compliance.model.NcrSeverity;
import com.di.compliance.model.NcrStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Normalizer Tests")
class NormalizerTest {

    // ============================================================================
    // Dates and timestamps
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
        "2024-03-15, 2024-03-15",
        "03/15/2024, 2024-03-15",
        "15-03-2024, 2024-03-15",
        "2024/03/15, 2024-03-15",
        "15/03/2024, 2024-03-15",
        "'2024-03-15 08:30:00', 2024-03-15",
        "'  2024-3-5  ', 2024-03-05"
    })
    @DisplayName("Should parse every accepted date layout")
    void testToDate_AcceptedLayouts(String raw, String expected) {
        assertEquals(LocalDate.parse(expected), Normalizer.toDate(raw));
    }

    @Test
    @DisplayName("Month-first wins for ambiguous slash dates")
    void testToDate_AmbiguousSlashDate() {
        assertEquals(LocalDate.of(2024, 3, 4), Normalizer.toDate("03/04/2024"));
        assertEquals(LocalDate.of(2024, 4, 13), Normalizer.toDate("13/04/2024"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    @DisplayName("Blank temporal input is absent")
    void testToDate_Blank(String raw) {
        assertNull(Normalizer.toDate(raw));
        assertNull(Normalizer.toDateTime(raw));
        assertNull(Normalizer.toDate(null));
    }

    @Test
    @DisplayName("Should reject impossible and unknown dates naming the offending text")
    void testToDate_Unparseable() {
        NormalizationException e = assertThrows(NormalizationException.class,
            () -> Normalizer.toDate("2024-02-30"));
        assertEquals(NormalizationException.Condition.UNPARSEABLE_TEMPORAL, e.getCondition());
        assertEquals("2024-02-30", e.getRawValue());
        assertTrue(e.getMessage().contains("2024-02-30"));

        assertThrows(NormalizationException.class, () -> Normalizer.toDate("next tuesday"));
    }

    @ParameterizedTest
    @CsvSource({
        "'2024-03-15 08:30:00', 2024-03-15T08:30:00",
        "2024-03-15T08:30:00, 2024-03-15T08:30:00",
        "'2024-03-15 08:30:00.123456', 2024-03-15T08:30:00.123456",
        "'03/15/2024 08:30:00', 2024-03-15T08:30:00",
        "2024-03-15, 2024-03-15T00:00:00",
        "15/03/2024, 2024-03-15T00:00:00",
        "'2024-03-01 9:30:00', 2024-03-01T09:30:00",
        "'2024-3-1 14:05:00', 2024-03-01T14:05:00",
        "'2024-3-1 14:05:00.5', 2024-03-01T14:05:00.5",
        "'2024-03-01 9:30', 2024-03-01T09:30:00"
    })
    @DisplayName("Should parse timestamps and resolve bare dates to midnight")
    void testToDateTime_AcceptedLayouts(String raw, String expected) {
        assertEquals(LocalDateTime.parse(expected), Normalizer.toDateTime(raw));
    }

    @Test
    @DisplayName("A time of day that cannot be read is an error, not midnight")
    void testToDateTime_BadTimeIsNotDropped() {
        NormalizationException e = assertThrows(NormalizationException.class,
            () -> Normalizer.toDateTime("2024-03-01 25:30:00"));
        assertEquals("2024-03-01 25:30:00", e.getRawValue());
    }

    @Test
    @DisplayName("Should reject unparseable timestamps")
    void testToDateTime_Unparseable() {
        NormalizationException e = assertThrows(NormalizationException.class,
            () -> Normalizer.toDateTime("yesterday 5pm"));
        assertEquals(NormalizationException.Condition.UNPARSEABLE_TEMPORAL, e.getCondition());
    }

    // ============================================================================
    // Decimals and units
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
        "'1,250.5', 1250.5",
        "' 42 ', 42",
        "'1 000', 1000",
        "-0.25, -0.25"
    })
    @DisplayName("Should strip separators and whitespace from decimals")
    void testToDecimal_Valid(String raw, String expected) {
        assertEquals(0, new BigDecimal(expected).compareTo(Normalizer.toDecimal(raw)));
    }

    @Test
    @DisplayName("Should reject invalid numeric text")
    void testToDecimal_Invalid() {
        NormalizationException e = assertThrows(NormalizationException.class,
            () -> Normalizer.toDecimal("12.3.4"));
        assertEquals(NormalizationException.Condition.UNPARSEABLE_NUMERIC, e.getCondition());
        assertNull(Normalizer.toDecimal("  "));
    }

    @Test
    @DisplayName("Length in centimetres becomes millimetres")
    void testToMeasurement_Centimetres() {
        Measurement m = Normalizer.toMeasurement("2.5", "cm");
        assertEquals(0, new BigDecimal("25").compareTo(m.value()));
        assertEquals("mm", m.unit());
    }

    @Test
    @DisplayName("Percentages above one are kept, ratios are scaled")
    void testToMeasurement_Percentages() {
        Measurement already = Normalizer.toMeasurement("99.5", "%");
        assertEquals(0, new BigDecimal("99.5").compareTo(already.value()));
        assertEquals("%", already.unit());

        Measurement ratio = Normalizer.toMeasurement("0.995", "%");
        assertEquals(0, new BigDecimal("99.5").compareTo(ratio.value()));
        assertEquals("%", ratio.unit());
    }

    @ParameterizedTest
    @CsvSource({
        "1.2, m, 1200, mm",
        "7, MM, 7, mm",
        "3, kN, 3000, N",
        "450, n, 450, N",
        "0.5, percent, 50, %"
    })
    @DisplayName("Should convert into the canonical unit of each family")
    void testToMeasurement_Families(String value, String unit, String expectedValue, String expectedUnit) {
        Measurement m = Normalizer.toMeasurement(value, unit);
        assertEquals(0, new BigDecimal(expectedValue).compareTo(m.value()));
        assertEquals(expectedUnit, m.unit());
    }

    @Test
    @DisplayName("Unknown units keep value and label")
    void testToMeasurement_UnknownUnit() {
        Measurement m = Normalizer.toMeasurement("12", " psi ");
        assertEquals(0, new BigDecimal("12").compareTo(m.value()));
        assertEquals("psi", m.unit());
    }

    @Test
    @DisplayName("A blank unit leaves the unit absent")
    void testToMeasurement_NoUnit() {
        Measurement m = Normalizer.toMeasurement("12", "");
        assertNull(m.unit());
        assertEquals(0, new BigDecimal("12").compareTo(m.value()));
    }

    // ============================================================================
    // Enumerations
    // ============================================================================

    @ParameterizedTest
    @ValueSource(strings = {"Passed", "ok", "PASS", " pass "})
    @DisplayName("Pass synonyms map to the same result")
    void testToInspectionResult_PassSynonyms(String raw) {
        assertEquals(InspectionResult.PASS, Normalizer.toInspectionResult(raw));
    }

    @Test
    @DisplayName("Unmapped result fails instead of defaulting")
    void testToInspectionResult_Unknown() {
        NormalizationException e = assertThrows(NormalizationException.class,
            () -> Normalizer.toInspectionResult("MAYBE"));
        assertEquals(NormalizationException.Condition.UNKNOWN_ENUMERATION, e.getCondition());
        assertEquals("inspection result", e.getFamily());
        assertEquals("MAYBE", e.getRawValue());
    }

    @ParameterizedTest
    @CsvSource({
        "In Review, IN_REVIEW",
        "in-review, IN_REVIEW",
        "Canceled, CANCELLED",
        "open, OPEN"
    })
    @DisplayName("NCR status synonyms are case and punctuation insensitive")
    void testToNcrStatus(String raw, NcrStatus expected) {
        assertEquals(expected, Normalizer.toNcrStatus(raw));
    }

    @ParameterizedTest
    @CsvSource({
        "Major, HIGH",
        "minor, LOW",
        "Critical, CRITICAL",
        "med, MEDIUM"
    })
    @DisplayName("NCR severity synonyms")
    void testToNcrSeverity(String raw, NcrSeverity expected) {
        assertEquals(expected, Normalizer.toNcrSeverity(raw));
    }

    // ============================================================================
    // Strings
    // ============================================================================

    @Test
    @DisplayName("Should trim, blank to absent and truncate without error")
    void testCleanString() {
        assertEquals("Plant A", Normalizer.cleanString("  Plant A  "));
        assertNull(Normalizer.cleanString("   "));
        assertNull(Normalizer.cleanString(null));
        assertEquals("abc", Normalizer.cleanString("abcdef", 3));
        assertEquals("ab", Normalizer.cleanString("ab", 3));
    }
}
