package com.di.compliance.normalize;

import com.di.compliance.model.InspectionResult;
import com.di.compliance.model.NcrSeverity;
import com.di.compliance.model.NcrStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts raw field text into typed values.
 *
 * <p>All functions are pure. Blank input yields {@code null}; any other input either converts or
 * raises a {@link NormalizationException} naming the offending text. Nothing is silently coerced.
 */
public final class Normalizer {

    private Normalizer() {
    }

    // ============================================================================
    // Temporal layouts (ordered; first match wins)
    // ============================================================================

    /**
     * Accepted date layouts without a time of day. Month-first is tried before day-first, so
     * {@code 03/04/2024} is 4 March while {@code 13/04/2024} falls through to 13 April.
     */
    static final List<DateTimeFormatter> DATE_ONLY_LAYOUTS = List.of(
            strict("uuuu-M-d"),
            strict("M/d/uuuu"),
            strict("d-M-uuuu"),
            strict("uuuu/M/d"),
            strict("d/M/uuuu")
    );

    /** Date fields also accept a full timestamp and keep its date. */
    static final List<DateTimeFormatter> DATE_LAYOUTS = List.of(
            DATE_ONLY_LAYOUTS.get(0),
            DATE_ONLY_LAYOUTS.get(1),
            DATE_ONLY_LAYOUTS.get(2),
            DATE_ONLY_LAYOUTS.get(3),
            DATE_ONLY_LAYOUTS.get(4),
            strict("uuuu-M-d H:mm:ss")
    );

    /** Hour, month and day may be unpadded ({@code 2024-3-1 9:30:00}). */
    static final List<DateTimeFormatter> DATETIME_LAYOUTS = List.of(
            new DateTimeFormatterBuilder()
                    .appendPattern("uuuu-M-d H:mm:ss")
                    .optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                    .optionalEnd()
                    .toFormatter(Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            strict("M/d/uuuu H:mm:ss"),
            strict("uuuu-M-d H:mm")
    );

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    // ============================================================================
    // Unit families
    // ============================================================================

    public static final String PERCENT = "%";
    public static final String MILLIMETRE = "mm";
    public static final String NEWTON = "N";

    private static final List<String> PERCENT_LABELS = List.of("%", "percent", "pct");

    private record Conversion(String canonical, BigDecimal factor) {
    }

    private static final Map<String, Conversion> CONVERSIONS = Map.ofEntries(
            Map.entry("mm", new Conversion(MILLIMETRE, BigDecimal.ONE)),
            Map.entry("millimeter", new Conversion(MILLIMETRE, BigDecimal.ONE)),
            Map.entry("millimeters", new Conversion(MILLIMETRE, BigDecimal.ONE)),
            Map.entry("millimetre", new Conversion(MILLIMETRE, BigDecimal.ONE)),
            Map.entry("millimetres", new Conversion(MILLIMETRE, BigDecimal.ONE)),
            Map.entry("cm", new Conversion(MILLIMETRE, BigDecimal.TEN)),
            Map.entry("centimeter", new Conversion(MILLIMETRE, BigDecimal.TEN)),
            Map.entry("centimeters", new Conversion(MILLIMETRE, BigDecimal.TEN)),
            Map.entry("centimetre", new Conversion(MILLIMETRE, BigDecimal.TEN)),
            Map.entry("centimetres", new Conversion(MILLIMETRE, BigDecimal.TEN)),
            Map.entry("m", new Conversion(MILLIMETRE, BigDecimal.valueOf(1000))),
            Map.entry("meter", new Conversion(MILLIMETRE, BigDecimal.valueOf(1000))),
            Map.entry("meters", new Conversion(MILLIMETRE, BigDecimal.valueOf(1000))),
            Map.entry("metre", new Conversion(MILLIMETRE, BigDecimal.valueOf(1000))),
            Map.entry("metres", new Conversion(MILLIMETRE, BigDecimal.valueOf(1000))),
            Map.entry("n", new Conversion(NEWTON, BigDecimal.ONE)),
            Map.entry("newton", new Conversion(NEWTON, BigDecimal.ONE)),
            Map.entry("newtons", new Conversion(NEWTON, BigDecimal.ONE)),
            Map.entry("kn", new Conversion(NEWTON, BigDecimal.valueOf(1000))),
            Map.entry("kilonewton", new Conversion(NEWTON, BigDecimal.valueOf(1000))),
            Map.entry("kilonewtons", new Conversion(NEWTON, BigDecimal.valueOf(1000)))
    );

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    // ============================================================================
    // Enumeration families
    // ============================================================================

    public static final SynonymTable<InspectionResult> INSPECTION_RESULTS =
            SynonymTable.builder("inspection result", InspectionResult.class)
                    .map(InspectionResult.PASS, "PASSED", "OK", "GOOD")
                    .map(InspectionResult.FAIL, "FAILED", "REJECT", "REJECTED", "NG")
                    .map(InspectionResult.CONDITIONAL, "COND", "PARTIAL", "CONDITIONAL_PASS")
                    .build();

    public static final SynonymTable<NcrStatus> NCR_STATUSES =
            SynonymTable.builder("NCR status", NcrStatus.class)
                    .map(NcrStatus.OPEN, "OPENED", "NEW")
                    .map(NcrStatus.IN_REVIEW, "REVIEW", "REVIEWING", "UNDER_REVIEW")
                    .map(NcrStatus.CLOSED, "CLOSE", "RESOLVED")
                    .map(NcrStatus.CANCELLED, "CANCELED", "CANCEL")
                    .build();

    public static final SynonymTable<NcrSeverity> NCR_SEVERITIES =
            SynonymTable.builder("NCR severity", NcrSeverity.class)
                    .map(NcrSeverity.LOW, "L", "MINOR")
                    .map(NcrSeverity.MEDIUM, "MED", "M", "MODERATE")
                    .map(NcrSeverity.HIGH, "H", "MAJOR")
                    .map(NcrSeverity.CRITICAL, "CRIT", "C", "SEVERE")
                    .build();

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // ============================================================================
    // Temporal
    // ============================================================================

    /**
     * @return the parsed date, or null for blank input
     * @throws NormalizationException when no accepted layout matches
     */
    public static LocalDate toDate(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        String text = raw.trim();
        LocalDate date = parseDate(text, DATE_LAYOUTS);
        if (date == null) {
            throw new NormalizationException(NormalizationException.Condition.UNPARSEABLE_TEMPORAL, text);
        }
        return date;
    }

    private static LocalDate parseDate(String text, List<DateTimeFormatter> layouts) {
        for (DateTimeFormatter layout : layouts) {
            try {
                return layout.parse(text, LocalDate::from);
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        return null;
    }

    /**
     * Parses a timestamp; a bare date resolves to midnight. Text carrying a time of day never loses it.
     *
     * @return the parsed timestamp, or null for blank input
     * @throws NormalizationException when no accepted layout matches
     */
    public static LocalDateTime toDateTime(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        String text = raw.trim();
        for (DateTimeFormatter layout : DATETIME_LAYOUTS) {
            try {
                return layout.parse(text, LocalDateTime::from);
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        LocalDate date = parseDate(text, DATE_ONLY_LAYOUTS);
        if (date == null) {
            throw new NormalizationException(NormalizationException.Condition.UNPARSEABLE_TEMPORAL, text);
        }
        return date.atStartOfDay();
    }

    // ============================================================================
    // Numeric
    // ============================================================================

    /**
     * Parses a decimal after removing whitespace and thousands separators ({@code "1, 250.5"} → 1250.5).
     *
     * @return the value, or null for blank input
     * @throws NormalizationException for anything that is not a finite decimal number
     */
    public static BigDecimal toDecimal(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        String text = WHITESPACE.matcher(raw).replaceAll("").replace(",", "");
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new NormalizationException(NormalizationException.Condition.UNPARSEABLE_NUMERIC, raw.trim());
        }
    }

    /**
     * Parses the value and converts it into the canonical unit of its family.
     *
     * @see #toCanonicalUnit(BigDecimal, String)
     */
    public static Measurement toMeasurement(String rawValue, String rawUnit) {
        return toCanonicalUnit(toDecimal(rawValue), rawUnit);
    }

    /**
     * Converts a value into its unit family's canonical unit:
     * <ul>
     *   <li>percentage ({@code %}, {@code percent}, {@code pct}): ratios of at most 1 are multiplied by 100</li>
     *   <li>length: millimetres ({@code cm}×10, {@code m}×1000, {@code mm}×1)</li>
     *   <li>force: newtons ({@code kN}×1000, {@code N}×1)</li>
     * </ul>
     * Unknown labels keep the value and the label as given. A blank label leaves the unit absent.
     */
    public static Measurement toCanonicalUnit(BigDecimal value, String rawUnit) {
        if (isBlank(rawUnit)) {
            return new Measurement(value, null);
        }
        String label = rawUnit.trim();
        String key = label.toLowerCase(Locale.ROOT);

        if (PERCENT_LABELS.contains(key)) {
            if (value != null && value.compareTo(BigDecimal.ONE) <= 0) {
                return new Measurement(value.multiply(HUNDRED), PERCENT);
            }
            return new Measurement(value, PERCENT);
        }

        Conversion conversion = CONVERSIONS.get(key);
        if (conversion == null) {
            return new Measurement(value, label);
        }
        return new Measurement(value == null ? null : value.multiply(conversion.factor()), conversion.canonical());
    }

    // ============================================================================
    // Enumerations
    // ============================================================================

    public static InspectionResult toInspectionResult(String raw) {
        return INSPECTION_RESULTS.map(raw);
    }

    public static NcrStatus toNcrStatus(String raw) {
        return NCR_STATUSES.map(raw);
    }

    public static NcrSeverity toNcrSeverity(String raw) {
        return NCR_SEVERITIES.map(raw);
    }

    // ============================================================================
    // Strings
    // ============================================================================

    /**
     * Trims, maps empty to null, and truncates to {@code maxLength} when one is given.
     */
    public static String cleanString(String raw, Integer maxLength) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (maxLength != null && trimmed.length() > maxLength) {
            return trimmed.substring(0, maxLength);
        }
        return trimmed;
    }

    public static String cleanString(String raw) {
        return cleanString(raw, null);
    }

    private static boolean isBlank(String raw) {
        return raw == null || raw.isBlank();
    }
}
