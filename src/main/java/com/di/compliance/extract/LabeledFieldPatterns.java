package com.di.compliance.extract;

import com.di.compliance.model.RecordType;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed {@code "Label: value"} patterns per record type. Every pattern is optional; for a field with
 * several alternatives the first one that matches wins. Numeric sub-fields use loosely-anchored
 * patterns because label formatting varies between report generators.
 */
final class LabeledFieldPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    /** Value running to the end of the line, trimmed. */
    private static final String LINE_VALUE = "[ \\t]*(.+?)[ \\t]*$";
    /** Identifier-like token. */
    private static final String TOKEN_VALUE = "[ \\t]*([A-Za-z0-9][\\w./-]*)";
    private static final String NUMBER = "(-?\\d+(?:\\.\\d+)?)";

    record FieldPattern(String field, List<Pattern> patterns) {

        static FieldPattern of(String field, String... regexes) {
            return new FieldPattern(field, Arrays.stream(regexes).map(r -> Pattern.compile(r, FLAGS)).toList());
        }

        String find(String text) {
            for (Pattern pattern : patterns) {
                Matcher m = pattern.matcher(text);
                if (m.find()) {
                    String value = m.group(1).trim();
                    if (!value.isEmpty()) {
                        return value;
                    }
                }
            }
            return null;
        }
    }

    private static final Map<RecordType, List<FieldPattern>> PATTERNS = new EnumMap<>(RecordType.class);

    static {
        PATTERNS.put(RecordType.NCR, List.of(
                FieldPattern.of("ncr_id",
                        "\\bNCR[ \\t]*(?:reference|ref\\.?|id|number|no\\.?)[ \\t]*[:#]" + TOKEN_VALUE),
                FieldPattern.of("title", "\\bTitle:" + LINE_VALUE),
                FieldPattern.of("site", "\\b(?:Site|Location):" + LINE_VALUE),
                FieldPattern.of("supplier", "\\bSupplier:" + LINE_VALUE),
                FieldPattern.of("part_number", "\\bPart Number:" + LINE_VALUE),
                FieldPattern.of("severity", "\\bSeverity:" + LINE_VALUE),
                FieldPattern.of("status", "\\bStatus:" + LINE_VALUE),
                FieldPattern.of("description", "\\bDescription:[ \\t]*(.+?)[ \\t]*(?:$|Initial)"),
                FieldPattern.of("root_cause", "\\bRoot Cause:" + LINE_VALUE),
                FieldPattern.of("corrective_action", "\\bCorrective Action:" + LINE_VALUE),
                FieldPattern.of("opened_at",
                        "\\b(?:Date of Occurrence|Date Opened|Date Raised|Opened(?: At| On)?):" + LINE_VALUE),
                FieldPattern.of("closed_at",
                        "\\b(?:Close-?out Date|Date Closed|Closed(?: At| On)?):" + LINE_VALUE),
                FieldPattern.of("linked_inspection_id",
                        "\\b(?:Linked Inspection|Inspection (?:ID|Ref(?:erence)?)):" + TOKEN_VALUE)
        ));

        PATTERNS.put(RecordType.INSPECTION, List.of(
                FieldPattern.of("inspection_id",
                        "\\bInspection[ \\t]*(?:ID|No\\.?|Number|Ref(?:erence)?)[ \\t]*[:#]" + TOKEN_VALUE,
                        "\\bCertificate[ \\t]*(?:No\\.?|Number)[ \\t]*[:#]" + TOKEN_VALUE),
                FieldPattern.of("site", "\\bSite(?: Location)?:" + LINE_VALUE),
                FieldPattern.of("production_line", "\\b(?:Production )?Line:" + LINE_VALUE),
                FieldPattern.of("part_number", "\\bPart Number:" + LINE_VALUE),
                FieldPattern.of("part_description", "\\bDescription:" + LINE_VALUE),
                FieldPattern.of("supplier", "\\bSupplier:" + LINE_VALUE),
                FieldPattern.of("inspector", "\\bInspector:" + LINE_VALUE),
                FieldPattern.of("inspection_date", "\\bInspection Date:" + LINE_VALUE),
                FieldPattern.of("result", "\\b(?:INSPECTION )?RESULT:" + LINE_VALUE),
                FieldPattern.of("measurement_value", "\\b(?:Measured Value|Dimension).*?" + NUMBER),
                FieldPattern.of("measurement_unit",
                        "\\bUnits?:[ \\t]*(\\S+)",
                        "\\b(?:Measured Value|Dimension).*?-?\\d+(?:\\.\\d+)?[ \\t]*(mm|cm|m|kn|n|%|percent|pct)(?![A-Za-z])"),
                FieldPattern.of("spec_min", "\\bSpec(?:ification)? Min.*?" + NUMBER),
                FieldPattern.of("spec_max", "\\bSpec(?:ification)? Max.*?" + NUMBER)
        ));

        PATTERNS.put(RecordType.MAINTENANCE, List.of(
                FieldPattern.of("event_id",
                        "\\bWork Order(?:[ \\t]*(?:No\\.?|Number|#))?[ \\t]*:" + TOKEN_VALUE,
                        "\\bEvent ID:" + TOKEN_VALUE),
                FieldPattern.of("site", "\\bSite:" + LINE_VALUE),
                FieldPattern.of("machine_id", "\\bMachine ID:" + TOKEN_VALUE),
                FieldPattern.of("machine_description",
                        "\\b(?:Machine )?Description:[ \\t]*(.+?)[ \\t]*(?:$|Location|Work)"),
                FieldPattern.of("event_type", "\\b(?:Event |Maintenance )?Type:" + LINE_VALUE),
                FieldPattern.of("event_date", "\\b(?:Event Date|Date Performed):" + LINE_VALUE),
                FieldPattern.of("technician", "\\bTechnician:" + LINE_VALUE),
                FieldPattern.of("downtime_hours", "\\bDowntime.*?" + NUMBER),
                FieldPattern.of("description", "\\bWORK DESCRIPTION:?\\s+(.+?)[ \\t]*(?:$|PARTS)"),
                FieldPattern.of("parts_replaced", "\\bParts Replaced:" + LINE_VALUE)
        ));
    }

    private LabeledFieldPatterns() {
    }

    /**
     * Applies every pattern of the record type; fields that do not match are left out.
     */
    static Map<String, String> extract(RecordType type, String text) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldPattern fp : PATTERNS.get(type)) {
            String value = fp.find(text);
            if (value != null) {
                fields.put(fp.field(), value);
            }
        }
        return fields;
    }
}
