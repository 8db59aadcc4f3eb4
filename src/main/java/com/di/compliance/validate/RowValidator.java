package com.di.compliance.validate;

import com.di.compliance.extract.ExtractedRow;
import com.di.compliance.model.DomainRecord;
import com.di.compliance.model.Inspection;
import com.di.compliance.model.MaintenanceEvent;
import com.di.compliance.model.NonConformanceReport;
import com.di.compliance.model.RecordType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collects every problem of a row instead of stopping at the first one. An empty list means valid.
 */
@Component
public class RowValidator {

    public static final String RECORD_TYPE_FIELD = "record_type";

    /**
     * Checks that every required field is present and non-blank.
     */
    public List<ValidationProblem> validate(Map<String, String> fields, List<String> requiredFields, int position) {
        List<ValidationProblem> problems = new ArrayList<>();
        for (String field : requiredFields) {
            String value = fields.get(field);
            if (value == null || value.isBlank()) {
                problems.add(ValidationProblem.missing(field, position));
            }
        }
        return problems;
    }

    /**
     * Required-field check against the row's record type; a row without a type has a single problem.
     */
    public List<ValidationProblem> validate(ExtractedRow row) {
        RecordType type = row.recordType();
        if (type == null) {
            String label = row.get(RECORD_TYPE_FIELD);
            if (label == null || label.isBlank()) {
                return List.of(ValidationProblem.missing(RECORD_TYPE_FIELD, row.position()));
            }
            return List.of(ValidationProblem.invalid(RECORD_TYPE_FIELD, row.position(),
                    "unknown record type '" + label.trim() + "'"));
        }
        return validate(row.fields(), type.getRequiredFields(), row.position());
    }

    /**
     * Consistency rules on a normalized record: spec bounds in order, NCR closed after it was opened,
     * non-negative downtime.
     */
    public List<ValidationProblem> validate(DomainRecord record, int position) {
        List<ValidationProblem> problems = new ArrayList<>();
        if (record instanceof Inspection inspection) {
            BigDecimal min = inspection.getSpecMin();
            BigDecimal max = inspection.getSpecMax();
            if (min != null && max != null && min.compareTo(max) > 0) {
                problems.add(ValidationProblem.invalid("spec_min", position,
                        String.format("spec_min %s exceeds spec_max %s", min.toPlainString(), max.toPlainString())));
            }
        } else if (record instanceof NonConformanceReport ncr) {
            if (ncr.getOpenedAt() != null && ncr.getClosedAt() != null
                    && ncr.getClosedAt().isBefore(ncr.getOpenedAt())) {
                problems.add(ValidationProblem.invalid("closed_at", position, "closed before it was opened"));
            }
        } else if (record instanceof MaintenanceEvent event) {
            if (event.getDowntimeHours() != null && event.getDowntimeHours().signum() < 0) {
                problems.add(ValidationProblem.invalid("downtime_hours", position, "negative downtime"));
            }
        }
        return problems;
    }

    public static String describe(List<ValidationProblem> problems) {
        return problems.stream().map(ValidationProblem::message).collect(Collectors.joining("; "));
    }
}
