package com.di.compliance.normalize;

import com.di.compliance.extract.ExtractedRow;
import com.di.compliance.model.DomainRecord;
import com.di.compliance.model.Inspection;
import com.di.compliance.model.MaintenanceEvent;
import com.di.compliance.model.NonConformanceReport;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.function.Function;

/**
 * Maps an extracted row onto the closed schema of its record type.
 *
 * <p>Every field goes through {@link Normalizer}; the first failing field aborts the row with a
 * {@link NormalizationException} that names the field.
 */
@Component
public class RecordNormalizer {

    static final int KEY_LENGTH = 100;
    static final int NAME_LENGTH = 200;
    static final int UNIT_LENGTH = 20;
    static final int EVENT_TYPE_LENGTH = 50;

    public DomainRecord normalize(ExtractedRow row) {
        if (row.recordType() == null) {
            throw new IllegalArgumentException("Row " + row.position() + " has no record type");
        }
        return switch (row.recordType()) {
            case INSPECTION -> toInspection(new FieldReader(row));
            case NCR -> toNcr(new FieldReader(row));
            case MAINTENANCE -> toMaintenanceEvent(new FieldReader(row));
        };
    }

    /**
     * A unit without a measured value is dropped together with it.
     */
    Inspection toInspection(FieldReader f) {
        String unit = f.raw("measurement_unit");
        Measurement measured = f.measurement("measurement_value", unit);
        Measurement specMin = f.measurement("spec_min", unit);
        Measurement specMax = f.measurement("spec_max", unit);

        return Inspection.builder()
                .inspectionId(f.string("inspection_id", KEY_LENGTH))
                .site(f.string("site", KEY_LENGTH))
                .productionLine(f.string("production_line", KEY_LENGTH))
                .supplier(f.string("supplier", NAME_LENGTH))
                .partNumber(f.string("part_number", KEY_LENGTH))
                .partDescription(f.string("part_description"))
                .inspectionDate(f.date("inspection_date"))
                .inspector(f.string("inspector", NAME_LENGTH))
                .result(f.convert("result", Normalizer::toInspectionResult))
                .measurementValue(measured.value())
                .measurementUnit(measured.value() == null ? null : Normalizer.cleanString(measured.unit(), UNIT_LENGTH))
                .specMin(specMin.value())
                .specMax(specMax.value())
                .notes(f.string("notes"))
                .build();
    }

    NonConformanceReport toNcr(FieldReader f) {
        return NonConformanceReport.builder()
                .ncrId(f.string("ncr_id", KEY_LENGTH))
                .linkedInspectionKey(f.string("linked_inspection_id", KEY_LENGTH))
                .site(f.string("site", KEY_LENGTH))
                .supplier(f.string("supplier", NAME_LENGTH))
                .partNumber(f.string("part_number", KEY_LENGTH))
                .partDescription(f.string("part_description"))
                .severity(f.convert("severity", Normalizer::toNcrSeverity))
                .status(f.convert("status", Normalizer::toNcrStatus))
                .description(f.string("description"))
                .rootCause(f.string("root_cause"))
                .correctiveAction(f.string("corrective_action"))
                .openedAt(f.dateTime("opened_at"))
                .reviewedAt(f.dateTime("reviewed_at"))
                .closedAt(f.dateTime("closed_at"))
                .build();
    }

    MaintenanceEvent toMaintenanceEvent(FieldReader f) {
        return MaintenanceEvent.builder()
                .eventId(f.string("event_id", KEY_LENGTH))
                .site(f.string("site", KEY_LENGTH))
                .machineId(f.string("machine_id", KEY_LENGTH))
                .machineDescription(f.string("machine_description"))
                .eventType(f.string("event_type", EVENT_TYPE_LENGTH))
                .eventDate(f.date("event_date"))
                .downtimeHours(f.decimal("downtime_hours"))
                .technician(f.string("technician", NAME_LENGTH))
                .description(f.string("description"))
                .partsReplaced(f.string("parts_replaced"))
                .notes(f.string("notes"))
                .build();
    }

    /**
     * Reads raw fields of one row and attributes normalization failures to the field name.
     */
    static final class FieldReader {

        private final ExtractedRow row;

        FieldReader(ExtractedRow row) {
            this.row = row;
        }

        String raw(String field) {
            return row.get(field);
        }

        String string(String field) {
            return Normalizer.cleanString(row.get(field));
        }

        String string(String field, int maxLength) {
            return Normalizer.cleanString(row.get(field), maxLength);
        }

        LocalDate date(String field) {
            return convert(field, Normalizer::toDate);
        }

        LocalDateTime dateTime(String field) {
            return convert(field, Normalizer::toDateTime);
        }

        BigDecimal decimal(String field) {
            return convert(field, Normalizer::toDecimal);
        }

        Measurement measurement(String field, String unit) {
            BigDecimal value = decimal(field);
            return Normalizer.toCanonicalUnit(value, unit);
        }

        <T> T convert(String field, Function<String, T> converter) {
            try {
                return converter.apply(row.get(field));
            } catch (NormalizationException e) {
                throw e.forField(field);
            }
        }
    }
}
