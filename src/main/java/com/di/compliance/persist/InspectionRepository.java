package com.di.compliance.persist;

import com.di.compliance.model.Inspection;
import com.di.compliance.model.InspectionResult;
import com.di.compliance.model.RecordType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.di.compliance.persist.JdbcSupport.*;

/**
 * JDBC repository for the {@code inspections} table.
 */
@Repository
@RequiredArgsConstructor
public class InspectionRepository implements DomainRecordRepository<Inspection> {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Inspection> ROW_MAPPER = (rs, n) -> Inspection.builder()
            .id(rs.getLong("id"))
            .inspectionId(rs.getString("inspection_id"))
            .documentId(nullableLong(rs.getLong("document_id"), rs.wasNull()))
            .site(rs.getString("site"))
            .productionLine(rs.getString("production_line"))
            .supplier(rs.getString("supplier"))
            .partNumber(rs.getString("part_number"))
            .partDescription(rs.getString("part_description"))
            .inspectionDate(toLocalDate(rs.getDate("inspection_date")))
            .inspector(rs.getString("inspector"))
            .result(InspectionResult.valueOf(rs.getString("result")))
            .measurementValue(rs.getBigDecimal("measurement_value"))
            .measurementUnit(rs.getString("measurement_unit"))
            .specMin(rs.getBigDecimal("spec_min"))
            .specMax(rs.getBigDecimal("spec_max"))
            .notes(rs.getString("notes"))
            .build();

    @Override
    public RecordType recordType() {
        return RecordType.INSPECTION;
    }

    @Override
    public Optional<Long> findIdByNaturalKey(String inspectionId) {
        List<Long> ids = jdbc.queryForList(
                "SELECT id FROM inspections WHERE inspection_id = ?", Long.class, inspectionId);
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    @Override
    public long insert(Inspection r) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                INSERT INTO inspections
                  (inspection_id, document_id, site, production_line, supplier,
                   part_number, part_description, inspection_date, inspector, result,
                   measurement_value, measurement_unit, spec_min, spec_max, notes)
                VALUES (?,?,?,?,?, ?,?,?,?,?, ?,?,?,?,?)
                """, new String[]{"id"});
            setString(ps, 1, r.getInspectionId());
            setLong(ps, 2, r.getDocumentId());
            setString(ps, 3, r.getSite());
            setString(ps, 4, r.getProductionLine());
            setString(ps, 5, r.getSupplier());
            setString(ps, 6, r.getPartNumber());
            setString(ps, 7, r.getPartDescription());
            setDate(ps, 8, r.getInspectionDate());
            setString(ps, 9, r.getInspector());
            setEnum(ps, 10, r.getResult());
            setDecimal(ps, 11, r.getMeasurementValue());
            setString(ps, 12, r.getMeasurementUnit());
            setDecimal(ps, 13, r.getSpecMin());
            setDecimal(ps, 14, r.getSpecMax());
            setString(ps, 15, r.getNotes());
            return ps;
        }, keys);
        return Objects.requireNonNull(keys.getKey(), "no generated id for inspection").longValue();
    }

    public Optional<Inspection> findByInspectionId(String inspectionId) {
        List<Inspection> rows = jdbc.query(
                "SELECT * FROM inspections WHERE inspection_id = ?", ROW_MAPPER, inspectionId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public long count() {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM inspections", Long.class);
        return n == null ? 0 : n;
    }
}
