package com.di.compliance.persist;

import com.di.compliance.model.NcrSeverity;
import com.di.compliance.model.NcrStatus;
import com.di.compliance.model.NonConformanceReport;
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
 * JDBC repository for the {@code ncrs} table. {@code linked_inspection_id} holds the resolved
 * inspection row id or null.
 */
@Repository
@RequiredArgsConstructor
public class NonConformanceReportRepository implements DomainRecordRepository<NonConformanceReport> {

    private final JdbcTemplate jdbc;

    private static final RowMapper<NonConformanceReport> ROW_MAPPER = (rs, n) -> NonConformanceReport.builder()
            .id(rs.getLong("id"))
            .ncrId(rs.getString("ncr_id"))
            .documentId(nullableLong(rs.getLong("document_id"), rs.wasNull()))
            .linkedInspectionId(nullableLong(rs.getLong("linked_inspection_id"), rs.wasNull()))
            .site(rs.getString("site"))
            .supplier(rs.getString("supplier"))
            .partNumber(rs.getString("part_number"))
            .partDescription(rs.getString("part_description"))
            .severity(NcrSeverity.valueOf(rs.getString("severity")))
            .status(NcrStatus.valueOf(rs.getString("status")))
            .description(rs.getString("description"))
            .rootCause(rs.getString("root_cause"))
            .correctiveAction(rs.getString("corrective_action"))
            .openedAt(toLocalDateTime(rs.getTimestamp("opened_at")))
            .reviewedAt(toLocalDateTime(rs.getTimestamp("reviewed_at")))
            .closedAt(toLocalDateTime(rs.getTimestamp("closed_at")))
            .build();

    @Override
    public RecordType recordType() {
        return RecordType.NCR;
    }

    @Override
    public Optional<Long> findIdByNaturalKey(String ncrId) {
        List<Long> ids = jdbc.queryForList("SELECT id FROM ncrs WHERE ncr_id = ?", Long.class, ncrId);
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    @Override
    public long insert(NonConformanceReport r) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                INSERT INTO ncrs
                  (ncr_id, document_id, linked_inspection_id, site, supplier,
                   part_number, part_description, severity, status, description,
                   root_cause, corrective_action, opened_at, reviewed_at, closed_at)
                VALUES (?,?,?,?,?, ?,?,?,?,?, ?,?,?,?,?)
                """, new String[]{"id"});
            setString(ps, 1, r.getNcrId());
            setLong(ps, 2, r.getDocumentId());
            setLong(ps, 3, r.getLinkedInspectionId());
            setString(ps, 4, r.getSite());
            setString(ps, 5, r.getSupplier());
            setString(ps, 6, r.getPartNumber());
            setString(ps, 7, r.getPartDescription());
            setEnum(ps, 8, r.getSeverity());
            setEnum(ps, 9, r.getStatus());
            setString(ps, 10, r.getDescription());
            setString(ps, 11, r.getRootCause());
            setString(ps, 12, r.getCorrectiveAction());
            setTimestamp(ps, 13, r.getOpenedAt());
            setTimestamp(ps, 14, r.getReviewedAt());
            setTimestamp(ps, 15, r.getClosedAt());
            return ps;
        }, keys);
        return Objects.requireNonNull(keys.getKey(), "no generated id for ncr").longValue();
    }

    public Optional<NonConformanceReport> findByNcrId(String ncrId) {
        List<NonConformanceReport> rows = jdbc.query("SELECT * FROM ncrs WHERE ncr_id = ?", ROW_MAPPER, ncrId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public long count() {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM ncrs", Long.class);
        return n == null ? 0 : n;
    }
}
