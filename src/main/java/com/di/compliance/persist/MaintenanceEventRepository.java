package com.di.compliance.persist;

import com.di.compliance.model.MaintenanceEvent;
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

@Repository
@RequiredArgsConstructor
public class MaintenanceEventRepository implements DomainRecordRepository<MaintenanceEvent> {

    private final JdbcTemplate jdbc;

    private static final RowMapper<MaintenanceEvent> ROW_MAPPER = (rs, n) -> MaintenanceEvent.builder()
            .id(rs.getLong("id"))
            .eventId(rs.getString("event_id"))
            .documentId(nullableLong(rs.getLong("document_id"), rs.wasNull()))
            .site(rs.getString("site"))
            .machineId(rs.getString("machine_id"))
            .machineDescription(rs.getString("machine_description"))
            .eventType(rs.getString("event_type"))
            .eventDate(toLocalDate(rs.getDate("event_date")))
            .downtimeHours(rs.getBigDecimal("downtime_hours"))
            .technician(rs.getString("technician"))
            .description(rs.getString("description"))
            .partsReplaced(rs.getString("parts_replaced"))
            .notes(rs.getString("notes"))
            .build();

    @Override
    public RecordType recordType() {
        return RecordType.MAINTENANCE;
    }

    @Override
    public Optional<Long> findIdByNaturalKey(String eventId) {
        List<Long> ids = jdbc.queryForList(
                "SELECT id FROM maintenance_events WHERE event_id = ?", Long.class, eventId);
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    @Override
    public long insert(MaintenanceEvent r) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                INSERT INTO maintenance_events
                  (event_id, document_id, site, machine_id, machine_description,
                   event_type, event_date, downtime_hours, technician, description,
                   parts_replaced, notes)
                VALUES (?,?,?,?,?, ?,?,?,?,?, ?,?)
                """, new String[]{"id"});
            setString(ps, 1, r.getEventId());
            setLong(ps, 2, r.getDocumentId());
            setString(ps, 3, r.getSite());
            setString(ps, 4, r.getMachineId());
            setString(ps, 5, r.getMachineDescription());
            setString(ps, 6, r.getEventType());
            setDate(ps, 7, r.getEventDate());
            setDecimal(ps, 8, r.getDowntimeHours());
            setString(ps, 9, r.getTechnician());
            setString(ps, 10, r.getDescription());
            setString(ps, 11, r.getPartsReplaced());
            setString(ps, 12, r.getNotes());
            return ps;
        }, keys);
        return Objects.requireNonNull(keys.getKey(), "no generated id for maintenance event").longValue();
    }

    public Optional<MaintenanceEvent> findByEventId(String eventId) {
        List<MaintenanceEvent> rows = jdbc.query(
                "SELECT * FROM maintenance_events WHERE event_id = ?", ROW_MAPPER, eventId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public long count() {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM maintenance_events", Long.class);
        return n == null ? 0 : n;
    }
}
