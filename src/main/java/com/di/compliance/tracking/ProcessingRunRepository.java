package com.di.compliance.tracking;

import com.di.compliance.model.ProcessingRun;
import com.di.compliance.model.ProcessingStage;
import com.di.compliance.model.RunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC repository for the append-only {@code processing_runs} audit table.
 *
 * <p>A run is inserted when its stage starts and finalized exactly once; the finalizing update only
 * touches rows whose {@code finished_at} is still null.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ProcessingRunRepository {

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------
    // RowMapper
    // ------------------------------------------------------------------

    private static final RowMapper<ProcessingRun> ROW_MAPPER = (rs, n) -> {
        ProcessingRun r = new ProcessingRun();
        r.setId(rs.getLong("id"));
        r.setDocumentId(nullableLong(rs.getLong("document_id"), rs.wasNull()));
        r.setStage(ProcessingStage.valueOf(rs.getString("stage")));
        r.setStatus(RunStatus.valueOf(rs.getString("status")));
        r.setErrorMessage(rs.getString("error_message"));
        r.setRowsAttempted(rs.getInt("rows_attempted"));
        r.setRowsSucceeded(rs.getInt("rows_succeeded"));
        r.setRowsFailed(rs.getInt("rows_failed"));
        r.setStartedAt(toInstant(rs.getTimestamp("started_at")));
        r.setFinishedAt(toInstant(rs.getTimestamp("finished_at")));
        r.setMetadata(rs.getString("metadata"));
        return r;
    };

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    public long insertStarted(Long documentId, ProcessingStage stage, Instant startedAt) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                INSERT INTO processing_runs
                  (document_id, stage, status, rows_attempted, rows_succeeded, rows_failed, started_at)
                VALUES (?,?,?, 0,0,0, ?)
                """, new String[]{"id"});
            if (documentId == null) {
                ps.setNull(1, Types.BIGINT);
            } else {
                ps.setLong(1, documentId);
            }
            ps.setString(2, stage.name());
            ps.setString(3, RunStatus.RUNNING.name());
            ps.setTimestamp(4, Timestamp.from(startedAt));
            return ps;
        }, keys);
        return Objects.requireNonNull(keys.getKey(), "no generated id for processing run").longValue();
    }

    /**
     * Writes the terminal state of a run.
     *
     * @return false when the run was already finalized (nothing written)
     */
    public boolean finalizeRun(ProcessingRun run) {
        int updated = jdbc.update("""
            UPDATE processing_runs
               SET document_id    = COALESCE(?, document_id),
                   status         = ?,
                   error_message  = ?,
                   rows_attempted = ?,
                   rows_succeeded = ?,
                   rows_failed    = ?,
                   finished_at    = ?,
                   metadata       = ?
             WHERE id = ? AND finished_at IS NULL
            """,
            new SqlParameterValue(Types.BIGINT, run.getDocumentId()), run.getStatus().name(), run.getErrorMessage(),
            run.getRowsAttempted(), run.getRowsSucceeded(), run.getRowsFailed(),
            Timestamp.from(run.getFinishedAt()), run.getMetadata(), run.getId());
        return updated == 1;
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    public Optional<ProcessingRun> findById(long id) {
        List<ProcessingRun> rows = jdbc.query(
                "SELECT * FROM processing_runs WHERE id = ?", ROW_MAPPER, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<ProcessingRun> findByDocumentId(long documentId) {
        return jdbc.query(
                "SELECT * FROM processing_runs WHERE document_id = ? ORDER BY id",
                ROW_MAPPER, documentId);
    }

    public List<ProcessingRun> findUnownedFailures() {
        return jdbc.query(
                "SELECT * FROM processing_runs WHERE document_id IS NULL AND status = 'FAILED' ORDER BY id",
                ROW_MAPPER);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static Long nullableLong(long v, boolean wasNull) { return wasNull ? null : v; }
}
