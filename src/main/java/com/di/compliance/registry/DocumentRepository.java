package com.di.compliance.registry;

import com.di.compliance.model.DocumentRecord;
import com.di.compliance.model.SourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
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
 * JDBC repository for the {@code documents} table. Rows are inserted once and never updated.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class DocumentRepository {

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------
    // RowMapper
    // ------------------------------------------------------------------

    private static final RowMapper<DocumentRecord> ROW_MAPPER = (rs, n) -> {
        DocumentRecord d = new DocumentRecord();
        d.setId(rs.getLong("id"));
        d.setSourceKind(SourceKind.valueOf(rs.getString("source")));
        d.setFilename(rs.getString("filename"));
        d.setStoragePath(rs.getString("file_path"));
        d.setChecksum(rs.getString("checksum"));
        d.setSizeBytes(nullableLong(rs.getLong("file_size_bytes"), rs.wasNull()));
        d.setReceivedAt(toInstant(rs.getTimestamp("received_at")));
        d.setMetadata(rs.getString("metadata"));
        return d;
    };

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    /**
     * Inserts the document and returns its generated id.
     *
     * @throws org.springframework.dao.DuplicateKeyException when the checksum is already registered
     */
    public long insert(DocumentRecord doc) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                INSERT INTO documents
                  (source, filename, file_path, checksum, file_size_bytes, received_at, metadata)
                VALUES (?,?,?,?,?,?,?)
                """, new String[]{"id"});
            ps.setString(1, doc.getSourceKind().name());
            ps.setString(2, doc.getFilename());
            ps.setString(3, doc.getStoragePath());
            ps.setString(4, doc.getChecksum());
            if (doc.getSizeBytes() == null) {
                ps.setNull(5, Types.BIGINT);
            } else {
                ps.setLong(5, doc.getSizeBytes());
            }
            ps.setTimestamp(6, Timestamp.from(doc.getReceivedAt()));
            ps.setString(7, doc.getMetadata());
            return ps;
        }, keys);
        return Objects.requireNonNull(keys.getKey(), "no generated id for document").longValue();
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    public Optional<DocumentRecord> findByChecksum(String checksum) {
        List<DocumentRecord> rows = jdbc.query(
                "SELECT * FROM documents WHERE checksum = ?", ROW_MAPPER, checksum);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<DocumentRecord> findById(long id) {
        List<DocumentRecord> rows = jdbc.query(
                "SELECT * FROM documents WHERE id = ?", ROW_MAPPER, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public long count() {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM documents", Long.class);
        return n == null ? 0 : n;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static Long nullableLong(long v, boolean wasNull) { return wasNull ? null : v; }
}
