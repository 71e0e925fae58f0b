package com.eainde.research.memory;

import com.eainde.research.exception.EntityNotFoundException;
import com.eainde.research.exception.PersistenceException;
import com.eainde.research.model.Signal;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
public class SignalRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    private final RowMapper<Signal> rowMapper;

    public SignalRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.rowMapper = (rs, rowNum) -> new Signal(
                rs.getLong("id"),
                rs.getTimestamp("discovered_at").toInstant(),
                rs.getString("signal_type"),
                rs.getString("subject"),
                json.readMap(rs.getString("payload")),
                rs.getBoolean("processed"),
                rs.getBoolean("resulted_in_insight"),
                rs.getObject("insight_id", Long.class));
    }

    public Signal insert(Signal signal) {
        Instant discoveredAt = signal.discoveredAt() != null ? signal.discoveredAt() : Instant.now();
        String payload = json.write(signal.payload());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(con -> {
                PreparedStatement ps = con.prepareStatement("""
                        INSERT INTO signals (discovered_at, signal_type, subject, payload, processed, resulted_in_insight)
                        VALUES (?, ?, ?, ?, FALSE, FALSE)
                        """, new String[]{"id"});
                ps.setTimestamp(1, Timestamp.from(discoveredAt));
                ps.setString(2, signal.signalType());
                ps.setString(3, signal.subject());
                ps.setString(4, payload);
                return ps;
            }, keyHolder);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to insert signal " + signal.signalType() + "/" + signal.subject(), e);
        }
        long id = Objects.requireNonNull(keyHolder.getKey(), "no generated id").longValue();
        return new Signal(id, discoveredAt, signal.signalType(), signal.subject(), signal.payload(), false, false, null);
    }

    public Optional<Signal> findById(long id) {
        return jdbcTemplate.query("SELECT * FROM signals WHERE id = ?", rowMapper, id).stream().findFirst();
    }

    /**
     * Oldest first, so a backlog drains in arrival order.
     */
    public List<Signal> findUnprocessed(int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM signals WHERE processed = FALSE ORDER BY discovered_at ASC, id ASC LIMIT ?",
                rowMapper, limit);
    }

    /**
     * Idempotent; a second call with the same arguments leaves the row unchanged.
     */
    public void markProcessed(long signalId, Long insightId) {
        int rows;
        try {
            if (insightId != null) {
                rows = jdbcTemplate.update(
                        "UPDATE signals SET processed = TRUE, resulted_in_insight = TRUE, insight_id = ? WHERE id = ?",
                        insightId, signalId);
            } else {
                rows = jdbcTemplate.update("UPDATE signals SET processed = TRUE WHERE id = ?", signalId);
            }
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to mark signal " + signalId + " processed", e);
        }
        if (rows == 0) {
            throw new EntityNotFoundException("Signal", signalId);
        }
    }
}
