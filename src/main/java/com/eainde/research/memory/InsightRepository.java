package com.eainde.research.memory;

import com.eainde.research.exception.PersistenceException;
import com.eainde.research.model.Evidence;
import com.eainde.research.model.Insight;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.dao.DataAccessException;
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

@Repository
public class InsightRepository {

    private static final TypeReference<List<Evidence>> EVIDENCE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Insight> rowMapper;

    public InsightRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.rowMapper = (rs, rowNum) -> Insight.builder()
                .id(rs.getLong("id"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .signalId(rs.getObject("signal_id", Long.class))
                .signalType(rs.getString("signal_type"))
                .subject(rs.getString("subject"))
                .companyName(rs.getString("company_name"))
                .headline(rs.getString("headline"))
                .evidence(json.readList(rs.getString("evidence"), EVIDENCE))
                .analysis(rs.getString("analysis"))
                .interestingnessScore(rs.getDouble("interestingness_score"))
                .shownToUser(rs.getBoolean("shown_to_user"))
                .embedding(json.readVector(rs.getString("embedding")))
                .metadata(json.readMap(rs.getString("metadata")))
                .build();
    }

    public Insight insert(Insight insight) {
        Instant createdAt = insight.createdAt() != null ? insight.createdAt() : Instant.now();
        String evidence = json.write(insight.evidence());
        String embedding = json.writeVector(insight.embedding());
        String metadata = json.write(insight.metadata());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(con -> {
                PreparedStatement ps = con.prepareStatement("""
                        INSERT INTO insights
                            (created_at, signal_id, signal_type, subject, company_name, headline, evidence,
                             analysis, interestingness_score, shown_to_user, embedding, metadata)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, FALSE, ?, ?)
                        """, new String[]{"id"});
                ps.setTimestamp(1, Timestamp.from(createdAt));
                if (insight.signalId() != null) {
                    ps.setLong(2, insight.signalId());
                } else {
                    ps.setNull(2, Types.BIGINT);
                }
                ps.setString(3, insight.signalType());
                ps.setString(4, insight.subject());
                ps.setString(5, insight.companyName());
                ps.setString(6, insight.headline());
                ps.setString(7, evidence);
                ps.setString(8, insight.analysis());
                ps.setDouble(9, insight.interestingnessScore());
                ps.setString(10, embedding);
                ps.setString(11, metadata);
                return ps;
            }, keyHolder);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to insert insight for signal " + insight.signalId(), e);
        }
        long id = Objects.requireNonNull(keyHolder.getKey(), "no generated id").longValue();
        return insight.toBuilder().id(id).createdAt(createdAt).shownToUser(false).build();
    }

    public Optional<Insight> findById(long id) {
        return jdbcTemplate.query("SELECT * FROM insights WHERE id = ?", rowMapper, id).stream().findFirst();
    }

    public Optional<Insight> findBySignalId(long signalId) {
        return jdbcTemplate.query("SELECT * FROM insights WHERE signal_id = ?", rowMapper, signalId)
                .stream().findFirst();
    }

    public List<Insight> findBySubject(String subject, int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM insights WHERE subject = ? ORDER BY created_at DESC, id DESC LIMIT ?",
                rowMapper, subject, limit);
    }

    /**
     * Insights not yet shown whose score is at or above the threshold, best first.
     */
    public List<Insight> findUndisplayed(double minScore) {
        return jdbcTemplate.query("""
                SELECT * FROM insights
                WHERE shown_to_user = FALSE AND interestingness_score >= ?
                ORDER BY interestingness_score DESC, created_at DESC
                """, rowMapper, minScore);
    }

    /**
     * Insights of a signal type whose average feedback rating reaches {@code minRating}.
     */
    public List<Insight> findHighRated(String signalType, double minRating, int limit) {
        return jdbcTemplate.query("""
                SELECT i.* FROM insights i
                WHERE i.signal_type = ?
                  AND (SELECT AVG(CAST(f.star_rating AS DOUBLE PRECISION)) FROM feedback f WHERE f.insight_id = i.id) >= ?
                ORDER BY i.created_at DESC
                LIMIT ?
                """, rowMapper, signalType, minRating, limit);
    }

    public List<Insight> findAllWithEmbedding() {
        return jdbcTemplate.query("SELECT * FROM insights WHERE embedding IS NOT NULL", rowMapper);
    }

    public boolean markShown(long id) {
        try {
            return jdbcTemplate.update("UPDATE insights SET shown_to_user = TRUE WHERE id = ?", id) > 0;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to mark insight " + id + " shown", e);
        }
    }
}
