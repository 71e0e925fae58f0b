package com.eainde.research.memory;

import com.eainde.research.exception.PersistenceException;
import com.eainde.research.model.Feedback;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

@Repository
public class FeedbackRepository {

    private static final TypeReference<List<String>> TAGS = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Feedback> rowMapper;

    public FeedbackRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.rowMapper = (rs, rowNum) -> {
            Date outcomeDate = rs.getDate("outcome_date");
            return Feedback.builder()
                    .id(rs.getLong("id"))
                    .insightId(rs.getLong("insight_id"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .starRating(rs.getInt("star_rating"))
                    .tags(new HashSet<>(json.readList(rs.getString("tags"), TAGS)))
                    .comment(rs.getString("comment"))
                    .invested(rs.getBoolean("invested"))
                    .outcomeReturn(rs.getObject("outcome_return", Double.class))
                    .outcomeDate(outcomeDate == null ? null : outcomeDate.toLocalDate())
                    .build();
        };
    }

    public Feedback insert(Feedback feedback) {
        Instant createdAt = feedback.createdAt() != null ? feedback.createdAt() : Instant.now();
        String tags = json.write(feedback.tags().stream().sorted().toList());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(con -> {
                PreparedStatement ps = con.prepareStatement("""
                        INSERT INTO feedback
                            (insight_id, created_at, star_rating, tags, comment, invested, outcome_return, outcome_date)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                        """, new String[]{"id"});
                ps.setLong(1, feedback.insightId());
                ps.setTimestamp(2, Timestamp.from(createdAt));
                ps.setInt(3, feedback.starRating());
                ps.setString(4, tags);
                ps.setString(5, feedback.comment());
                ps.setBoolean(6, feedback.invested());
                if (feedback.outcomeReturn() != null) {
                    ps.setDouble(7, feedback.outcomeReturn());
                } else {
                    ps.setNull(7, Types.DOUBLE);
                }
                if (feedback.outcomeDate() != null) {
                    ps.setDate(8, Date.valueOf(feedback.outcomeDate()));
                } else {
                    ps.setNull(8, Types.DATE);
                }
                return ps;
            }, keyHolder);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to insert feedback for insight " + feedback.insightId(), e);
        }
        long id = Objects.requireNonNull(keyHolder.getKey(), "no generated id").longValue();
        return Feedback.builder()
                .id(id)
                .insightId(feedback.insightId())
                .createdAt(createdAt)
                .starRating(feedback.starRating())
                .tags(feedback.tags())
                .comment(feedback.comment())
                .invested(feedback.invested())
                .outcomeReturn(feedback.outcomeReturn())
                .outcomeDate(feedback.outcomeDate())
                .build();
    }

    public List<Feedback> findByInsightId(long insightId) {
        return jdbcTemplate.query(
                "SELECT * FROM feedback WHERE insight_id = ? ORDER BY created_at ASC", rowMapper, insightId);
    }
}
