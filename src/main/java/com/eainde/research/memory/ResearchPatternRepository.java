package com.eainde.research.memory;

import com.eainde.research.exception.PersistenceException;
import com.eainde.research.model.ResearchPattern;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
public class ResearchPatternRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<ResearchPattern> rowMapper;

    public ResearchPatternRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.rowMapper = (rs, rowNum) -> {
            Timestamp lastUsed = rs.getTimestamp("last_used");
            return new ResearchPattern(
                    rs.getLong("id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    rs.getDouble("success_rate"),
                    rs.getDouble("avg_rating"),
                    rs.getInt("usage_count"),
                    lastUsed == null ? null : lastUsed.toInstant(),
                    json.readVector(rs.getString("embedding")),
                    json.readMap(rs.getString("metadata")));
        };
    }

    public Optional<ResearchPattern> findByName(String name) {
        return jdbcTemplate.query("SELECT * FROM research_patterns WHERE name = ?", rowMapper, name)
                .stream().findFirst();
    }

    public List<ResearchPattern> findAll() {
        return jdbcTemplate.query("SELECT * FROM research_patterns ORDER BY name", rowMapper);
    }

    /**
     * Updates the row with the same name, inserting it when absent.
     */
    public ResearchPattern save(ResearchPattern pattern) {
        Timestamp lastUsed = pattern.lastUsed() == null ? null : Timestamp.from(pattern.lastUsed());
        String embedding = json.writeVector(pattern.embedding());
        String metadata = json.write(pattern.metadata());
        try {
            int rows = jdbcTemplate.update("""
                    UPDATE research_patterns
                    SET description = ?, success_rate = ?, avg_rating = ?, usage_count = ?,
                        last_used = ?, embedding = ?, metadata = ?
                    WHERE name = ?
                    """,
                    pattern.description(), pattern.successRate(), pattern.avgRating(), pattern.usageCount(),
                    lastUsed, embedding, metadata, pattern.name());
            if (rows == 0) {
                jdbcTemplate.update("""
                        INSERT INTO research_patterns
                            (name, description, success_rate, avg_rating, usage_count, last_used, embedding, metadata)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                        pattern.name(), pattern.description(), pattern.successRate(), pattern.avgRating(),
                        pattern.usageCount(), lastUsed, embedding, metadata);
            }
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save research pattern " + pattern.name(), e);
        }
        return findByName(pattern.name()).orElseThrow();
    }
}
