package com.eainde.research.memory;

import com.eainde.research.exception.PersistenceException;
import com.eainde.research.model.InsightFeatures;
import com.eainde.research.model.RewardTrainingSample;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public class RewardSampleRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<RewardTrainingSample> rowMapper;

    public RewardSampleRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.rowMapper = (rs, rowNum) -> new RewardTrainingSample(
                rs.getLong("id"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getObject("insight_id", Long.class),
                json.read(rs.getString("insight_features"), InsightFeatures.class),
                rs.getInt("human_rating"),
                rs.getBoolean("used_in_training"));
    }

    public void insert(RewardTrainingSample sample) {
        Instant createdAt = sample.createdAt() != null ? sample.createdAt() : Instant.now();
        try {
            jdbcTemplate.update("""
                    INSERT INTO reward_training (created_at, insight_id, insight_features, human_rating, used_in_training)
                    VALUES (?, ?, ?, ?, ?)
                    """,
                    Timestamp.from(createdAt), sample.insightId(), json.write(sample.features()),
                    sample.humanRating(), sample.usedInTraining());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to insert reward sample for insight " + sample.insightId(), e);
        }
    }

    public List<RewardTrainingSample> findUnused() {
        return jdbcTemplate.query(
                "SELECT * FROM reward_training WHERE used_in_training = FALSE ORDER BY id", rowMapper);
    }

    public List<RewardTrainingSample> findAll() {
        return jdbcTemplate.query("SELECT * FROM reward_training ORDER BY id", rowMapper);
    }

    public void markUsed(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return;
        }
        try {
            jdbcTemplate.batchUpdate("UPDATE reward_training SET used_in_training = TRUE WHERE id = ?",
                    ids.stream().map(id -> new Object[]{id}).toList());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to mark reward samples used", e);
        }
    }
}
