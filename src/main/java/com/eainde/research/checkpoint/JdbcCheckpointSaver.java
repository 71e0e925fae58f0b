package com.eainde.research.checkpoint;

import com.eainde.research.exception.PersistenceException;
import com.eainde.research.state.ResearchState;
import com.eainde.research.state.RunStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Persists checkpoints to {@code research_checkpoints}. The primary key on
 * {@code (run_id, seq)} rejects a second writer for the same step.
 */
@Log4j2
@Component
@ConditionalOnProperty(name = "research.pipeline.checkpoint-store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcCheckpointSaver extends ResearchCheckpointSaver {

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<CheckpointEntry> rowMapper;

    public JdbcCheckpointSaver(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        super(objectMapper, clock);
        this.jdbcTemplate = jdbcTemplate;
        this.rowMapper = (rs, rowNum) -> new CheckpointEntry(
                rs.getString("run_id"),
                rs.getInt("seq"),
                rs.getString("checkpoint_id"),
                rs.getString("node_id"),
                rs.getString("next_node_id"),
                RunStatus.valueOf(rs.getString("status")),
                rs.getString("stage_pointer"),
                deserialize(rs.getString("state_json")),
                rs.getTimestamp("created_at").toInstant());
    }

    @Override
    protected void append(CheckpointEntry entry) {
        Object signalId = entry.state().get(ResearchState.SIGNAL_ID);
        try {
            jdbcTemplate.update("""
                    INSERT INTO research_checkpoints
                        (run_id, seq, checkpoint_id, node_id, next_node_id, signal_id, stage_pointer, status,
                         state_json, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    entry.runId(),
                    entry.sequence(),
                    entry.checkpointId(),
                    entry.nodeId(),
                    entry.nextNodeId(),
                    signalId instanceof Number number ? number.longValue() : null,
                    entry.stagePointer(),
                    entry.status().name(),
                    serialize(entry.state()),
                    Timestamp.from(entry.createdAt()));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to append checkpoint " + entry.sequence()
                    + " for run " + entry.runId(), e);
        }
    }

    @Override
    protected List<CheckpointEntry> remove(String runId) {
        List<CheckpointEntry> entries = history(runId);
        try {
            jdbcTemplate.update("DELETE FROM research_checkpoints WHERE run_id = ?", runId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to release checkpoints of run " + runId, e);
        }
        log.info("Released {} checkpoints of run {}", entries.size(), runId);
        return entries;
    }

    @Override
    public Optional<CheckpointEntry> latest(String runId) {
        return jdbcTemplate.query(
                "SELECT * FROM research_checkpoints WHERE run_id = ? ORDER BY seq DESC LIMIT 1",
                rowMapper, runId).stream().findFirst();
    }

    @Override
    public List<CheckpointEntry> history(String runId) {
        return jdbcTemplate.query(
                "SELECT * FROM research_checkpoints WHERE run_id = ? ORDER BY seq ASC", rowMapper, runId);
    }
}
