package com.automation.engine.persistence.jdbc;

import com.automation.core.exception.NotFoundException;
import com.automation.core.exception.StorageException;
import com.automation.core.model.ActionInvocation;
import com.automation.core.model.ActionState;
import com.automation.core.model.TriggeredAction;
import com.automation.core.repository.ActionInvocationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed invocation ledger.
 * The invocation id primary key and ON CONFLICT DO NOTHING make claims atomic.
 */
@Repository("jdbcActionInvocationRepository")
@ConditionalOnProperty(prefix = "automation.storage", name = "type", havingValue = "jdbc")
public class JdbcActionInvocationRepository implements ActionInvocationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcActionInvocationRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<ActionInvocation> rowMapper;

    public JdbcActionInvocationRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new ActionInvocationRowMapper();
    }

    @Override
    public boolean tryCreate(ActionInvocation invocation) {
        String sql = """
            INSERT INTO action_invocations (
                invocation_id, automation_id, action_index, action_type,
                state, attempts, reason, created_at, updated_at, triggered_action_json
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (invocation_id) DO NOTHING
            """;
        try {
            int rows = jdbcTemplate.update(sql,
                invocation.invocationId(),
                invocation.automationId(),
                invocation.actionIndex(),
                invocation.actionType(),
                invocation.state().name(),
                invocation.attempts(),
                invocation.reason(),
                Timestamp.from(invocation.createdAt()),
                Timestamp.from(invocation.updatedAt()),
                toJson(invocation.triggeredAction())
            );
            if (rows == 0) {
                log.debug("Invocation already claimed: {}", invocation.invocationId());
            }
            return rows > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to claim invocation " + invocation.invocationId(), e);
        }
    }

    @Override
    @Transactional
    public boolean update(ActionInvocation invocation, ActionState expectedState) {
        String sql = """
            UPDATE action_invocations SET
                state = ?,
                attempts = ?,
                reason = ?,
                updated_at = ?
            WHERE invocation_id = ? AND state = ?
            """;
        try {
            int rows = jdbcTemplate.update(sql,
                invocation.state().name(),
                invocation.attempts(),
                invocation.reason(),
                Timestamp.from(invocation.updatedAt()),
                invocation.invocationId(),
                expectedState.name()
            );
            if (rows > 0) {
                return true;
            }
            if (findById(invocation.invocationId()).isEmpty()) {
                throw new NotFoundException("ActionInvocation", invocation.invocationId().toString());
            }
            log.debug("Invocation {} is no longer {}", invocation.invocationId(), expectedState);
            return false;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to update invocation " + invocation.invocationId(), e);
        }
    }

    @Override
    public Optional<ActionInvocation> findById(UUID invocationId) {
        String sql = "SELECT * FROM action_invocations WHERE invocation_id = ?";
        try {
            List<ActionInvocation> results = jdbcTemplate.query(sql, rowMapper, invocationId);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read invocation " + invocationId, e);
        }
    }

    @Override
    public List<ActionInvocation> findByState(ActionState state, Instant updatedBefore, int limit) {
        String sql = """
            SELECT * FROM action_invocations
            WHERE state = ? AND updated_at < ?
            ORDER BY updated_at
            LIMIT ?
            """;
        try {
            return jdbcTemplate.query(sql, rowMapper, state.name(), Timestamp.from(updatedBefore), limit);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to scan invocations in state " + state, e);
        }
    }

    @Override
    public List<ActionInvocation> findByAutomation(UUID automationId) {
        String sql = """
            SELECT * FROM action_invocations
            WHERE automation_id = ?
            ORDER BY created_at
            """;
        try {
            return jdbcTemplate.query(sql, rowMapper, automationId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list invocations of automation " + automationId, e);
        }
    }

    // ========== Helper Methods ==========

    private String toJson(TriggeredAction triggeredAction) {
        try {
            return objectMapper.writeValueAsString(triggeredAction);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize triggered action " + triggeredAction.id(), e);
        }
    }

    private class ActionInvocationRowMapper implements RowMapper<ActionInvocation> {
        @Override
        public ActionInvocation mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new ActionInvocation(
                    UUID.fromString(rs.getString("invocation_id")),
                    UUID.fromString(rs.getString("automation_id")),
                    rs.getInt("action_index"),
                    rs.getString("action_type"),
                    ActionState.valueOf(rs.getString("state")),
                    rs.getInt("attempts"),
                    rs.getString("reason"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant(),
                    objectMapper.readValue(rs.getString("triggered_action_json"), TriggeredAction.class)
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map invocation row", e);
            }
        }
    }
}
