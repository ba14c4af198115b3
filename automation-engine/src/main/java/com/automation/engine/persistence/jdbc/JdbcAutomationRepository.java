package com.automation.engine.persistence.jdbc;

import com.automation.core.exception.StorageException;
import com.automation.core.model.Automation;
import com.automation.core.repository.AutomationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of AutomationRepository.
 */
@Repository("jdbcAutomationRepository")
@ConditionalOnProperty(prefix = "automation.storage", name = "type", havingValue = "jdbc")
public class JdbcAutomationRepository implements AutomationRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Automation> rowMapper;

    public JdbcAutomationRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new AutomationRowMapper();
    }

    @Override
    public void save(Automation automation) {
        String sql = """
            INSERT INTO automations (id, name, enabled, created, updated, automation_json)
            VALUES (?, ?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (id) DO UPDATE SET
                name = EXCLUDED.name,
                enabled = EXCLUDED.enabled,
                updated = EXCLUDED.updated,
                automation_json = EXCLUDED.automation_json
            """;
        try {
            jdbcTemplate.update(sql,
                automation.id(),
                automation.name(),
                automation.enabled(),
                Timestamp.from(automation.created()),
                Timestamp.from(automation.updated()),
                toJson(automation)
            );
        } catch (DataAccessException e) {
            throw new StorageException("Failed to save automation " + automation.id(), e);
        }
    }

    @Override
    public Optional<Automation> findById(UUID automationId) {
        String sql = "SELECT automation_json FROM automations WHERE id = ?";
        try {
            List<Automation> results = jdbcTemplate.query(sql, rowMapper, automationId);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read automation " + automationId, e);
        }
    }

    @Override
    public List<Automation> findAll() {
        try {
            return jdbcTemplate.query("SELECT automation_json FROM automations ORDER BY created, id", rowMapper);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list automations", e);
        }
    }

    @Override
    public List<Automation> findEnabled() {
        String sql = "SELECT automation_json FROM automations WHERE enabled ORDER BY created, id";
        try {
            return jdbcTemplate.query(sql, rowMapper);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list enabled automations", e);
        }
    }

    @Override
    public boolean delete(UUID automationId) {
        try {
            return jdbcTemplate.update("DELETE FROM automations WHERE id = ?", automationId) > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete automation " + automationId, e);
        }
    }

    private String toJson(Automation automation) {
        try {
            return objectMapper.writeValueAsString(automation);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize automation " + automation.id(), e);
        }
    }

    private class AutomationRowMapper implements RowMapper<Automation> {
        @Override
        public Automation mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return objectMapper.readValue(rs.getString("automation_json"), Automation.class);
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map automation row", e);
            }
        }
    }
}
