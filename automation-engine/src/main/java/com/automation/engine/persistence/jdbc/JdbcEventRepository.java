package com.automation.engine.persistence.jdbc;

import com.automation.core.exception.StorageException;
import com.automation.core.model.Event;
import com.automation.core.query.EventFilter;
import com.automation.core.repository.EventRepository;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * PostgreSQL-backed implementation of EventRepository.
 *
 * The occurred window is applied in SQL; the remaining filter clauses
 * (patterns, labels, related resources) are applied to the narrowed rows.
 */
@Repository("jdbcEventRepository")
@ConditionalOnProperty(prefix = "automation.storage", name = "type", havingValue = "jdbc")
public class JdbcEventRepository implements EventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Event> rowMapper;

    public JdbcEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new EventRowMapper();
    }

    @Override
    public boolean append(Event event) {
        String sql = """
            INSERT INTO events (id, occurred, event, resource_id, received, event_json)
            VALUES (?, ?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (id) DO NOTHING
            """;
        try {
            int rows = jdbcTemplate.update(sql,
                event.id(),
                Timestamp.from(event.occurred()),
                event.event(),
                event.resourceId(),
                Timestamp.from(event.received()),
                toJson(event)
            );
            if (rows == 0) {
                log.debug("Event already stored: {}", event.id());
            }
            return rows > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to append event " + event.id(), e);
        }
    }

    @Override
    @Transactional
    public List<Event> appendAll(List<Event> events) {
        List<Event> stored = new ArrayList<>(events.size());
        for (Event event : events) {
            if (append(event)) {
                stored.add(event);
            }
        }
        return stored;
    }

    @Override
    public Optional<Event> findById(UUID eventId) {
        String sql = "SELECT event_json FROM events WHERE id = ?";
        try {
            List<Event> results = jdbcTemplate.query(sql, rowMapper, eventId);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read event " + eventId, e);
        }
    }

    @Override
    public List<Event> query(EventFilter filter, int offset, int limit) {
        return matching(filter).skip(offset).limit(limit).collect(Collectors.toList());
    }

    @Override
    public List<Event> findAll(EventFilter filter) {
        return matching(filter).collect(Collectors.toList());
    }

    @Override
    public long count(EventFilter filter) {
        return matching(filter).count();
    }

    private Stream<Event> matching(EventFilter filter) {
        String direction = filter.order() == EventFilter.Order.ASC ? "ASC" : "DESC";
        String sql = """
            SELECT event_json FROM events
            WHERE occurred >= ? AND occurred <= ?
            ORDER BY occurred %s, id %s
            """.formatted(direction, direction);
        try {
            List<Event> window = jdbcTemplate.query(sql, rowMapper,
                Timestamp.from(filter.occurred().since()),
                Timestamp.from(filter.occurred().until()));
            return window.stream()
                .filter(filter::includes)
                .sorted(filter.comparator());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to query events", e);
        }
    }

    // ========== Helper Methods ==========

    private String toJson(Event event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize event " + event.id(), e);
        }
    }

    private class EventRowMapper implements RowMapper<Event> {
        @Override
        public Event mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return objectMapper.readValue(rs.getString("event_json"), Event.class);
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map event row", e);
            }
        }
    }
}
