package com.automation.engine.persistence;

import com.automation.core.model.Event;
import com.automation.core.query.EventFilter;
import com.automation.core.repository.EventRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of EventRepository.
 * Used when {@code automation.storage.type} is memory, and by tests.
 */
@Repository
@ConditionalOnProperty(prefix = "automation.storage", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryEventRepository implements EventRepository {

    private final Map<UUID, Event> events = new ConcurrentHashMap<>();

    @Override
    public boolean append(Event event) {
        return events.putIfAbsent(event.id(), event) == null;
    }

    @Override
    public List<Event> appendAll(List<Event> eventList) {
        List<Event> stored = new ArrayList<>(eventList.size());
        for (Event event : eventList) {
            if (append(event)) {
                stored.add(event);
            }
        }
        return stored;
    }

    @Override
    public Optional<Event> findById(UUID eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    @Override
    public List<Event> query(EventFilter filter, int offset, int limit) {
        return matching(filter)
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<Event> findAll(EventFilter filter) {
        return matching(filter).collect(Collectors.toList());
    }

    @Override
    public long count(EventFilter filter) {
        return events.values().stream().filter(filter::includes).count();
    }

    private Stream<Event> matching(EventFilter filter) {
        return events.values().stream()
            .filter(filter::includes)
            .sorted(filter.comparator());
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
