package com.automation.engine.persistence;

import com.automation.core.model.Automation;
import com.automation.core.repository.AutomationRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of AutomationRepository.
 */
@Repository
@ConditionalOnProperty(prefix = "automation.storage", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryAutomationRepository implements AutomationRepository {

    private final Map<UUID, Automation> automations = new ConcurrentHashMap<>();

    @Override
    public void save(Automation automation) {
        automations.put(automation.id(), automation);
    }

    @Override
    public Optional<Automation> findById(UUID automationId) {
        return Optional.ofNullable(automations.get(automationId));
    }

    @Override
    public List<Automation> findAll() {
        return automations.values().stream()
            .sorted(Comparator.comparing(Automation::created).thenComparing(Automation::id))
            .collect(Collectors.toList());
    }

    @Override
    public List<Automation> findEnabled() {
        return findAll().stream()
            .filter(Automation::enabled)
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(UUID automationId) {
        return automations.remove(automationId) != null;
    }
}
