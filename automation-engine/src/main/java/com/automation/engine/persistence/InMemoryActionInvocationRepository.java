package com.automation.engine.persistence;

import com.automation.core.exception.NotFoundException;
import com.automation.core.model.ActionInvocation;
import com.automation.core.model.ActionState;
import com.automation.core.repository.ActionInvocationRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ActionInvocationRepository.
 */
@Repository
@ConditionalOnProperty(prefix = "automation.storage", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryActionInvocationRepository implements ActionInvocationRepository {

    private final Map<UUID, ActionInvocation> invocations = new ConcurrentHashMap<>();

    @Override
    public boolean tryCreate(ActionInvocation invocation) {
        return invocations.putIfAbsent(invocation.invocationId(), invocation) == null;
    }

    @Override
    public boolean update(ActionInvocation invocation, ActionState expectedState) {
        AtomicBoolean updated = new AtomicBoolean(false);
        ActionInvocation stored = invocations.computeIfPresent(invocation.invocationId(), (id, existing) -> {
            if (existing.state() != expectedState) {
                return existing;
            }
            updated.set(true);
            return invocation;
        });
        if (stored == null) {
            throw new NotFoundException("ActionInvocation", invocation.invocationId().toString());
        }
        return updated.get();
    }

    @Override
    public Optional<ActionInvocation> findById(UUID invocationId) {
        return Optional.ofNullable(invocations.get(invocationId));
    }

    @Override
    public List<ActionInvocation> findByState(ActionState state, Instant updatedBefore, int limit) {
        return invocations.values().stream()
            .filter(i -> i.state() == state)
            .filter(i -> i.updatedAt().isBefore(updatedBefore))
            .sorted(Comparator.comparing(ActionInvocation::updatedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<ActionInvocation> findByAutomation(UUID automationId) {
        return invocations.values().stream()
            .filter(i -> i.automationId().equals(automationId))
            .sorted(Comparator.comparing(ActionInvocation::createdAt))
            .collect(Collectors.toList());
    }
}
