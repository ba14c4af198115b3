package com.automation.engine.trigger;

import com.automation.core.model.Automation;
import com.automation.core.repository.AutomationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-through cache of enabled automations for the evaluation hot path.
 *
 * The cached set is reloaded when it is older than the refresh interval
 * or after {@link #invalidate()}, which administrative writes call.
 * If a reload fails the previous set stays in use.
 */
public class AutomationCatalog {

    private static final Logger log = LoggerFactory.getLogger(AutomationCatalog.class);

    private final AutomationRepository repository;
    private final Clock clock;
    private final Duration refreshInterval;

    private volatile Snapshot snapshot;

    public AutomationCatalog(AutomationRepository repository, Clock clock, Duration refreshInterval) {
        this.repository = repository;
        this.clock = clock;
        this.refreshInterval = refreshInterval;
    }

    /**
     * Enabled automations, at most one refresh interval stale.
     */
    public List<Automation> enabled() {
        return current().automations();
    }

    /**
     * Look up an enabled automation by id.
     */
    public Optional<Automation> find(UUID automationId) {
        return Optional.ofNullable(current().byId().get(automationId));
    }

    /**
     * Force the next read to reload from the repository.
     */
    public void invalidate() {
        snapshot = null;
    }

    private Snapshot current() {
        Snapshot current = snapshot;
        Instant now = clock.instant();
        if (current != null && !current.isStale(now, refreshInterval)) {
            return current;
        }
        synchronized (this) {
            current = snapshot;
            if (current != null && !current.isStale(now, refreshInterval)) {
                return current;
            }
            try {
                Snapshot loaded = Snapshot.of(repository.findEnabled(), now);
                snapshot = loaded;
                log.debug("Loaded {} enabled automations", loaded.automations().size());
                return loaded;
            } catch (RuntimeException e) {
                if (current == null) {
                    throw e;
                }
                log.warn("Failed to refresh automations, keeping {} cached: {}",
                    current.automations().size(), e.getMessage());
                return current;
            }
        }
    }

    private record Snapshot(List<Automation> automations, Map<UUID, Automation> byId, Instant loadedAt) {

        static Snapshot of(List<Automation> automations, Instant loadedAt) {
            Map<UUID, Automation> byId = new LinkedHashMap<>();
            for (Automation automation : automations) {
                if (automation.enabled()) {
                    byId.put(automation.id(), automation);
                }
            }
            return new Snapshot(List.copyOf(byId.values()), byId, loadedAt);
        }

        boolean isStale(Instant now, Duration refreshInterval) {
            return !loadedAt.plus(refreshInterval).isAfter(now);
        }
    }
}
