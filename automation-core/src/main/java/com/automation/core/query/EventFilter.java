package com.automation.core.query;

import com.automation.core.matching.ResourceMatcher;
import com.automation.core.model.Event;
import com.automation.core.model.Labelled;
import com.automation.core.model.RelatedResource;
import com.automation.core.model.ResourceSpecification;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Query over stored events. Every present sub-filter must accept an event.
 * Absent sub-filters accept everything.
 *
 * Call {@link #resolve(Instant)} before using a filter so that the occurred
 * window is concrete; page tokens carry resolved filters.
 */
public record EventFilter(
    OccurredFilter occurred,
    EventNameFilter event,
    ResourceFilter resource,
    RelatedFilter related,
    @JsonProperty("any_resource")
    ResourceFilter anyResource,
    IdFilter id,
    Order order
) {

    public static final Duration DEFAULT_LOOKBACK = Duration.ofDays(1);

    public enum Order {
        ASC,
        DESC
    }

    public EventFilter {
        occurred = occurred == null ? new OccurredFilter(null, null) : occurred;
        order = order == null ? Order.DESC : order;
    }

    public static EventFilter all() {
        return new EventFilter(null, null, null, null, null, null, null);
    }

    /**
     * Fill in the default occurred window: the last day up to now.
     */
    public EventFilter resolve(Instant now) {
        Instant since = occurred.since() != null ? occurred.since() : now.minus(DEFAULT_LOOKBACK);
        Instant until = occurred.until() != null ? occurred.until() : now;
        return new EventFilter(new OccurredFilter(since, until), event, resource, related, anyResource, id, order);
    }

    public EventFilter withOccurred(Instant since, Instant until) {
        return new EventFilter(new OccurredFilter(since, until), event, resource, related, anyResource, id, order);
    }

    public EventFilter withOrder(Order newOrder) {
        return new EventFilter(occurred, event, resource, related, anyResource, id, newOrder);
    }

    public boolean includes(Event e) {
        return occurred.includes(e)
            && (event == null || event.includes(e))
            && (resource == null || resource.includesPrimary(e))
            && (related == null || related.includes(e))
            && (anyResource == null || anyResource.includesAny(e))
            && (id == null || id.includes(e));
    }

    /**
     * Sort order for results: by occurred, ties broken by id.
     */
    public Comparator<Event> comparator() {
        Comparator<Event> ascending = Comparator.comparing(Event::occurred)
            .thenComparing(Event::id);
        return order == Order.ASC ? ascending : ascending.reversed();
    }

    /**
     * Inclusive occurred window.
     */
    public record OccurredFilter(Instant since, Instant until) {

        boolean includes(Event e) {
            Instant at = e.occurred();
            return (since == null || !at.isBefore(since))
                && (until == null || !at.isAfter(until));
        }
    }

    public record EventNameFilter(
        List<String> prefix,
        @JsonProperty("exclude_prefix")
        List<String> excludePrefix,
        List<String> name,
        @JsonProperty("exclude_name")
        List<String> excludeName
    ) {

        public static EventNameFilter names(String... names) {
            return new EventNameFilter(null, null, List.of(names), null);
        }

        public static EventNameFilter prefixes(String... prefixes) {
            return new EventNameFilter(List.of(prefixes), null, null, null);
        }

        boolean includes(Event e) {
            String n = e.event();
            if (prefix != null && !prefix.isEmpty() && prefix.stream().noneMatch(n::startsWith)) {
                return false;
            }
            if (excludePrefix != null && excludePrefix.stream().anyMatch(n::startsWith)) {
                return false;
            }
            if (name != null && !name.isEmpty() && !name.contains(n)) {
                return false;
            }
            return excludeName == null || !excludeName.contains(n);
        }
    }

    /**
     * Used both for the primary resource and for "primary or any related".
     */
    public record ResourceFilter(
        List<String> id,
        @JsonProperty("id_prefix")
        List<String> idPrefix,
        ResourceSpecification labels
    ) {

        public static ResourceFilter ids(String... ids) {
            return new ResourceFilter(List.of(ids), null, null);
        }

        public static ResourceFilter idPrefixes(String... prefixes) {
            return new ResourceFilter(null, List.of(prefixes), null);
        }

        boolean includesPrimary(Event e) {
            return accepts(e.resource());
        }

        boolean includesAny(Event e) {
            if (accepts(e.resource())) {
                return true;
            }
            for (RelatedResource r : e.related()) {
                if (accepts(r)) {
                    return true;
                }
            }
            return false;
        }

        boolean accepts(Labelled candidate) {
            String resourceId = candidate.id();
            if (id != null && !id.isEmpty() && !id.contains(resourceId)) {
                return false;
            }
            if (idPrefix != null && !idPrefix.isEmpty()
                    && (resourceId == null || idPrefix.stream().noneMatch(resourceId::startsWith))) {
                return false;
            }
            return labels == null || ResourceMatcher.matches(labels, candidate);
        }
    }

    /**
     * Each present criterion must be satisfied by some related resource.
     */
    public record RelatedFilter(
        List<String> id,
        List<String> role,
        ResourceSpecification labels
    ) {

        boolean includes(Event e) {
            List<RelatedResource> related = e.related();
            if (id != null && !id.isEmpty() && related.stream().noneMatch(r -> id.contains(r.id()))) {
                return false;
            }
            if (role != null && !role.isEmpty() && related.stream().noneMatch(r -> role.contains(r.role()))) {
                return false;
            }
            return labels == null || ResourceMatcher.matchesRelated(labels, related);
        }
    }

    public record IdFilter(List<UUID> id) {

        boolean includes(Event e) {
            return id == null || id.isEmpty() || id.contains(e.id());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Instant since;
        private Instant until;
        private EventNameFilter event;
        private ResourceFilter resource;
        private RelatedFilter related;
        private ResourceFilter anyResource;
        private final List<UUID> ids = new ArrayList<>();
        private Order order;

        public Builder since(Instant since) {
            this.since = since;
            return this;
        }

        public Builder until(Instant until) {
            this.until = until;
            return this;
        }

        public Builder event(EventNameFilter event) {
            this.event = event;
            return this;
        }

        public Builder resource(ResourceFilter resource) {
            this.resource = resource;
            return this;
        }

        public Builder related(RelatedFilter related) {
            this.related = related;
            return this;
        }

        public Builder anyResource(ResourceFilter anyResource) {
            this.anyResource = anyResource;
            return this;
        }

        public Builder id(UUID id) {
            this.ids.add(id);
            return this;
        }

        public Builder order(Order order) {
            this.order = order;
            return this;
        }

        public EventFilter build() {
            return new EventFilter(
                new OccurredFilter(since, until),
                event,
                resource,
                related,
                anyResource,
                ids.isEmpty() ? null : new IdFilter(List.copyOf(ids)),
                order
            );
        }
    }
}
