package com.automation.core.model;

import com.automation.core.exception.EventValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable record of something that happened to a resource.
 * Append-only; the automation engine both consumes and produces events.
 *
 * Primary Key: id
 *
 * Invariants:
 * - Events are never modified once stored
 * - occurred drives ordering and window placement, received is the server stamp
 * - resource always carries prefect.resource.id
 */
public record Event(
    // Primary key
    UUID id,

    // Timing
    Instant occurred,

    // Dotted event name, e.g. prefect.flow-run.Running
    String event,

    // Subject
    Resource resource,
    List<RelatedResource> related,

    // Data
    JsonNode payload,

    // Server receipt time
    Instant received,

    // Causality (optional)
    UUID follows
) {

    public Event {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (resource == null) {
            resource = new Resource(Map.of());
        }
        related = related == null ? List.of() : List.copyOf(related);
        if (payload == null || payload.isNull()) {
            payload = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * Stamp the server receipt time.
     */
    public Event receive(Instant now) {
        return new Event(id, occurred, event, resource, related, payload, now, follows);
    }

    /**
     * Reject events the engine cannot place or key.
     *
     * @throws EventValidationException if a required field is missing
     */
    public Event validate() {
        if (occurred == null) {
            throw new EventValidationException("occurred", "is required");
        }
        if (event == null || event.isBlank()) {
            throw new EventValidationException("event", "is required");
        }
        String resourceId = resource.id();
        if (resourceId == null || resourceId.isBlank()) {
            throw new EventValidationException("resource", Resource.ID + " is required");
        }
        for (RelatedResource r : related) {
            if (r.id() == null || r.id().isBlank()) {
                throw new EventValidationException("related", Resource.ID + " is required");
            }
            if (r.role() == null || r.role().isBlank()) {
                throw new EventValidationException("related", Resource.ROLE + " is required");
            }
        }
        return this;
    }

    public String resourceId() {
        return resource.id();
    }

    /**
     * Related resources playing the given role, in event order.
     */
    public List<RelatedResource> relatedInRole(String role) {
        return related.stream()
            .filter(r -> role.equals(r.role()))
            .toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID id = UUID.randomUUID();
        private Instant occurred;
        private String event;
        private Map<String, String> resource = Map.of();
        private final List<RelatedResource> related = new ArrayList<>();
        private JsonNode payload;
        private Instant received;
        private UUID follows;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder occurred(Instant occurred) {
            this.occurred = occurred;
            return this;
        }

        public Builder event(String event) {
            this.event = event;
            return this;
        }

        public Builder resource(Map<String, String> resource) {
            this.resource = resource;
            return this;
        }

        public Builder resourceId(String resourceId) {
            this.resource = Map.of(Resource.ID, resourceId);
            return this;
        }

        public Builder related(RelatedResource relatedResource) {
            this.related.add(relatedResource);
            return this;
        }

        public Builder related(List<RelatedResource> relatedResources) {
            this.related.addAll(relatedResources);
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder received(Instant received) {
            this.received = received;
            return this;
        }

        public Builder follows(UUID follows) {
            this.follows = follows;
            return this;
        }

        public Event build() {
            return new Event(id, occurred, event, new Resource(resource), related, payload, received, follows);
        }
    }
}
