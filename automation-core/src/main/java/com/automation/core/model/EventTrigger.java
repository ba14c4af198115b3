package com.automation.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Describes which events an automation watches and when it fires.
 *
 * Invariants (enforced by AutomationValidator at authoring time):
 * - threshold >= 0
 * - within >= 0, and > 0 for proactive triggers
 * - every pattern is well-formed
 */
public record EventTrigger(
    // Which primary resources are relevant
    ResourceSpecification match,

    // Which related resources must be present
    @JsonProperty("match_related")
    ResourceSpecification matchRelated,

    // Event-name patterns that open a window
    Set<String> after,

    // Event-name patterns that are counted (reactive) or awaited (proactive)
    Set<String> expect,

    // Labels of the primary resource that identify a trigger instance
    @JsonProperty("for_each")
    Set<String> forEach,

    Posture posture,
    int threshold,
    Duration within
) {

    public EventTrigger {
        match = match == null ? ResourceSpecification.ANY : match;
        matchRelated = matchRelated == null ? ResourceSpecification.ANY : matchRelated;
        after = after == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(after));
        expect = expect == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(expect));
        forEach = forEach == null || forEach.isEmpty()
            ? Set.of(Resource.ID)
            : Collections.unmodifiableSet(new LinkedHashSet<>(forEach));
        posture = posture == null ? Posture.REACTIVE : posture;
        within = within == null ? Duration.ZERO : within;
    }

    @JsonIgnore
    public boolean isProactive() {
        return posture == Posture.PROACTIVE;
    }

    public boolean hasAfter() {
        return !after.isEmpty();
    }

    /**
     * Number of expected events that resolve a proactive epoch.
     * A threshold of zero still requires one event.
     */
    public int requiredExpectCount() {
        return Math.max(threshold, 1);
    }

    /**
     * Resolve the trigger-instance identity for an event's primary resource.
     * Labels missing from the resource are left out.
     */
    public Map<String, String> triggeringLabels(Resource resource) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (String label : forEach) {
            String value = resource.get(label);
            if (value != null) {
                labels.put(label, value);
            }
        }
        return Collections.unmodifiableMap(labels);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ResourceSpecification match;
        private ResourceSpecification matchRelated;
        private Set<String> after = Set.of();
        private Set<String> expect = Set.of();
        private Set<String> forEach;
        private Posture posture = Posture.REACTIVE;
        private int threshold = 1;
        private Duration within = Duration.ZERO;

        public Builder match(Map<String, String> match) {
            this.match = ResourceSpecification.of(match);
            return this;
        }

        public Builder match(ResourceSpecification match) {
            this.match = match;
            return this;
        }

        public Builder matchRelated(Map<String, String> matchRelated) {
            this.matchRelated = ResourceSpecification.of(matchRelated);
            return this;
        }

        public Builder matchRelated(ResourceSpecification matchRelated) {
            this.matchRelated = matchRelated;
            return this;
        }

        public Builder after(String... after) {
            this.after = Set.of(after);
            return this;
        }

        public Builder expect(String... expect) {
            this.expect = Set.of(expect);
            return this;
        }

        public Builder forEach(String... forEach) {
            this.forEach = Set.of(forEach);
            return this;
        }

        public Builder posture(Posture posture) {
            this.posture = posture;
            return this;
        }

        public Builder threshold(int threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder within(Duration within) {
            this.within = within;
            return this;
        }

        public EventTrigger build() {
            return new EventTrigger(match, matchRelated, after, expect, forEach, posture, threshold, within);
        }
    }
}
