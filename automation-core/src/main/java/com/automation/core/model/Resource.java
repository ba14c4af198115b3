package com.automation.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The labelled entity an event is about, such as a flow run or a deployment.
 * Serialized as a flat JSON object of labels.
 *
 * Invariants:
 * - Label order is preserved
 * - A stored event's resource always carries {@link #ID}
 */
public record Resource(Map<String, String> labels) implements Labelled {

    public static final String ID = "prefect.resource.id";
    public static final String NAME = "prefect.resource.name";
    public static final String ROLE = "prefect.resource.role";

    public Resource {
        labels = labels == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Resource of(Map<String, String> labels) {
        return new Resource(labels);
    }

    @Override
    @JsonValue
    public Map<String, String> labels() {
        return labels;
    }

    public String name() {
        return get(NAME);
    }

    /**
     * Relate this resource to another one under the given role.
     */
    public RelatedResource as(String role) {
        Map<String, String> copy = new LinkedHashMap<>(labels);
        copy.put(ROLE, role);
        return new RelatedResource(copy);
    }
}
