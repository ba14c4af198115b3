package com.automation.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A secondary resource attached to an event, qualified by its role
 * (for example the deployment a flow run belongs to, or the target of an action).
 */
public record RelatedResource(Map<String, String> labels) implements Labelled {

    public RelatedResource {
        labels = labels == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RelatedResource of(Map<String, String> labels) {
        return new RelatedResource(labels);
    }

    public static RelatedResource of(String id, String role) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(Resource.ID, id);
        labels.put(Resource.ROLE, role);
        return new RelatedResource(labels);
    }

    @Override
    @JsonValue
    public Map<String, String> labels() {
        return labels;
    }

    public String role() {
        return get(Resource.ROLE);
    }
}
