package com.automation.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Label patterns a resource must satisfy.
 * In JSON each label maps to a single pattern or a list of alternatives:
 * <pre>
 * {"prefect.resource.id": "prefect.flow-run.*", "prefect.resource.role": ["deployment", "work-queue"]}
 * </pre>
 *
 * Pattern forms: exact value, {@code *}, {@code prefix*}, {@code !value}.
 * Matching itself lives in {@link com.automation.core.matching.ResourceMatcher}.
 */
public record ResourceSpecification(Map<String, List<String>> patterns) {

    public static final ResourceSpecification ANY = new ResourceSpecification(Map.of());

    public ResourceSpecification {
        if (patterns == null) {
            patterns = Map.of();
        } else {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            patterns.forEach((label, values) -> copy.put(label,
                values == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(values))));
            patterns = Collections.unmodifiableMap(copy);
        }
    }

    /**
     * Accepts both the single-value and the list form of each label.
     * Values of any other shape are kept as their string form so that
     * validation can report them instead of failing deserialization.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ResourceSpecification fromJson(Map<String, Object> raw) {
        if (raw == null) {
            return ANY;
        }
        Map<String, List<String>> patterns = new LinkedHashMap<>();
        raw.forEach((label, value) -> {
            if (value == null) {
                patterns.put(label, null);
            } else if (value instanceof Collection<?> values) {
                List<String> strings = new ArrayList<>();
                for (Object v : values) {
                    strings.add(v == null ? null : v.toString());
                }
                patterns.put(label, strings);
            } else {
                patterns.put(label, List.of(value.toString()));
            }
        });
        return new ResourceSpecification(patterns);
    }

    public static ResourceSpecification of(Map<String, String> single) {
        Map<String, List<String>> patterns = new LinkedHashMap<>();
        single.forEach((label, value) -> patterns.put(label, List.of(value)));
        return new ResourceSpecification(patterns);
    }

    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        patterns.forEach((label, values) -> json.put(label, values.size() == 1 ? values.get(0) : values));
        return json;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }
}
