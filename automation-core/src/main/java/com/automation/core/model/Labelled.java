package com.automation.core.model;

import java.util.Map;

/**
 * Anything described by a flat set of string labels.
 */
public interface Labelled {

    Map<String, String> labels();

    default String get(String label) {
        return labels().get(label);
    }

    default boolean has(String label) {
        return labels().containsKey(label);
    }

    default String id() {
        return get(Resource.ID);
    }
}
