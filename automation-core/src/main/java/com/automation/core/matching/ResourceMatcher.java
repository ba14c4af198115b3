package com.automation.core.matching;

import com.automation.core.model.Labelled;
import com.automation.core.model.RelatedResource;
import com.automation.core.model.ResourceSpecification;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Label and event-name pattern matching.
 *
 * Pattern forms:
 * <ul>
 *   <li>{@code value}: exact match</li>
 *   <li>{@code *}: label present with any value</li>
 *   <li>{@code prefix*}: value starts with prefix</li>
 *   <li>{@code !value}: label absent or value differs</li>
 * </ul>
 * Matching never throws: malformed patterns simply do not match.
 * Use {@link #validate} to reject them at authoring time.
 */
public final class ResourceMatcher {

    public static final String WILDCARD = "*";
    public static final String NEGATION = "!";

    private ResourceMatcher() {
    }

    /**
     * Every label in the specification must match; extra resource labels are ignored.
     */
    public static boolean matches(ResourceSpecification spec, Labelled resource) {
        if (spec == null || spec.isEmpty()) {
            return true;
        }
        if (resource == null) {
            return false;
        }
        for (Map.Entry<String, List<String>> entry : spec.patterns().entrySet()) {
            if (!labelMatches(entry.getValue(), resource.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * At least one related resource must satisfy the whole specification.
     * An empty specification passes; an empty related list fails any non-empty one.
     */
    public static boolean matchesRelated(ResourceSpecification spec, Collection<RelatedResource> related) {
        if (spec == null || spec.isEmpty()) {
            return true;
        }
        if (related == null) {
            return false;
        }
        for (RelatedResource candidate : related) {
            if (matches(spec, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * An empty pattern set matches every event name.
     */
    public static boolean matchesEvent(Collection<String> patterns, String eventName) {
        if (patterns == null || patterns.isEmpty()) {
            return true;
        }
        return anyMatch(patterns, eventName);
    }

    /**
     * Like {@link #matchesEvent} but an empty pattern set matches nothing.
     */
    public static boolean matchesAnyEvent(Collection<String> patterns, String eventName) {
        return patterns != null && anyMatch(patterns, eventName);
    }

    private static boolean anyMatch(Collection<String> patterns, String value) {
        for (String pattern : patterns) {
            if (valueMatches(pattern, value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean labelMatches(List<String> patterns, String value) {
        if (patterns == null || patterns.isEmpty()) {
            return false;
        }
        return anyMatch(patterns, value);
    }

    static boolean valueMatches(String pattern, String value) {
        if (pattern == null || pattern.isEmpty()) {
            return false;
        }
        if (pattern.startsWith(NEGATION)) {
            String negated = pattern.substring(1);
            if (negated.isEmpty()) {
                return false;
            }
            return value == null || !valueMatches(negated, value);
        }
        if (value == null) {
            return false;
        }
        if (pattern.equals(WILDCARD)) {
            return true;
        }
        if (pattern.endsWith(WILDCARD)) {
            return value.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(value);
    }

    /**
     * Report malformed label patterns.
     *
     * @param field name used in problem messages, e.g. {@code match_related}
     * @return problem descriptions, empty when valid
     */
    public static List<String> validate(String field, ResourceSpecification spec) {
        List<String> problems = new ArrayList<>();
        if (spec == null) {
            return problems;
        }
        spec.patterns().forEach((label, patterns) -> {
            if (label == null || label.isBlank()) {
                problems.add(field + ": label names must not be empty");
                return;
            }
            if (patterns == null || patterns.isEmpty()) {
                problems.add(field + "." + label + ": at least one pattern is required");
                return;
            }
            for (String pattern : patterns) {
                String problem = patternProblem(pattern);
                if (problem != null) {
                    problems.add(field + "." + label + ": " + problem);
                }
            }
        });
        return problems;
    }

    /**
     * Report malformed event-name patterns.
     */
    public static List<String> validateEventPatterns(String field, Collection<String> patterns) {
        List<String> problems = new ArrayList<>();
        if (patterns == null) {
            return problems;
        }
        for (String pattern : patterns) {
            String problem = patternProblem(pattern);
            if (problem != null) {
                problems.add(field + ": " + problem);
            }
        }
        return problems;
    }

    private static String patternProblem(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return "patterns must not be empty";
        }
        String body = pattern.startsWith(NEGATION) ? pattern.substring(1) : pattern;
        if (body.isEmpty()) {
            return "'" + pattern + "' negates nothing";
        }
        int star = body.indexOf(WILDCARD);
        if (star >= 0 && star != body.length() - 1) {
            return "'" + pattern + "' may only use * as its final character";
        }
        return null;
    }
}
