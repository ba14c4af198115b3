package com.automation.core.action;

import com.automation.core.model.Event;
import com.automation.core.model.TriggeredAction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {{ placeholder }}} references in notification text.
 *
 * Supported placeholders:
 * <ul>
 *   <li>{@code automation.id}, {@code automation.name}, {@code automation.description}</li>
 *   <li>{@code firing.id}, {@code firing.triggered}</li>
 *   <li>{@code event.id}, {@code event.event}, {@code event.occurred}, {@code event.resource.<label>}</li>
 *   <li>{@code labels.<label>} for the triggering labels</li>
 * </ul>
 * Unknown placeholders are left untouched. Placeholders that resolve to
 * nothing (for example {@code event.*} on a timeout firing) render empty.
 */
public final class ActionTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.\\-]+)\\s*}}");

    private ActionTemplates() {
    }

    public static String render(String template, TriggeredAction triggeredAction) {
        if (template == null || template.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = resolve(matcher.group(1), triggeredAction);
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? matcher.group(0) : value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String resolve(String path, TriggeredAction ta) {
        Event event = ta.triggeringEvent();
        if (path.startsWith("labels.")) {
            return orEmpty(ta.triggeringLabels().get(path.substring("labels.".length())));
        }
        if (path.startsWith("event.resource.")) {
            return event == null ? "" : orEmpty(event.resource().get(path.substring("event.resource.".length())));
        }
        return switch (path) {
            case "automation.id" -> ta.automation().id().toString();
            case "automation.name" -> orEmpty(ta.automation().name());
            case "automation.description" -> orEmpty(ta.automation().description());
            case "firing.id" -> ta.firing().id().toString();
            case "firing.triggered" -> String.valueOf(ta.triggered());
            case "event.id" -> event == null ? "" : event.id().toString();
            case "event.event" -> event == null ? "" : event.event();
            case "event.occurred" -> event == null ? "" : String.valueOf(event.occurred());
            default -> null;
        };
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
