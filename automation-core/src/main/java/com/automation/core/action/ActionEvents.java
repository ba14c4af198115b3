package com.automation.core.action;

import com.automation.core.model.Event;
import com.automation.core.model.Resource;
import com.automation.core.model.TriggeredAction;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the events that feed action outcomes back into the stream.
 *
 * Outcome event ids are derived from the invocation id, so re-reporting the
 * same invocation after recovery is absorbed by the event store's id dedup.
 */
public final class ActionEvents {

    public static final String EXECUTED = "automation.action.executed";
    public static final String FAILED = "automation.action.failed";
    public static final String TARGET_ROLE = "target";

    private ActionEvents() {
    }

    public static Event executed(TriggeredAction triggeredAction, ActionResult result, ActionContext context) {
        ObjectNode payload = basePayload(triggeredAction);
        payload.put("status_code", result.statusCode());
        return outcome(triggeredAction, context, EXECUTED, payload, result);
    }

    public static Event failed(TriggeredAction triggeredAction, String reason, ActionContext context) {
        ObjectNode payload = basePayload(triggeredAction);
        payload.put("reason", reason);
        return outcome(triggeredAction, context, FAILED, payload, ActionResult.of(0));
    }

    /**
     * Resource id under which an automation's own events are reported.
     */
    public static String automationResourceId(String namespace, UUID automationId) {
        return namespace + ".automation." + automationId;
    }

    private static ObjectNode basePayload(TriggeredAction triggeredAction) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("action_index", triggeredAction.actionIndex());
        payload.put("action_type", triggeredAction.action().type());
        payload.put("invocation", triggeredAction.id().toString());
        return payload;
    }

    private static Event outcome(TriggeredAction triggeredAction, ActionContext context, String suffix,
                                 ObjectNode payload, ActionResult result) {
        String name = context.namespace() + "." + suffix;
        Map<String, String> resource = new LinkedHashMap<>();
        resource.put(Resource.ID, automationResourceId(context.namespace(), triggeredAction.automation().id()));
        if (triggeredAction.automation().name() != null) {
            resource.put(Resource.NAME, triggeredAction.automation().name());
        }
        Event triggeringEvent = triggeredAction.triggeringEvent();
        return Event.builder()
            .id(outcomeId(triggeredAction.id(), name))
            .occurred(context.clock().instant())
            .event(name)
            .resource(resource)
            .related(List.copyOf(result.related()))
            .payload(payload)
            .follows(triggeringEvent == null ? null : triggeringEvent.id())
            .build();
    }

    static UUID outcomeId(UUID invocationId, String eventName) {
        return UUID.nameUUIDFromBytes((invocationId + "|" + eventName).getBytes(StandardCharsets.UTF_8));
    }
}
