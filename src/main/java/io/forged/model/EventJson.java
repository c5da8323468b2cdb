package io.forged.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.forged.util.Jsons;

/**
 * Wire rendering of {@link Event}: the shape the streaming transport serializes.
 *
 * <pre>
 * { "id": "12", "kind": 1, "timestamp": "...", "agent_id": "a1", "workspace_id": "ws1",
 *   "payload": { "agent_state_changed": { ... } } }
 * </pre>
 */
public final class EventJson {
    private EventJson() {
    }

    public static ObjectNode toNode(Event event) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("id", event.id());
        node.put("kind", event.kind().code());
        node.put("timestamp", event.timestamp().toString());
        node.put("agent_id", event.agentId());
        node.put("workspace_id", event.workspaceId());
        ObjectNode payload = node.putObject("payload");
        EventPayload body = event.payload();
        if (body == null) {
            return node;
        }
        switch (event.kind()) {
            case AGENT_STATE_CHANGED -> {
                EventPayload.AgentStateChanged p = (EventPayload.AgentStateChanged) body;
                ObjectNode v = payload.putObject("agent_state_changed");
                v.put("previous_state", p.previousState());
                v.put("new_state", p.newState());
                v.put("reason", p.reason());
            }
            case ERROR -> {
                EventPayload.Error p = (EventPayload.Error) body;
                ObjectNode v = payload.putObject("error");
                v.put("code", p.code());
                v.put("message", p.message());
                v.put("recoverable", p.recoverable());
            }
            case PANE_CONTENT_CHANGED -> {
                EventPayload.PaneContentChanged p = (EventPayload.PaneContentChanged) body;
                ObjectNode v = payload.putObject("pane_content_changed");
                v.put("content_hash", p.contentHash());
                v.put("lines_changed", p.linesChanged());
            }
            case RESOURCE_VIOLATION -> {
                EventPayload.ResourceViolation p = (EventPayload.ResourceViolation) body;
                ObjectNode v = payload.putObject("resource_violation");
                v.put("resource_type", p.resourceType());
                v.put("current_value", p.currentValue());
                v.put("limit_value", p.limitValue());
                v.put("violation_count", p.violationCount());
                v.put("action_taken", p.actionTaken());
            }
            default -> {
            }
        }
        return node;
    }

    public static String toJsonLine(Event event) {
        return Jsons.toCompactJson(toNode(event));
    }
}
