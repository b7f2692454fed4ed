package tech.syncbridge.platform.webhook.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * GitHub names the event in {@code X-GitHub-Event} ("issues", "pull_request") and nests the
 * changed object under the singular key ("issue", "pull_request").
 */
public class GitHubPayloadParser implements WebhookPayloadParser {

    static final String EVENT_HEADER = "X-GitHub-Event";

    @Override
    public ParsedWebhook parse(JsonNode payload, Map<String, String> headers) {
        if (!payload.isObject()) {
            throw new MalformedPayloadException("GitHub webhook body is not an object");
        }
        String event = headers.get(EVENT_HEADER);
        String action = JsonFields.text(payload, "action");
        if (event == null && action == null) {
            throw new MalformedPayloadException("GitHub webhook names no event");
        }
        String eventType = event == null ? action : action == null ? event : event + "." + action;
        if (event == null) {
            return new ParsedWebhook(eventType, null, List.of());
        }

        String objectKey = payload.has(event) ? event : singular(event);
        JsonNode object = payload.get(objectKey);
        String ref = JsonFields.text(object, "number", "id");
        if (ref == null) {
            return new ParsedWebhook(eventType, null, List.of());
        }
        return new ParsedWebhook(eventType, objectKey, List.of(ref));
    }

    private static String singular(String event) {
        return event.endsWith("s") ? event.substring(0, event.length() - 1) : event;
    }
}
