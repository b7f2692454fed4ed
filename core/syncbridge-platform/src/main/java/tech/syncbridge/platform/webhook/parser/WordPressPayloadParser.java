package tech.syncbridge.platform.webhook.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * WordPress webhook plugins post {@code {"action": "post_updated", "post": {"ID": 42, "post_type": "post"}}}.
 */
public class WordPressPayloadParser implements WebhookPayloadParser {

    @Override
    public ParsedWebhook parse(JsonNode payload, Map<String, String> headers) {
        String action = JsonFields.text(payload, "action", "hook");
        if (action == null) {
            throw new MalformedPayloadException("WordPress webhook has no action");
        }
        int underscore = action.indexOf('_');
        String objectKey = underscore > 0 ? action.substring(0, underscore) : action;
        JsonNode object = payload.get(objectKey);
        String id = JsonFields.text(object, "ID", "id");
        if (id == null) {
            return new ParsedWebhook(action, null, List.of());
        }
        String entityType = JsonFields.text(object, "post_type");
        return new ParsedWebhook(action, entityType != null ? entityType : objectKey, List.of(id));
    }
}
