package tech.syncbridge.platform.webhook.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Salesforce streaming notifications: {@code {"event": {"type": "updated"}, "sobject": {"Id": ..., "attributes": {"type": "Contact"}}}}.
 */
public class SalesforcePayloadParser implements WebhookPayloadParser {

    @Override
    public ParsedWebhook parse(JsonNode payload, Map<String, String> headers) {
        JsonNode sobject = payload.get("sobject");
        if (sobject == null || !sobject.isObject()) {
            throw new MalformedPayloadException("Salesforce notification has no sobject");
        }
        String id = JsonFields.text(sobject, "Id", "id");
        String objectType = JsonFields.text(sobject.get("attributes"), "type");
        if (id == null || objectType == null) {
            throw new MalformedPayloadException("Salesforce sobject lacks Id or attributes.type");
        }
        String eventType = JsonFields.text(payload.get("event"), "type");
        String entityType = objectType.toLowerCase(Locale.ROOT);
        return new ParsedWebhook(entityType + "." + (eventType == null ? "changed" : eventType), entityType, List.of(id));
    }
}
