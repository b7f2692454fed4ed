package tech.syncbridge.platform.webhook.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * HubSpot posts an array of events such as
 * {@code [{"subscriptionType": "contact.propertyChange", "objectId": 123}]}.
 */
public class HubSpotPayloadParser implements WebhookPayloadParser {

    @Override
    public ParsedWebhook parse(JsonNode payload, Map<String, String> headers) {
        List<JsonNode> events = new ArrayList<>();
        if (payload.isArray()) {
            payload.forEach(events::add);
        } else if (payload.isObject()) {
            events.add(payload);
        }
        if (events.isEmpty()) {
            throw new MalformedPayloadException("HubSpot webhook carries no events");
        }

        String eventType = JsonFields.text(events.get(0), "subscriptionType");
        if (eventType == null) {
            throw new MalformedPayloadException("HubSpot webhook event has no subscriptionType");
        }
        String entityType = objectOf(eventType);

        Set<String> refs = new LinkedHashSet<>();
        for (JsonNode event : events) {
            String subscription = JsonFields.text(event, "subscriptionType");
            String objectId = JsonFields.text(event, "objectId");
            if (subscription != null && objectId != null && entityType.equals(objectOf(subscription))) {
                refs.add(objectId);
            }
        }
        return new ParsedWebhook(eventType, entityType, new ArrayList<>(refs));
    }

    private static String objectOf(String subscriptionType) {
        int dot = subscriptionType.indexOf('.');
        String object = dot > 0 ? subscriptionType.substring(0, dot) : subscriptionType;
        return object.toLowerCase(Locale.ROOT);
    }
}
