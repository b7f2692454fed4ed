package tech.syncbridge.platform.webhook.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Extracts the event type and changed records from a provider's webhook body.
 */
public interface WebhookPayloadParser {

    /**
     * @param headers request headers, looked up case-insensitively
     * @throws MalformedPayloadException if the body lacks what the provider always sends
     */
    ParsedWebhook parse(JsonNode payload, Map<String, String> headers);
}
