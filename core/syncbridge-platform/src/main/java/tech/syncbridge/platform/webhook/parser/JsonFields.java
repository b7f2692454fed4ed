package tech.syncbridge.platform.webhook.parser;

import com.fasterxml.jackson.databind.JsonNode;

final class JsonFields {

    private JsonFields() {
        // Utility class
    }

    /**
     * First of {@code names} present on the node as a scalar, as text.
     */
    static String text(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isValueNode() && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }
}
