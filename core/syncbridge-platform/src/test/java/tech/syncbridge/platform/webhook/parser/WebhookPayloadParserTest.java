package tech.syncbridge.platform.webhook.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookPayloadParserTest {

    private final ObjectMapper mapper = new ObjectMapper();

    // ==================== HubSpot ====================

    @Test
    @DisplayName("HubSpot batches collapse to one entity type with distinct object ids")
    void hubspot_shouldCollectObjectIds() throws Exception {
        ParsedWebhook parsed = new HubSpotPayloadParser().parse(json("""
            [{"subscriptionType": "contact.propertyChange", "objectId": 1},
             {"subscriptionType": "contact.creation", "objectId": 2},
             {"subscriptionType": "contact.propertyChange", "objectId": 1},
             {"subscriptionType": "deal.creation", "objectId": 9}]
            """), Map.of());

        assertThat(parsed.eventType()).isEqualTo("contact.propertyChange");
        assertThat(parsed.entityType()).isEqualTo("contact");
        assertThat(parsed.entityRefs()).containsExactly("1", "2");
    }

    @Test
    @DisplayName("HubSpot payload without events is malformed")
    void hubspot_shouldReject_whenEmpty() {
        assertThatThrownBy(() -> new HubSpotPayloadParser().parse(json("[]"), Map.of()))
            .isInstanceOf(MalformedPayloadException.class);
    }

    // ==================== GitHub ====================

    @Test
    @DisplayName("GitHub issue events target the issue number")
    void github_shouldTargetIssueNumber() throws Exception {
        ParsedWebhook parsed = new GitHubPayloadParser().parse(
            json("{\"action\": \"opened\", \"issue\": {\"number\": 17, \"id\": 9001}}"),
            Map.of("X-GitHub-Event", "issues"));

        assertThat(parsed.eventType()).isEqualTo("issues.opened");
        assertThat(parsed.entityType()).isEqualTo("issue");
        assertThat(parsed.entityRefs()).containsExactly("17");
    }

    @Test
    @DisplayName("GitHub pings carry no targets")
    void github_shouldHaveNoTargets_forPing() throws Exception {
        ParsedWebhook parsed = new GitHubPayloadParser().parse(json("{\"zen\": \"Keep it simple\"}"),
            Map.of("X-GitHub-Event", "ping"));

        assertThat(parsed.eventType()).isEqualTo("ping");
        assertThat(parsed.hasTargets()).isFalse();
    }

    // ==================== Salesforce ====================

    @Test
    @DisplayName("Salesforce notifications are typed by the sobject")
    void salesforce_shouldUseSobjectType() throws Exception {
        ParsedWebhook parsed = new SalesforcePayloadParser().parse(json("""
            {"event": {"type": "updated"}, "sobject": {"Id": "003xx", "attributes": {"type": "Contact"}}}
            """), Map.of());

        assertThat(parsed.eventType()).isEqualTo("contact.updated");
        assertThat(parsed.entityType()).isEqualTo("contact");
        assertThat(parsed.entityRefs()).containsExactly("003xx");
    }

    @Test
    @DisplayName("Salesforce notification without sobject is malformed")
    void salesforce_shouldReject_whenSobjectMissing() {
        assertThatThrownBy(() -> new SalesforcePayloadParser().parse(json("{\"event\": {}}"), Map.of()))
            .isInstanceOf(MalformedPayloadException.class);
    }

    // ==================== WordPress ====================

    @Test
    @DisplayName("WordPress events use the post type as entity type")
    void wordpress_shouldUsePostType() throws Exception {
        ParsedWebhook parsed = new WordPressPayloadParser().parse(
            json("{\"action\": \"post_updated\", \"post\": {\"ID\": 42, \"post_type\": \"page\"}}"), Map.of());

        assertThat(parsed.eventType()).isEqualTo("post_updated");
        assertThat(parsed.entityType()).isEqualTo("page");
        assertThat(parsed.entityRefs()).containsExactly("42");
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }
}
