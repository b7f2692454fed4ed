package tech.syncbridge.platform.webhook;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.syncbridge.platform.credential.Credential;
import tech.syncbridge.platform.integration.IntegrationService;
import tech.syncbridge.platform.integration.ProviderType;
import tech.syncbridge.platform.webhook.signature.HmacSignatureVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static io.restassured.RestAssured.given;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for WebhookResource.
 */
@Tag("integration")
@QuarkusTest
class WebhookResourceTest {

    @Inject
    IntegrationService integrationService;

    private String instanceId;

    @BeforeEach
    void setUp() {
        String id = integrationService.create("tenant-" + System.nanoTime(), "Webhook test", ProviderType.HUBSPOT, null, null).id;
        integrationService.connect(id, Credential.oauth2("tok", null, null, List.of()).withWebhookSecret("whsec-test"), "test");
        instanceId = id;
    }

    private static String body(long objectId) {
        return "[{\"subscriptionType\":\"deal.creation\",\"objectId\":" + objectId + "}]";
    }

    private static String sign(String body) throws Exception {
        return "sha256=" + HmacSignatureVerifier.sign(body.getBytes(StandardCharsets.UTF_8), "whsec-test");
    }

    // ==================== Receive ====================

    @Test
    @DisplayName("A signed webhook is accepted with 202 and a redelivery answers 200")
    void receive_shouldAcceptThenDedupe() throws Exception {
        String payload = body(System.nanoTime());

        String eventId = given()
            .contentType(ContentType.JSON)
            .header("X-Hub-Signature-256", sign(payload))
            .body(payload)
        .when()
            .post("/webhooks/hubspot/" + instanceId)
        .then()
            .statusCode(202)
            .body("status", equalTo("RECEIVED"))
            .extract().path("eventId");

        given()
            .contentType(ContentType.JSON)
            .header("X-Hub-Signature-256", sign(payload))
            .body(payload)
        .when()
            .post("/webhooks/hubspot/" + instanceId)
        .then()
            .statusCode(200)
            .body("status", equalTo("DEDUPED"));

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
            given()
            .when()
                .get("/webhooks/events/" + eventId)
            .then()
                .statusCode(200)
                .body("status", equalTo("PROCESSED"))
                .body("entityType", equalTo("deal")));
    }

    @Test
    @DisplayName("A bad signature is rejected with 401")
    void receive_shouldReturn401_whenSignatureInvalid() {
        given()
            .contentType(ContentType.JSON)
            .header("X-Hub-Signature-256", "sha256=00")
            .body(body(1))
        .when()
            .post("/webhooks/hubspot/" + instanceId)
        .then()
            .statusCode(401);
    }

    @Test
    @DisplayName("Unknown providers and instances answer 404")
    void receive_shouldReturn404_whenProviderOrInstanceUnknown() throws Exception {
        String payload = body(1);

        given()
            .contentType(ContentType.JSON)
            .body(payload)
        .when()
            .post("/webhooks/myspace/" + instanceId)
        .then()
            .statusCode(404);

        given()
            .contentType(ContentType.JSON)
            .header("X-Hub-Signature-256", sign(payload))
            .body(payload)
        .when()
            .post("/webhooks/hubspot/int_missing")
        .then()
            .statusCode(404);
    }

    // ==================== Administration ====================

    @Test
    @DisplayName("Stats and dead letters are listed per instance")
    void admin_shouldListStatsAndDeadLetters() {
        given()
        .when()
            .get("/webhooks/stats?instanceId=" + instanceId)
        .then()
            .statusCode(200)
            .body("instanceId", equalTo(instanceId));

        given()
        .when()
            .get("/webhooks/dead-letters?instanceId=" + instanceId)
        .then()
            .statusCode(200)
            .body("size()", equalTo(0));

        given()
        .when()
            .get("/webhooks/dead-letters")
        .then()
            .statusCode(400);
    }

    @Test
    @DisplayName("Replay of a missing event answers 404")
    void replay_shouldReturn404_whenNotFound() {
        given()
        .when()
            .post("/webhooks/events/whe_missing/replay")
        .then()
            .statusCode(404);
    }
}
