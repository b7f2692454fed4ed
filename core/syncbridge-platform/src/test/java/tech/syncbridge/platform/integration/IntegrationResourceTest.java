package tech.syncbridge.platform.integration;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for IntegrationResource.
 */
@Tag("integration")
@QuarkusTest
class IntegrationResourceTest {

    private String createIntegration(String tenantId) {
        return given()
            .contentType(ContentType.JSON)
            .body("""
                {"tenantId": "%s", "name": "Acme HubSpot", "provider": "hubspot"}
                """.formatted(tenantId))
        .when()
            .post("/integrations")
        .then()
            .statusCode(201)
            .header("Location", containsString("/integrations/"))
            .body("status", equalTo("PENDING_AUTH"))
            .body("connected", equalTo(false))
            .extract().path("id");
    }

    private void connect(String id) {
        given()
            .contentType(ContentType.JSON)
            .header("X-Actor", "alice")
            .body("""
                {"type": "oauth2", "accessToken": "tok-123", "webhookSecret": "whsec-test"}
                """)
        .when()
            .put("/integrations/" + id + "/credentials")
        .then()
            .statusCode(200)
            .body("status", equalTo("ACTIVE"))
            .body("connected", equalTo(true))
            .body("$", not(hasKey("accessToken")));
    }

    // ==================== Lifecycle ====================

    @Test
    @DisplayName("Create, connect and list an integration instance")
    void lifecycle_shouldCreateConnectAndList() {
        String tenantId = "tenant-" + System.nanoTime();
        String id = createIntegration(tenantId);
        connect(id);

        given()
        .when()
            .get("/integrations?tenantId=" + tenantId)
        .then()
            .statusCode(200)
            .body("total", equalTo(1))
            .body("integrations[0].id", equalTo(id))
            .body("integrations[0].provider", equalTo("hubspot"));
    }

    @Test
    @DisplayName("Create should return 400 when required fields are missing")
    void create_shouldReturn400_whenInvalid() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"provider\": \"hubspot\"}")
        .when()
            .post("/integrations")
        .then()
            .statusCode(400);
    }

    @Test
    @DisplayName("List should return 400 without tenantId")
    void list_shouldReturn400_whenTenantMissing() {
        given()
        .when()
            .get("/integrations")
        .then()
            .statusCode(400)
            .body("error", containsString("tenantId"));
    }

    @Test
    @DisplayName("Get should return 404 for unknown instance")
    void get_shouldReturn404_whenNotFound() {
        given()
        .when()
            .get("/integrations/int_missing")
        .then()
            .statusCode(404);
    }

    @Test
    @DisplayName("Credentials without their secret are rejected")
    void storeCredentials_shouldReturn400_whenIncomplete() {
        String id = createIntegration("tenant-" + System.nanoTime());

        given()
            .contentType(ContentType.JSON)
            .body("{\"type\": \"api_key\"}")
        .when()
            .put("/integrations/" + id + "/credentials")
        .then()
            .statusCode(400);
    }

    @Test
    @DisplayName("Disconnect revokes the instance and sync can no longer be triggered")
    void disconnect_shouldRevokeInstance() {
        String id = createIntegration("tenant-" + System.nanoTime());
        connect(id);

        given()
        .when()
            .delete("/integrations/" + id)
        .then()
            .statusCode(200)
            .body("status", equalTo("REVOKED"))
            .body("connected", equalTo(false));

        given()
            .contentType(ContentType.JSON)
            .body("{\"entityTypes\": [\"contact\"]}")
        .when()
            .post("/integrations/" + id + "/sync")
        .then()
            .statusCode(409);
    }

    // ==================== Sync ====================

    @Test
    @DisplayName("Trigger sync should return 400 when no mapping exists for the entity type")
    void triggerSync_shouldReturn400_whenMappingMissing() {
        String id = createIntegration("tenant-" + System.nanoTime());
        connect(id);

        given()
            .contentType(ContentType.JSON)
            .body("{\"entity_types\": [\"contact\"], \"direction\": \"pull\"}")
        .when()
            .post("/integrations/" + id + "/sync")
        .then()
            .statusCode(400)
            .body("error", containsString("mapping"));
    }

    @Test
    @DisplayName("Trigger sync queues a job visible in the job list")
    void triggerSync_shouldQueueJob() {
        String id = createIntegration("tenant-" + System.nanoTime());
        connect(id);
        given()
            .contentType(ContentType.JSON)
            .body("""
                {"instanceId": "%s", "entityType": "contact", "direction": "INBOUND",
                 "mapping": {"name": "contacts-in", "rules": [
                   {"sourceField": "id", "targetField": "id", "transform": "IDENTITY", "dataType": "STRING"}]}}
                """.formatted(id))
        .when()
            .post("/mappings")
        .then()
            .statusCode(201);

        String jobId = given()
            .contentType(ContentType.JSON)
            .body("{\"entityTypes\": [\"contact\"]}")
        .when()
            .post("/integrations/" + id + "/sync")
        .then()
            .statusCode(202)
            .body("jobId", notNullValue())
            .extract().path("jobId");

        given()
        .when()
            .get("/integrations/" + id + "/jobs")
        .then()
            .statusCode(200)
            .body("id", hasItem(jobId));

        given()
        .when()
            .get("/jobs/" + jobId)
        .then()
            .statusCode(200)
            .body("instanceId", equalTo(id))
            .body("trigger", notNullValue());
    }

    // ==================== Local Records ====================

    @Test
    @DisplayName("Local records are written and read back")
    void localRecords_shouldRoundTrip() {
        String id = createIntegration("tenant-" + System.nanoTime());

        given()
            .contentType(ContentType.JSON)
            .body("{\"data\": {\"email\": \"jane@example.com\"}}")
        .when()
            .put("/integrations/" + id + "/records/contact/c1")
        .then()
            .statusCode(200);

        given()
        .when()
            .get("/integrations/" + id + "/records/contact/c1")
        .then()
            .statusCode(200)
            .body("data.email", equalTo("jane@example.com"));

        given()
        .when()
            .get("/integrations/" + id + "/records/contact/c2")
        .then()
            .statusCode(404);
    }
}
