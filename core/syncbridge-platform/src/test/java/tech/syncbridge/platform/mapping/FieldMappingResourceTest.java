package tech.syncbridge.platform.mapping;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.syncbridge.platform.integration.IntegrationService;
import tech.syncbridge.platform.integration.ProviderType;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for FieldMappingResource.
 */
@Tag("integration")
@QuarkusTest
class FieldMappingResourceTest {

    private static final String CONTACT_MAPPING = """
        {"name": "contacts-in", "rules": [
          {"sourceField": "id", "targetField": "id", "dataType": "STRING"},
          {"sourceField": "properties.email", "targetField": "email", "transform": "FUNCTION",
           "transformConfig": {"function": "normalize_email"}}]}
        """;

    @Inject
    IntegrationService integrationService;

    private String instanceId;

    @BeforeEach
    void setUp() {
        instanceId = integrationService.create("tenant-" + System.nanoTime(), "Mapping test", ProviderType.HUBSPOT, null, null).id;
    }

    private String createMapping() {
        return given()
            .contentType(ContentType.JSON)
            .body("""
                {"instanceId": "%s", "entityType": "contact", "direction": "INBOUND", "mapping": %s}
                """.formatted(instanceId, CONTACT_MAPPING))
        .when()
            .post("/mappings")
        .then()
            .statusCode(201)
            .body("version", equalTo(1))
            .body("active", equalTo(true))
            .extract().path("id");
    }

    // ==================== Create ====================

    @Test
    @DisplayName("Create should store the mapping and list it under the instance")
    void create_shouldStoreMapping() {
        String id = createMapping();

        given()
        .when()
            .get("/mappings?instanceId=" + instanceId)
        .then()
            .statusCode(200)
            .body("id", hasItem(id));
    }

    @Test
    @DisplayName("Create should return 400 with violation details for an invalid mapping")
    void create_shouldReturn400_whenMappingInvalid() {
        given()
            .contentType(ContentType.JSON)
            .body("""
                {"instanceId": "%s", "entityType": "contact", "direction": "INBOUND",
                 "mapping": {"name": "bad", "rules": [
                   {"sourceField": "name", "targetField": "name", "transform": "FUNCTION",
                    "transformConfig": {"function": "no_such_function"}}]}}
                """.formatted(instanceId))
        .when()
            .post("/mappings")
        .then()
            .statusCode(400)
            .body("error", equalTo("Invalid field mapping"))
            .body("details", hasItem(containsString("UNKNOWN_FUNCTION")));
    }

    @Test
    @DisplayName("Create should return 409 when an active mapping exists")
    void create_shouldReturn409_whenDuplicate() {
        createMapping();

        given()
            .contentType(ContentType.JSON)
            .body("""
                {"instanceId": "%s", "entityType": "contact", "direction": "INBOUND", "mapping": %s}
                """.formatted(instanceId, CONTACT_MAPPING))
        .when()
            .post("/mappings")
        .then()
            .statusCode(409);
    }

    // ==================== Preview / Suggest ====================

    @Test
    @DisplayName("Preview should transform a sample record")
    void preview_shouldTransformSample() {
        String id = createMapping();

        given()
            .contentType(ContentType.JSON)
            .body("{\"record\": {\"id\": \"c1\", \"properties\": {\"email\": \" Jane@Example.com\"}}}")
        .when()
            .post("/mappings/" + id + "/preview")
        .then()
            .statusCode(200)
            .body("success", equalTo(true))
            .body("record.email", equalTo("jane@example.com"));
    }

    @Test
    @DisplayName("Suggest should draft rules by field name")
    void suggest_shouldDraftRules() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"name\": \"draft\", \"sourceFields\": [\"email_address\"], \"targetFields\": [\"email\"]}")
        .when()
            .post("/mappings/suggest")
        .then()
            .statusCode(200)
            .body("rules[0].targetField", equalTo("email"));
    }

    // ==================== Delete ====================

    @Test
    @DisplayName("Delete should deactivate the mapping")
    void delete_shouldDeactivate() {
        String id = createMapping();

        given()
        .when()
            .delete("/mappings/" + id)
        .then()
            .statusCode(204);

        given()
        .when()
            .get("/mappings/" + id)
        .then()
            .statusCode(200)
            .body("active", equalTo(false));
    }

    @Test
    @DisplayName("Get should return 404 for an unknown mapping")
    void get_shouldReturn404_whenNotFound() {
        given()
        .when()
            .get("/mappings/fm_missing")
        .then()
            .statusCode(404);
    }
}
