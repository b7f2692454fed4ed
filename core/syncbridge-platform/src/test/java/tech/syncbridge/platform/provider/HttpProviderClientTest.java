package tech.syncbridge.platform.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.syncbridge.platform.credential.Credential;
import tech.syncbridge.platform.integration.IntegrationInstance;
import tech.syncbridge.platform.integration.ProviderType;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpProviderClientTest {

    private WireMockServer server;
    private HttpProviderClient client;
    private ProviderContext ctx;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();

        client = new HttpProviderClient(ProviderType.HUBSPOT, server.baseUrl(), HttpClient.newHttpClient(),
            new ObjectMapper(), new ProviderRateLimiters(Map.of()), Duration.ofSeconds(5));

        IntegrationInstance instance = new IntegrationInstance();
        instance.id = "int_test";
        instance.providerType = ProviderType.HUBSPOT;
        ctx = new ProviderContext(instance, Credential.apiKey("key-123"));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    // ==================== Change pages ====================

    @Test
    @DisplayName("Unreadable entries are reported beside the readable records of the page")
    void fetchChanges_shouldKeepReadableRecords_whenPageHasMalformedEntries() {
        server.stubFor(get(urlPathEqualTo("/contact/changes")).willReturn(okJson("""
            {"records": [
              {"id": "c1", "modified_at": "2024-03-01T08:00:00Z", "data": {"email": "a@b.com"}},
              {"modified_at": "2024-03-01T08:00:01Z", "data": {"email": "x@y.com"}},
              {"id": "c3", "modified_at": "yesterday", "data": {}},
              {"id": "c4", "data": {"email": "c@d.com"}}
            ],
            "next_cursor": "p2", "has_more": true}
            """)));

        RecordPage page = client.fetchChanges(ctx, "contact", null, 100);

        assertThat(page.records()).extracting(ExternalRecord::externalId).containsExactly("c1", "c4");
        assertThat(page.records().get(0).modifiedAt()).isEqualTo(Instant.parse("2024-03-01T08:00:00Z"));
        assertThat(page.malformed()).extracting(MalformedRecord::externalId).containsExactly(null, "c3");
        assertThat(page.nextCursor()).isEqualTo("p2");
        assertThat(page.hasMore()).isTrue();
    }

    @Test
    @DisplayName("A page without next_cursor has no cursor rather than echoing the request's")
    void fetchChanges_shouldReturnNullCursor_whenProviderSendsNone() {
        server.stubFor(get(urlPathEqualTo("/contact/changes")).willReturn(okJson("""
            {"records": [], "has_more": true}
            """)));

        RecordPage page = client.fetchChanges(ctx, "contact", "p7", 100);

        assertThat(page.nextCursor()).isNull();
        server.verify(getRequestedFor(urlPathEqualTo("/contact/changes"))
            .withQueryParam("cursor", equalTo("p7"))
            .withQueryParam("limit", equalTo("100"))
            .withHeader("Authorization", equalTo("Bearer key-123")));
    }

    // ==================== Error classification ====================

    @Test
    @DisplayName("429 is a rate limit carrying Retry-After")
    void fetchChanges_shouldThrowRateLimited_on429() {
        server.stubFor(get(urlPathEqualTo("/contact/changes"))
            .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "7")));

        assertThatThrownBy(() -> client.fetchChanges(ctx, "contact", null, 100))
            .isInstanceOfSatisfying(RateLimitedException.class, e ->
                assertThat(e.getRetryAfter()).contains(Duration.ofSeconds(7)));
    }

    @Test
    @DisplayName("401 with token_revoked is a revocation")
    void fetchChanges_shouldThrowRevokedAuth_on401WithRevokedToken() {
        server.stubFor(get(urlPathEqualTo("/contact/changes"))
            .willReturn(aResponse().withStatus(401).withBody("{\"error\": \"token_revoked\"}")));

        assertThatThrownBy(() -> client.fetchChanges(ctx, "contact", null, 100))
            .isInstanceOfSatisfying(ProviderAuthException.class, e -> assertThat(e.isRevoked()).isTrue());
    }

    @Test
    @DisplayName("5xx is transient")
    void fetchChanges_shouldThrowUnavailable_on503() {
        server.stubFor(get(urlPathEqualTo("/contact/changes")).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> client.fetchChanges(ctx, "contact", null, 100))
            .isInstanceOf(ProviderUnavailableException.class);
    }

    // ==================== Single records ====================

    @Test
    @DisplayName("A missing record is empty, not an error")
    void fetchRecord_shouldBeEmpty_on404() {
        server.stubFor(get(urlPathEqualTo("/contact/c9")).willReturn(aResponse().withStatus(404)));

        assertThat(client.fetchRecord(ctx, "contact", "c9")).isEmpty();
    }

    @Test
    @DisplayName("An unreadable single record is a per-record failure")
    void fetchRecord_shouldThrowRecordException_whenTimestampUnreadable() {
        server.stubFor(get(urlPathEqualTo("/contact/c3")).willReturn(okJson("""
            {"id": "c3", "modified_at": "yesterday", "data": {}}
            """)));

        assertThatThrownBy(() -> client.fetchRecord(ctx, "contact", "c3"))
            .isInstanceOf(ProviderRecordException.class)
            .hasMessageContaining("c3");
    }
}
