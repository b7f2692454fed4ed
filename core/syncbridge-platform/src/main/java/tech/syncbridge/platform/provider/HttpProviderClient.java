package tech.syncbridge.platform.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.integration.ProviderType;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Provider client speaking the sync gateway's JSON protocol.
 *
 * <ul>
 *   <li>{@code GET {base}/{entityType}/changes?limit=&cursor=} returns
 *       {@code {"records": [{"id", "modified_at", "data"}], "next_cursor", "has_more"}}</li>
 *   <li>{@code GET {base}/{entityType}/{id}} returns one record, 404 when absent</li>
 *   <li>{@code PUT {base}/{entityType}/{id}} writes the record data and returns {@code {"id", "modified_at"}}</li>
 * </ul>
 *
 * Failures are classified by HTTP status: 401/403 authentication, 429 rate limit
 * (honouring Retry-After), 5xx and timeouts transient, other 4xx per-record.
 */
public class HttpProviderClient implements ProviderClient {

    private static final Logger LOG = Logger.getLogger(HttpProviderClient.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final int MAX_ERROR_BODY_LENGTH = 500;

    private final ProviderType providerType;
    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProviderRateLimiters rateLimiters;
    private final Duration requestTimeout;

    public HttpProviderClient(ProviderType providerType, String baseUrl, HttpClient httpClient,
                              ObjectMapper objectMapper, ProviderRateLimiters rateLimiters, Duration requestTimeout) {
        this.providerType = providerType;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.rateLimiters = rateLimiters;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public RecordPage fetchChanges(ProviderContext ctx, String entityType, String cursor, int pageSize) {
        StringBuilder uri = new StringBuilder(baseUrl)
            .append('/').append(encode(entityType))
            .append("/changes?limit=").append(pageSize);
        if (cursor != null) {
            uri.append("&cursor=").append(encode(cursor));
        }

        JsonNode body = readJson(send(ctx, request(ctx, uri.toString()).GET()));
        List<ExternalRecord> records = new ArrayList<>();
        List<MalformedRecord> malformed = new ArrayList<>();
        for (JsonNode node : body.path("records")) {
            try {
                records.add(toRecord(entityType, node));
            } catch (ProviderRecordException e) {
                LOG.warnf("Skipping unreadable %s entry from %s: %s", entityType, providerType.getValue(), e.getMessage());
                malformed.add(new MalformedRecord(node.hasNonNull("id") ? node.get("id").asText() : null, e.getMessage()));
            }
        }
        String nextCursor = body.hasNonNull("next_cursor") ? body.get("next_cursor").asText() : null;
        return new RecordPage(records, malformed, nextCursor, body.path("has_more").asBoolean(false));
    }

    @Override
    public Optional<ExternalRecord> fetchRecord(ProviderContext ctx, String entityType, String externalId) {
        String uri = baseUrl + "/" + encode(entityType) + "/" + encode(externalId);
        HttpResponse<String> response = sendAllowing404(ctx, request(ctx, uri).GET());
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        return Optional.of(toRecord(entityType, readJson(response)));
    }

    @Override
    public WriteResult write(ProviderContext ctx, String entityType, String externalId, Map<String, Object> data) {
        String uri = baseUrl + "/" + encode(entityType) + "/" + encode(externalId);
        String json;
        try {
            json = objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new ProviderRecordException("Record " + externalId + " is not serializable: " + e.getOriginalMessage(), 0);
        }

        HttpResponse<String> response = send(ctx, request(ctx, uri)
            .header("Content-Type", "application/json")
            .PUT(HttpRequest.BodyPublishers.ofString(json)));

        if (response.body() == null || response.body().isBlank()) {
            return new WriteResult(externalId, Instant.now());
        }
        JsonNode body = readJson(response);
        return new WriteResult(
            body.hasNonNull("id") ? body.get("id").asText() : externalId,
            body.hasNonNull("modified_at") ? Instant.parse(body.get("modified_at").asText()) : Instant.now());
    }

    private HttpRequest.Builder request(ProviderContext ctx, String uri) {
        return HttpRequest.newBuilder()
            .uri(URI.create(uri))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .header("Authorization", "Bearer " + ctx.credential().bearerToken());
    }

    private HttpResponse<String> send(ProviderContext ctx, HttpRequest.Builder builder) {
        HttpResponse<String> response = sendAllowing404(ctx, builder);
        if (response.statusCode() == 404) {
            throw new ProviderRecordException(describe(response), 404);
        }
        return response;
    }

    private HttpResponse<String> sendAllowing404(ProviderContext ctx, HttpRequest.Builder builder) {
        rateLimiters.acquire(providerType, ctx.instance().id);
        HttpRequest request = builder.build();

        HttpResponse<String> response;
        try {
            LOG.debugf("%s %s", request.method(), request.uri());
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderUnavailableException(providerType.getValue() + " request timed out: " + request.uri(), e);
        } catch (IOException e) {
            throw new ProviderUnavailableException(providerType.getValue() + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("Interrupted while calling " + providerType.getValue(), e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300 || status == 404) {
            return response;
        }
        if (status == 401 || status == 403) {
            throw new ProviderAuthException(describe(response), isRevocation(response));
        }
        if (status == 429) {
            throw new RateLimitedException(describe(response), retryAfter(response));
        }
        if (status >= 500) {
            throw new ProviderUnavailableException(describe(response));
        }
        throw new ProviderRecordException(describe(response), status);
    }

    private ExternalRecord toRecord(String entityType, JsonNode node) {
        if (!node.hasNonNull("id")) {
            throw new ProviderRecordException(providerType.getValue() + " returned a " + entityType + " record without id", 0);
        }
        String id = node.get("id").asText();
        Instant modifiedAt;
        Map<String, Object> data;
        try {
            modifiedAt = node.hasNonNull("modified_at") ? Instant.parse(node.get("modified_at").asText()) : null;
            data = node.hasNonNull("data") ? objectMapper.convertValue(node.get("data"), MAP_TYPE) : null;
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new ProviderRecordException(providerType.getValue() + " returned an unreadable " + entityType
                + " record " + id + ": " + e.getMessage(), 0);
        }
        return new ExternalRecord(entityType, id, modifiedAt, data == null ? Map.of() : data);
    }

    private JsonNode readJson(HttpResponse<String> response) {
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException(providerType.getValue() + " returned malformed JSON", e);
        }
    }

    private boolean isRevocation(HttpResponse<String> response) {
        String body = response.body();
        return body != null && (body.contains("token_revoked") || body.contains("invalid_grant"));
    }

    private static Duration retryAfter(HttpResponse<String> response) {
        return response.headers().firstValue("Retry-After")
            .flatMap(value -> {
                try {
                    return Optional.of(Duration.ofSeconds(Long.parseLong(value.trim())));
                } catch (NumberFormatException e) {
                    LOG.debugf("Ignoring non-numeric Retry-After [%s]", value);
                    return Optional.empty();
                }
            })
            .orElse(null);
    }

    private String describe(HttpResponse<String> response) {
        String body = response.body();
        if (body != null && body.length() > MAX_ERROR_BODY_LENGTH) {
            body = body.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
        }
        return providerType.getValue() + " responded " + response.statusCode() + " for "
            + response.request().method() + " " + response.request().uri().getPath()
            + (body == null || body.isBlank() ? "" : ": " + body);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
