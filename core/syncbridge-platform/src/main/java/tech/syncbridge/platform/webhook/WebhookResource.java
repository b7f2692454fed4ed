package tech.syncbridge.platform.webhook;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.integration.ProviderType;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inbound webhook endpoint and dead-letter administration.
 *
 * <p>The body is read as raw bytes: signatures are computed over the exact payload the
 * provider sent, so nothing may parse or re-encode it before verification.</p>
 */
@Path("/webhooks")
@Tag(name = "Webhooks", description = "Inbound provider webhooks and event administration")
@Produces(MediaType.APPLICATION_JSON)
public class WebhookResource {

    private static final Logger LOG = Logger.getLogger(WebhookResource.class);

    @Inject
    WebhookIngestionService ingestionService;

    @Inject
    WebhookEventService eventService;

    // ==================== Inbound ====================

    @POST
    @Path("/{provider}/{instanceId}")
    @Consumes(MediaType.WILDCARD)
    @Operation(summary = "Receive a provider webhook",
        description = "Verifies the provider signature, deduplicates redeliveries and queues the event for processing.")
    @APIResponses({
        @APIResponse(responseCode = "202", description = "Event queued for processing",
            content = @Content(schema = @Schema(implementation = WebhookAcceptedResponse.class))),
        @APIResponse(responseCode = "200", description = "Duplicate delivery, already received"),
        @APIResponse(responseCode = "400", description = "Payload could not be parsed"),
        @APIResponse(responseCode = "401", description = "Signature missing or invalid"),
        @APIResponse(responseCode = "404", description = "Unknown provider or instance"),
        @APIResponse(responseCode = "410", description = "Instance disconnected"),
        @APIResponse(responseCode = "503", description = "Webhook secret could not be read")
    })
    public Response receive(@PathParam("provider") String provider,
                            @PathParam("instanceId") String instanceId,
                            @Context HttpHeaders httpHeaders,
                            byte[] body) {
        ProviderType providerType;
        try {
            providerType = ProviderType.fromValue(provider);
        } catch (IllegalArgumentException e) {
            LOG.debugf("Webhook for unknown provider [%s]", provider);
            return error(RejectionReason.UNSUPPORTED_PROVIDER.httpStatus(), "Unsupported provider: " + provider);
        }

        Map<String, String> headers = new HashMap<>();
        httpHeaders.getRequestHeaders().forEach((name, values) -> {
            if (!values.isEmpty()) {
                headers.put(name, values.get(0));
            }
        });

        ReceiveOutcome outcome = ingestionService.receive(providerType, instanceId, body == null ? new byte[0] : body, headers);
        if (outcome instanceof ReceiveOutcome.Accepted accepted) {
            Response.Status status = accepted.isDeduped() ? Response.Status.OK : Response.Status.ACCEPTED;
            return Response.status(status)
                .entity(new WebhookAcceptedResponse(accepted.eventId(), accepted.status()))
                .build();
        }
        ReceiveOutcome.Rejected rejected = (ReceiveOutcome.Rejected) outcome;
        return error(rejected.reason().httpStatus(), rejected.message());
    }

    // ==================== Event Administration ====================

    @GET
    @Path("/dead-letters")
    @Operation(summary = "List dead-lettered events of an instance")
    @APIResponse(responseCode = "200", description = "Dead-lettered events, oldest first")
    public Response deadLetters(@QueryParam("instanceId") String instanceId,
                                @QueryParam("limit") @DefaultValue("100") int limit) {
        if (instanceId == null || instanceId.isBlank()) {
            return error(400, "instanceId query parameter is required");
        }
        List<WebhookEventDto> events = eventService.deadLetters(instanceId, Math.max(1, Math.min(limit, 500))).stream()
            .map(WebhookResource::toDto)
            .toList();
        return Response.ok(events).build();
    }

    @GET
    @Path("/events/{id}")
    @Operation(summary = "Get a webhook event")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Event",
            content = @Content(schema = @Schema(implementation = WebhookEventDto.class))),
        @APIResponse(responseCode = "404", description = "Event not found")
    })
    public Response getEvent(@PathParam("id") String id) {
        try {
            return Response.ok(toDto(eventService.get(id))).build();
        } catch (NotFoundException e) {
            return error(404, e.getMessage());
        }
    }

    @POST
    @Path("/events/{id}/replay")
    @Operation(summary = "Replay a failed or dead-lettered event", description = "Resets the retry budget and queues the event again.")
    @APIResponses({
        @APIResponse(responseCode = "202", description = "Event queued",
            content = @Content(schema = @Schema(implementation = WebhookEventDto.class))),
        @APIResponse(responseCode = "404", description = "Event not found"),
        @APIResponse(responseCode = "409", description = "Event is not failed or dead-lettered")
    })
    public Response replay(@PathParam("id") String id) {
        try {
            return Response.accepted(toDto(eventService.replay(id))).build();
        } catch (NotFoundException e) {
            return error(404, e.getMessage());
        } catch (IllegalStateException e) {
            return error(409, e.getMessage());
        }
    }

    @GET
    @Path("/stats")
    @Operation(summary = "Webhook event counts by status")
    @APIResponse(responseCode = "200", description = "Counts by status")
    public Response statistics(@QueryParam("instanceId") String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            return error(400, "instanceId query parameter is required");
        }
        return Response.ok(new WebhookStatsResponse(instanceId, eventService.statistics(instanceId))).build();
    }

    // ==================== Helper Methods ====================

    static WebhookEventDto toDto(WebhookEvent event) {
        return new WebhookEventDto(
            event.id,
            event.instanceId,
            event.provider,
            event.eventType,
            event.entityType,
            event.entityRefs,
            event.payloadHash,
            event.signatureValid,
            event.status,
            event.retryCount,
            event.nextAttemptAt,
            event.lastError,
            event.receivedAt,
            event.processedAt
        );
    }

    private static Response error(int status, String message) {
        return Response.status(status)
            .entity(new ErrorResponse(message))
            .build();
    }

    // ==================== DTOs ====================

    public record WebhookAcceptedResponse(
        String eventId,
        WebhookStatus status
    ) {}

    public record WebhookEventDto(
        String id,
        String instanceId,
        ProviderType provider,
        String eventType,
        String entityType,
        List<String> entityRefs,
        String payloadHash,
        boolean signatureValid,
        WebhookStatus status,
        int retryCount,
        Instant nextAttemptAt,
        String lastError,
        Instant receivedAt,
        Instant processedAt
    ) {}

    public record WebhookStatsResponse(
        String instanceId,
        Map<WebhookStatus, Long> countsByStatus
    ) {}

    public record ErrorResponse(
        String error
    ) {}
}
