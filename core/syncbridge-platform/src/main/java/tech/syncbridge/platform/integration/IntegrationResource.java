package tech.syncbridge.platform.integration;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.*;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.credential.Credential;
import tech.syncbridge.platform.credential.CredentialException;
import tech.syncbridge.platform.credential.CredentialType;
import tech.syncbridge.platform.localstore.LocalRecord;
import tech.syncbridge.platform.localstore.LocalRecordRepository;
import tech.syncbridge.platform.sync.ConflictPolicy;
import tech.syncbridge.platform.sync.ConflictRecord;
import tech.syncbridge.platform.sync.ConflictService;
import tech.syncbridge.platform.sync.SyncDirection;
import tech.syncbridge.platform.sync.SyncJob;
import tech.syncbridge.platform.sync.SyncJobResource;
import tech.syncbridge.platform.sync.SyncJobService;
import tech.syncbridge.platform.sync.SyncStatistics;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Integration instances: lifecycle, credentials, local records and sync triggering.
 */
@Path("/integrations")
@Tag(name = "Integrations", description = "Manage integration instances and trigger syncs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class IntegrationResource {

    private static final Logger LOG = Logger.getLogger(IntegrationResource.class);

    static final String ACTOR_HEADER = "X-Actor";

    @Inject
    IntegrationService integrationService;

    @Inject
    SyncJobService syncJobService;

    @Inject
    ConflictService conflictService;

    @Inject
    LocalRecordRepository localRecords;

    // ==================== Instance Lifecycle ====================

    @POST
    @Operation(summary = "Create integration instance",
        description = "Creates an instance in PENDING_AUTH. It becomes ACTIVE once credentials are stored.")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Instance created",
            content = @Content(schema = @Schema(implementation = IntegrationDto.class))),
        @APIResponse(responseCode = "400", description = "Invalid request")
    })
    public Response createIntegration(@Valid @NotNull CreateIntegrationRequest request, @Context UriInfo uriInfo) {
        SyncSchedule schedule = request.schedule() == null ? null : new SyncSchedule(
            request.schedule().entityTypes(), request.schedule().direction(), request.schedule().intervalMinutes());

        IntegrationInstance instance = integrationService.create(
            request.tenantId(), request.name(), request.provider(), request.conflictPolicy(), schedule);

        return Response.status(Response.Status.CREATED)
            .entity(toDto(instance))
            .location(uriInfo.getAbsolutePathBuilder().path(instance.id).build())
            .build();
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get integration instance with sync statistics")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Instance details",
            content = @Content(schema = @Schema(implementation = IntegrationDto.class))),
        @APIResponse(responseCode = "404", description = "Instance not found")
    })
    public Response getIntegration(@PathParam("id") String id) {
        return integrationService.find(id)
            .map(instance -> Response.ok(toDto(instance)).build())
            .orElse(notFound("Integration instance not found: " + id));
    }

    @GET
    @Operation(summary = "List a tenant's integration instances")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Instances of the tenant",
            content = @Content(schema = @Schema(implementation = IntegrationListResponse.class))),
        @APIResponse(responseCode = "400", description = "tenantId missing")
    })
    public Response listIntegrations(@QueryParam("tenantId") String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return Response.status(Response.Status.BAD_REQUEST)
                .entity(new ErrorResponse("tenantId query parameter is required"))
                .build();
        }
        List<IntegrationDto> dtos = integrationService.list(tenantId).stream()
            .map(IntegrationResource::toDto)
            .toList();
        return Response.ok(new IntegrationListResponse(dtos, dtos.size())).build();
    }

    @PUT
    @Path("/{id}/credentials")
    @Operation(summary = "Store or rotate the instance credential",
        description = "Encrypts the credential and activates the instance. Also used to reauthorize an instance in ERROR.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Credential stored, instance active",
            content = @Content(schema = @Schema(implementation = IntegrationDto.class))),
        @APIResponse(responseCode = "404", description = "Instance not found"),
        @APIResponse(responseCode = "409", description = "Instance was disconnected"),
        @APIResponse(responseCode = "503", description = "Encryption unavailable")
    })
    public Response storeCredentials(@PathParam("id") String id,
                                     @Valid @NotNull CredentialRequest request,
                                     @HeaderParam(ACTOR_HEADER) @DefaultValue("api") String actor) {
        try {
            IntegrationInstance instance = integrationService.connect(id, request.toCredential(), actor);
            return Response.ok(toDto(instance)).build();
        } catch (NotFoundException e) {
            return notFound(e.getMessage());
        } catch (IllegalStateException e) {
            return conflict(e.getMessage());
        } catch (CredentialException e) {
            LOG.errorf(e, "Failed to store credential for instance [%s]", id);
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(new ErrorResponse("Credential could not be stored"))
                .build();
        }
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Disconnect integration instance",
        description = "Marks the instance REVOKED and purges every stored credential version.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Instance disconnected",
            content = @Content(schema = @Schema(implementation = IntegrationDto.class))),
        @APIResponse(responseCode = "404", description = "Instance not found")
    })
    public Response disconnect(@PathParam("id") String id,
                               @HeaderParam(ACTOR_HEADER) @DefaultValue("api") String actor) {
        try {
            return Response.ok(toDto(integrationService.disconnect(id, actor))).build();
        } catch (NotFoundException e) {
            return notFound(e.getMessage());
        }
    }

    // ==================== Local Records ====================

    @PUT
    @Path("/{id}/records/{entityType}/{externalId}")
    @Operation(summary = "Write a local record",
        description = "The record becomes dirty and is sent to the provider by the next push.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Record stored",
            content = @Content(schema = @Schema(implementation = LocalRecord.class))),
        @APIResponse(responseCode = "404", description = "Instance not found")
    })
    public Response putRecord(@PathParam("id") String id,
                              @PathParam("entityType") String entityType,
                              @PathParam("externalId") String externalId,
                              @Valid @NotNull LocalRecordRequest request) {
        if (integrationService.find(id).isEmpty()) {
            return notFound("Integration instance not found: " + id);
        }
        Instant modifiedAt = request.modifiedAt() != null ? request.modifiedAt() : Instant.now();
        LocalRecord record = localRecords.saveLocalChange(id, entityType, externalId, request.data(), modifiedAt);
        return Response.ok(record).build();
    }

    @GET
    @Path("/{id}/records/{entityType}/{externalId}")
    @Operation(summary = "Read a local record")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Record",
            content = @Content(schema = @Schema(implementation = LocalRecord.class))),
        @APIResponse(responseCode = "404", description = "Record not found")
    })
    public Response getRecord(@PathParam("id") String id,
                              @PathParam("entityType") String entityType,
                              @PathParam("externalId") String externalId) {
        return localRecords.find(id, entityType, externalId)
            .map(record -> Response.ok(record).build())
            .orElse(notFound("Record not found: " + entityType + "/" + externalId));
    }

    // ==================== Sync ====================

    @POST
    @Path("/{id}/sync")
    @Operation(summary = "Trigger a sync job",
        description = "Queues a job for the given entity types and direction. Jobs of one instance run one at a time.")
    @APIResponses({
        @APIResponse(responseCode = "202", description = "Job queued",
            content = @Content(schema = @Schema(implementation = TriggerSyncResponse.class))),
        @APIResponse(responseCode = "400", description = "No entity types or a mapping is missing"),
        @APIResponse(responseCode = "404", description = "Instance not found"),
        @APIResponse(responseCode = "409", description = "Instance is not active")
    })
    public Response triggerSync(@PathParam("id") String id, @Valid @NotNull TriggerSyncRequest request) {
        SyncDirection direction = request.direction() != null ? request.direction() : SyncDirection.PULL;
        try {
            SyncJob job = syncJobService.trigger(id, new LinkedHashSet<>(request.entityTypes()), direction);
            return Response.accepted(new TriggerSyncResponse(job.id, job.status.name())).build();
        } catch (NotFoundException e) {
            return notFound(e.getMessage());
        } catch (BadRequestException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                .entity(new ErrorResponse(e.getMessage()))
                .build();
        } catch (IllegalStateException e) {
            return conflict(e.getMessage());
        }
    }

    @GET
    @Path("/{id}/jobs")
    @Operation(summary = "List sync jobs of an instance, newest first")
    @APIResponse(responseCode = "200", description = "Jobs")
    public Response listJobs(@PathParam("id") String id,
                             @QueryParam("limit") @DefaultValue("50") int limit) {
        List<SyncJobResource.SyncJobDto> jobs = syncJobService.list(id, Math.max(1, Math.min(limit, 500))).stream()
            .map(SyncJobResource::toDto)
            .toList();
        return Response.ok(jobs).build();
    }

    @GET
    @Path("/{id}/sync-stats")
    @Operation(summary = "Sync statistics", description = "Job counts by status and record totals across all jobs.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Statistics",
            content = @Content(schema = @Schema(implementation = SyncStatistics.class))),
        @APIResponse(responseCode = "404", description = "Instance not found")
    })
    public Response syncStatistics(@PathParam("id") String id) {
        try {
            return Response.ok(syncJobService.statistics(id)).build();
        } catch (NotFoundException e) {
            return notFound(e.getMessage());
        }
    }

    @GET
    @Path("/{id}/conflicts")
    @Operation(summary = "List conflict records of an instance")
    @APIResponse(responseCode = "200", description = "Conflict records")
    public Response listConflicts(@PathParam("id") String id,
                                  @QueryParam("open") @DefaultValue("false") boolean openOnly) {
        List<ConflictRecord> conflicts = conflictService.list(id, openOnly);
        return Response.ok(conflicts).build();
    }

    // ==================== Helper Methods ====================

    static IntegrationDto toDto(IntegrationInstance instance) {
        return new IntegrationDto(
            instance.id,
            instance.tenantId,
            instance.name,
            instance.providerType,
            instance.status,
            instance.credentialRef != null,
            instance.conflictPolicy,
            instance.schedule,
            new IntegrationStats(instance.totalSyncs, instance.successfulSyncs, instance.failedSyncs,
                instance.consecutiveAuthFailures, instance.lastSyncAt, instance.lastError),
            instance.createdAt,
            instance.updatedAt
        );
    }

    private static Response notFound(String message) {
        return Response.status(Response.Status.NOT_FOUND)
            .entity(new ErrorResponse(message))
            .build();
    }

    private static Response conflict(String message) {
        return Response.status(Response.Status.CONFLICT)
            .entity(new ErrorResponse(message))
            .build();
    }

    // ==================== DTOs ====================

    public record IntegrationDto(
        String id,
        String tenantId,
        String name,
        ProviderType provider,
        IntegrationStatus status,
        boolean connected,
        ConflictPolicy conflictPolicy,
        SyncSchedule schedule,
        IntegrationStats stats,
        Instant createdAt,
        Instant updatedAt
    ) {}

    public record IntegrationStats(
        int totalSyncs,
        int successfulSyncs,
        int failedSyncs,
        int consecutiveAuthFailures,
        Instant lastSyncAt,
        String lastError
    ) {}

    public record IntegrationListResponse(
        List<IntegrationDto> integrations,
        int total
    ) {}

    public record CreateIntegrationRequest(
        @NotBlank(message = "Tenant id is required")
        String tenantId,
        @NotBlank(message = "Name is required")
        String name,
        @NotNull(message = "Provider is required")
        ProviderType provider,
        ConflictPolicy conflictPolicy,
        @Valid
        ScheduleRequest schedule
    ) {}

    public record ScheduleRequest(
        @NotEmpty(message = "Schedule needs at least one entity type")
        List<String> entityTypes,
        SyncDirection direction,
        @Positive(message = "Schedule interval must be positive")
        int intervalMinutes
    ) {}

    public record CredentialRequest(
        @NotNull(message = "Credential type is required")
        CredentialType type,
        String accessToken,
        String refreshToken,
        String apiKey,
        Instant expiresAt,
        List<String> scopes,
        String webhookSecret
    ) {
        @AssertTrue(message = "OAuth2 credentials need an access token, API key credentials need an api key")
        public boolean isComplete() {
            if (type == null) {
                return true;
            }
            String secret = type == CredentialType.API_KEY ? apiKey : accessToken;
            return secret != null && !secret.isBlank();
        }

        Credential toCredential() {
            return new Credential(type, accessToken, refreshToken, apiKey, expiresAt, scopes, webhookSecret);
        }
    }

    public record LocalRecordRequest(
        @NotNull(message = "Record data is required")
        Map<String, Object> data,
        Instant modifiedAt
    ) {}

    public record TriggerSyncRequest(
        @NotEmpty(message = "At least one entity type is required")
        @JsonAlias("entity_types")
        List<String> entityTypes,
        SyncDirection direction
    ) {}

    public record TriggerSyncResponse(
        String jobId,
        String status
    ) {}

    public record ErrorResponse(
        String error
    ) {}
}
