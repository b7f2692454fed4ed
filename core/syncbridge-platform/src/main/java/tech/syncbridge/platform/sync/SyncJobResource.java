package tech.syncbridge.platform.sync;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Path("/jobs")
@Tag(name = "Sync Jobs", description = "Inspect and cancel sync jobs")
@Produces(MediaType.APPLICATION_JSON)
public class SyncJobResource {

    @Inject
    SyncJobService syncJobService;

    @GET
    @Path("/{id}")
    @Operation(summary = "Get job status and statistics")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Job details",
            content = @Content(schema = @Schema(implementation = SyncJobDto.class))),
        @APIResponse(responseCode = "404", description = "Job not found")
    })
    public Response getJob(@PathParam("id") String id) {
        try {
            return Response.ok(toDto(syncJobService.get(id))).build();
        } catch (NotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND)
                .entity(new ErrorResponse(e.getMessage()))
                .build();
        }
    }

    @POST
    @Path("/{id}/cancel")
    @Operation(summary = "Cancel a job",
        description = "A waiting job is cancelled at once. A running job stops at its next page boundary.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Cancellation accepted",
            content = @Content(schema = @Schema(implementation = SyncJobDto.class))),
        @APIResponse(responseCode = "404", description = "Job not found"),
        @APIResponse(responseCode = "409", description = "Job already finished")
    })
    public Response cancelJob(@PathParam("id") String id) {
        try {
            return Response.ok(toDto(syncJobService.cancel(id))).build();
        } catch (NotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND)
                .entity(new ErrorResponse(e.getMessage()))
                .build();
        } catch (IllegalStateException e) {
            return Response.status(Response.Status.CONFLICT)
                .entity(new ErrorResponse(e.getMessage()))
                .build();
        }
    }

    public static SyncJobDto toDto(SyncJob job) {
        return new SyncJobDto(
            job.id,
            job.instanceId,
            job.entityTypes,
            job.direction,
            job.status,
            job.trigger,
            job.triggerRef,
            job.targetExternalIds,
            job.stats,
            job.cursor.positions(),
            job.mappingVersions,
            job.recordErrors,
            job.failure,
            job.attempt,
            job.nextAttemptAt,
            job.cancelRequested,
            job.createdAt,
            job.startedAt,
            job.completedAt
        );
    }

    // ==================== DTOs ====================

    public record SyncJobDto(
        String id,
        String instanceId,
        Set<String> entityTypes,
        SyncDirection direction,
        SyncJobStatus status,
        SyncTrigger trigger,
        String triggerRef,
        List<String> targetExternalIds,
        SyncStats stats,
        Map<String, String> cursor,
        Map<String, Integer> mappingVersions,
        List<RecordError> recordErrors,
        JobFailure failure,
        int attempt,
        Instant nextAttemptAt,
        boolean cancelRequested,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
    ) {}

    public record ErrorResponse(
        String error
    ) {}
}
