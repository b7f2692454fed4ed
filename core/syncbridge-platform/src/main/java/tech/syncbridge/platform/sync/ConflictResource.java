package tech.syncbridge.platform.sync;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Manual resolution of conflicts parked by the MANUAL_REVIEW policy.
 */
@Path("/conflicts")
@Tag(name = "Conflicts", description = "Inspect and resolve sync conflicts")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConflictResource {

    @Inject
    ConflictService conflictService;

    @GET
    @Path("/{id}")
    @Operation(summary = "Get a conflict record")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Conflict record",
            content = @Content(schema = @Schema(implementation = ConflictRecord.class))),
        @APIResponse(responseCode = "404", description = "Conflict not found")
    })
    public Response getConflict(@PathParam("id") String id) {
        try {
            return Response.ok(conflictService.get(id)).build();
        } catch (NotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        }
    }

    @POST
    @Path("/{id}/resolve")
    @Operation(summary = "Resolve an open conflict",
        description = "SOURCE_WINS keeps the provider version locally. TARGET_WINS and MERGE queue the local version for the next push.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Conflict resolved",
            content = @Content(schema = @Schema(implementation = ConflictRecord.class))),
        @APIResponse(responseCode = "400", description = "Invalid resolution"),
        @APIResponse(responseCode = "404", description = "Conflict not found"),
        @APIResponse(responseCode = "409", description = "Conflict already resolved")
    })
    public Response resolveConflict(@PathParam("id") String id,
                                    @Valid @NotNull ResolveConflictRequest request,
                                    @HeaderParam("X-Actor") @DefaultValue("api") String actor) {
        try {
            return Response.ok(conflictService.resolve(id, request.resolution(), actor)).build();
        } catch (NotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        } catch (IllegalStateException e) {
            return error(Response.Status.CONFLICT, e.getMessage());
        }
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status)
            .entity(new ErrorResponse(message))
            .build();
    }

    public record ResolveConflictRequest(
        @NotNull(message = "Resolution is required")
        ConflictResolution resolution
    ) {}

    public record ErrorResponse(
        String error
    ) {}
}
