package tech.syncbridge.platform.mapping;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.*;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.syncbridge.transform.TransformResult;
import tech.syncbridge.transform.mapping.FieldMapping;

import java.util.List;
import java.util.Map;

/**
 * Field mapping configuration. Invalid mappings are rejected by
 * {@link MappingValidationExceptionMapper} before anything is stored.
 */
@Path("/mappings")
@Tag(name = "Field Mappings", description = "Versioned field mapping configuration")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class FieldMappingResource {

    @Inject
    FieldMappingService mappingService;

    // ==================== Create & Update ====================

    @POST
    @Operation(summary = "Create field mapping",
        description = "Validates the rules (unknown functions, duplicate target fields, bad paths) and stores version 1.")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Mapping created",
            content = @Content(schema = @Schema(implementation = FieldMappingVersion.class))),
        @APIResponse(responseCode = "400", description = "Mapping failed validation"),
        @APIResponse(responseCode = "404", description = "Instance not found"),
        @APIResponse(responseCode = "409", description = "An active mapping already exists")
    })
    public Response createMapping(@Valid @NotNull CreateMappingRequest request, @Context UriInfo uriInfo) {
        try {
            FieldMappingVersion created = mappingService.create(
                request.instanceId(), request.entityType(), request.direction(), request.mapping());
            return Response.status(Response.Status.CREATED)
                .entity(created)
                .location(uriInfo.getAbsolutePathBuilder().path(created.id).build())
                .build();
        } catch (NotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            return error(Response.Status.CONFLICT, e.getMessage());
        }
    }

    @PUT
    @Path("/{id}")
    @Operation(summary = "Update field mapping",
        description = "Changes the latest version in place unless a completed job used it, in which case a new version is created.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Mapping updated",
            content = @Content(schema = @Schema(implementation = FieldMappingVersion.class))),
        @APIResponse(responseCode = "400", description = "Mapping failed validation"),
        @APIResponse(responseCode = "404", description = "Mapping not found")
    })
    public Response updateMapping(@PathParam("id") String id, @Valid @NotNull UpdateMappingRequest request) {
        try {
            return Response.ok(mappingService.update(id, request.mapping())).build();
        } catch (NotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        }
    }

    // ==================== Read ====================

    @GET
    @Operation(summary = "List mappings of an instance")
    @APIResponse(responseCode = "200", description = "Latest version of each mapping")
    public Response listMappings(@QueryParam("instanceId") String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            return error(Response.Status.BAD_REQUEST, "instanceId query parameter is required");
        }
        return Response.ok(mappingService.list(instanceId)).build();
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get the latest version of a mapping")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Mapping",
            content = @Content(schema = @Schema(implementation = FieldMappingVersion.class))),
        @APIResponse(responseCode = "404", description = "Mapping not found")
    })
    public Response getMapping(@PathParam("id") String id) {
        try {
            return Response.ok(mappingService.get(id)).build();
        } catch (NotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        }
    }

    @GET
    @Path("/{id}/versions")
    @Operation(summary = "List every version of a mapping")
    @APIResponse(responseCode = "200", description = "Versions, oldest first")
    public Response listVersions(@PathParam("id") String id) {
        List<FieldMappingVersion> versions = mappingService.versions(id);
        if (versions.isEmpty()) {
            return error(Response.Status.NOT_FOUND, "Field mapping not found: " + id);
        }
        return Response.ok(versions).build();
    }

    // ==================== Delete ====================

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete field mapping", description = "Deactivates the mapping. Versions used by past jobs are kept.")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Mapping deactivated"),
        @APIResponse(responseCode = "404", description = "Mapping not found")
    })
    public Response deleteMapping(@PathParam("id") String id) {
        try {
            mappingService.delete(id);
            return Response.noContent().build();
        } catch (NotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        }
    }

    // ==================== Preview & Suggest ====================

    @POST
    @Path("/{id}/preview")
    @Operation(summary = "Transform a sample record", description = "Runs the mapping against the sample without persisting anything.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Transformation result",
            content = @Content(schema = @Schema(implementation = TransformResult.class))),
        @APIResponse(responseCode = "404", description = "Mapping not found")
    })
    public Response previewMapping(@PathParam("id") String id, @Valid @NotNull PreviewRequest request) {
        try {
            return Response.ok(mappingService.preview(id, request.record())).build();
        } catch (NotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        }
    }

    @POST
    @Path("/suggest")
    @Operation(summary = "Suggest a draft mapping",
        description = "Pairs source and target fields by normalized name similarity. The draft is not stored.")
    @APIResponse(responseCode = "200", description = "Draft mapping",
        content = @Content(schema = @Schema(implementation = FieldMapping.class)))
    public Response suggestMapping(@Valid @NotNull SuggestRequest request) {
        String name = request.name() != null ? request.name() : "suggested";
        return Response.ok(mappingService.suggest(name, request.sourceFields(), request.targetFields())).build();
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status)
            .entity(new ErrorResponse(message))
            .build();
    }

    // ==================== DTOs ====================

    public record CreateMappingRequest(
        @NotBlank(message = "Instance id is required")
        String instanceId,
        @NotBlank(message = "Entity type is required")
        String entityType,
        @NotNull(message = "Direction is required")
        MappingDirection direction,
        @NotNull(message = "Mapping is required")
        FieldMapping mapping
    ) {}

    public record UpdateMappingRequest(
        @NotNull(message = "Mapping is required")
        FieldMapping mapping
    ) {}

    public record PreviewRequest(
        @NotNull(message = "Sample record is required")
        Map<String, Object> record
    ) {}

    public record SuggestRequest(
        String name,
        @NotEmpty(message = "Source fields are required")
        List<String> sourceFields,
        @NotEmpty(message = "Target fields are required")
        List<String> targetFields
    ) {}

    public record ErrorResponse(
        String error
    ) {}
}
