package tech.syncbridge.platform.mapping;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import tech.syncbridge.platform.shared.ErrorResponse;
import tech.syncbridge.transform.mapping.MappingValidationException;

import java.util.List;

/**
 * Rejected mapping writes become 400 with one entry per violation, formatted
 * {@code location: CODE message}.
 */
@Provider
public class MappingValidationExceptionMapper implements ExceptionMapper<MappingValidationException> {

    @Override
    public Response toResponse(MappingValidationException exception) {
        List<String> details = exception.getViolations()
            .stream()
            .map(v -> v.location() + ": " + v.code() + " " + v.message())
            .toList();

        return Response
            .status(Response.Status.BAD_REQUEST)
            .entity(new ErrorResponse("Invalid field mapping", details))
            .build();
    }
}
