package tech.syncbridge.platform.shared;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.List;
import java.util.stream.Collectors;

@Provider
public class ValidationExceptionMapper implements ExceptionMapper<ConstraintViolationException> {

    @Override
    public Response toResponse(ConstraintViolationException exception) {
        List<String> messages = exception.getConstraintViolations()
            .stream()
            .map(ConstraintViolation::getMessage)
            .sorted()
            .toList();

        return Response
            .status(Response.Status.BAD_REQUEST)
            .entity(new ErrorResponse(String.join(", ", messages), messages))
            .build();
    }
}
