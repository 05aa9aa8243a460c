package io.github.chirino.recall.api;

import io.github.chirino.recall.api.dto.ErrorResponse;
import io.github.chirino.recall.store.ResourceNotFoundException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/** Turns exceptions escaping the resources into JSON {@link ErrorResponse} bodies. */
public class GlobalExceptionMapper {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @ServerExceptionMapper
    public Response handleConstraintViolation(ConstraintViolationException e) {
        List<Map<String, String>> violations =
                e.getConstraintViolations().stream()
                        .map(
                                v ->
                                        Map.of(
                                                "field", extractFieldName(v),
                                                "message", v.getMessage()))
                        .toList();
        return respond(
                Response.Status.BAD_REQUEST,
                new ErrorResponse(
                        "Validation failed",
                        "validation_error",
                        Map.of("violations", violations)));
    }

    private String extractFieldName(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot >= 0 ? path.substring(lastDot + 1) : path;
    }

    @ServerExceptionMapper
    public Response handleNotFound(ResourceNotFoundException e) {
        return respond(
                Response.Status.NOT_FOUND,
                new ErrorResponse(
                        e.getMessage(),
                        "not_found",
                        Map.of("resource", e.getResource(), "id", e.getId())));
    }

    @ServerExceptionMapper
    public Response handleBadRequest(IllegalArgumentException e) {
        return respond(
                Response.Status.BAD_REQUEST, new ErrorResponse(e.getMessage(), "bad_request"));
    }

    @ServerExceptionMapper
    public Response handleException(Exception e) {
        if (e instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            if (status >= 500) {
                LOG.errorf(e, "Server error %d", status);
            }
            return wae.getResponse();
        }

        LOG.errorf(e, "Unhandled exception");
        return respond(
                Response.Status.INTERNAL_SERVER_ERROR,
                new ErrorResponse(
                        "Internal server error",
                        "internal_error",
                        Map.of(
                                "message",
                                e.getMessage() != null
                                        ? e.getMessage()
                                        : e.getClass().getName())));
    }

    private static Response respond(Response.Status status, ErrorResponse error) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(error).build();
    }
}
