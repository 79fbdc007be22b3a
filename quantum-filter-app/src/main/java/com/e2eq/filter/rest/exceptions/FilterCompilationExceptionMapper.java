package com.e2eq.filter.rest.exceptions;

import com.e2eq.filter.exceptions.FilterCompilationException;
import com.e2eq.filter.rest.models.RestError;
import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * A sanitized filter that still cannot be expressed as a query, e.g. {@code between} with reversed bounds.
 */
@Provider
public class FilterCompilationExceptionMapper implements ExceptionMapper<FilterCompilationException> {
    @Override
    public Response toResponse(FilterCompilationException exception) {
        Log.debugf("Filter compilation failed on field %s operator %s: %s",
                exception.getField(), exception.getOperator(), exception.getMessage());

        RestError error = RestError.builder()
                .status(Response.Status.BAD_REQUEST.getStatusCode())
                .statusMessage("Invalid filter")
                .reasonMessage(exception.getMessage())
                .field(exception.getField())
                .operator(exception.getOperator())
                .build();

        return Response.status(Response.Status.BAD_REQUEST).entity(error).build();
    }
}
