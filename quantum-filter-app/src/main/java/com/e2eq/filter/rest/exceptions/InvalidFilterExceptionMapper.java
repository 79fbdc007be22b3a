package com.e2eq.filter.rest.exceptions;

import com.e2eq.filter.exceptions.InvalidFilterException;
import com.e2eq.filter.rest.models.RestError;
import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * The filter parameter was not a well formed JSON value.
 */
@Provider
public class InvalidFilterExceptionMapper implements ExceptionMapper<InvalidFilterException> {
    @Override
    public Response toResponse(InvalidFilterException exception) {
        Log.debugf("Invalid filter: %s", exception.getMessage());

        RestError error = RestError.builder().build();
        error.setStatus(Response.Status.BAD_REQUEST.getStatusCode());
        error.setStatusMessage("Invalid filter");
        error.setReasonMessage(exception.getMessage());

        return Response.status(Response.Status.BAD_REQUEST).entity(error).build();
    }
}
