package com.e2eq.filter.rest.exceptions;

import com.e2eq.filter.exceptions.FilterRejectedException;
import com.e2eq.filter.rest.models.RestError;
import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.ArrayList;

@Provider
public class FilterRejectedExceptionMapper implements ExceptionMapper<FilterRejectedException> {
    @Override
    public Response toResponse(FilterRejectedException exception) {
        Log.warnf("Filter rejected with %d violation(s)", exception.getViolations().size());

        RestError error = RestError.builder()
                .status(Response.Status.BAD_REQUEST.getStatusCode())
                .statusMessage("Filter rejected")
                .reasonMessage(exception.getMessage())
                .violations(new ArrayList<>(exception.getViolations()))
                .build();

        return Response.status(Response.Status.BAD_REQUEST).entity(error).build();
    }
}
