package com.e2eq.filter.rest.resources;

import com.e2eq.filter.model.persistent.morphia.query.CompiledFilter;
import com.e2eq.filter.model.persistent.morphia.query.FilterPipeline;
import com.e2eq.filter.rest.models.FilterExplanation;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.ArrayList;

/**
 * Shows how a filter would be sanitized and compiled. Nothing is read from the database.
 */
@Path("/filters/explain")
@Produces(MediaType.APPLICATION_JSON)
public class FilterExplainResource {

   @Inject
   FilterPipeline filterPipeline;

   @GET
   public FilterExplanation explain(@QueryParam("filter") String filter) {
      return toExplanation(filterPipeline.process(filter));
   }

   static FilterExplanation toExplanation(CompiledFilter compiled) {
      return FilterExplanation.builder()
              .sanitized(compiled.tree().toMap())
              .query(compiled.query().toJson())
              .violations(new ArrayList<>(compiled.violations()))
              .failedClosed(compiled.failedClosed())
              .build();
   }
}
