package com.e2eq.filter.rest.resources;

import com.e2eq.filter.model.persistent.morphia.FilterableMorphiaRepo;
import com.e2eq.filter.model.persistent.morphia.PageRequest;
import com.e2eq.filter.model.persistent.morphia.PageResult;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * List and count endpoints driven by an advanced filter in the {@code filter} query parameter.
 *
 * @param <T> entity type
 */
public abstract class BaseFilterResource<T> {

   protected abstract FilterableMorphiaRepo<T> getRepo();

   /**
    * Server side conditions for the current caller, e.g. tenant scoping. None by default.
    */
   protected Map<String, Object> getContextFilters() {
      return Map.of();
   }

   @GET
   @Produces(MediaType.APPLICATION_JSON)
   public PageResult<T> list(@QueryParam("filter") String filter,
                             @DefaultValue("1") @QueryParam("page") int page,
                             @DefaultValue("10") @QueryParam("itemsPerPage") int itemsPerPage,
                             @QueryParam("sortBy") List<String> sortBy,
                             @QueryParam("sortDesc") List<Boolean> sortDesc) {
      PageRequest request = PageRequest.builder()
              .page(page)
              .itemsPerPage(itemsPerPage)
              .sortBy(sortBy == null ? new ArrayList<>() : sortBy)
              .sortDesc(sortDesc == null ? new ArrayList<>() : sortDesc)
              .build();
      return getRepo().findPaginated(request, filter, getContextFilters());
   }

   @GET
   @Path("count")
   @Produces(MediaType.APPLICATION_JSON)
   public long count(@QueryParam("filter") String filter) {
      return getRepo().count(filter, getContextFilters());
   }
}
