package com.e2eq.filter.rest.resources;

import com.e2eq.filter.model.catalog.Product;
import com.e2eq.filter.model.persistent.morphia.FilterableMorphiaRepo;
import com.e2eq.filter.model.persistent.morphia.ProductRepo;
import jakarta.inject.Inject;
import jakarta.ws.rs.Path;

@Path("/products")
public class ProductResource extends BaseFilterResource<Product> {

   @Inject
   ProductRepo productRepo;

   @Override
   protected FilterableMorphiaRepo<Product> getRepo() {
      return productRepo;
   }
}
