package com.e2eq.filter.model.persistent.morphia;

import com.e2eq.filter.model.catalog.Product;
import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class ProductRepo extends FilterableMorphiaRepo<Product> {

   @Override
   public Class<Product> getPersistentClass() {
      return Product.class;
   }
}
