package com.e2eq.filter.model.catalog;

import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Id;
import dev.morphia.annotations.Indexed;
import dev.morphia.annotations.Property;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

@Entity("products")
@RegisterForReflection
@Data
@EqualsAndHashCode
@NoArgsConstructor
public class Product {
   @Id
   protected ObjectId id;

   @Indexed
   protected String sku;
   protected String name;
   protected String category;
   protected double price;
   protected int stock;
   protected List<String> tags = new ArrayList<>();

   @Property("supplier_id")
   protected ObjectId supplierId;

   /** Identifier issued by an external catalog; not an ObjectId despite the name. */
   @Property("external_id")
   protected String externalId;

   protected Date createdAt;

   @Property("isDeleted")
   protected boolean deleted;
}
