package com.e2eq.filter.model.persistent.morphia;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class PageRequest {
   public static final int DEFAULT_ITEMS_PER_PAGE = 10;
   public static final int MAX_ITEMS_PER_PAGE = 1000;

   @Builder.Default
   protected int page = 1;
   @Builder.Default
   protected int itemsPerPage = DEFAULT_ITEMS_PER_PAGE;
   @Builder.Default
   protected List<String> sortBy = new ArrayList<>();
   @Builder.Default
   protected List<Boolean> sortDesc = new ArrayList<>();

   public static PageRequest of(int page, int itemsPerPage) {
      return PageRequest.builder().page(page).itemsPerPage(itemsPerPage).build();
   }

   /** Page number, never below 1. */
   public int validPage() {
      return Math.max(1, page);
   }

   /** Page size, between 1 and {@link #MAX_ITEMS_PER_PAGE}. */
   public int validItemsPerPage() {
      return Math.min(MAX_ITEMS_PER_PAGE, Math.max(1, itemsPerPage));
   }

   /** Rows to skip; saturates at {@code Integer.MAX_VALUE} for pages past the addressable range. */
   public int skip() {
      long skip = (long) (validPage() - 1) * validItemsPerPage();
      return (int) Math.min(skip, Integer.MAX_VALUE);
   }

   /**
    * Sort document pairing {@code sortBy[i]} with {@code sortDesc[i]}; a missing or false flag sorts ascending.
    * Field names are taken as given, callers check them before they reach the database.
    */
   public Document sortDocument() {
      Document sort = new Document();
      if (sortBy == null) {
         return sort;
      }
      for (int i = 0; i < sortBy.size(); i++) {
         String field = sortBy.get(i);
         if (field == null || field.isBlank()) {
            continue;
         }
         boolean desc = sortDesc != null && i < sortDesc.size() && Boolean.TRUE.equals(sortDesc.get(i));
         sort.append(field, desc ? -1 : 1);
      }
      return sort;
   }
}
