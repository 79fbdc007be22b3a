package com.e2eq.filter.model.persistent.morphia;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class PageResult<T> {
   @Builder.Default
   protected List<T> data = new ArrayList<>();
   protected int page;
   protected int itemsPerPage;
   protected long totalFilteredRows;
   protected long totalRows;
   protected long pages;
   /** Clauses dropped from the client filter; empty when it was used as sent. */
   @Builder.Default
   protected List<String> filterViolations = new ArrayList<>();

   public static long pageCount(long totalFilteredRows, int itemsPerPage) {
      return (totalFilteredRows + itemsPerPage - 1) / itemsPerPage;
   }
}
