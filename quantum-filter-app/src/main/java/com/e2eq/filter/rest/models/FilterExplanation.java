package com.e2eq.filter.rest.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * What a client filter turns into, without running it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class FilterExplanation {
   /** Canonical filter after sanitization. */
   protected Map<String, Object> sanitized;
   /** Native query in MongoDB extended JSON. */
   protected String query;
   protected List<String> violations;
   protected boolean failedClosed;
}
