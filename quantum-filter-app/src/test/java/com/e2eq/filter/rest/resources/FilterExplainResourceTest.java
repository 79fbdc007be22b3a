package com.e2eq.filter.rest.resources;

import com.e2eq.filter.model.persistent.morphia.query.FilterPipeline;
import com.e2eq.filter.rest.models.FilterExplanation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FilterExplainResourceTest {

    private final FilterExplainResource resource = new FilterExplainResource();

    {
        resource.filterPipeline = FilterPipeline.builder().build();
    }

    @Test
    public void explain_showsSanitizedTreeAndQuery() {
        FilterExplanation explanation = resource.explain("{\"name\":{\"like\":\"a+b\"},\"$where\":\"1\",\"user_id\":\"507f1f77bcf86cd799439011\"}");

        assertEquals(Map.of("like", "a+b"), explanation.getSanitized().get("name"));
        assertFalse(explanation.getSanitized().containsKey("$where"));
        assertTrue(explanation.getQuery().contains("\"$regex\": \".*a\\\\+b.*\""), explanation.getQuery());
        assertTrue(explanation.getQuery().contains("\"$oid\": \"507f1f77bcf86cd799439011\""), explanation.getQuery());
        assertEquals(List.of("$ operators not allowed. Use DSL operators instead. Found: $where"), explanation.getViolations());
        assertFalse(explanation.isFailedClosed());
    }

    @Test
    public void explain_withoutFilter() {
        FilterExplanation explanation = resource.explain(null);
        assertTrue(explanation.getSanitized().isEmpty());
        assertEquals("{}", explanation.getQuery());
        assertTrue(explanation.getViolations().isEmpty());
    }
}
