package com.e2eq.filter.annotations;

import dev.morphia.annotations.Id;
import dev.morphia.annotations.Property;
import dev.morphia.annotations.Transient;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.util.Date;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FilterFieldSchemaTest {

    static class Address {
        String city;
        ObjectId regionId;
    }

    static class BaseEntity {
        @Id
        ObjectId id;
        @Property("isDeleted")
        boolean deleted;
    }

    static class Order extends BaseEntity {
        static final String CONSTANT = "x";

        @Property("customer_id")
        ObjectId customerId;
        @Property("external_id")
        String externalId;
        double total;
        Date placedAt;
        Address shipTo;
        @Transient
        String cached;
        transient String scratch;
    }

    @Test
    public void forModelClass_mapsIdsPropertiesAndKinds() {
        FilterFieldSchema schema = FilterFieldSchema.forModelClass(Order.class);

        assertTrue(schema.isIdentifier("_id"));
        assertTrue(schema.isIdentifier("customer_id"));
        assertEquals(FieldKind.STRING, schema.kindOf("external_id").orElseThrow());
        assertEquals(FieldKind.NUMBER, schema.kindOf("total").orElseThrow());
        assertEquals(FieldKind.DATE, schema.kindOf("placedAt").orElseThrow());
        assertEquals(FieldKind.BOOLEAN, schema.kindOf("isDeleted").orElseThrow());
    }

    @Test
    public void forModelClass_flattensEmbeddedAndSkipsTransient() {
        FilterFieldSchema schema = FilterFieldSchema.forModelClass(Order.class);

        assertEquals(FieldKind.STRING, schema.kindOf("shipTo.city").orElseThrow());
        assertTrue(schema.isIdentifier("shipTo.regionId"));
        assertFalse(schema.isDeclared("cached"));
        assertFalse(schema.isDeclared("scratch"));
        assertFalse(schema.isDeclared("CONSTANT"));
        assertFalse(schema.isDeclared("customerId"));
    }

    @Test
    public void of_usesGivenKinds() {
        FilterFieldSchema schema = FilterFieldSchema.of(Map.of("owner_id", FieldKind.STRING));
        assertTrue(schema.isDeclared("owner_id"));
        assertFalse(schema.isIdentifier("owner_id"));
        assertTrue(schema.kindOf("other").isEmpty());
    }
}
