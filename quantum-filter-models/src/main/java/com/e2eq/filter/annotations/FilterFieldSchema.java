package com.e2eq.filter.annotations;

import dev.morphia.annotations.Id;
import dev.morphia.annotations.Property;
import dev.morphia.annotations.Reference;
import dev.morphia.annotations.Transient;
import org.bson.types.ObjectId;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.time.temporal.Temporal;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The persistent fields of a model and the kind of value each holds.
 * Built by hand or by introspecting a Morphia model class. The compiler uses it as the authority on identifier
 * coercion, and the repository uses it to decide which fields a client may sort on.
 */
public final class FilterFieldSchema {

    // Morphia's default for @Property#value
    private static final String UNSET_PROPERTY_NAME = ".";

    private final Map<String, FieldKind> fields;

    private FilterFieldSchema(Map<String, FieldKind> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static FilterFieldSchema of(Map<String, FieldKind> fields) {
        return new FilterFieldSchema(fields);
    }

    /**
     * Creates a schema by introspecting the persistent fields of a model class, superclasses included.
     * {@code @Id} maps to {@code _id}, {@code @Property} names are honoured, static, transient and
     * {@code @Transient} fields are skipped, embedded types are flattened to dotted paths.
     */
    public static FilterFieldSchema forModelClass(Class<?> modelClass) {
        Map<String, FieldKind> fields = new LinkedHashMap<>();
        collectFields(modelClass, "", fields, 0);
        return new FilterFieldSchema(fields);
    }

    public boolean isDeclared(String fieldPath) {
        return fields.containsKey(fieldPath);
    }

    public Optional<FieldKind> kindOf(String fieldPath) {
        return Optional.ofNullable(fields.get(fieldPath));
    }

    public boolean isIdentifier(String fieldPath) {
        return fields.get(fieldPath) == FieldKind.IDENTIFIER;
    }

    private static void collectFields(Class<?> clazz, String prefix, Map<String, FieldKind> fields, int depth) {
        if (clazz == null || clazz == Object.class || depth > 4) return;

        for (Field field : clazz.getDeclaredFields()) {
            int modifiers = field.getModifiers();
            if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isAnnotationPresent(Transient.class)) {
                continue;
            }

            String fieldName = getFieldName(field);
            String fullPath = prefix.isEmpty() ? fieldName : prefix + "." + fieldName;
            FieldKind kind = kindOf(field);
            fields.putIfAbsent(fullPath, kind);

            if (kind == FieldKind.OTHER && isEmbeddable(field.getType())) {
                collectFields(field.getType(), fullPath, fields, depth + 1);
            }
        }

        collectFields(clazz.getSuperclass(), prefix, fields, depth);
    }

    private static String getFieldName(Field field) {
        if (field.isAnnotationPresent(Id.class)) {
            return "_id";
        }
        Property prop = field.getAnnotation(Property.class);
        if (prop != null && !prop.value().isEmpty() && !UNSET_PROPERTY_NAME.equals(prop.value())) {
            return prop.value();
        }
        return field.getName();
    }

    private static FieldKind kindOf(Field field) {
        Class<?> type = field.getType();
        if (type == ObjectId.class || field.isAnnotationPresent(Reference.class)) {
            return FieldKind.IDENTIFIER;
        }
        if (type == String.class || type == Character.class || type == char.class || type.isEnum()) {
            return FieldKind.STRING;
        }
        if (type == Boolean.class || type == boolean.class) {
            return FieldKind.BOOLEAN;
        }
        if (Number.class.isAssignableFrom(type) || (type.isPrimitive() && type != void.class)) {
            return FieldKind.NUMBER;
        }
        if (Date.class.isAssignableFrom(type) || Temporal.class.isAssignableFrom(type)) {
            return FieldKind.DATE;
        }
        return FieldKind.OTHER;
    }

    private static boolean isEmbeddable(Class<?> type) {
        return !type.isArray()
                && !type.isInterface()
                && !type.getName().startsWith("java.")
                && !type.getName().startsWith("org.bson.");
    }
}
