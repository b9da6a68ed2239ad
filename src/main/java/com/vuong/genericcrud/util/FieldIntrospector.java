package com.vuong.genericcrud.util;

import jakarta.persistence.ElementCollection;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Transient;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reflection helpers for record classes, caching results to avoid repeated
 * reflection cost.
 */
public final class FieldIntrospector {

    private static final Map<Class<?>, List<Field>> FILTERABLE_FIELDS = new ConcurrentHashMap<>();
    private static final Map<Class<?>, Map<String, Field>> FIELD_CACHE = new ConcurrentHashMap<>();

    private FieldIntrospector() {
        // Utility class
    }

    /**
     * Retrieves the basic persistent fields of a record class, superclasses first.
     * Static, transient, collection and relationship fields are left out.
     * @param recordClass the record class to inspect
     * @return the filterable fields, in declaration order
     */
    public static List<Field> getFilterableFields(Class<?> recordClass) {
        return FILTERABLE_FIELDS.computeIfAbsent(recordClass, cls -> {
            List<Field> fields = new ArrayList<>();
            for (Field field : getAllFields(cls)) {
                if (isFilterable(field)) {
                    field.setAccessible(true);
                    fields.add(field);
                }
            }
            return Collections.unmodifiableList(fields);
        });
    }

    /**
     * Finds a field by name anywhere in the class hierarchy.
     * @return the field, or null when the class has no such field
     */
    public static Field findField(Class<?> clazz, String fieldName) {
        return FIELD_CACHE
                .computeIfAbsent(clazz, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(fieldName, k -> findFieldInHierarchy(clazz, fieldName));
    }

    /**
     * Reads a field value, rethrowing access failures as unchecked.
     */
    public static Object read(Field field, Object target) {
        try {
            field.setAccessible(true);
            return field.get(target);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read field " + field.getName() + " of " + target.getClass().getName(), e);
        }
    }

    /**
     * Writes a field value, rethrowing access failures as unchecked.
     */
    public static void write(Field field, Object target, Object value) {
        try {
            field.setAccessible(true);
            field.set(target, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot write field " + field.getName() + " of " + target.getClass().getName(), e);
        }
    }

    private static boolean isFilterable(Field field) {
        int modifiers = field.getModifiers();
        if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
            return false;
        }
        if (Collection.class.isAssignableFrom(field.getType()) || Map.class.isAssignableFrom(field.getType())) {
            return false;
        }
        return !(field.isAnnotationPresent(Transient.class) ||
                field.isAnnotationPresent(OneToMany.class) ||
                field.isAnnotationPresent(ManyToOne.class) ||
                field.isAnnotationPresent(ManyToMany.class) ||
                field.isAnnotationPresent(OneToOne.class) ||
                field.isAnnotationPresent(ElementCollection.class));
    }

    private static List<Field> getAllFields(Class<?> type) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            Collections.addAll(fields, c.getDeclaredFields());
        }
        return fields;
    }

    private static Field findFieldInHierarchy(Class<?> clazz, String fieldName) {
        Class<?> current = clazz;
        while (current != null && current != Object.class) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(fieldName)) {
                    return field;
                }
            }
            current = current.getSuperclass();
        }
        return null;
    }
}
