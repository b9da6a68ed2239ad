package com.vuong.genericcrud.core.domain.query;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Typed identifier of a persistent attribute of record shape {@code T}.
 * Declare them as constants next to the entity so omit lists, ordering and
 * clause builders are checked against the record type at compile time.
 *
 * @param <T> the record type owning the attribute
 * @param <V> the attribute value type
 */
@Getter
@EqualsAndHashCode
public final class Attribute<T, V> {

    private final String name;
    private final Class<V> javaType;

    private Attribute(@NonNull String name, @NonNull Class<V> javaType) {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Attribute name cannot be empty");
        }
        this.name = name;
        this.javaType = javaType;
    }

    public static <T, V> Attribute<T, V> of(String name, Class<V> javaType) {
        return new Attribute<>(name, javaType);
    }

    @Override
    public String toString() {
        return name;
    }
}
