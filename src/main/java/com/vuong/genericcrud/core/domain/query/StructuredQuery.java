package com.vuong.genericcrud.core.domain.query;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explicit filter descriptor for record type {@code T}.
 * <p>
 * All clauses are combined with AND; there is no OR. Keyed clauses keep insertion
 * order so the generated query shape is stable, ordering directives are a list and
 * are applied in the order given.
 *
 * <pre>
 * StructuredQuery&lt;User&gt; query = StructuredQuery.&lt;User&gt;builder()
 *         .like(User.NAME, "es")
 *         .between(BaseModel.CREATED_AT, from, to)
 *         .orderBy(User.NAME, SortDirection.ASC)
 *         .fetch("group")
 *         .build();
 * </pre>
 *
 * @param <T> the record type
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class StructuredQuery<T> {

    private final Map<String, Object> equalities;
    private final Map<String, String> substrings;
    private final Map<String, Range<?>> ranges;
    private final Set<String> nullChecks;
    private final List<OrderBy> orders;
    private final Set<String> fetches;
    private final Set<String> omitted;
    private final boolean includeDeleted;

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * A query without any clause; matches every live record.
     */
    public static <T> StructuredQuery<T> all() {
        return new Builder<T>().build();
    }

    public boolean isEmpty() {
        return equalities.isEmpty() && substrings.isEmpty() && ranges.isEmpty() && nullChecks.isEmpty();
    }

    public static final class Builder<T> {

        private final Map<String, Object> equalities = new LinkedHashMap<>();
        private final Map<String, String> substrings = new LinkedHashMap<>();
        private final Map<String, Range<?>> ranges = new LinkedHashMap<>();
        private final Set<String> nullChecks = new LinkedHashSet<>();
        private final List<OrderBy> orders = new ArrayList<>();
        private final Set<String> fetches = new LinkedHashSet<>();
        private final Set<String> omitted = new LinkedHashSet<>();
        private boolean includeDeleted;

        private Builder() {
        }

        public <V> Builder<T> equal(Attribute<? super T, V> attribute, V value) {
            return equal(attribute.getName(), value);
        }

        /**
         * Adds an equality constraint by attribute name. The name is not checked here;
         * an unknown attribute fails when the query executes.
         */
        public Builder<T> equal(String attribute, Object value) {
            if (value == null) {
                throw new IllegalArgumentException("Equality value for " + attribute + " is null, use isNull instead");
            }
            equalities.put(attribute, value);
            return this;
        }

        public Builder<T> like(Attribute<? super T, String> attribute, String fragment) {
            return like(attribute.getName(), fragment);
        }

        /**
         * Adds a substring constraint: the attribute must contain {@code fragment}.
         */
        public Builder<T> like(String attribute, String fragment) {
            if (fragment == null) {
                throw new IllegalArgumentException("Substring for " + attribute + " is null");
            }
            substrings.put(attribute, fragment);
            return this;
        }

        /**
         * Adds an inclusive range constraint. Either bound may be null for an open side.
         */
        public <V extends Comparable<? super V>> Builder<T> between(Attribute<? super T, V> attribute, V lower, V upper) {
            ranges.put(attribute.getName(), new Range<>(lower, upper));
            return this;
        }

        public Builder<T> isNull(Attribute<? super T, ?> attribute) {
            nullChecks.add(attribute.getName());
            return this;
        }

        public Builder<T> orderBy(Attribute<? super T, ?> attribute, SortDirection direction) {
            orders.add(new OrderBy(attribute.getName(), direction));
            return this;
        }

        /**
         * Requests the named relation to be loaded together with the record.
         */
        public Builder<T> fetch(String relation) {
            if (relation == null || relation.isBlank()) {
                throw new IllegalArgumentException("Relation name cannot be empty");
            }
            fetches.add(relation);
            return this;
        }

        @SafeVarargs
        public final Builder<T> omit(Attribute<? super T, ?>... attributes) {
            for (Attribute<? super T, ?> attribute : attributes) {
                omitted.add(attribute.getName());
            }
            return this;
        }

        /**
         * Includes soft-deleted records in the result.
         */
        public Builder<T> includeDeleted() {
            this.includeDeleted = true;
            return this;
        }

        public StructuredQuery<T> build() {
            return new StructuredQuery<>(
                    Collections.unmodifiableMap(new LinkedHashMap<>(equalities)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(substrings)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(ranges)),
                    Collections.unmodifiableSet(new LinkedHashSet<>(nullChecks)),
                    List.copyOf(orders),
                    Collections.unmodifiableSet(new LinkedHashSet<>(fetches)),
                    Collections.unmodifiableSet(new LinkedHashSet<>(omitted)),
                    includeDeleted);
        }
    }
}
