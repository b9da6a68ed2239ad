package com.vuong.genericcrud.core.domain.specification;

import com.vuong.genericcrud.core.domain.query.Range;
import com.vuong.genericcrud.core.domain.query.StructuredQuery;
import com.vuong.genericcrud.util.FieldIntrospector;
import com.vuong.genericcrud.util.ZeroValues;

import java.lang.reflect.Field;
import java.util.Collection;
import java.util.Set;

/**
 * Translates a filter description into a {@link PredicateSet}.
 * Translation is a pure transform: it never touches the database and never fails on
 * attribute names, which are validated by JPA when the predicates run.
 */
public final class QueryTranslator {

    private QueryTranslator() {
        // Utility class
    }

    /**
     * Builds equality conditions from the non-zero attributes of a partially populated
     * record. Attributes at their zero value are skipped, so an all-zero example
     * matches every record.
     *
     * @param recordType the record class
     * @param example    the example record
     * @param omitted    attribute names to leave out of the filter and the operation
     * @param <T>        the record type
     * @return the predicate set, one EQUAL condition per non-zero attribute
     */
    public static <T> PredicateSet<T> translateByExample(Class<T> recordType, T example, Collection<String> omitted) {
        if (example == null) {
            throw new IllegalArgumentException("Example record cannot be null");
        }
        Set<String> omit = Set.copyOf(omitted);
        PredicateSet.PredicateSetBuilder<T> builder = PredicateSet.<T>builder()
                .recordType(recordType)
                .omitted(omitted);

        for (Field field : FieldIntrospector.getFilterableFields(example.getClass())) {
            if (omit.contains(field.getName())) {
                continue;
            }
            Object value = FieldIntrospector.read(field, example);
            if (!ZeroValues.isZeroValue(field.getType(), value)) {
                builder.condition(Condition.equal(field.getName(), value));
            }
        }
        return builder.build();
    }

    /**
     * Builds the predicate set of a structured query. Conditions are emitted clause by
     * clause (equality, substring, range, null check) in insertion order; ordering,
     * eager-load and omit directives are carried over unchanged.
     *
     * @param recordType the record class
     * @param query      the structured query
     * @param <T>        the record type
     * @return the predicate set
     */
    public static <T> PredicateSet<T> translateStructured(Class<T> recordType, StructuredQuery<T> query) {
        if (query == null) {
            throw new IllegalArgumentException("Query cannot be null");
        }
        PredicateSet.PredicateSetBuilder<T> builder = PredicateSet.<T>builder().recordType(recordType);

        query.getEqualities().forEach((attribute, value) -> builder.condition(Condition.equal(attribute, value)));
        query.getSubstrings().forEach((attribute, fragment) -> builder.condition(Condition.like(attribute, fragment)));
        query.getRanges().forEach((attribute, range) -> builder.condition(toCondition(attribute, range)));
        query.getNullChecks().forEach(attribute -> builder.condition(Condition.isNull(attribute)));

        return builder
                .orders(query.getOrders())
                .fetches(query.getFetches())
                .omitted(query.getOmitted())
                .includeDeleted(query.isIncludeDeleted())
                .build();
    }

    private static Condition toCondition(String attribute, Range<?> range) {
        return Condition.between(attribute, range.getLower(), range.getUpper());
    }
}
