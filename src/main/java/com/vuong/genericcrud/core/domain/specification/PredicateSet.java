package com.vuong.genericcrud.core.domain.specification;

import com.vuong.genericcrud.core.domain.query.OrderBy;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of translating a filter: the conjunctive conditions plus the ordering,
 * eager-load and omit directives that go with them. Building one performs no I/O.
 *
 * @param <T> the record type the predicates apply to
 */
@Value
@Builder(toBuilder = true)
public class PredicateSet<T> {

    @NonNull
    Class<T> recordType;

    @Singular
    List<Condition> conditions;

    @Singular
    List<OrderBy> orders;

    @Singular
    Set<String> fetches;

    @Singular("omit")
    Set<String> omitted;

    boolean includeDeleted;

    public static <T> PredicateSet<T> matchAll(Class<T> recordType) {
        return PredicateSet.<T>builder().recordType(recordType).build();
    }

    /**
     * Names of the attributes constrained by a condition, in emission order.
     */
    public List<String> constrainedAttributes() {
        return conditions.stream().map(Condition::getAttribute).collect(Collectors.toList());
    }

    public boolean isUnconstrained() {
        return conditions.isEmpty();
    }

    /**
     * Renders the set for logs, e.g. {@code User WHERE name = a ORDER BY id ASC}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(recordType.getSimpleName());
        if (!conditions.isEmpty()) {
            sb.append(" WHERE ").append(conditions.stream().map(Condition::toString).collect(Collectors.joining(" AND ")));
        }
        if (!orders.isEmpty()) {
            sb.append(" ORDER BY ").append(orders.stream().map(OrderBy::render).collect(Collectors.joining(", ")));
        }
        if (!fetches.isEmpty()) {
            sb.append(" FETCH ").append(String.join(", ", fetches));
        }
        if (!omitted.isEmpty()) {
            sb.append(" OMIT ").append(String.join(", ", omitted));
        }
        if (includeDeleted) {
            sb.append(" INCLUDING DELETED");
        }
        return sb.toString();
    }
}
