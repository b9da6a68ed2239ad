package com.vuong.genericcrud.core.domain.specification;

import com.vuong.genericcrud.core.domain.model.SoftDeletable;
import com.vuong.genericcrud.core.domain.query.OrderBy;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds JPA Specifications and Sorts from translated predicate sets.
 * All conditions are combined with AND; soft-deleted records are excluded for
 * {@link SoftDeletable} types unless the set includes deleted records.
 */
public class SpecificationBuilder {

    private SpecificationBuilder() {
        // Utility class
    }

    /**
     * Builds a JPA Specification from a predicate set.
     *
     * @param predicateSet the translated filter
     * @param softDelete   whether the deletion marker filter applies at all
     * @param <T>          the entity type
     * @return a Specification that can be used with JpaSpecificationExecutor
     */
    public static <T> Specification<T> build(PredicateSet<T> predicateSet, boolean softDelete) {
        return (root, query, criteriaBuilder) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (softDelete && !predicateSet.isIncludeDeleted()
                    && SoftDeletable.class.isAssignableFrom(predicateSet.getRecordType())) {
                predicates.add(criteriaBuilder.isNull(root.get(SoftDeletable.DELETED_AT_ATTRIBUTE)));
            }

            for (Condition condition : predicateSet.getConditions()) {
                predicates.add(toPredicate(condition, root, criteriaBuilder));
            }

            if (!predicateSet.getFetches().isEmpty() && !isCountQuery(query)) {
                for (String relation : predicateSet.getFetches()) {
                    root.fetch(relation, JoinType.LEFT);
                }
                query.distinct(true);
            }

            return criteriaBuilder.and(predicates.toArray(new Predicate[0]));
        };
    }

    /**
     * Builds the Sort of a predicate set, directives in the order given.
     */
    public static Sort buildSort(PredicateSet<?> predicateSet) {
        List<Sort.Order> orders = new ArrayList<>();
        for (OrderBy order : predicateSet.getOrders()) {
            orders.add(new Sort.Order(order.getDirection().toSortDirection(), order.getAttribute()));
        }
        return orders.isEmpty() ? Sort.unsorted() : Sort.by(orders);
    }

    private static <T> Predicate toPredicate(Condition condition, Root<T> root, CriteriaBuilder cb) {
        String attribute = condition.getAttribute();
        return switch (condition.getOperator()) {
            case EQUAL -> cb.equal(root.get(attribute), condition.getValue());
            case LIKE -> cb.like(root.<String>get(attribute), condition.pattern(), Condition.LIKE_ESCAPE);
            case BETWEEN -> between(root.get(attribute), condition.getValue(), condition.getUpper(), cb);
            case IS_NULL -> cb.isNull(root.get(attribute));
        };
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static Predicate between(Expression path, Object lower, Object upper, CriteriaBuilder cb) {
        Comparable lo = (Comparable) lower;
        Comparable hi = (Comparable) upper;
        if (lo != null && hi != null) {
            return cb.between(path, lo, hi);
        }
        if (lo != null) {
            return cb.greaterThanOrEqualTo(path, lo);
        }
        return cb.lessThanOrEqualTo(path, hi);
    }

    private static boolean isCountQuery(CriteriaQuery<?> query) {
        if (query == null) {
            return true;
        }
        Class<?> resultType = query.getResultType();
        return Long.class.equals(resultType) || long.class.equals(resultType);
    }
}
