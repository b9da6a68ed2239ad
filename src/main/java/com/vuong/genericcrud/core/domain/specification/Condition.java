package com.vuong.genericcrud.core.domain.specification;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * A single filter predicate on one attribute.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Condition {

    public enum Operator {
        EQUAL,
        LIKE,
        BETWEEN,
        IS_NULL
    }

    @NonNull
    String attribute;

    @NonNull
    Operator operator;

    /** Equality value, substring, or lower bound depending on the operator. */
    Object value;

    /** Upper bound, only for {@link Operator#BETWEEN}. */
    Object upper;

    public static Condition equal(String attribute, Object value) {
        return new Condition(attribute, Operator.EQUAL, value, null);
    }

    public static Condition like(String attribute, String fragment) {
        return new Condition(attribute, Operator.LIKE, fragment, null);
    }

    public static Condition between(String attribute, Object lower, Object upper) {
        return new Condition(attribute, Operator.BETWEEN, lower, upper);
    }

    public static Condition isNull(String attribute) {
        return new Condition(attribute, Operator.IS_NULL, null, null);
    }

    public static final char LIKE_ESCAPE = '\\';

    /**
     * The LIKE pattern for a substring condition. Wildcards inside the fragment are escaped
     * with {@link #LIKE_ESCAPE}, so they only match themselves.
     */
    public String pattern() {
        String fragment = String.valueOf(value);
        StringBuilder sb = new StringBuilder(fragment.length() + 2).append('%');
        for (char c : fragment.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.append('%').toString();
    }

    @Override
    public String toString() {
        return switch (operator) {
            case EQUAL -> attribute + " = " + value;
            case LIKE -> attribute + " LIKE '%" + value + "%'";
            case BETWEEN -> describeRange();
            case IS_NULL -> attribute + " IS NULL";
        };
    }

    private String describeRange() {
        if (value != null && upper != null) {
            return attribute + " BETWEEN " + value + " AND " + upper;
        }
        return value != null ? attribute + " >= " + value : attribute + " <= " + upper;
    }
}
