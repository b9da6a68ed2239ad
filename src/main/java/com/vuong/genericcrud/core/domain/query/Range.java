package com.vuong.genericcrud.core.domain.query;

import lombok.Value;

/**
 * Inclusive bound pair for a range constraint. A missing bound leaves that side open,
 * but at least one bound must be present.
 *
 * @param <V> the comparable value type
 */
@Value
public class Range<V extends Comparable<? super V>> {

    V lower;
    V upper;

    public Range(V lower, V upper) {
        if (lower == null && upper == null) {
            throw new IllegalArgumentException("Range requires at least one bound");
        }
        if (lower != null && upper != null && lower.compareTo(upper) > 0) {
            throw new IllegalArgumentException("Range lower bound " + lower + " is after upper bound " + upper);
        }
        this.lower = lower;
        this.upper = upper;
    }

    public boolean hasLower() {
        return lower != null;
    }

    public boolean hasUpper() {
        return upper != null;
    }
}
