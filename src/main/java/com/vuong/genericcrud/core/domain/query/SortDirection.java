package com.vuong.genericcrud.core.domain.query;

import org.springframework.data.domain.Sort;

/**
 * Direction of an ordering directive.
 */
public enum SortDirection {
    ASC,
    DESC;

    /**
     * Renders the direction as it appears in an ORDER BY clause.
     * @return "ASC" or "DESC"
     */
    public String render() {
        return switch (this) {
            case ASC -> "ASC";
            case DESC -> "DESC";
        };
    }

    public Sort.Direction toSortDirection() {
        return switch (this) {
            case ASC -> Sort.Direction.ASC;
            case DESC -> Sort.Direction.DESC;
        };
    }
}
