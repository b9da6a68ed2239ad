package com.vuong.genericcrud.core.domain.query;

import lombok.NonNull;
import lombok.Value;

/**
 * One ordering directive. Queries keep these in a list so that multi-column
 * ordering is applied in the order the directives were given.
 */
@Value
public class OrderBy {

    @NonNull
    String attribute;

    @NonNull
    SortDirection direction;

    /**
     * Renders the directive as an ORDER BY fragment, e.g. {@code "name DESC"}.
     */
    public String render() {
        return attribute + " " + direction.render();
    }
}
