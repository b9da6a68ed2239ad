package com.vuong.genericcrud.core.domain.specification;

import com.vuong.genericcrud.core.domain.query.OrderBy;
import com.vuong.genericcrud.core.domain.query.SortDirection;
import com.vuong.genericcrud.support.TestUser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SpecificationBuilder Tests")
class SpecificationBuilderTest {

    @Test
    @DisplayName("Should build an unsorted Sort without ordering directives")
    void shouldBuildUnsorted() {
        Sort sort = SpecificationBuilder.buildSort(PredicateSet.matchAll(TestUser.class));

        assertThat(sort.isUnsorted()).isTrue();
    }

    @Test
    @DisplayName("Should keep ordering directives in sequence")
    void shouldKeepOrderSequence() {
        // Given
        PredicateSet<TestUser> predicateSet = PredicateSet.<TestUser>builder()
                .recordType(TestUser.class)
                .order(new OrderBy("age", SortDirection.DESC))
                .order(new OrderBy("name", SortDirection.ASC))
                .build();

        // When
        Sort sort = SpecificationBuilder.buildSort(predicateSet);

        // Then
        assertThat(sort.toList()).containsExactly(
                Sort.Order.desc("age"),
                Sort.Order.asc("name"));
    }
}
