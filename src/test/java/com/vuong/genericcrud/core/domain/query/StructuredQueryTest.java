package com.vuong.genericcrud.core.domain.query;

import com.vuong.genericcrud.core.domain.model.BaseModel;
import com.vuong.genericcrud.support.TestUser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StructuredQuery Tests")
class StructuredQueryTest {

    @Test
    @DisplayName("Should collect every clause kind")
    void shouldCollectClauses() {
        // Given
        Instant from = Instant.parse("2024-01-01T00:00:00Z");
        Instant to = Instant.parse("2024-02-01T00:00:00Z");

        // When
        StructuredQuery<TestUser> query = StructuredQuery.<TestUser>builder()
                .equal(TestUser.AGE, 30)
                .like(TestUser.NAME, "es")
                .between(BaseModel.CREATED_AT, from, to)
                .isNull(TestUser.LAST_SEEN_AT)
                .orderBy(TestUser.NAME, SortDirection.DESC)
                .fetch("group")
                .omit(TestUser.AGE)
                .build();

        // Then
        assertThat(query.getEqualities()).containsEntry("age", 30);
        assertThat(query.getSubstrings()).containsEntry("name", "es");
        assertThat(query.getRanges().get("createdAt").getLower()).isEqualTo(from);
        assertThat(query.getRanges().get("createdAt").getUpper()).isEqualTo(to);
        assertThat(query.getNullChecks()).containsExactly("lastSeenAt");
        assertThat(query.getOrders()).containsExactly(new OrderBy("name", SortDirection.DESC));
        assertThat(query.getFetches()).containsExactly("group");
        assertThat(query.getOmitted()).containsExactly("age");
        assertThat(query.isIncludeDeleted()).isFalse();
        assertThat(query.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("Should keep ordering directives in the order given")
    void shouldKeepOrderingSequence() {
        // When
        StructuredQuery<TestUser> query = StructuredQuery.<TestUser>builder()
                .orderBy(TestUser.AGE, SortDirection.DESC)
                .orderBy(TestUser.NAME, SortDirection.ASC)
                .orderBy(BaseModel.ID, SortDirection.ASC)
                .build();

        // Then
        assertThat(query.getOrders()).extracting(OrderBy::render)
                .containsExactly("age DESC", "name ASC", "id ASC");
    }

    @Test
    @DisplayName("Should reject null equality values")
    void shouldRejectNullEquality() {
        assertThatThrownBy(() -> StructuredQuery.<TestUser>builder().equal(TestUser.NAME, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("isNull");
    }

    @Test
    @DisplayName("Should build an empty query that matches everything")
    void shouldBuildEmptyQuery() {
        StructuredQuery<TestUser> query = StructuredQuery.all();

        assertThat(query.isEmpty()).isTrue();
        assertThat(query.getOrders()).isEmpty();
    }

    @Test
    @DisplayName("Should not be affected by builder changes after build")
    void shouldBeImmutable() {
        // Given
        StructuredQuery.Builder<TestUser> builder = StructuredQuery.<TestUser>builder().equal(TestUser.NAME, "a");
        StructuredQuery<TestUser> query = builder.build();

        // When
        builder.equal(TestUser.AGE, 1);

        // Then
        assertThat(query.getEqualities()).containsOnlyKeys("name");
        assertThatThrownBy(() -> query.getEqualities().put("age", 2))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should validate range bounds")
    void shouldValidateRangeBounds() {
        assertThatThrownBy(() -> new Range<Integer>(null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Range<>(5, 1))
                .isInstanceOf(IllegalArgumentException.class);

        Range<Integer> open = new Range<>(3, null);
        assertThat(open.hasLower()).isTrue();
        assertThat(open.hasUpper()).isFalse();
    }

    @Test
    @DisplayName("Should render sort directions")
    void shouldRenderSortDirections() {
        assertThat(SortDirection.ASC.render()).isEqualTo("ASC");
        assertThat(SortDirection.DESC.render()).isEqualTo("DESC");
        assertThat(SortDirection.DESC.toSortDirection()).isEqualTo(org.springframework.data.domain.Sort.Direction.DESC);
    }
}
