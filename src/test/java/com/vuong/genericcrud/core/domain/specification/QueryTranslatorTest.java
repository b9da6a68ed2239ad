package com.vuong.genericcrud.core.domain.specification;

import com.vuong.genericcrud.core.domain.model.BaseModel;
import com.vuong.genericcrud.core.domain.query.OrderBy;
import com.vuong.genericcrud.core.domain.query.SortDirection;
import com.vuong.genericcrud.core.domain.query.StructuredQuery;
import com.vuong.genericcrud.support.TestGroup;
import com.vuong.genericcrud.support.TestUser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QueryTranslator Tests")
class QueryTranslatorTest {

    static class Sample {
        static String shared = "ignored";
        int count;
        boolean active;
        String label;
        transient String cache;
        List<String> tags;
    }

    @Test
    @DisplayName("Should emit equality only for non-zero attributes")
    void shouldEmitOnlyNonZeroAttributes() {
        // Given
        TestUser example = TestUser.named("test");

        // When
        PredicateSet<TestUser> predicateSet = QueryTranslator.translateByExample(TestUser.class, example, Set.of());

        // Then
        assertThat(predicateSet.getConditions()).containsExactly(Condition.equal("name", "test"));
        assertThat(predicateSet.getRecordType()).isEqualTo(TestUser.class);
    }

    @Test
    @DisplayName("Should produce an unconstrained set for an all-zero example")
    void shouldMatchAllForEmptyExample() {
        PredicateSet<TestUser> predicateSet = QueryTranslator.translateByExample(TestUser.class, new TestUser(), Set.of());

        assertThat(predicateSet.isUnconstrained()).isTrue();
    }

    @Test
    @DisplayName("Should include the primary key and inherited attributes")
    void shouldIncludeInheritedAttributes() {
        // Given
        TestUser example = new TestUser("a", 11);
        example.setId(5L);
        example.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));

        // When
        PredicateSet<TestUser> predicateSet = QueryTranslator.translateByExample(TestUser.class, example, Set.of());

        // Then
        assertThat(predicateSet.constrainedAttributes()).containsExactlyInAnyOrder("id", "createdAt", "name", "age");
    }

    @Test
    @DisplayName("Should leave omitted attributes out of the filter")
    void shouldSkipOmittedAttributes() {
        // Given
        TestUser example = new TestUser("a", 11);
        example.setCreatedAt(Instant.now());

        // When
        PredicateSet<TestUser> predicateSet = QueryTranslator.translateByExample(
                TestUser.class, example, Set.of("createdAt", "age"));

        // Then
        assertThat(predicateSet.constrainedAttributes()).containsExactly("name");
        assertThat(predicateSet.getOmitted()).containsExactlyInAnyOrder("createdAt", "age");
    }

    @Test
    @DisplayName("Should ignore relationship fields")
    void shouldIgnoreRelationships() {
        // Given
        TestUser example = TestUser.named("a");
        example.setGroup(new TestGroup("admins"));

        // When
        PredicateSet<TestUser> predicateSet = QueryTranslator.translateByExample(TestUser.class, example, Set.of());

        // Then
        assertThat(predicateSet.constrainedAttributes()).containsExactly("name");
    }

    @Test
    @DisplayName("Should skip primitive defaults, static, transient and collection fields")
    void shouldSkipNonPersistentAndPrimitiveDefaults() {
        // Given
        Sample sample = new Sample();
        sample.cache = "x";
        sample.tags = List.of("t");

        // When
        PredicateSet<Sample> empty = QueryTranslator.translateByExample(Sample.class, sample, Set.of());
        sample.count = 3;
        sample.active = true;
        PredicateSet<Sample> filled = QueryTranslator.translateByExample(Sample.class, sample, Set.of());

        // Then
        assertThat(empty.isUnconstrained()).isTrue();
        assertThat(filled.getConditions()).containsExactlyInAnyOrder(
                Condition.equal("count", 3),
                Condition.equal("active", true));
    }

    @Test
    @DisplayName("Should reject a null example")
    void shouldRejectNullExample() {
        assertThatThrownBy(() -> QueryTranslator.translateByExample(TestUser.class, null, Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should translate every clause of a structured query")
    void shouldTranslateStructuredQuery() {
        // Given
        Instant from = Instant.parse("2024-01-01T00:00:00Z");
        Instant to = Instant.parse("2024-01-31T00:00:00Z");
        StructuredQuery<TestUser> query = StructuredQuery.<TestUser>builder()
                .isNull(TestUser.LAST_SEEN_AT)
                .between(BaseModel.CREATED_AT, from, to)
                .like(TestUser.NAME, "es")
                .equal(TestUser.AGE, 11)
                .orderBy(TestUser.AGE, SortDirection.DESC)
                .orderBy(TestUser.NAME, SortDirection.ASC)
                .fetch("group")
                .omit(TestUser.AGE)
                .includeDeleted()
                .build();

        // When
        PredicateSet<TestUser> predicateSet = QueryTranslator.translateStructured(TestUser.class, query);

        // Then
        assertThat(predicateSet.getConditions()).containsExactly(
                Condition.equal("age", 11),
                Condition.like("name", "es"),
                Condition.between("createdAt", from, to),
                Condition.isNull("lastSeenAt"));
        assertThat(predicateSet.getOrders()).containsExactly(
                new OrderBy("age", SortDirection.DESC),
                new OrderBy("name", SortDirection.ASC));
        assertThat(predicateSet.getFetches()).containsExactly("group");
        assertThat(predicateSet.getOmitted()).containsExactly("age");
        assertThat(predicateSet.isIncludeDeleted()).isTrue();
    }

    @Test
    @DisplayName("Should pass unknown attribute names through untouched")
    void shouldPassUnknownAttributesThrough() {
        // Given
        StructuredQuery<TestUser> query = StructuredQuery.<TestUser>builder().equal("nickname", "x").build();

        // When
        PredicateSet<TestUser> predicateSet = QueryTranslator.translateStructured(TestUser.class, query);

        // Then
        assertThat(predicateSet.constrainedAttributes()).containsExactly("nickname");
    }

    @Test
    @DisplayName("Should describe the predicate set for logs")
    void shouldDescribePredicateSet() {
        // Given
        StructuredQuery<TestUser> query = StructuredQuery.<TestUser>builder()
                .equal(TestUser.NAME, "a")
                .like(TestUser.NAME, "es")
                .between(TestUser.AGE, 10, null)
                .orderBy(BaseModel.ID, SortDirection.ASC)
                .build();

        // When
        String description = QueryTranslator.translateStructured(TestUser.class, query).describe();

        // Then
        assertThat(description).isEqualTo("TestUser WHERE name = a AND name LIKE '%es%' AND age >= 10 ORDER BY id ASC");
    }
}
