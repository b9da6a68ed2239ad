package com.vuong.genericcrud.core.domain.specification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Condition Tests")
class ConditionTest {

    @Test
    @DisplayName("Should wrap a plain fragment in wildcards")
    void shouldWrapFragment() {
        assertThat(Condition.like("name", "es").pattern()).isEqualTo("%es%");
    }

    @Test
    @DisplayName("Should escape wildcard and escape characters in the fragment")
    void shouldEscapeWildcards() {
        assertThat(Condition.like("name", "a_c").pattern()).isEqualTo("%a\\_c%");
        assertThat(Condition.like("name", "100%").pattern()).isEqualTo("%100\\%%");
        assertThat(Condition.like("name", "C:\\tmp").pattern()).isEqualTo("%C:\\\\tmp%");
    }

    @Test
    @DisplayName("Should describe a substring condition with the raw fragment")
    void shouldDescribeRawFragment() {
        assertThat(Condition.like("name", "a_c")).hasToString("name LIKE '%a_c%'");
    }
}
