package com.boqregistry.classification.rules;

import com.boqregistry.classification.ClassificationException;
import com.boqregistry.classification.TestRuleTables;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleTableTest {

    @Test
    @DisplayName("keeps declaration order and normalizes keywords")
    void declarationOrder() {
        RuleTable table = TestRuleTables.workGroups();

        assertThat(table.size()).isEqualTo(6);
        assertThat(table.declarationIndex("ZEMNI_PRACE")).isZero();
        assertThat(table.declarationIndex("DOPRAVA")).isEqualTo(5);
        assertThat(table.declarationIndex("NOPE")).isEqualTo(Integer.MAX_VALUE);
        assertThat(table.find("BETON_MONOLIT").orElseThrow().include()).contains("betonaz", "zakladova deska");
        assertThat(table.find("BETON_MONOLIT").orElseThrow().unitBoost()).containsExactly("m3");
        assertThat(table.contains("IZOLACE")).isTrue();
        assertThat(table.contains(null)).isFalse();
    }

    @Test
    @DisplayName("empty table is rejected")
    void emptyTable() {
        assertInvalid(List.of());
    }

    @Test
    @DisplayName("blank and duplicate categories are rejected")
    void blankAndDuplicateCategories() {
        assertInvalid(List.of(rule(" ", Set.of())));
        assertInvalid(List.of(rule("A", Set.of()), rule("A", Set.of())));
    }

    @Test
    @DisplayName("priorityOver must reference another existing category")
    void priorityOverTargets() {
        assertInvalid(List.of(rule("A", Set.of("B"))));
        assertInvalid(List.of(rule("A", Set.of("A"))));
        assertThat(RuleTable.of(List.of(rule("A", Set.of("B")), rule("B", Set.of()))).size()).isEqualTo(2);
    }

    private static CategoryRule rule(String category, Set<String> priorityOver) {
        return CategoryRule.builder()
                .category(category)
                .include(List.of("x"))
                .priority(100)
                .priorityOver(priorityOver)
                .build();
    }

    private static void assertInvalid(List<CategoryRule> rules) {
        assertThatThrownBy(() -> RuleTable.of(rules))
                .isInstanceOf(ClassificationException.class)
                .satisfies(e -> assertThat(((ClassificationException) e).getErrorCode())
                        .isEqualTo(ClassificationException.INVALID_RULES));
    }
}
