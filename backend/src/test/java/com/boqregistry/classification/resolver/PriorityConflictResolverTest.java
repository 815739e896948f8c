package com.boqregistry.classification.resolver;

import com.boqregistry.classification.TestRuleTables;
import com.boqregistry.classification.rules.CategoryRule;
import com.boqregistry.classification.rules.CategoryScore;
import com.boqregistry.classification.rules.RuleTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityConflictResolverTest {

    private final PriorityConflictResolver resolver = new PriorityConflictResolver();

    @Test
    @DisplayName("outranking rule gets +0.3 per outranked category that also matched")
    void priorityBonus() {
        RuleTable table = TestRuleTables.anchoring();

        Resolution resolution = resolver.resolve(List.of(
                score("VYZTUZ", "1.0", "tycove"),
                score("KOTVENI", "1.0", "tycove")), table);

        assertThat(resolution.category()).isEqualTo("KOTVENI");
        assertThat(resolution.rawScore()).isEqualByComparingTo("1.0");
        assertThat(resolution.adjustedScore()).isEqualByComparingTo("1.3");
        assertThat(resolution.confidence()).isEqualTo(65);
    }

    @Test
    @DisplayName("no bonus when the outranked category did not score positively")
    void noBonusWithoutConflict() {
        Resolution resolution = resolver.resolve(List.of(
                score("VYZTUZ", "-1.0"),
                score("KOTVENI", "1.0", "kotvy")), TestRuleTables.anchoring());

        assertThat(resolution.category()).isEqualTo("KOTVENI");
        assertThat(resolution.adjustedScore()).isEqualByComparingTo("1.0");
    }

    @Test
    @DisplayName("outranking rule wins while the outranked raw score is higher by less than the bonus")
    void bonusCoversSmallerRawScore() {
        RuleTable table = RuleTable.of(List.of(
                CategoryRule.builder().category("BROAD").include(List.of("x")).priority(150).build(),
                CategoryRule.builder().category("NARROW").include(List.of("x")).priority(100)
                        .priorityOver(Set.of("BROAD")).build()));

        Resolution narrowWins = resolver.resolve(List.of(score("BROAD", "1.2"), score("NARROW", "1.0")), table);
        Resolution tieToPriority = resolver.resolve(List.of(score("BROAD", "1.3"), score("NARROW", "1.0")), table);
        Resolution broadWins = resolver.resolve(List.of(score("BROAD", "1.4"), score("NARROW", "1.0")), table);

        assertThat(narrowWins.category()).isEqualTo("NARROW");
        assertThat(narrowWins.rawScore()).isEqualByComparingTo("1.0");
        assertThat(narrowWins.adjustedScore()).isEqualByComparingTo("1.3");
        assertThat(tieToPriority.category()).isEqualTo("BROAD");
        assertThat(broadWins.category()).isEqualTo("BROAD");
    }

    @Test
    @DisplayName("rank lists every positive category best first with bonuses applied")
    void rankAllCandidates() {
        List<RankedCategory> ranked = resolver.rank(List.of(
                score("VYZTUZ", "2.0", "vyztuz", "pruty", "tycove"),
                score("KOTVENI", "1.0", "tycove")), TestRuleTables.anchoring());

        assertThat(ranked).extracting(RankedCategory::category).containsExactly("VYZTUZ", "KOTVENI");
        assertThat(ranked.get(0).confidence()).isEqualTo(100);
        assertThat(ranked.get(0).evidence()).containsExactly("vyztuz", "pruty", "tycove");
        assertThat(ranked.get(1).adjustedScore()).isEqualByComparingTo("1.3");
        assertThat(ranked.get(1).confidence()).isEqualTo(65);
    }

    @Test
    @DisplayName("rank is empty when nothing scores positively; resolve agrees with the first ranked entry")
    void rankAgreesWithResolve() {
        RuleTable table = TestRuleTables.workGroups();
        List<CategoryScore> scores = List.of(
                score("BETON_MONOLIT", "1.0", "betonaz"),
                score("DOPRAVA", "1.0", "dovoz"));

        assertThat(resolver.rank(List.of(score("IZOLACE", "0.0")), table)).isEmpty();
        assertThat(resolver.rank(scores, table).get(0).category())
                .isEqualTo(resolver.resolve(scores, table).category())
                .isEqualTo("DOPRAVA");
    }

    @Test
    @DisplayName("higher adjusted score beats priority")
    void scoreBeatsPriority() {
        Resolution resolution = resolver.resolve(List.of(
                score("VYZTUZ", "2.0", "vyztuz", "pruty"),
                score("KOTVENI", "1.0", "kotvy")), TestRuleTables.anchoring());

        assertThat(resolution.category()).isEqualTo("VYZTUZ");
        assertThat(resolution.adjustedScore()).isEqualByComparingTo("2.0");
    }

    @Test
    @DisplayName("equal scores: higher rule priority wins, then earlier declaration")
    void tieBreaks() {
        RuleTable table = RuleTable.of(List.of(
                rule("FIRST", 100), rule("SECOND", 100), rule("IMPORTANT", 150)));

        assertThat(resolver.resolve(List.of(score("FIRST", "1.0"), score("IMPORTANT", "1.0")), table).category())
                .isEqualTo("IMPORTANT");
        assertThat(resolver.resolve(List.of(score("SECOND", "1.0"), score("FIRST", "1.0")), table).category())
                .isEqualTo("FIRST");
    }

    @Test
    @DisplayName("result does not depend on the order of the scores")
    void orderIndependent() {
        RuleTable table = TestRuleTables.workGroups();
        List<CategoryScore> scores = new ArrayList<>(List.of(
                score("ZEMNI_PRACE", "0.5"),
                score("BETON_MONOLIT", "1.0", "betonaz"),
                score("BETON_PREFAB", "1.0", "panel"),
                score("DOPRAVA", "1.0", "dovoz")));

        Resolution forward = resolver.resolve(scores, table);
        Collections.reverse(scores);
        Resolution reversed = resolver.resolve(scores, table);

        assertThat(forward).isEqualTo(reversed);
        assertThat(forward.category()).isEqualTo("BETON_PREFAB");
    }

    @Test
    @DisplayName("only non-positive scores leave the item unclassified")
    void unclassified() {
        Resolution resolution = resolver.resolve(List.of(score("VYZTUZ", "0.0"), score("KOTVENI", "-2.0")),
                TestRuleTables.anchoring());

        assertThat(resolution.isClassified()).isFalse();
        assertThat(resolution.confidence()).isZero();
        assertThat(resolution.evidence()).isEmpty();
    }

    @Test
    @DisplayName("evidence of the winner is capped at four keywords")
    void evidenceCap() {
        Resolution resolution = resolver.resolve(List.of(score("KOTVENI", "5.0", "a", "b", "c", "d", "e")),
                TestRuleTables.anchoring());

        assertThat(resolution.evidence()).containsExactly("a", "b", "c", "d");
    }

    private static CategoryScore score(String category, String value, String... evidence) {
        return new CategoryScore(category, new BigDecimal(value), List.of(evidence));
    }

    private static CategoryRule rule(String category, int priority) {
        return CategoryRule.builder().category(category).include(List.of("x")).priority(priority)
                .priorityOver(Set.of()).build();
    }
}
