package com.boqregistry.classification.rules;

import com.boqregistry.classification.TestRuleTables;
import com.boqregistry.common.TextNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RuleScoringEngineTest {

    private final RuleScoringEngine engine = new RuleScoringEngine();

    private static final CategoryRule REINFORCEMENT = CategoryRule.builder()
            .category("VYZTUZ")
            .include(List.of("Výztuž", "pruty", "kari"))
            .exclude(List.of("kotvy"))
            .unitBoost(Set.of("kg"))
            .priority(100)
            .codeBoost(List.of("B500B"))
            .subtypes(Map.of("SITE", List.of("kari", "síť")))
            .build();

    @Test
    @DisplayName("+1 per include keyword, keywords become evidence in rule order")
    void includeKeywords() {
        CategoryScore score = engine.score("kari site a pruty", null, null, REINFORCEMENT);

        assertThat(score.score()).isEqualByComparingTo("2.0");
        assertThat(score.evidence()).containsExactly("pruty", "kari");
    }

    @Test
    @DisplayName("keywords are matched without diacritics")
    void diacriticsInsensitive() {
        String text = TextNormalizer.normalize("Výztuž ŽB stěn");

        assertThat(engine.score(text, null, null, REINFORCEMENT).evidence()).containsExactly("vyztuz");
    }

    @Test
    @DisplayName("one exclude hit cancels two include hits")
    void excludeDominates() {
        CategoryScore score = engine.score("vyztuz pruty pro kotvy", null, null, REINFORCEMENT);

        assertThat(score.score()).isEqualByComparingTo("0.0");
        assertThat(score.isPositive()).isFalse();
    }

    @Test
    @DisplayName("unit boost matches m³/m3 style units after normalization")
    void unitBoost() {
        CategoryRule concrete = TestRuleTables.workGroups().find("BETON_MONOLIT").orElseThrow();

        assertThat(engine.score("betonaz zakladu", null, "m3", concrete).score()).isEqualByComparingTo("1.5");
        assertThat(engine.score("betonaz zakladu", null, "M³", concrete).score()).isEqualByComparingTo("1.5");
        assertThat(engine.score("betonaz zakladu", null, "ks", concrete).score()).isEqualByComparingTo("1.0");
    }

    @Test
    @DisplayName("code markers add 0.5 once and are case sensitive")
    void codeBoost() {
        CategoryScore boosted = engine.score("vyztuz", "Výztuž B500B B500B", "kg", REINFORCEMENT);
        CategoryScore lowerCase = engine.score("vyztuz", "Výztuž b500b", "kg", REINFORCEMENT);

        assertThat(boosted.score()).isEqualByComparingTo("2.0");
        assertThat(boosted.evidence()).containsExactly("vyztuz", "B500B");
        assertThat(lowerCase.score()).isEqualByComparingTo("1.5");
    }

    @Test
    @DisplayName("scoreAll scores every rule in declaration order")
    void scoreAll() {
        RuleTable table = TestRuleTables.workGroups();

        List<CategoryScore> scores = engine.scoreAll("Betonáž základů", null, "m3", table);

        assertThat(scores).extracting(CategoryScore::category)
                .containsExactly("ZEMNI_PRACE", "BETON_MONOLIT", "BETON_PREFAB", "BEDNENI", "IZOLACE", "DOPRAVA");
        assertThat(scores.get(1).score()).isEqualByComparingTo("1.5");
        assertThat(scores.get(5).score()).isEqualByComparingTo("-1.5");
    }

    @Test
    @DisplayName("confidence is score / 2.0 as percent, clamped to 0..100")
    void confidence() {
        assertThat(RuleScoringEngine.confidence(new BigDecimal("1.5"))).isEqualTo(75);
        assertThat(RuleScoringEngine.confidence(new BigDecimal("0.3"))).isEqualTo(15);
        assertThat(RuleScoringEngine.confidence(new BigDecimal("2.3"))).isEqualTo(100);
        assertThat(RuleScoringEngine.confidence(BigDecimal.ZERO)).isZero();
        assertThat(RuleScoringEngine.confidence(new BigDecimal("-1.0"))).isZero();
        assertThat(RuleScoringEngine.confidence(null)).isZero();
    }

    @Test
    @DisplayName("work type is the subtype with most marker hits, GENERAL otherwise")
    void workType() {
        assertThat(engine.workType("kari sit 150x150", REINFORCEMENT)).isEqualTo("SITE");
        assertThat(engine.workType("pruty", REINFORCEMENT)).isEqualTo(RuleScoringEngine.GENERAL_WORK_TYPE);
    }
}
