package com.boqregistry.classification;

import com.boqregistry.classification.rules.CategoryRule;
import com.boqregistry.classification.rules.RuleTable;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule tables shared by the engine tests: a trimmed copy of the default Czech work groups and a two-rule
 * anchoring/reinforcement table.
 */
public final class TestRuleTables {

    private TestRuleTables() {
    }

    public static RuleTable workGroups() {
        return RuleTable.of(List.of(
                CategoryRule.builder()
                        .category("ZEMNI_PRACE")
                        .include(List.of("výkop", "hloubení", "jáma", "zásyp", "násyp"))
                        .exclude(List.of("pilot", "vrt"))
                        .unitBoost(Set.of("m3", "m2"))
                        .priority(100)
                        .build(),
                CategoryRule.builder()
                        .category("BETON_MONOLIT")
                        .include(List.of("betonáž", "monolit", "železobeton", "základová deska"))
                        .exclude(List.of("z dílců", "prefabrik", "obrubník"))
                        .unitBoost(Set.of("m³"))
                        .priority(100)
                        .codeBoost(List.of("C25/30", "C30/37"))
                        .subtypes(Map.of("ZAKLADY", List.of("základ")))
                        .build(),
                CategoryRule.builder()
                        .category("BETON_PREFAB")
                        .include(List.of("z dílců", "prefabrik", "obrubník", "panel"))
                        .unitBoost(Set.of("ks", "m"))
                        .priority(100)
                        .priorityOver(Set.of("BETON_MONOLIT"))
                        .build(),
                CategoryRule.builder()
                        .category("BEDNENI")
                        .include(List.of("bednění", "odbednění"))
                        .unitBoost(Set.of("m2"))
                        .priority(80)
                        .build(),
                CategoryRule.builder()
                        .category("IZOLACE")
                        .include(List.of("izolace", "hydroizolace"))
                        .unitBoost(Set.of("m2"))
                        .priority(100)
                        .build(),
                CategoryRule.builder()
                        .category("DOPRAVA")
                        .include(List.of("doprava betonu", "odvoz", "dovoz"))
                        .exclude(List.of("beton"))
                        .unitBoost(Set.of("m3", "t"))
                        .priority(100)
                        .priorityOver(Set.of("BETON_MONOLIT"))
                        .build()
        ));
    }

    /** "tyčové" is claimed by both groups; anchoring outranks reinforcement. */
    public static RuleTable anchoring() {
        return RuleTable.of(List.of(
                CategoryRule.builder()
                        .category("VYZTUZ")
                        .include(List.of("výztuž", "pruty", "tyčové"))
                        .unitBoost(Set.of("kg", "t"))
                        .priority(100)
                        .build(),
                CategoryRule.builder()
                        .category("KOTVENI")
                        .include(List.of("kotvy", "trvalé", "tyčové"))
                        .priority(120)
                        .priorityOver(Set.of("VYZTUZ"))
                        .build()
        ));
    }
}
