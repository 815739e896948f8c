package com.boqregistry.classification.config;

import com.boqregistry.classification.rules.CategoryRule;
import com.boqregistry.classification.rules.RuleTable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Work-group rule table. See application.yml boqregistry.classification.rules; list order is the declaration order
 * used as the final tie-break.
 */
@ConfigurationProperties(prefix = "boqregistry.classification")
@NoArgsConstructor
@Getter
@Setter
public class ClassificationRulesProperties {

    private List<RuleDefinition> rules = new ArrayList<>();

    /**
     * Validated, immutable rule table.
     *
     * @throws com.boqregistry.classification.ClassificationException INVALID_RULES for inconsistent configuration
     */
    public RuleTable toRuleTable() {
        return RuleTable.of(rules.stream().map(RuleDefinition::toRule).toList());
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class RuleDefinition {

        private String category;
        private List<String> include = new ArrayList<>();
        private List<String> exclude = new ArrayList<>();
        private List<String> unitBoost = new ArrayList<>();
        /** Higher wins ties. Default 100. */
        private int priority = 100;
        private List<String> priorityOver = new ArrayList<>();
        private List<String> codeBoost = new ArrayList<>();
        private Map<String, List<String>> subtypes = new LinkedHashMap<>();

        CategoryRule toRule() {
            return CategoryRule.builder()
                    .category(category)
                    .include(include)
                    .exclude(exclude)
                    .unitBoost(new LinkedHashSet<>(unitBoost))
                    .priority(priority)
                    .priorityOver(new LinkedHashSet<>(priorityOver))
                    .codeBoost(codeBoost)
                    .subtypes(subtypes)
                    .build();
        }
    }
}
