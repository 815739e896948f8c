package com.boqregistry.classification.rules;

import com.boqregistry.classification.ClassificationException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated set of category rules for one classification run. Declaration order is kept and used as the
 * last tie-break. Construction fails fast; a table is never partially built.
 */
public final class RuleTable {

    private final List<CategoryRule> rules;
    private final Map<String, Integer> indexByCategory;

    private RuleTable(List<CategoryRule> rules, Map<String, Integer> indexByCategory) {
        this.rules = rules;
        this.indexByCategory = indexByCategory;
    }

    /**
     * Validate and build.
     *
     * @throws ClassificationException INVALID_RULES on blank or duplicate category ids, or priorityOver references to
     *                                 unknown (or the same) category
     */
    public static RuleTable of(List<CategoryRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new ClassificationException(ClassificationException.INVALID_RULES, "Rule table is empty");
        }
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < rules.size(); i++) {
            CategoryRule rule = rules.get(i);
            if (rule == null || rule.category() == null || rule.category().isBlank()) {
                throw new ClassificationException(ClassificationException.INVALID_RULES, "Rule #" + i + " has no category");
            }
            if (index.putIfAbsent(rule.category(), i) != null) {
                throw new ClassificationException(ClassificationException.INVALID_RULES,
                        "Duplicate category in rule table: " + rule.category());
            }
        }
        for (CategoryRule rule : rules) {
            for (String target : rule.priorityOver()) {
                if (target.equals(rule.category())) {
                    throw new ClassificationException(ClassificationException.INVALID_RULES,
                            "Rule " + rule.category() + " lists itself in priorityOver");
                }
                if (!index.containsKey(target)) {
                    throw new ClassificationException(ClassificationException.INVALID_RULES,
                            "Rule " + rule.category() + " has priority over unknown category " + target);
                }
            }
        }
        return new RuleTable(List.copyOf(rules), Map.copyOf(index));
    }

    public List<CategoryRule> rules() {
        return rules;
    }

    public Optional<CategoryRule> find(String category) {
        Integer i = category == null ? null : indexByCategory.get(category);
        return i == null ? Optional.empty() : Optional.of(rules.get(i));
    }

    public boolean contains(String category) {
        return category != null && indexByCategory.containsKey(category);
    }

    /** Position in declaration order; Integer.MAX_VALUE for unknown categories. */
    public int declarationIndex(String category) {
        return indexByCategory.getOrDefault(category, Integer.MAX_VALUE);
    }

    public int size() {
        return rules.size();
    }
}
