package com.boqregistry.classification.rules;

import com.boqregistry.common.TextNormalizer;
import lombok.Builder;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matching rule for one work group. Keywords and units are normalized on construction so scoring compares
 * normalized text against normalized keywords; codeBoost markers (e.g. "C30/37") are kept verbatim and matched
 * case-sensitively against the raw item text.
 *
 * @param category     work group id (e.g. BETON_MONOLIT)
 * @param include      +1.0 per keyword found
 * @param exclude      -2.0 per keyword found
 * @param unitBoost    +0.5 when the item unit is one of these
 * @param priority     tie-break weight, higher wins
 * @param priorityOver work groups this rule outranks when both score positively
 * @param codeBoost    +0.5 (once) when one of these markers appears in the raw text
 * @param subtypes     work type name to marker keywords, used to refine the winning group
 */
@Builder
public record CategoryRule(
        String category,
        List<String> include,
        List<String> exclude,
        Set<String> unitBoost,
        int priority,
        Set<String> priorityOver,
        List<String> codeBoost,
        Map<String, List<String>> subtypes
) {

    public CategoryRule {
        category = category == null ? null : category.strip();
        include = normalizedKeywords(include);
        exclude = normalizedKeywords(exclude);
        unitBoost = normalizedUnits(unitBoost);
        priorityOver = priorityOver == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(priorityOver));
        codeBoost = codeBoost == null ? List.of() : List.copyOf(codeBoost);
        subtypes = normalizedSubtypes(subtypes);
    }

    private static List<String> normalizedKeywords(Collection<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String keyword : keywords) {
            String n = TextNormalizer.normalize(keyword);
            if (!n.isEmpty()) {
                out.add(n);
            }
        }
        return List.copyOf(out);
    }

    private static Set<String> normalizedUnits(Collection<String> units) {
        if (units == null) {
            return Set.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String unit : units) {
            String n = TextNormalizer.normalizeUnit(unit);
            if (!n.isEmpty()) {
                out.add(n);
            }
        }
        return Collections.unmodifiableSet(out);
    }

    private static Map<String, List<String>> normalizedSubtypes(Map<String, List<String>> subtypes) {
        if (subtypes == null || subtypes.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> out = new LinkedHashMap<>();
        subtypes.forEach((name, keywords) -> out.put(name, normalizedKeywords(keywords)));
        return Collections.unmodifiableMap(out);
    }
}
