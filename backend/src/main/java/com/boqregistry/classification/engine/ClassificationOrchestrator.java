package com.boqregistry.classification.engine;

import com.boqregistry.classification.ClassificationException;
import com.boqregistry.classification.cascade.CascadePropagator;
import com.boqregistry.classification.fallback.FallbackClassifier;
import com.boqregistry.classification.fallback.FallbackRequest;
import com.boqregistry.classification.fallback.FallbackSuggestion;
import com.boqregistry.classification.override.OverrideStore;
import com.boqregistry.classification.resolver.PriorityConflictResolver;
import com.boqregistry.classification.resolver.Resolution;
import com.boqregistry.classification.role.RowRoleClassifier;
import com.boqregistry.classification.role.RowRoleStats;
import com.boqregistry.classification.rules.RuleScoringEngine;
import com.boqregistry.classification.rules.RuleTable;
import com.boqregistry.classification.similarity.SimilarItemMatch;
import com.boqregistry.classification.similarity.SimilarItemMatcher;
import com.boqregistry.common.TextNormalizer;
import com.boqregistry.domain.BoqItem;
import com.boqregistry.domain.ClassificationMode;
import com.boqregistry.domain.ClassificationSource;
import com.boqregistry.domain.RowRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs a classification batch: roles, then override / rules / AI fallback per MAIN and SECTION row, then cascade to
 * subordinate rows. A subordinate row with an override keeps it instead of inheriting; one with no MAIN or SECTION
 * row above it is classified like a source row. Every decision is computed before any category is written, so a
 * failing batch leaves categories untouched. Apart from the optional AI fallback the outcome depends only on the
 * items, rules and override snapshot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClassificationOrchestrator {

    private final RowRoleClassifier rowRoleClassifier;
    private final RuleScoringEngine ruleScoringEngine;
    private final PriorityConflictResolver priorityConflictResolver;
    private final CascadePropagator cascadePropagator;
    private final SimilarItemMatcher similarItemMatcher;
    private final FallbackClassifier fallbackClassifier;
    @Qualifier("fallback-executor")
    private final Executor fallbackExecutor;

    /**
     * Classify a batch of rows.
     *
     * @param overrides snapshot of the project's override store
     * @throws ClassificationException RECLASSIFY_NOT_CONFIRMED, DUPLICATE_ROW_POSITION, ITEM_NOT_FOUND
     */
    public BatchClassificationResult classifyBatch(List<BoqItem> items, RuleTable rules, OverrideStore overrides,
                                                   ClassificationOptions options) {
        boolean reclassifyAll = options.mode() == ClassificationMode.RECLASSIFY_ALL;
        if (reclassifyAll && !options.confirmed()) {
            throw new ClassificationException(ClassificationException.RECLASSIFY_NOT_CONFIRMED,
                    "Reclassifying all items overwrites existing categories and must be confirmed");
        }
        Map<String, List<BoqItem>> sheets = cascadePropagator.orderSheets(items);
        applyRoleCorrections(items, options.roleCorrections());
        rowRoleClassifier.assignRoles(items, reclassifyAll);
        RowRoleStats roleStats = RowRoleStats.EMPTY;
        for (List<BoqItem> sheet : sheets.values()) {
            roleStats = roleStats.plus(rowRoleClassifier.annotateSheet(sheet));
        }

        Set<BoqItem> targets = Collections.newSetFromMap(new IdentityHashMap<>());
        for (BoqItem item : items) {
            if (reclassifyAll || !item.hasCategory()) {
                targets.add(item);
            }
        }

        Map<BoqItem, Decision> decisions = new IdentityHashMap<>();
        Map<BoqItem, FallbackRequest> fallbackRequests = new LinkedHashMap<>();
        for (List<BoqItem> sheet : sheets.values()) {
            Set<BoqItem> inRun = rowsInCascadeRuns(sheet);
            for (int i = 0; i < sheet.size(); i++) {
                BoqItem item = sheet.get(i);
                if (!targets.contains(item) || item.getRole() == null || item.getRole() == RowRole.UNKNOWN) {
                    continue;
                }
                if (!isSource(item) && inRun.contains(item)) {
                    // subordinate inside a run: only an override keeps it from inheriting the source category
                    overrideDecision(item, rules, overrides).ifPresent(d -> decisions.put(item, d));
                    continue;
                }
                Decision decision = decide(item, rules, overrides, options.minConfidence());
                if (decision.category() == null && options.fallbackEnabled() && fallbackClassifier.isAvailable()) {
                    fallbackRequests.put(item, fallbackRequest(sheet, i));
                }
                decisions.put(item, decision);
            }
        }
        decisions.putAll(runFallback(fallbackRequests, rules, options.minConfidence()));

        for (List<BoqItem> sheet : sheets.values()) {
            for (int i = 0; i < sheet.size(); i++) {
                BoqItem source = sheet.get(i);
                if (!isSource(source)) {
                    continue;
                }
                Decision sourceDecision = decisions.containsKey(source)
                        ? decisions.get(source)
                        : Decision.existing(source, rules, ruleScoringEngine);
                for (int target : cascadePropagator.cascadeTargets(sheet, i)) {
                    BoqItem subordinate = sheet.get(target);
                    if (targets.contains(subordinate) && !decisions.containsKey(subordinate)) {
                        decisions.put(subordinate, sourceDecision.cascadedFrom(source));
                    }
                }
            }
        }

        return apply(items, targets, decisions, roleStats);
    }

    /**
     * Copy the category of {@code source} to uncategorized rows with a similar description, then cascade to their
     * uncategorized subordinates.
     *
     * @return applied decisions; empty when the source has no category or nothing is similar enough
     */
    public List<ItemClassification> applyCategoryToSimilar(BoqItem source, List<BoqItem> allItems,
                                                           int minConfidence, int maxResults) {
        if (!source.hasCategory()) {
            return List.of();
        }
        Map<String, List<BoqItem>> sheets = cascadePropagator.orderSheets(allItems);
        rowRoleClassifier.assignRoles(allItems, false);
        String category = source.getCategory();

        List<SimilarItemMatch> matches = similarItemMatcher.findSimilar(source, allItems, minConfidence, maxResults);
        if (matches.isEmpty()) {
            log.debug("No rows similar to {} at {}%", source.getId(), minConfidence);
            return List.of();
        }
        Map<BoqItem, ItemClassification> applied = new LinkedHashMap<>();
        for (SimilarItemMatch match : matches) {
            BoqItem item = match.item();
            applied.put(item, new ItemClassification(item.getId(), item.getCategory(), category,
                    ClassificationSource.SIMILARITY, match.similarity(), List.of(), null, source.getId()));
        }
        for (SimilarItemMatch match : matches) {
            List<BoqItem> sheet = sheets.get(sheetKey(match.item()));
            int index = indexOf(sheet, match.item());
            for (int target : cascadePropagator.cascadeTargets(sheet, index)) {
                BoqItem subordinate = sheet.get(target);
                if (!subordinate.hasCategory() && !applied.containsKey(subordinate)) {
                    applied.put(subordinate, new ItemClassification(subordinate.getId(), subordinate.getCategory(),
                            category, ClassificationSource.CASCADE, match.similarity(), List.of(), null,
                            match.item().getId()));
                }
            }
        }
        applied.forEach((item, classification) -> item.setCategory(classification.category()));
        log.info("Applied {} from {} to {} similar rows ({} incl. subordinates)",
                category, source.getId(), matches.size(), applied.size());
        return List.copyOf(applied.values());
    }

    /**
     * Validate row positions and fill in missing roles without classifying anything.
     *
     * @throws ClassificationException DUPLICATE_ROW_POSITION
     */
    public List<BoqItem> withRoles(List<BoqItem> items) {
        cascadePropagator.orderSheets(items);
        rowRoleClassifier.assignRoles(items, false);
        return items;
    }

    private Decision decide(BoqItem item, RuleTable rules, OverrideStore overrides, int minConfidence) {
        Optional<Decision> override = overrideDecision(item, rules, overrides);
        if (override.isPresent()) {
            return override.get();
        }
        Resolution resolution = priorityConflictResolver.resolve(
                ruleScoringEngine.scoreAll(item.getDescription(), item.getFullDescription(), item.getUnit(), rules), rules);
        if (resolution.isClassified() && resolution.confidence() >= minConfidence) {
            log.debug("Row {} ({}): rules -> {} score {} evidence {}", item.getId(), item.getCode(),
                    resolution.category(), resolution.adjustedScore(), resolution.evidence());
            String text = TextNormalizer.normalizeAll(item.getDescription(), item.getFullDescription());
            return new Decision(resolution.category(), ClassificationSource.RULE, resolution.confidence(),
                    resolution.evidence(), workType(text, resolution.category(), rules), null);
        }
        if (resolution.isClassified()) {
            log.debug("Row {} ({}): {} at {}% is below {}%", item.getId(), item.getCode(), resolution.category(),
                    resolution.confidence(), minConfidence);
        } else {
            log.debug("Row {} ({}): no rule matched", item.getId(), item.getCode());
        }
        return Decision.NONE;
    }

    private Optional<Decision> overrideDecision(BoqItem item, RuleTable rules, OverrideStore overrides) {
        return overrides.lookup(item.getCode()).map(category -> {
            log.debug("Row {} ({}): override -> {}", item.getId(), item.getCode(), category);
            String text = TextNormalizer.normalizeAll(item.getDescription(), item.getFullDescription());
            return new Decision(category, ClassificationSource.OVERRIDE, 100, List.of(),
                    workType(text, category, rules), null);
        });
    }

    /**
     * Rows reached by the cascade of some MAIN or SECTION row of the sheet. SUBORDINATE rows outside this set have no
     * source above them and are classified on their own.
     */
    private Set<BoqItem> rowsInCascadeRuns(List<BoqItem> sheet) {
        Set<BoqItem> inRun = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < sheet.size(); i++) {
            if (isSource(sheet.get(i))) {
                for (int target : cascadePropagator.cascadeTargets(sheet, i)) {
                    inRun.add(sheet.get(target));
                }
            }
        }
        return inRun;
    }

    /**
     * @throws ClassificationException ITEM_NOT_FOUND when a correction names an item outside the batch
     */
    private void applyRoleCorrections(List<BoqItem> items, Map<String, RowRole> corrections) {
        if (corrections.isEmpty()) {
            return;
        }
        Map<String, BoqItem> byId = new LinkedHashMap<>();
        for (BoqItem item : items) {
            byId.putIfAbsent(item.getId(), item);
        }
        for (String itemId : corrections.keySet()) {
            if (!byId.containsKey(itemId)) {
                throw new ClassificationException(ClassificationException.ITEM_NOT_FOUND,
                        "Role correction for unknown item " + itemId);
            }
        }
        corrections.forEach((itemId, role) -> rowRoleClassifier.overrideRole(byId.get(itemId), role));
        log.debug("Applied {} role corrections", corrections.size());
    }

    private FallbackRequest fallbackRequest(List<BoqItem> sheet, int index) {
        BoqItem item = sheet.get(index);
        List<String> context = new ArrayList<>();
        for (int target : cascadePropagator.cascadeTargets(sheet, index)) {
            BoqItem subordinate = sheet.get(target);
            String line = TextNormalizer.isBlank(subordinate.getDescription())
                    ? subordinate.getFullDescription()
                    : subordinate.getDescription();
            if (!TextNormalizer.isBlank(line)) {
                context.add(line.strip());
            }
        }
        String description = TextNormalizer.isBlank(item.getFullDescription())
                ? item.getDescription()
                : item.getFullDescription();
        return new FallbackRequest(description, item.getUnit(), context);
    }

    private Map<BoqItem, Decision> runFallback(Map<BoqItem, FallbackRequest> requests, RuleTable rules,
                                               int minConfidence) {
        if (requests.isEmpty()) {
            return Map.of();
        }
        Map<BoqItem, CompletableFuture<Optional<FallbackSuggestion>>> futures = new LinkedHashMap<>();
        requests.forEach((item, request) -> futures.put(item, CompletableFuture
                .supplyAsync(() -> fallbackClassifier.suggest(request), fallbackExecutor)
                .exceptionally(e -> {
                    log.warn("AI fallback failed for row {}: {}", item.getId(), e.getMessage());
                    return Optional.empty();
                })));
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<BoqItem, Decision> decisions = new IdentityHashMap<>();
        int accepted = 0;
        for (Map.Entry<BoqItem, CompletableFuture<Optional<FallbackSuggestion>>> entry : futures.entrySet()) {
            BoqItem item = entry.getKey();
            Optional<FallbackSuggestion> suggestion = entry.getValue().join();
            if (suggestion.isEmpty()) {
                continue;
            }
            FallbackSuggestion s = suggestion.get();
            if (!rules.contains(s.category())) {
                log.warn("AI fallback returned unknown category {} for row {}; ignored", s.category(), item.getId());
                continue;
            }
            if (s.confidence() < minConfidence) {
                log.debug("AI fallback {} at {}% for row {} is below {}%", s.category(), s.confidence(), item.getId(),
                        minConfidence);
                continue;
            }
            String text = TextNormalizer.normalizeAll(item.getDescription(), item.getFullDescription());
            decisions.put(item, new Decision(s.category(), ClassificationSource.AI_FALLBACK, s.confidence(),
                    s.evidence(), workType(text, s.category(), rules), null));
            accepted++;
        }
        log.info("AI fallback classified {} of {} unresolved rows", accepted, requests.size());
        return decisions;
    }

    private BatchClassificationResult apply(List<BoqItem> items, Set<BoqItem> targets, Map<BoqItem, Decision> decisions,
                                            RowRoleStats roleStats) {
        List<ItemClassification> classifications = new ArrayList<>();
        Map<ClassificationSource, Integer> bySource = new EnumMap<>(ClassificationSource.class);
        int changed = 0;
        int classified = 0;
        for (BoqItem item : items) {
            if (!targets.contains(item)) {
                continue;
            }
            Decision decision = decisions.getOrDefault(item, Decision.NONE);
            String previous = item.hasCategory() ? item.getCategory() : null;
            ItemClassification classification = new ItemClassification(item.getId(), previous, decision.category(),
                    decision.source(), decision.confidence(), decision.evidence(), decision.workType(),
                    decision.cascadeSourceId());
            classifications.add(classification);
            bySource.merge(decision.source(), 1, Integer::sum);
            if (classification.isClassified()) {
                classified++;
            }
            if (classification.isChanged()) {
                changed++;
            }
            item.setCategory(decision.category());
        }

        Map<String, Integer> groupCounts = new TreeMap<>();
        for (BoqItem item : items) {
            if (item.hasCategory()) {
                groupCounts.merge(item.getCategory(), 1, Integer::sum);
            }
        }
        int unclassified = classifications.size() - classified;
        log.info("Classified batch of {} rows: {} targeted, {} changed, {} classified, {} unclassified, by source {}",
                items.size(), classifications.size(), changed, classified, unclassified, bySource);
        return new BatchClassificationResult(List.copyOf(items), List.copyOf(classifications), changed,
                items.size() - changed, classified, unclassified, bySource, groupCounts, roleStats);
    }

    private String workType(String normalizedText, String category, RuleTable rules) {
        return rules.find(category)
                .map(rule -> ruleScoringEngine.workType(normalizedText, rule))
                .orElse(RuleScoringEngine.GENERAL_WORK_TYPE);
    }

    private static boolean isSource(BoqItem item) {
        return item.getRole() != null && item.getRole().isCascadeSource();
    }

    private static String sheetKey(BoqItem item) {
        return item.getSheetId() == null ? "" : item.getSheetId();
    }

    private static int indexOf(List<BoqItem> sheet, BoqItem item) {
        for (int i = 0; i < sheet.size(); i++) {
            if (sheet.get(i) == item) {
                return i;
            }
        }
        throw new IllegalStateException("Row " + item.getId() + " missing from its sheet");
    }

    private record Decision(String category, ClassificationSource source, int confidence, List<String> evidence,
                            String workType, String cascadeSourceId) {

        static final Decision NONE = new Decision(null, ClassificationSource.NONE, 0, List.of(), null, null);

        /** Category a non-targeted source row already carries. */
        static Decision existing(BoqItem item, RuleTable rules, RuleScoringEngine engine) {
            if (!item.hasCategory()) {
                return NONE;
            }
            String text = TextNormalizer.normalizeAll(item.getDescription(), item.getFullDescription());
            String workType = rules.find(item.getCategory())
                    .map(rule -> engine.workType(text, rule))
                    .orElse(RuleScoringEngine.GENERAL_WORK_TYPE);
            return new Decision(item.getCategory(), ClassificationSource.NONE, 100, List.of(), workType, null);
        }

        Decision cascadedFrom(BoqItem source) {
            if (category == null) {
                return NONE;
            }
            return new Decision(category, ClassificationSource.CASCADE, confidence, List.of(), workType, source.getId());
        }
    }
}
