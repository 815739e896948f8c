package com.boqregistry.classification.engine;

import com.boqregistry.classification.ClassificationException;
import com.boqregistry.classification.config.SimilarityProperties;
import com.boqregistry.classification.config.SuggestionProperties;
import com.boqregistry.classification.override.ClassificationOverrideService;
import com.boqregistry.classification.rules.RuleTable;
import com.boqregistry.classification.suggestion.ClassificationStats;
import com.boqregistry.classification.suggestion.ClassificationSuggester;
import com.boqregistry.classification.suggestion.ItemSuggestions;
import com.boqregistry.classification.suggestion.SimilarCategorySuggestion;
import com.boqregistry.domain.BoqItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Project-level entry point: runs batches against the configured rule table and a snapshot of the project's
 * overrides.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClassificationService {

    private final ClassificationOrchestrator orchestrator;
    private final ClassificationOverrideService overrideService;
    private final RuleTable ruleTable;
    private final SimilarityProperties similarityProperties;
    private final ClassificationSuggester suggester;
    private final SuggestionProperties suggestionProperties;

    public BatchClassificationResult classify(String projectId, List<BoqItem> items, ClassificationOptions options) {
        log.debug("Classifying {} rows for project {} in {} mode", items.size(), projectId, options.mode());
        return orchestrator.classifyBatch(items, ruleTable, overrideService.storeFor(projectId).snapshot(), options);
    }

    /**
     * @param minConfidence null for the configured default
     * @param maxResults    null for the configured default
     * @throws ClassificationException ITEM_NOT_FOUND when {@code sourceItemId} is not among {@code items}
     */
    public List<ItemClassification> applyToSimilar(String projectId, String sourceItemId, List<BoqItem> items,
                                                   Integer minConfidence, Integer maxResults) {
        BoqItem source = find(projectId, sourceItemId, items);
        int min = minConfidence != null ? minConfidence : similarityProperties.getMinConfidence();
        int max = maxResults != null ? maxResults : similarityProperties.getMaxResults();
        return orchestrator.applyCategoryToSimilar(source, items, min, max);
    }

    /**
     * Ranked rule candidates for uncategorized rows.
     *
     * @param minConfidence null for the configured default
     */
    public List<ItemSuggestions> suggest(List<BoqItem> items, Integer minConfidence) {
        int min = minConfidence != null ? minConfidence : suggestionProperties.getMinConfidence();
        return suggester.suggest(items, ruleTable, min);
    }

    /**
     * Category suggested for {@code itemId} by the categorized rows that resemble it.
     *
     * @throws ClassificationException ITEM_NOT_FOUND when {@code itemId} is not among {@code items}
     */
    public SimilarCategorySuggestion suggestFromSimilar(String projectId, String itemId, List<BoqItem> items,
                                                        Integer minConfidence, Integer maxResults) {
        BoqItem target = find(projectId, itemId, items);
        int min = minConfidence != null ? minConfidence : similarityProperties.getMinConfidence();
        int max = maxResults != null ? maxResults : suggestionProperties.getSimilarMaxResults();
        return suggester.suggestFromSimilar(target, orchestrator.withRoles(items), min, max);
    }

    public ClassificationStats stats(List<BoqItem> items) {
        return suggester.stats(items);
    }

    public RuleTable ruleTable() {
        return ruleTable;
    }

    private static BoqItem find(String projectId, String itemId, List<BoqItem> items) {
        return items.stream()
                .filter(item -> Objects.equals(item.getId(), itemId))
                .findFirst()
                .orElseThrow(() -> new ClassificationException(ClassificationException.ITEM_NOT_FOUND,
                        "Item " + itemId + " not found in project " + projectId));
    }
}
