package com.boqregistry.api.controller;

import com.boqregistry.api.dto.BoqItemPayload;
import com.boqregistry.api.dto.ClassifyRequest;
import com.boqregistry.api.dto.ClassifyResponse;
import com.boqregistry.api.dto.RuleTableResponse;
import com.boqregistry.api.dto.SimilarRequest;
import com.boqregistry.api.dto.SimilarResponse;
import com.boqregistry.api.dto.SimilarSuggestionRequest;
import com.boqregistry.api.dto.SimilarSuggestionResponse;
import com.boqregistry.api.dto.StatsRequest;
import com.boqregistry.api.dto.SuggestionsRequest;
import com.boqregistry.api.dto.SuggestionsResponse;
import com.boqregistry.classification.engine.BatchClassificationResult;
import com.boqregistry.classification.engine.ClassificationService;
import com.boqregistry.classification.engine.ItemClassification;
import com.boqregistry.classification.rules.RuleTable;
import com.boqregistry.classification.suggestion.ClassificationStats;
import com.boqregistry.classification.suggestion.ItemSuggestions;
import com.boqregistry.classification.suggestion.SimilarCategorySuggestion;
import com.boqregistry.domain.BoqItem;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Batch classification, similar-item propagation, review suggestions and the read-only rule table.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ClassificationController {

    private final ClassificationService classificationService;

    @PostMapping("/projects/{projectId}/classification")
    public ResponseEntity<ClassifyResponse> classify(@PathVariable String projectId,
                                                     @Valid @RequestBody ClassifyRequest request) {
        List<BoqItem> items = request.items().stream().map(BoqItemPayload::toItem).toList();
        BatchClassificationResult result = classificationService.classify(projectId, items, request.toOptions());
        return ResponseEntity.ok(new ClassifyResponse(
                result.items().stream().map(BoqItemPayload::from).toList(),
                result.classifications(),
                result.changed(),
                result.unchanged(),
                result.classified(),
                result.unclassified(),
                result.bySource(),
                result.groupCounts(),
                result.roleStats()));
    }

    @PostMapping("/projects/{projectId}/classification/similar")
    public ResponseEntity<SimilarResponse> applyToSimilar(@PathVariable String projectId,
                                                          @Valid @RequestBody SimilarRequest request) {
        List<BoqItem> items = request.items().stream().map(BoqItemPayload::toItem).toList();
        List<ItemClassification> applied = classificationService.applyToSimilar(projectId, request.sourceItemId(),
                items, request.minConfidence(), request.maxResults());
        return ResponseEntity.ok(new SimilarResponse(items.stream().map(BoqItemPayload::from).toList(), applied));
    }

    @PostMapping("/projects/{projectId}/classification/suggestions")
    public ResponseEntity<SuggestionsResponse> suggestions(@PathVariable String projectId,
                                                           @Valid @RequestBody SuggestionsRequest request) {
        List<BoqItem> items = request.items().stream().map(BoqItemPayload::toItem).toList();
        List<ItemSuggestions> suggestions = classificationService.suggest(items, request.minConfidence());
        return ResponseEntity.ok(new SuggestionsResponse(suggestions.size(), suggestions));
    }

    @PostMapping("/projects/{projectId}/classification/similar/suggestion")
    public ResponseEntity<SimilarSuggestionResponse> suggestFromSimilar(@PathVariable String projectId,
                                                                        @Valid @RequestBody SimilarSuggestionRequest request) {
        List<BoqItem> items = request.items().stream().map(BoqItemPayload::toItem).toList();
        SimilarCategorySuggestion suggestion = classificationService.suggestFromSimilar(projectId, request.itemId(),
                items, request.minConfidence(), request.maxResults());
        return ResponseEntity.ok(SimilarSuggestionResponse.from(suggestion));
    }

    @PostMapping("/projects/{projectId}/classification/stats")
    public ResponseEntity<ClassificationStats> stats(@PathVariable String projectId,
                                                     @Valid @RequestBody StatsRequest request) {
        List<BoqItem> items = request.items().stream().map(BoqItemPayload::toItem).toList();
        return ResponseEntity.ok(classificationService.stats(items));
    }

    @GetMapping("/classification/rules")
    public ResponseEntity<RuleTableResponse> rules() {
        RuleTable table = classificationService.ruleTable();
        return ResponseEntity.ok(new RuleTableResponse(table.size(), table.rules()));
    }
}
