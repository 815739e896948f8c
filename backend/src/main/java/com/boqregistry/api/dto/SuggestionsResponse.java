package com.boqregistry.api.dto;

import com.boqregistry.classification.suggestion.ItemSuggestions;

import java.util.List;

public record SuggestionsResponse(int count, List<ItemSuggestions> suggestions) {
}
