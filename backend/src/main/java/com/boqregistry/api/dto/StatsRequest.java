package com.boqregistry.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record StatsRequest(@NotNull(message = "INVALID_ITEMS") List<@Valid BoqItemPayload> items) {
}
