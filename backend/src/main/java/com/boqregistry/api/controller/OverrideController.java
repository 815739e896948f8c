package com.boqregistry.api.controller;

import com.boqregistry.api.dto.ClearOverridesResponse;
import com.boqregistry.api.dto.OverrideListResponse;
import com.boqregistry.api.dto.OverrideRequest;
import com.boqregistry.api.dto.OverrideResponse;
import com.boqregistry.classification.override.ClassificationOverrideService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * PUT/GET/DELETE /projects/{projectId}/overrides.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/overrides")
@RequiredArgsConstructor
public class OverrideController {

    private final ClassificationOverrideService overrideService;

    @PutMapping
    public ResponseEntity<OverrideResponse> recordOverride(@PathVariable String projectId,
                                                           @Valid @RequestBody OverrideRequest request) {
        return ResponseEntity.ok(OverrideResponse.from(
                overrideService.recordOverride(projectId, request.code(), request.category(), request.confirmed())));
    }

    @GetMapping
    public ResponseEntity<OverrideListResponse> listOverrides(@PathVariable String projectId) {
        List<OverrideResponse> overrides = overrideService.listOverrides(projectId).stream()
                .map(OverrideResponse::from)
                .toList();
        return ResponseEntity.ok(new OverrideListResponse(projectId, overrides.size(), overrides));
    }

    @DeleteMapping
    public ResponseEntity<ClearOverridesResponse> clearOverrides(@PathVariable String projectId) {
        return ResponseEntity.ok(new ClearOverridesResponse(projectId, overrideService.clearOverrides(projectId)));
    }
}
