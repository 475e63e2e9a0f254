package com.claude.patternlearning.controller;

import com.claude.patternlearning.dto.PatternResponse;
import com.claude.patternlearning.dto.WeightsResponse;
import com.claude.patternlearning.entity.ConversionPattern;
import com.claude.patternlearning.entity.PatternHistory;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.pattern.PatternJsonCodec;
import com.claude.patternlearning.service.TenantService;
import com.claude.patternlearning.store.PatternStore;
import com.claude.patternlearning.store.TenantWeights;
import com.claude.patternlearning.store.WeightCacheService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/patterns")
public class PatternController {

    private final PatternStore patternStore;
    private final WeightCacheService weightCacheService;
    private final TenantService tenantService;
    private final PatternJsonCodec codec;

    public PatternController(PatternStore patternStore,
                             WeightCacheService weightCacheService,
                             TenantService tenantService,
                             PatternJsonCodec codec) {
        this.patternStore = patternStore;
        this.weightCacheService = weightCacheService;
        this.tenantService = tenantService;
        this.codec = codec;
    }

    @GetMapping("/{tenantId}")
    public ResponseEntity<List<PatternResponse>> getCurrentPatterns(@PathVariable String tenantId) {
        tenantService.getTenant(tenantId);
        List<PatternResponse> patterns = patternStore.listCurrent(tenantId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(patterns);
    }

    @GetMapping("/{tenantId}/weights")
    public ResponseEntity<WeightsResponse> getWeights(@PathVariable String tenantId) {
        tenantService.getTenant(tenantId);
        TenantWeights weights = weightCacheService.getWeights(tenantId);
        return ResponseEntity.ok(WeightsResponse.builder()
                .tenantId(tenantId)
                .source(weights.isLearned() ? "learned" : "default")
                .weights(weights.getWeights().toMap())
                .sampleCount(weights.getSampleCount())
                .validUntil(weights.getValidUntil())
                .build());
    }

    @GetMapping("/{tenantId}/{type}")
    public ResponseEntity<PatternResponse> getCurrentPattern(@PathVariable String tenantId,
                                                             @PathVariable String type) {
        return patternStore.findCurrent(tenantId, PatternType.fromCode(type))
                .map(this::toResponse)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{tenantId}/{type}/history")
    public ResponseEntity<List<PatternResponse>> getHistory(@PathVariable String tenantId,
                                                            @PathVariable String type) {
        List<PatternResponse> history = patternStore.history(tenantId, PatternType.fromCode(type)).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(history);
    }

    private PatternResponse toResponse(ConversionPattern pattern) {
        return PatternResponse.builder()
                .tenantId(pattern.getTenantId())
                .patternType(pattern.getPatternType().getCode())
                .version(pattern.getVersion())
                .sampleSize(pattern.getSampleSize())
                .confidence(pattern.getConfidence())
                .computedAt(pattern.getComputedAt())
                .validUntil(pattern.getValidUntil())
                .lifecycle(patternStore.lifecycleOf(pattern))
                .payload(codec.toTree(pattern.getPayload()))
                .build();
    }

    private PatternResponse toResponse(PatternHistory history) {
        return PatternResponse.builder()
                .tenantId(history.getTenantId())
                .patternType(history.getPatternType().getCode())
                .version(history.getVersion())
                .sampleSize(history.getSampleSize())
                .confidence(history.getConfidence())
                .computedAt(history.getComputedAt())
                .validUntil(history.getValidUntil())
                .promoted(history.getPromoted())
                .insufficientData(history.getInsufficientData())
                .payload(codec.toTree(history.getPayload()))
                .build();
    }
}
