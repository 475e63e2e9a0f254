package com.claude.patternlearning.controller;

import com.claude.patternlearning.dto.BackfillResult;
import com.claude.patternlearning.dto.HealthReport;
import com.claude.patternlearning.dto.LearningRunSummary;
import com.claude.patternlearning.dto.TenantLearningResult;
import com.claude.patternlearning.entity.Tenant;
import com.claude.patternlearning.scheduling.JobRunOutcome;
import com.claude.patternlearning.scheduling.ScheduledJobRunner;
import com.claude.patternlearning.service.PatternBackfillService;
import com.claude.patternlearning.service.PatternHealthMonitor;
import com.claude.patternlearning.service.PatternLearningOrchestrator;
import com.claude.patternlearning.service.TenantService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/admin/learning")
public class LearningAdminController {

    private final PatternLearningOrchestrator orchestrator;
    private final PatternBackfillService backfillService;
    private final PatternHealthMonitor healthMonitor;
    private final TenantService tenantService;
    private final ScheduledJobRunner jobRunner;

    public LearningAdminController(PatternLearningOrchestrator orchestrator,
                                   PatternBackfillService backfillService,
                                   PatternHealthMonitor healthMonitor,
                                   TenantService tenantService,
                                   ScheduledJobRunner jobRunner) {
        this.orchestrator = orchestrator;
        this.backfillService = backfillService;
        this.healthMonitor = healthMonitor;
        this.tenantService = tenantService;
        this.jobRunner = jobRunner;
    }

    @PostMapping("/run")
    public ResponseEntity<LearningRunSummary> runAllTenants() {
        return ResponseEntity.ok(orchestrator.runLearningForAllTenants());
    }

    @PostMapping("/tenants/{tenantId}/run")
    public ResponseEntity<TenantLearningResult> runTenant(@PathVariable String tenantId) {
        return ResponseEntity.ok(orchestrator.runLearningForTenant(tenantId));
    }

    @PostMapping("/tenants/{tenantId}/backfill")
    public ResponseEntity<BackfillResult> backfillTenant(@PathVariable String tenantId) {
        return ResponseEntity.ok(backfillService.backfillTenant(tenantId));
    }

    @PostMapping("/tenants/{tenantId}/reset")
    public ResponseEntity<String> resetTenantFailures(@PathVariable String tenantId) {
        tenantService.resetFailures(tenantId);
        return ResponseEntity.ok("Reset failure count for tenant: " + tenantId);
    }

    @GetMapping("/tenants/eligible")
    public ResponseEntity<List<Tenant>> getEligibleTenants() {
        return ResponseEntity.ok(tenantService.getEligibleTenants());
    }

    @PostMapping("/health")
    public ResponseEntity<HealthReport> runHealthCheck() {
        return ResponseEntity.ok(healthMonitor.runHealthCheck());
    }

    @PostMapping("/jobs/{name}/trigger")
    public CompletableFuture<ResponseEntity<JobRunOutcome>> triggerJob(@PathVariable String name) {
        return jobRunner.trigger(name).thenApply(ResponseEntity::ok);
    }

    @GetMapping("/jobs/{name}")
    public ResponseEntity<JobRunOutcome> getLastOutcome(@PathVariable String name) {
        return jobRunner.lastOutcome(name)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
