package com.claude.patternlearning.service;

import com.claude.patternlearning.config.PatternLearningProperties;
import com.claude.patternlearning.dto.LearningRunSummary;
import com.claude.patternlearning.dto.TenantLearningResult;
import com.claude.patternlearning.entity.LearningRunRecord;
import com.claude.patternlearning.entity.LearningRunRecord.DetectorOutcome;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.entity.Tenant;
import com.claude.patternlearning.repository.LearningRunRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.JobExecution;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the learning job for every eligible tenant, or for one tenant on demand.
 *
 * <p>Tenants are isolated from each other: each runs on its own {@code batchTaskExecutor}
 * thread with a timeout, and whatever goes wrong for one tenant is recorded against that
 * tenant only.
 */
@Service
@Slf4j
public class PatternLearningOrchestrator {

    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private final TenantService tenantService;
    private final TenantLearningJobLauncher jobLauncher;
    private final LearningRunRecordRepository runRecordRepository;
    private final Executor batchTaskExecutor;
    private final PatternLearningProperties properties;
    private final Clock clock;

    public PatternLearningOrchestrator(TenantService tenantService,
                                       TenantLearningJobLauncher jobLauncher,
                                       LearningRunRecordRepository runRecordRepository,
                                       @Qualifier("batchTaskExecutor") Executor batchTaskExecutor,
                                       PatternLearningProperties properties,
                                       Clock clock) {
        this.tenantService = tenantService;
        this.jobLauncher = jobLauncher;
        this.runRecordRepository = runRecordRepository;
        this.batchTaskExecutor = batchTaskExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public LearningRunSummary runLearningForAllTenants() {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        String runId = newRunId(startedAt);
        resetStaleRuns();

        List<Tenant> tenants = tenantService.getEligibleTenants();
        log.info("Learning run {} started for {} eligible tenants", runId, tenants.size());

        int waveSize = Math.max(1, properties.getOrchestrator().getMaxConcurrentTenants());
        Duration timeout = properties.getOrchestrator().getTenantTimeout();
        List<TenantLearningResult> results = new ArrayList<>();
        for (int from = 0; from < tenants.size(); from += waveSize) {
            List<Tenant> wave = tenants.subList(from, Math.min(from + waveSize, tenants.size()));
            results.addAll(runWave(wave, runId, timeout));
        }

        LearningRunSummary summary = LearningRunSummary.builder()
                .runId(runId)
                .startedAt(startedAt)
                .completedAt(LocalDateTime.now(clock))
                .succeeded(count(results, TenantLearningResult.Status.SUCCESS))
                .partial(count(results, TenantLearningResult.Status.PARTIAL))
                .failed(count(results, TenantLearningResult.Status.FAILED))
                .tenants(results)
                .build();

        log.info("Learning run {} finished: {} succeeded, {} partial, {} failed",
                runId, summary.getSucceeded(), summary.getPartial(), summary.getFailed());
        return summary;
    }

    /**
     * On-demand run for one tenant, on the calling thread. Tenants that are not ACTIVE,
     * or already running, are skipped.
     */
    public TenantLearningResult runLearningForTenant(String tenantId) {
        Tenant tenant = tenantService.getTenant(tenantId);
        if (tenant.getStatus() != Tenant.TenantStatus.ACTIVE) {
            log.warn("[{}] on-demand learning skipped, tenant is {}", tenantId, tenant.getStatus());
            return TenantLearningResult.skipped(tenantId, "Tenant is " + tenant.getStatus());
        }
        if (tenant.getLastLearningStatus() == Tenant.LearningStatus.RUNNING) {
            log.warn("[{}] on-demand learning skipped, a run is already in progress", tenantId);
            return TenantLearningResult.skipped(tenantId, "A learning run is already in progress");
        }
        return runTenant(tenantId, newRunId(LocalDateTime.now(clock)));
    }

    /**
     * Marks tenants left in RUNNING for longer than the stale window as failed.
     */
    public int resetStaleRuns() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusMinutes(properties.getOrchestrator().getStaleRunMinutes());
        List<Tenant> stale = tenantService.getStaleRunningTenants(cutoff);
        for (Tenant tenant : stale) {
            log.warn("[{}] stale run since {}, marking as failed", tenant.getTenantId(), tenant.getLastLearningRun());
            tenantService.recordFailure(tenant.getTenantId(), "Run timed out and was marked stale");
        }
        return stale.size();
    }

    TenantLearningResult runTenant(String tenantId, String runId) {
        return runTenant(tenantId, runId, new AtomicBoolean());
    }

    /**
     * Runs one wave and waits for all of it. Waves are no larger than the executor's thread
     * count, so a large tenant list never overflows its queue.
     */
    private List<TenantLearningResult> runWave(List<Tenant> wave, String runId, Duration timeout) {
        List<TenantRun> runs = new ArrayList<>();
        for (Tenant tenant : wave) {
            TenantRun run = new TenantRun(tenant.getTenantId());
            try {
                run.future = CompletableFuture.supplyAsync(
                        () -> runTenant(run.tenantId, runId, run.settled), batchTaskExecutor);
            } catch (RejectedExecutionException e) {
                log.error("[{}] learning run {} rejected by the executor: {}", run.tenantId, runId, e.getMessage());
                run.future = CompletableFuture.completedFuture(
                        TenantLearningResult.failed(run.tenantId, runId, "Rejected by executor"));
            }
            runs.add(run);
        }

        List<TenantLearningResult> results = new ArrayList<>();
        for (TenantRun run : runs) {
            results.add(await(run, runId, timeout));
        }
        return results;
    }

    /**
     * {@code settled} is claimed by whichever side writes the tenant's final state first:
     * this run when it finishes, or {@link #await} when the run times out.
     */
    private TenantLearningResult runTenant(String tenantId, String runId, AtomicBoolean settled) {
        try {
            tenantService.recordRunning(tenantId);
            JobExecution execution = jobLauncher.launch(tenantId, runId);
            return classify(tenantId, runId, execution, settled);
        } catch (Exception e) {
            log.error("[{}] learning run {} aborted", tenantId, runId, e);
            if (settled.compareAndSet(false, true)) {
                tenantService.recordFailure(tenantId, e.getMessage());
            }
            return TenantLearningResult.failed(tenantId, runId, e.getMessage());
        }
    }

    private TenantLearningResult classify(String tenantId, String runId, JobExecution execution,
                                          AtomicBoolean settled) {
        Map<String, DetectorOutcome> outcomes = new TreeMap<>();
        for (LearningRunRecord record : runRecordRepository.findByRunIdAndTenantIdOrderByPatternTypeAsc(runId, tenantId)) {
            outcomes.put(record.getPatternType().getCode(), record.getOutcome());
        }

        int failed = 0;
        for (PatternType type : PatternType.values()) {
            DetectorOutcome outcome = outcomes.get(type.getCode());
            if (outcome == null || outcome.isFailure()) {
                failed++;
            }
        }

        if (!settled.compareAndSet(false, true)) {
            log.warn("[{}] learning run {} finished after it was abandoned, tenant state left as failed",
                    tenantId, runId);
            return TenantLearningResult.builder()
                    .tenantId(tenantId)
                    .runId(runId)
                    .status(TenantLearningResult.Status.FAILED)
                    .outcomes(outcomes)
                    .message("Abandoned after timeout")
                    .build();
        }

        TenantLearningResult.Status status;
        if (execution.getStatus().isUnsuccessful() || failed == PatternType.values().length) {
            status = TenantLearningResult.Status.FAILED;
            tenantService.recordFailure(tenantId, "Job " + execution.getStatus() + ", " + failed + " detectors failed");
        } else if (failed > 0) {
            status = TenantLearningResult.Status.PARTIAL;
            tenantService.recordPartial(tenantId);
        } else {
            status = TenantLearningResult.Status.SUCCESS;
            tenantService.recordSuccess(tenantId);
        }

        return TenantLearningResult.builder()
                .tenantId(tenantId)
                .runId(runId)
                .status(status)
                .outcomes(outcomes)
                .build();
    }

    private TenantLearningResult await(TenantRun run, String runId, Duration timeout) {
        String tenantId = run.tenantId;
        CompletableFuture<TenantLearningResult> future = run.future;
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (!run.settled.compareAndSet(false, true)) {
                // finished while the timeout fired
                return future.handle((result, error) -> result != null
                        ? result : TenantLearningResult.failed(tenantId, runId, String.valueOf(error))).join();
            }
            log.error("[{}] learning run {} exceeded {}, abandoning it", tenantId, runId, timeout);
            future.cancel(true);
            tenantService.recordFailure(tenantId, "Timed out after " + timeout);
            return TenantLearningResult.failed(tenantId, runId, "Timed out");
        } catch (ExecutionException e) {
            log.error("[{}] learning run {} failed", tenantId, runId, e.getCause());
            if (run.settled.compareAndSet(false, true)) {
                tenantService.recordFailure(tenantId, String.valueOf(e.getCause()));
            }
            return TenantLearningResult.failed(tenantId, runId, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return TenantLearningResult.failed(tenantId, runId, "Interrupted");
        }
    }

    private int count(List<TenantLearningResult> results, TenantLearningResult.Status status) {
        return (int) results.stream().filter(r -> r.getStatus() == status).count();
    }

    private String newRunId(LocalDateTime now) {
        return now.format(RUN_ID_FORMAT) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static class TenantRun {
        private final String tenantId;
        private final AtomicBoolean settled = new AtomicBoolean();
        private CompletableFuture<TenantLearningResult> future;

        private TenantRun(String tenantId) {
            this.tenantId = tenantId;
        }
    }
}
