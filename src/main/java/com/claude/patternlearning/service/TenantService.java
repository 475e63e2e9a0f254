package com.claude.patternlearning.service;

import com.claude.patternlearning.entity.Tenant;
import com.claude.patternlearning.exception.TenantNotFoundException;
import com.claude.patternlearning.repository.TenantRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Tenant eligibility and learning status bookkeeping.
 *
 * <p>A tenant is picked for a run while it is ACTIVE, learning is enabled, its failure
 * count is below the limit and no run is in progress. Each FAILED run counts against the
 * limit; reaching it disables learning until {@link #resetFailures} is called.
 */
@Service
@Slf4j
public class TenantService {

    private final TenantRepository tenantRepository;
    private final Clock clock;

    public TenantService(TenantRepository tenantRepository, Clock clock) {
        this.tenantRepository = tenantRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<Tenant> getEligibleTenants() {
        return tenantRepository.findEligibleForLearning();
    }

    @Transactional(readOnly = true)
    public List<Tenant> getAllTenants() {
        return tenantRepository.findAllByOrderByTenantIdAsc();
    }

    @Transactional(readOnly = true)
    public Tenant getTenant(String tenantId) {
        return tenantRepository.findByTenantId(tenantId)
                .orElseThrow(() -> new TenantNotFoundException(tenantId));
    }

    @Transactional
    public void recordRunning(String tenantId) {
        Tenant tenant = getTenant(tenantId);
        tenant.recordRunning(LocalDateTime.now(clock));
        tenantRepository.save(tenant);
    }

    @Transactional
    public void recordSuccess(String tenantId) {
        tenantRepository.findByTenantId(tenantId)
                .ifPresentOrElse(
                    tenant -> {
                        tenant.recordSuccess(LocalDateTime.now(clock));
                        tenantRepository.save(tenant);
                        log.info("[{}] learning run succeeded", tenantId);
                    },
                    () -> log.warn("[{}] tenant vanished before its success could be recorded", tenantId)
                );
    }

    @Transactional
    public void recordPartial(String tenantId) {
        tenantRepository.findByTenantId(tenantId)
                .ifPresentOrElse(
                    tenant -> {
                        tenant.recordPartial(LocalDateTime.now(clock));
                        tenantRepository.save(tenant);
                        log.warn("[{}] learning run partially failed", tenantId);
                    },
                    () -> log.warn("[{}] tenant vanished before its partial result could be recorded", tenantId)
                );
    }

    @Transactional
    public void recordFailure(String tenantId, String reason) {
        tenantRepository.findByTenantId(tenantId)
                .ifPresentOrElse(
                    tenant -> {
                        tenant.recordFailure(LocalDateTime.now(clock));
                        tenantRepository.save(tenant);
                        log.error("[{}] learning run failed (failure {}/{}): {}",
                                tenantId, tenant.getFailureCount(), tenant.getMaxFailures(), reason);
                        if (!Boolean.TRUE.equals(tenant.getLearningEnabled())) {
                            log.warn("[{}] learning disabled after reaching the failure limit", tenantId);
                        }
                    },
                    () -> log.warn("[{}] tenant vanished before its failure could be recorded", tenantId)
                );
    }

    @Transactional
    public void resetFailures(String tenantId) {
        Tenant tenant = getTenant(tenantId);
        tenant.setFailureCount(0);
        tenant.setLearningEnabled(true);
        tenant.setLastLearningStatus(Tenant.LearningStatus.PENDING);
        tenantRepository.save(tenant);
        log.info("[{}] failure count reset, learning re-enabled", tenantId);
    }

    /**
     * Tenants stuck in RUNNING since before the cutoff, usually left behind by a crash.
     */
    @Transactional(readOnly = true)
    public List<Tenant> getStaleRunningTenants(LocalDateTime cutoff) {
        return tenantRepository.findByLastLearningStatusAndLastLearningRunBefore(Tenant.LearningStatus.RUNNING, cutoff);
    }
}
