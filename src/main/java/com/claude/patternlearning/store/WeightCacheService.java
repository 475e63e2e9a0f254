package com.claude.patternlearning.store;

import com.claude.patternlearning.entity.TenantWeightCache;
import com.claude.patternlearning.pattern.PatternJsonCodec;
import com.claude.patternlearning.pattern.ScoringWeights;
import com.claude.patternlearning.repository.TenantWeightCacheRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-through cache over {@code tenant_weight_cache}.
 *
 * <p>Only {@link PatternStore} writes the table. It calls {@link #refresh} inside its
 * transaction, and the in-memory entry is dropped once that transaction commits.
 *
 * <p>Every eviction bumps a per-tenant generation. A reader only caches what it loaded if
 * the generation is unchanged, so a row read before a commit is never cached after it.
 */
@Service
@Slf4j
public class WeightCacheService {

    private final TenantWeightCacheRepository weightCacheRepository;
    private final PatternJsonCodec codec;
    private final Clock clock;

    private final ConcurrentHashMap<String, TenantWeights> cache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    public WeightCacheService(TenantWeightCacheRepository weightCacheRepository,
                              PatternJsonCodec codec,
                              Clock clock) {
        this.weightCacheRepository = weightCacheRepository;
        this.codec = codec;
        this.clock = clock;
    }

    public TenantWeights getWeights(String tenantId) {
        LocalDateTime now = LocalDateTime.now(clock);
        TenantWeights cached = cache.get(tenantId);
        if (cached != null && !cached.isStaleAt(now)) {
            return cached;
        }
        long generation = generation(tenantId).get();
        TenantWeights loaded = load(tenantId, now);
        cache.compute(tenantId, (id, current) ->
                generation(id).get() == generation ? loaded : current);
        return loaded;
    }

    /**
     * Upserts the persisted weights for a tenant. Must run inside the caller's transaction.
     */
    void refresh(String tenantId, ScoringWeights weights, int sampleCount,
                 LocalDateTime updatedAt, LocalDateTime validUntil) {
        TenantWeightCache row = weightCacheRepository.findById(tenantId).orElseGet(TenantWeightCache::new);
        row.setTenantId(tenantId);
        row.setWeights(codec.encode(weights));
        row.setSampleCount(sampleCount);
        row.setUpdatedAt(updatedAt);
        row.setValidUntil(validUntil);
        weightCacheRepository.save(row);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    evict(tenantId);
                }
            });
        } else {
            evict(tenantId);
        }
    }

    public void evict(String tenantId) {
        // ordered against the reader's compute on the same key
        cache.compute(tenantId, (id, current) -> {
            generation(id).incrementAndGet();
            return null;
        });
        log.debug("[{}] weight cache entry evicted", tenantId);
    }

    private AtomicLong generation(String tenantId) {
        return generations.computeIfAbsent(tenantId, id -> new AtomicLong());
    }

    private TenantWeights load(String tenantId, LocalDateTime now) {
        Optional<TenantWeightCache> row = weightCacheRepository.findById(tenantId);
        if (row.isEmpty() || !row.get().getValidUntil().isAfter(now)) {
            return TenantWeights.defaults(tenantId);
        }
        TenantWeightCache stored = row.get();
        ScoringWeights weights = codec.decode(stored.getWeights(), ScoringWeights.class);
        return new TenantWeights(tenantId, weights, true, stored.getSampleCount(), stored.getValidUntil());
    }
}
