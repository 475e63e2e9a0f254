package com.claude.patternlearning.repository;

import com.claude.patternlearning.entity.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface TenantRepository extends JpaRepository<Tenant, Long> {

    Optional<Tenant> findByTenantId(String tenantId);

    @Query("SELECT t FROM Tenant t WHERE t.learningEnabled = true " +
           "AND t.status = :status " +
           "AND t.failureCount < t.maxFailures " +
           "AND t.lastLearningStatus <> :running " +
           "ORDER BY t.tenantId ASC")
    List<Tenant> findEligible(@Param("status") Tenant.TenantStatus status,
                              @Param("running") Tenant.LearningStatus running);

    default List<Tenant> findEligibleForLearning() {
        return findEligible(Tenant.TenantStatus.ACTIVE, Tenant.LearningStatus.RUNNING);
    }

    List<Tenant> findByLastLearningStatusAndLastLearningRunBefore(Tenant.LearningStatus status, LocalDateTime cutoff);

    List<Tenant> findAllByOrderByTenantIdAsc();
}
