package com.claude.patternlearning.repository;

import com.claude.patternlearning.entity.Lead;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface LeadRepository extends JpaRepository<Lead, Long> {

    @Query("SELECT l FROM Lead l WHERE l.tenantId = :tenantId " +
           "AND l.status IN :statuses " +
           "AND l.createdAt >= :since " +
           "ORDER BY l.id ASC")
    List<Lead> findByTenantAndStatusSince(@Param("tenantId") String tenantId,
                                          @Param("statuses") Collection<Lead.LeadStatus> statuses,
                                          @Param("since") LocalDateTime since);

    List<Lead> findByTenantIdOrderByIdAsc(String tenantId);

    List<Lead> findByTenantIdAndStatusOrderByIdAsc(String tenantId, Lead.LeadStatus status);

    long countByTenantIdAndStatus(String tenantId, Lead.LeadStatus status);
}
