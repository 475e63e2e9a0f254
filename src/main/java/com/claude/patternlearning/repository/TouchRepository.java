package com.claude.patternlearning.repository;

import com.claude.patternlearning.entity.Touch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.List;

@Repository
public interface TouchRepository extends JpaRepository<Touch, Long> {

    List<Touch> findByTenantIdOrderByIdAsc(String tenantId);

    List<Touch> findByLeadIdOrderBySentAtAscIdAsc(Long leadId);

    @Query("SELECT t.leadId FROM Touch t WHERE t.tenantId = :tenantId AND t.ledToBooking = true")
    List<Long> findLeadIdsWithBookingTouch(@Param("tenantId") String tenantId);

    long countByLeadIdAndLedToBookingTrue(Long leadId);
}
