package com.claude.patternlearning.repository;

import com.claude.patternlearning.entity.PatternHistory;
import com.claude.patternlearning.entity.PatternType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.List;

@Repository
public interface PatternHistoryRepository extends JpaRepository<PatternHistory, Long> {

    long countByTenantIdAndPatternType(String tenantId, PatternType patternType);

    List<PatternHistory> findByTenantIdAndPatternTypeOrderByVersionDesc(String tenantId, PatternType patternType);

    @Query("SELECT h FROM PatternHistory h WHERE h.tenantId = :tenantId " +
           "AND h.patternType = :patternType ORDER BY h.version DESC")
    List<PatternHistory> findRecent(@Param("tenantId") String tenantId,
                                    @Param("patternType") PatternType patternType,
                                    Pageable pageable);
}
