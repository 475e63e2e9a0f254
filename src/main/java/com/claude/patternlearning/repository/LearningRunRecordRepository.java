package com.claude.patternlearning.repository;

import com.claude.patternlearning.entity.LearningRunRecord;
import com.claude.patternlearning.entity.PatternType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.List;
import java.util.Optional;

@Repository
public interface LearningRunRecordRepository extends JpaRepository<LearningRunRecord, Long> {

    Optional<LearningRunRecord> findByRunIdAndTenantIdAndPatternType(String runId, String tenantId, PatternType patternType);

    List<LearningRunRecord> findByRunIdAndTenantIdOrderByPatternTypeAsc(String runId, String tenantId);

    @Query("SELECT r FROM LearningRunRecord r WHERE r.tenantId = :tenantId " +
           "AND r.patternType = :patternType ORDER BY r.id DESC")
    List<LearningRunRecord> findRecent(@Param("tenantId") String tenantId,
                                       @Param("patternType") PatternType patternType,
                                       Pageable pageable);
}
