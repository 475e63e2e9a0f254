package com.claude.patternlearning.repository;

import com.claude.patternlearning.entity.ConversionPattern;
import com.claude.patternlearning.entity.PatternType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.List;
import java.util.Optional;

@Repository
public interface ConversionPatternRepository extends JpaRepository<ConversionPattern, Long> {

    Optional<ConversionPattern> findByTenantIdAndPatternType(String tenantId, PatternType patternType);

    List<ConversionPattern> findByTenantIdOrderByPatternTypeAsc(String tenantId);

    List<ConversionPattern> findAllByOrderByTenantIdAscPatternTypeAsc();
}
