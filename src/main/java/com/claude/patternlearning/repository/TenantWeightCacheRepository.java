package com.claude.patternlearning.repository;

import com.claude.patternlearning.entity.TenantWeightCache;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TenantWeightCacheRepository extends JpaRepository<TenantWeightCache, String> {
}
