package com.grc.riskengine.persistence.repository;

import com.grc.riskengine.persistence.entity.RiskScoreHistoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface RiskScoreHistoryRepository extends JpaRepository<RiskScoreHistoryEntity, Long> {

    List<RiskScoreHistoryEntity> findByServiceIdOrderByRecordedAtDesc(Long serviceId);

    @Modifying
    @Query("DELETE FROM RiskScoreHistoryEntity h WHERE h.serviceId = :serviceId AND h.recordedAt < :cutoff")
    int purgeOlderThan(@Param("serviceId") Long serviceId, @Param("cutoff") Instant cutoff);
}
