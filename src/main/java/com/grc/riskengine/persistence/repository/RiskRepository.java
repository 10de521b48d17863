package com.grc.riskengine.persistence.repository;

import com.grc.riskengine.domain.ApprovalStatus;
import com.grc.riskengine.domain.LifecycleState;
import com.grc.riskengine.domain.RiskCategory;
import com.grc.riskengine.persistence.entity.RiskEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface RiskRepository extends JpaRepository<RiskEntity, Long> {

    Optional<RiskEntity> findFirstByDedupeKeyAndCreatedAtAfterOrderByCreatedAtDesc(String dedupeKey, Instant since);

    /**
     * Merge candidates: active or pending-approval risks on the same service and
     * category created since the given instant, newest first.
     */
    @Query("SELECT r FROM RiskEntity r WHERE r.primaryServiceId = :serviceId AND r.category = :category " +
            "AND (r.lifecycleState = :active OR r.approvalStatus = :pending) " +
            "AND r.createdAt >= :since ORDER BY r.createdAt DESC")
    List<RiskEntity> findMergeCandidates(@Param("serviceId") Long serviceId,
                                         @Param("category") RiskCategory category,
                                         @Param("active") LifecycleState active,
                                         @Param("pending") ApprovalStatus pending,
                                         @Param("since") Instant since,
                                         Pageable pageable);

    long countByPrimaryServiceIdAndCreatedAtAfter(Long serviceId, Instant since);

    long countByPrimaryServiceIdAndCategoryAndCreatedAtAfter(Long serviceId, RiskCategory category, Instant since);

    List<RiskEntity> findByApprovalStatusAndLifecycleStateAndCreatedAtBefore(
            ApprovalStatus approvalStatus, LifecycleState lifecycleState, Instant before);
}
