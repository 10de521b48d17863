package com.grc.riskengine.persistence.repository;

import com.grc.riskengine.persistence.entity.RiskStateTransitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RiskStateTransitionRepository extends JpaRepository<RiskStateTransitionEntity, Long> {

    List<RiskStateTransitionEntity> findByRiskIdOrderByCreatedAtAsc(Long riskId);
}
