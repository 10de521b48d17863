package com.grc.riskengine.persistence.repository;

import com.grc.riskengine.persistence.entity.RiskChangeNotificationEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RiskChangeNotificationRepository extends JpaRepository<RiskChangeNotificationEntity, String> {

    List<RiskChangeNotificationEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
