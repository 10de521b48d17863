package com.grc.riskengine.persistence.repository;

import com.grc.riskengine.persistence.entity.ServiceRiskAssociationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ServiceRiskAssociationRepository extends JpaRepository<ServiceRiskAssociationEntity, Long> {

    List<ServiceRiskAssociationEntity> findByServiceId(Long serviceId);

    List<ServiceRiskAssociationEntity> findByRiskId(Long riskId);

    Optional<ServiceRiskAssociationEntity> findByServiceIdAndRiskId(Long serviceId, Long riskId);
}
