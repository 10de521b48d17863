package com.grc.riskengine.persistence.repository;

import com.grc.riskengine.persistence.entity.ServiceDependencyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for dependency edges.
 */
@Repository
public interface ServiceDependencyRepository extends JpaRepository<ServiceDependencyEntity, Long> {

    /** Edges the service declares: what it depends on. */
    List<ServiceDependencyEntity> findByServiceId(Long serviceId);

    /** Edges pointing at the service: its dependents. */
    List<ServiceDependencyEntity> findByDependsOnServiceId(Long dependsOnServiceId);
}
