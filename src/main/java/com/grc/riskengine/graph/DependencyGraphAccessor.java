package com.grc.riskengine.graph;

import com.grc.riskengine.persistence.entity.ServiceDependencyEntity;
import com.grc.riskengine.persistence.entity.ServiceEntity;
import com.grc.riskengine.persistence.repository.ServiceDependencyRepository;
import com.grc.riskengine.persistence.repository.ServiceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of services and their dependency edges. Never writes.
 */
@Component
@RequiredArgsConstructor
public class DependencyGraphAccessor {

    private final ServiceRepository serviceRepository;
    private final ServiceDependencyRepository dependencyRepository;

    public Optional<ServiceEntity> findService(Long serviceId) {
        if (serviceId == null) return Optional.empty();
        return serviceRepository.findById(serviceId);
    }

    /** Edges from {@code serviceId} to the services it depends on. */
    public List<ServiceDependencyEntity> dependenciesOf(Long serviceId) {
        return dependencyRepository.findByServiceId(serviceId);
    }

    /** Edges from dependents of {@code serviceId} pointing back at it. */
    public List<ServiceDependencyEntity> dependentsOf(Long serviceId) {
        return dependencyRepository.findByDependsOnServiceId(serviceId);
    }
}
