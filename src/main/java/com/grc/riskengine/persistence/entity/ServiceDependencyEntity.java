package com.grc.riskengine.persistence.entity;

import com.grc.riskengine.domain.DependencyCriticality;
import com.grc.riskengine.domain.DependencyType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directed edge: {@code serviceId} depends on {@code dependsOnServiceId}. The graph may contain cycles.
 */
@Entity
@Table(name = "service_dependencies", indexes = {
    @Index(name = "idx_dependency_service", columnList = "service_id"),
    @Index(name = "idx_dependency_depends_on", columnList = "depends_on_service_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_dependency_edge", columnNames = {"service_id", "depends_on_service_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceDependencyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "depends_on_service_id", nullable = false)
    private Long dependsOnServiceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "dependency_type", nullable = false)
    @Builder.Default
    private DependencyType dependencyType = DependencyType.FUNCTIONAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "criticality", nullable = false)
    @Builder.Default
    private DependencyCriticality criticality = DependencyCriticality.MEDIUM;

    /** Overrides the criticality default when set; must be in (0,1]. */
    @Column(name = "propagation_factor")
    private Double propagationFactor;

    public double effectivePropagationFactor() {
        if (propagationFactor != null && propagationFactor > 0 && propagationFactor <= 1) {
            return propagationFactor;
        }
        return criticality.getPropagationFactor();
    }
}
