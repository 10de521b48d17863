package com.grc.riskengine.api;

import com.grc.riskengine.domain.ApprovalStatus;
import com.grc.riskengine.domain.LifecycleState;
import com.grc.riskengine.persistence.entity.RiskEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RiskApprovalResponseDto {

    Long riskId;
    String title;
    ApprovalStatus approvalStatus;
    LifecycleState lifecycleState;
    String approvedBy;
    Instant approvedAt;

    public static RiskApprovalResponseDto from(RiskEntity risk) {
        return RiskApprovalResponseDto.builder()
                .riskId(risk.getId())
                .title(risk.getTitle())
                .approvalStatus(risk.getApprovalStatus())
                .lifecycleState(risk.getLifecycleState())
                .approvedBy(risk.getApprovedBy())
                .approvedAt(risk.getApprovedAt())
                .build();
    }
}
