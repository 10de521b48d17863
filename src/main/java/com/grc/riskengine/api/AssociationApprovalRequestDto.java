package com.grc.riskengine.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AssociationApprovalRequestDto {

    @NotBlank(message = "actor is required")
    private String actor;
}
