package com.grc.riskengine.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RiskApprovalRequestDto {

    @NotNull(message = "approved is required")
    private Boolean approved;

    @NotBlank(message = "actor is required")
    private String actor;

    private String comment;
}
