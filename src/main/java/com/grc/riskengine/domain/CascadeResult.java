package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CascadeResult {

    Long riskId;
    boolean triggered;
    List<CascadeImpact> impacts;
    String reason;

    public static CascadeResult skipped(Long riskId, String reason) {
        return CascadeResult.builder().riskId(riskId).triggered(false).impacts(List.of()).reason(reason).build();
    }
}
