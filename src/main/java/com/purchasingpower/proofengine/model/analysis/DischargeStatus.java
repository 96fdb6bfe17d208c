package com.purchasingpower.proofengine.model.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Whether a hypothesis is discharged later in the proof.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DischargeStatus {
    String assumptionId;

    @JsonProperty("isDischarged")
    boolean discharged;

    String dischargedAt;
    String dischargeReason;
}
