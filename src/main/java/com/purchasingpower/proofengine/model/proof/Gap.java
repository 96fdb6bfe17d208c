package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A hole in the reasoning between two points of a proof.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Gap {
    String id;
    GapType type;
    GapLocation location;
    String description;
    Severity severity;
    String suggestedFix;
}
