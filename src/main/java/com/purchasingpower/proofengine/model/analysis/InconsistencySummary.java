package com.purchasingpower.proofengine.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Reduction of an inconsistency list to a single verdict.
 *
 * <p>A proof is consistent when it has no critical and no error findings;
 * warnings alone never invalidate it.
 */
@Value
@Builder
public class InconsistencySummary {

    @JsonProperty("isConsistent")
    boolean consistent;

    int criticalCount;
    int errorCount;
    int warningCount;
    String summary;
}
