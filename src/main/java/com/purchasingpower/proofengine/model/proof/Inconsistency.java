package com.purchasingpower.proofengine.model.proof;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Inconsistency {
    String id;
    InconsistencyType type;
    List<String> involvedStatements;
    String explanation;
    InconsistencySeverity severity;
    String suggestedResolution;
}
