package com.purchasingpower.proofengine.model.analysis;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DecompositionMetrics {
    int atomCount;
    int rootCount;
    int leafCount;
    double avgDependencies;
    int maxDependencyDepth;
    double completeness;
    int gapCount;
    int implicitAssumptionCount;
}
