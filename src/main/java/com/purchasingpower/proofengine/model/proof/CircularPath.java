package com.purchasingpower.proofengine.model.proof;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A dependency cycle, listed in cycle order.
 */
@Value
@Builder
public class CircularPath {
    List<String> statements;
    int cycleLength;
    String explanation;
    Severity severity;
    String visualPath;
}
