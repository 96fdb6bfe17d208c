package com.purchasingpower.proofengine.model.proof;

import lombok.Builder;
import lombok.Value;

/**
 * Where a statement came from in the submitted proof.
 */
@Value
@Builder
public class SourceLocation {
    int stepNumber;
}
