package com.purchasingpower.proofengine.model.analysis;

import com.purchasingpower.proofengine.model.proof.Statement;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CycleAnalysis {
    List<Statement> involvedStatements;
    List<String> breakPoints;
    String suggestedFix;
}
