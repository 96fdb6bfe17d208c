package com.purchasingpower.proofengine.model.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Advisory match of a known fallacy shape. Never changes the consistency verdict.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FallacyWarning {
    String patternId;
    String name;
    String category;
    String severity;
    String statementId;
    String matchedText;
    String suggestion;
}
