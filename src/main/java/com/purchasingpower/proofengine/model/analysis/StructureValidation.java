package com.purchasingpower.proofengine.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StructureValidation {

    @JsonProperty("isValid")
    boolean valid;

    List<String> issues;
}
