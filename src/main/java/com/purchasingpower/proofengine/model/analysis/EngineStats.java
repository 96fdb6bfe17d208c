package com.purchasingpower.proofengine.model.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Which analysis passes are enabled, plus the engine version.
 */
@Value
@Builder
public class EngineStats {
    Map<String, Boolean> features;
    String version;
}
