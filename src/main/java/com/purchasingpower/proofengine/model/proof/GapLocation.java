package com.purchasingpower.proofengine.model.proof;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GapLocation {
    String from;
    String to;

    public static GapLocation of(String from, String to) {
        return new GapLocation(from, to);
    }
}
