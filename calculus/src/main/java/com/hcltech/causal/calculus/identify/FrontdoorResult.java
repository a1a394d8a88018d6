package com.hcltech.causal.calculus.identify;

import java.util.List;

public record FrontdoorResult(boolean satisfied, List<String> mediators) {
    static final FrontdoorResult NOT_SATISFIED = new FrontdoorResult(false, List.of());

    public FrontdoorResult {
        mediators = List.copyOf(mediators);
    }
}
