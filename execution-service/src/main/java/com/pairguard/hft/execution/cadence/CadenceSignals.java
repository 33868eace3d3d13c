package com.pairguard.hft.execution.cadence;

import java.util.List;

public record CadenceSignals(boolean near, boolean hot, List<String> nearReasons, List<String> hotReasons) {

    public CadenceSignals {
        nearReasons = List.copyOf(nearReasons);
        hotReasons = List.copyOf(hotReasons);
    }
}
