package com.solprofile.dto;

import java.util.List;
import java.util.Map;

/**
 * @param hourlyTradeCounts raw trade count per UTC hour, keys 0-23
 * @param activityFocusScore percentage (0-100) of trades falling inside the identified windows
 */
public record ActiveTradingPeriods(
        Map<Integer, Integer> hourlyTradeCounts,
        List<IdentifiedTradingWindow> identifiedWindows,
        double activityFocusScore
) {
    public static ActiveTradingPeriods empty() {
        return new ActiveTradingPeriods(Map.of(), List.of(), 0.0);
    }
}
