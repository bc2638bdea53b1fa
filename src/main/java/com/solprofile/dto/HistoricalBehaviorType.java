package com.solprofile.dto;

/**
 * Coarse behaviour derived from the median completed hold time.
 * Upper bounds are exclusive and expressed in minutes.
 */
public enum HistoricalBehaviorType {
    SNIPER(1),
    SCALPER(5),
    MOMENTUM(30),
    INTRADAY(4 * 60),
    DAY_TRADER(24 * 60),
    SWING(7 * 24 * 60),
    POSITION(30 * 24 * 60),
    HOLDER(Double.POSITIVE_INFINITY);

    private final double upperBoundMinutes;

    HistoricalBehaviorType(double upperBoundMinutes) {
        this.upperBoundMinutes = upperBoundMinutes;
    }

    public static HistoricalBehaviorType fromMedianHours(double medianHours) {
        double minutes = medianHours * 60.0;
        for (HistoricalBehaviorType type : values()) {
            if (minutes < type.upperBoundMinutes) return type;
        }
        return HOLDER;
    }
}
