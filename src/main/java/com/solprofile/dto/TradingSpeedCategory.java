package com.solprofile.dto;

/**
 * General trading speed from the median hold time across all positions.
 * Upper bounds are exclusive, in minutes.
 */
public enum TradingSpeedCategory {
    ULTRA_FLIPPER(3),
    FLIPPER(10),
    FAST_TRADER(60),
    DAY_TRADER(24 * 60),
    SWING_TRADER(7 * 24 * 60),
    POSITION_TRADER(Double.POSITIVE_INFINITY),
    LOW_ACTIVITY(Double.NaN);

    private final double upperBoundMinutes;

    TradingSpeedCategory(double upperBoundMinutes) {
        this.upperBoundMinutes = upperBoundMinutes;
    }

    public static TradingSpeedCategory fromMedianHours(double medianHours) {
        double minutes = medianHours * 60.0;
        if (minutes < ULTRA_FLIPPER.upperBoundMinutes) return ULTRA_FLIPPER;
        if (minutes < FLIPPER.upperBoundMinutes) return FLIPPER;
        if (minutes < FAST_TRADER.upperBoundMinutes) return FAST_TRADER;
        if (minutes < DAY_TRADER.upperBoundMinutes) return DAY_TRADER;
        if (minutes < SWING_TRADER.upperBoundMinutes) return SWING_TRADER;
        return POSITION_TRADER;
    }
}
