package com.solprofile.dto;

/**
 * @param averageSessionStartHour circular mean of session start hours, in [0,24)
 */
public record SessionMetrics(
        int sessionCount,
        double avgTradesPerSession,
        double averageSessionStartHour,
        double averageSessionDurationMinutes,
        ActiveTradingPeriods activeTradingPeriods
) {
    public static SessionMetrics empty() {
        return new SessionMetrics(0, 0.0, 0.0, 0.0, ActiveTradingPeriods.empty());
    }
}
