package com.solprofile.dto;

/**
 * Contiguous block of UTC hours with above-threshold activity.
 *
 * @param endTimeUtc inclusive end hour
 * @param percentageOfTotalTrades 0-100
 */
public record IdentifiedTradingWindow(
        int startTimeUtc,
        int endTimeUtc,
        int durationHours,
        int tradeCountInWindow,
        double percentageOfTotalTrades,
        double avgTradesPerHourInWindow
) {}
