package com.solprofile.dto;

/**
 * Baseline built from completed (EXITED) lifecycles only.
 *
 * @param historicalAverageHoldTimeHours peak-position weighted mean hold time
 * @param medianCompletedHoldTimeHours   median of per-token medians
 * @param completedCycleCount            number of unique tokens behind the pattern
 * @param completedLifecycleCount        number of lifecycles behind the pattern
 * @param dataQuality                    sample-size score in [0,1]
 */
public record WalletHistoricalPattern(
        String walletAddress,
        double historicalAverageHoldTimeHours,
        double medianCompletedHoldTimeHours,
        int completedCycleCount,
        int completedLifecycleCount,
        HistoricalBehaviorType behaviorType,
        ExitPattern exitPattern,
        double dataQuality,
        double observationPeriodDays
) {}
