package com.solprofile.dto;

/**
 * One holding cycle of one mint, from the first buy after a flat position until the
 * position returns to zero (or until the end of the history for the last cycle).
 *
 * @param exitTimestamp   first sell that brought the position to or below the exit threshold, null if never
 * @param behaviorType    null only for an ACTIVE cycle that is neither a full holder nor a profit taker
 * @param excessSellAmount sell amount that found no open lot during this cycle
 */
public record TokenPositionLifecycle(
        String mint,
        int cycleIndex,
        long entryTimestamp,
        Long exitTimestamp,
        double peakPosition,
        double currentPosition,
        double percentOfPeakRemaining,
        PositionStatus positionStatus,
        HolderBehaviorType behaviorType,
        double weightedHoldingTimeHours,
        double totalBought,
        double totalSold,
        int buyCount,
        int sellCount,
        double excessSellAmount
) {
    public boolean isActive() {
        return positionStatus == PositionStatus.ACTIVE;
    }

    public boolean isExited() {
        return positionStatus == PositionStatus.EXITED;
    }
}
