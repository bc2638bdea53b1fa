package com.solprofile.dto;

/**
 * Point-in-time exit forecast for one ACTIVE lifecycle.
 *
 * @param predictionConfidence equals the historical pattern's data quality
 */
public record WalletTokenPrediction(
        String walletAddress,
        String mint,
        long entryTimestamp,
        long asOfTimestamp,
        double positionAgeHours,
        double historicalMedianHoldTimeHours,
        double estimatedExitHours,
        long estimatedExitTimestamp,
        RiskLevel riskLevel,
        double percentOfPeakRemaining,
        double predictionConfidence
) {
    public boolean isOverdue() {
        return positionAgeHours > historicalMedianHoldTimeHours;
    }
}
