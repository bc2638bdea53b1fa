package com.solprofile.dto;

/**
 * Combined speed and pattern classification.
 *
 * @param typicalHoldTimeHours  hold time that drove the speed category (median)
 * @param economicHoldTimeHours size-weighted hold time, or the unweighted mean in legacy mode
 * @param label                 "{speed} ({pattern})"
 * @param legacyFallback        true when no historical pattern was available
 */
public record TradingInterpretation(
        TradingSpeedCategory speedCategory,
        BehavioralPattern behavioralPattern,
        double typicalHoldTimeHours,
        double economicHoldTimeHours,
        RiskLevel economicRisk,
        String label,
        String interpretation,
        double confidence,
        boolean legacyFallback
) {}
