package com.solprofile.dto;

/** Urgency bucket for an expected exit, by remaining minutes. */
public enum RiskLevel {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static RiskLevel fromRemainingHours(double hours) {
        double minutes = hours * 60.0;
        if (minutes < 5) return CRITICAL;
        if (minutes < 30) return HIGH;
        if (minutes < 120) return MEDIUM;
        return LOW;
    }
}
