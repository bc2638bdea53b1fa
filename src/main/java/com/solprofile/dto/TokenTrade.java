package com.solprofile.dto;

/** Normalized swap owned by a {@link TokenTradeSequence}. */
public record TokenTrade(
        long timestamp,
        TradeDirection direction,
        double amount,
        double solValue,
        Double usdcValue
) {
    public static TokenTrade from(SwapRecord r) {
        return new TokenTrade(r.timestampSeconds(), r.direction(), r.amount(), r.solValue(), r.usdcValue());
    }

    public boolean isBuy() {
        return direction == TradeDirection.IN;
    }

    public double usdcValueOrZero() {
        return usdcValue == null ? 0.0 : usdcValue;
    }
}
