package com.solprofile.dto;

/**
 * One raw swap leg of a wallet for a single token mint.
 *
 * @param mint             token mint address
 * @param timestampSeconds unix block time
 * @param direction        IN for buys, OUT for sells
 * @param amount           token amount, never negative
 * @param solValue         SOL value associated with the swap
 * @param usdcValue        USDC value associated with the swap, may be null
 */
public record SwapRecord(
        String mint,
        long timestampSeconds,
        TradeDirection direction,
        double amount,
        double solValue,
        Double usdcValue
) {
    public SwapRecord {
        if (mint == null || mint.isBlank()) {
            throw new IllegalArgumentException("Swap record mint must not be blank");
        }
        if (direction == null) {
            throw new IllegalArgumentException("Swap record direction must not be null for mint " + mint);
        }
        if (amount < 0 || Double.isNaN(amount)) {
            throw new IllegalArgumentException("Negative amount " + amount + " for mint " + mint);
        }
        if (solValue < 0 || Double.isNaN(solValue)) {
            throw new IllegalArgumentException("Negative SOL value " + solValue + " for mint " + mint);
        }
        if (usdcValue != null && (usdcValue < 0 || usdcValue.isNaN())) {
            throw new IllegalArgumentException("Negative USDC value " + usdcValue + " for mint " + mint);
        }
    }

    public static SwapRecord buy(String mint, long ts, double amount, double solValue) {
        return new SwapRecord(mint, ts, TradeDirection.IN, amount, solValue, null);
    }

    public static SwapRecord sell(String mint, long ts, double amount, double solValue) {
        return new SwapRecord(mint, ts, TradeDirection.OUT, amount, solValue, null);
    }

    public boolean isBuy() {
        return direction == TradeDirection.IN;
    }
}
