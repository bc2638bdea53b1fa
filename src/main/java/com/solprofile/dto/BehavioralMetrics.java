package com.solprofile.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Wallet-level behavioural fingerprint. Recomputed on every analysis call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BehavioralMetrics {

    // === Core flipper metrics ===
    private double buySellRatio;            // +Infinity when only buys
    private double buySellSymmetry;
    private double averageFlipDurationHours;
    private double medianHoldTime;          // hours, median FIFO flip duration
    private double sequenceConsistency;
    private double flipperScore;

    // === Current holdings ===
    private double averageCurrentHoldingDurationHours;
    private double medianCurrentHoldingDurationHours;
    private double weightedAverageHoldingDurationHours;
    private double percentOfValueInCurrentHoldings;

    // === Supporting counts ===
    private int uniqueTokensTraded;
    private int tokensWithBothBuyAndSell;
    private int tokensWithOnlyBuys;
    private int tokensWithOnlySells;
    private int totalTradeCount;
    private int totalBuyCount;
    private int totalSellCount;
    private int completePairsCount;
    private double averageTradesPerToken;

    // === Time distribution ===
    @Builder.Default
    private TradingTimeDistribution tradingTimeDistribution = new TradingTimeDistribution();
    private double percentTradesUnder1Hour;
    private double percentTradesUnder4Hours;

    // === Classification ===
    @Builder.Default
    private String tradingStyle = "Insufficient Data";
    private double confidenceScore;
    private TradingInterpretation tradingInterpretation;
    private WalletHistoricalPattern historicalPattern;

    @Builder.Default
    private TradingFrequency tradingFrequency = new TradingFrequency();
    @Builder.Default
    private TokenPreferences tokenPreferences = new TokenPreferences();
    @Builder.Default
    private RiskMetrics riskMetrics = new RiskMetrics();
    private double reentryRate;
    private double percentageOfUnpairedTokens;

    // === Sessions ===
    private int sessionCount;
    private double avgTradesPerSession;
    @Builder.Default
    private ActiveTradingPeriods activeTradingPeriods = ActiveTradingPeriods.empty();
    private double averageSessionStartHour;
    private double averageSessionDurationMinutes;

    private Long firstTransactionTimestamp;
    private Long lastTransactionTimestamp;

    // === Data quality ===
    private int excessSellCount;
    private int scamTokensFiltered;
    @Builder.Default
    private List<String> dataQualityWarnings = new ArrayList<>();

    public static BehavioralMetrics empty() {
        return BehavioralMetrics.builder().build();
    }

    /** Fractions of FIFO flips per duration bucket; sums to 1 when any flip exists. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TradingTimeDistribution {
        private double ultraFast;   // < 30 min
        private double veryFast;    // 30-60 min
        private double fast;        // 1-4 h
        private double moderate;    // 4-8 h
        private double dayTrader;   // 8-24 h
        private double swing;       // 1-7 d
        private double position;    // > 7 d
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TradingFrequency {
        private double tradesPerDay;
        private double tradesPerWeek;
        private double tradesPerMonth;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TokenPreferences {
        private List<TokenMetrics> mostTradedTokens = new ArrayList<>();
        private List<TokenMetrics> mostHeld = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TokenMetrics {
        private String mint;
        private int count;
        private double totalValue;
        private double totalUsdcValue;
        private long firstSeen;
        private long lastSeen;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RiskMetrics {
        private double averageTransactionValueSol;
        private double largestTransactionValueSol;
    }
}
