package com.solprofile.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Builder
@Data
public class BotDetectionResult {

    public enum Classification {
        BOT, HUMAN, UNKNOWN, INSTITUTIONAL;

        @JsonValue
        public String code() {
            return name().toLowerCase();
        }
    }

    public enum BotType {
        ARBITRAGE, MEV, MARKET_MAKER, SPAM;

        @JsonValue
        public String code() {
            return name().toLowerCase();
        }
    }

    private Classification classification;
    private double confidence;          // 0.1 - 0.95
    private BotType botType;            // only set for BOT
    private List<String> patterns;
    private List<String> reasons;
    private Diagnostics metrics;

    @Builder
    @Data
    public static class Diagnostics {
        private int dailyTokensTraded;
        private double avgTransactionValue;
        private int totalTransactions;
        private double flipperScore;
        private double frequencyScore;
        private double consistencyScore;
        private double botScore;
    }
}
