package com.solprofile.bean;

import com.solprofile.util.Constant;
import lombok.Data;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tunables of the behaviour engine. Bound from {@code behavior.*} in application.yml;
 * defaults match the values the analyzer has always used.
 */
@Data
public class BehaviorAnalysisConfig {

    private Set<String> excludedMints = new LinkedHashSet<>(Constant.DEFAULT_EXCLUDED_MINTS);
    private double sessionGapThresholdHours = 2.0;
    /** Added to the latest trade timestamp to obtain the analysis timestamp. */
    private long analysisTimestampBufferSeconds = 3600;

    private HoldingThresholds holdingThresholds = new HoldingThresholds();
    private HistoricalPatternConfig historicalPatternConfig = new HistoricalPatternConfig();
    private ScamFiltering scamFiltering = new ScamFiltering();
    private BotDetection botDetection = new BotDetection();

    @Data
    public static class HoldingThresholds {
        private double exitThreshold = 0.20;
        private double dustThreshold = 0.05;
        private double minimumSolValue = 0.001;
        private double minimumPercentageRemaining = 0.05;
        private long minimumHoldingTimeSeconds = 60;
    }

    @Data
    public static class HistoricalPatternConfig {
        private int minimumCompletedCycles = 3;
        /** 0 disables the age filter. */
        private int maximumDataAgeDays = 90;
    }

    @Data
    public static class ScamFiltering {
        private boolean enabled = true;
        private Thresholds thresholds = new Thresholds();
        private boolean logFilteredTokens = false;

        @Data
        public static class Thresholds {
            private int minTradeCount = 100;
            private double minTotalValue = 0.001;
            private double minTotalUsdcValue = 5.0;
        }
    }

    @Data
    public static class BotDetection {
        private int highFrequencyThreshold = 10;
        private double microTransactionSolThreshold = 0.1;
        private int maxDailyTokens = 50;
        private double institutionalMinAvgValueSol = 50.0;
    }
}
