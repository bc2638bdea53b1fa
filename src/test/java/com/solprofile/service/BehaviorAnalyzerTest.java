package com.solprofile.service;

import com.solprofile.bean.BehaviorAnalysisConfig;
import com.solprofile.dto.BehavioralMetrics;
import com.solprofile.dto.BotDetectionResult;
import com.solprofile.dto.HistoricalBehaviorType;
import com.solprofile.dto.RiskLevel;
import com.solprofile.dto.SwapRecord;
import com.solprofile.dto.TradingSpeedCategory;
import com.solprofile.dto.WalletHistoricalPattern;
import com.solprofile.dto.WalletTokenPrediction;
import com.solprofile.util.Constant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("BehaviorAnalyzer Tests")
class BehaviorAnalyzerTest {

    private static final String WALLET = "wallet1";
    /** 2024-01-01T00:00:00Z */
    private static final long DAY0 = 1_704_067_200L;

    private final BehaviorAnalyzer analyzer = new BehaviorAnalyzer(new BehaviorAnalysisConfig());

    /** Three tokens, each bought 100 and mostly sold after 1, 2 and 3 hours. */
    private static List<SwapRecord> threeCompletedTokens() {
        List<SwapRecord> records = new ArrayList<>();
        records.add(SwapRecord.buy("A", DAY0, 100, 1.0));
        records.add(SwapRecord.sell("A", DAY0 + 3_600, 85, 1.2));
        records.add(SwapRecord.buy("B", DAY0 + 10_000, 100, 2.0));
        records.add(SwapRecord.sell("B", DAY0 + 17_200, 85, 1.9));
        records.add(SwapRecord.buy("C", DAY0 + 20_000, 100, 0.5));
        records.add(SwapRecord.sell("C", DAY0 + 30_800, 85, 0.7));
        return records;
    }

    @Nested
    @DisplayName("Full analysis")
    class Analyze {

        @Test
        @DisplayName("Completed tokens produce a historical pattern and a classification")
        void endToEnd() {
            BehavioralMetrics m = analyzer.analyze(threeCompletedTokens(), WALLET);

            WalletHistoricalPattern p = m.getHistoricalPattern();
            assertThat(p).isNotNull();
            assertThat(p.completedCycleCount()).isEqualTo(3);
            assertThat(p.historicalAverageHoldTimeHours()).isCloseTo(2.0, within(1e-9));
            assertThat(p.medianCompletedHoldTimeHours()).isCloseTo(2.0, within(1e-9));
            assertThat(p.behaviorType()).isEqualTo(HistoricalBehaviorType.INTRADAY);

            assertThat(m.getTotalTradeCount()).isEqualTo(6);
            assertThat(m.getUniqueTokensTraded()).isEqualTo(3);
            assertThat(m.getTradingInterpretation().speedCategory()).isEqualTo(TradingSpeedCategory.DAY_TRADER);
            assertThat(m.getTradingInterpretation().legacyFallback()).isFalse();
            assertThat(m.getTradingStyle()).isEqualTo(m.getTradingInterpretation().label());
            assertThat(m.getConfidenceScore()).isEqualTo(m.getTradingInterpretation().confidence());
            assertThat(m.getFirstTransactionTimestamp()).isEqualTo(DAY0);
            assertThat(m.getLastTransactionTimestamp()).isEqualTo(DAY0 + 30_800);
            assertThat(m.getSessionCount()).isGreaterThan(0);
        }

        @Test
        @DisplayName("Same input gives identical metrics across analyzer instances")
        void deterministic() {
            List<SwapRecord> records = threeCompletedTokens();
            records.add(SwapRecord.buy("D", DAY0 + 40_000, 50, 0.4));

            BehavioralMetrics first = new BehaviorAnalyzer(new BehaviorAnalysisConfig()).analyze(records, WALLET);
            BehavioralMetrics second = new BehaviorAnalyzer(new BehaviorAnalysisConfig()).analyze(records, WALLET);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Without enough completed tokens the classification falls back and says so")
        void legacyFallbackWarning() {
            BehavioralMetrics m = analyzer.analyze(threeCompletedTokens().subList(0, 4), WALLET);

            assertThat(m.getHistoricalPattern()).isNull();
            assertThat(m.getTradingInterpretation().legacyFallback()).isTrue();
            assertThat(m.getDataQualityWarnings()).anyMatch(w -> w.contains("No historical pattern"));
        }

        @Test
        @DisplayName("Empty input and input made only of excluded mints give empty metrics")
        void emptyInput() {
            assertThat(analyzer.analyze(List.of(), WALLET)).isEqualTo(BehavioralMetrics.empty());
            assertThat(analyzer.analyze(null, WALLET)).isEqualTo(BehavioralMetrics.empty());

            List<SwapRecord> utilityOnly = List.of(
                    SwapRecord.buy(Constant.WSOL_MINT, DAY0, 10, 10),
                    SwapRecord.sell(Constant.USDC_MINT, DAY0 + 60, 1000, 5));
            assertThat(analyzer.analyze(utilityOnly, WALLET)).isEqualTo(BehavioralMetrics.empty());
        }

        @Test
        @DisplayName("Excluded mints do not change the result")
        void excludedMintsIgnored() {
            List<SwapRecord> withUtility = new ArrayList<>(threeCompletedTokens());
            withUtility.add(SwapRecord.buy(Constant.WSOL_MINT, DAY0 + 500, 10, 10));

            assertThat(analyzer.analyze(withUtility, WALLET)).isEqualTo(analyzer.analyze(threeCompletedTokens(), WALLET));
        }
    }

    @Nested
    @DisplayName("Derived operations")
    class Derived {

        @Test
        @DisplayName("Historical pattern alone matches the one embedded in the metrics")
        void historicalPattern() {
            WalletHistoricalPattern p = analyzer.calculateHistoricalPattern(threeCompletedTokens(), WALLET);

            assertThat(p).isEqualTo(analyzer.analyze(threeCompletedTokens(), WALLET).getHistoricalPattern());
            assertThat(analyzer.calculateHistoricalPattern(List.of(), WALLET)).isNull();
        }

        @Test
        @DisplayName("A held token gets an exit estimate relative to the analysis timestamp")
        void predictHeldToken() {
            List<SwapRecord> records = threeCompletedTokens();
            records.add(SwapRecord.buy("D", DAY0 + 40_000, 50, 0.4));

            WalletTokenPrediction p = analyzer.predictTokenExit(records, WALLET, "D", null);

            assertThat(p).isNotNull();
            // analysis timestamp is one hour after the latest trade
            assertThat(p.asOfTimestamp()).isEqualTo(DAY0 + 43_600);
            assertThat(p.positionAgeHours()).isCloseTo(1.0, within(1e-9));
            assertThat(p.estimatedExitHours()).isCloseTo(1.0, within(1e-9));
            assertThat(p.estimatedExitTimestamp()).isEqualTo(DAY0 + 47_200);
            assertThat(p.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        }

        @Test
        @DisplayName("Explicit reference time and unpredictable tokens")
        void predictEdgeCases() {
            List<SwapRecord> records = threeCompletedTokens();
            records.add(SwapRecord.buy("D", DAY0 + 40_000, 50, 0.4));

            WalletTokenPrediction p = analyzer.predictTokenExit(records, WALLET, "D", DAY0 + 40_000 + 7_200);
            assertThat(p.estimatedExitHours()).isZero();
            assertThat(p.riskLevel()).isEqualTo(RiskLevel.CRITICAL);

            assertThat(analyzer.predictTokenExit(records, WALLET, "A", null)).isNull();
            assertThat(analyzer.predictTokenExit(records, WALLET, "UNKNOWN", null)).isNull();
            assertThat(analyzer.predictTokenExit(List.of(), WALLET, "D", null)).isNull();
        }

        @Test
        @DisplayName("Bot detection runs on the filtered records")
        void detectBot() {
            BotDetectionResult r = analyzer.detectBot(threeCompletedTokens(), WALLET);

            assertThat(r.getClassification()).isEqualTo(BotDetectionResult.Classification.HUMAN);
            assertThat(r.getMetrics().getTotalTransactions()).isEqualTo(6);

            BotDetectionResult empty = analyzer.detectBot(
                    List.of(SwapRecord.buy(Constant.USDT_MINT, DAY0, 1, 1)), WALLET);
            assertThat(empty.getClassification()).isEqualTo(BotDetectionResult.Classification.UNKNOWN);
        }
    }
}
