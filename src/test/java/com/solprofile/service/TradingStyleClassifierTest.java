package com.solprofile.service;

import com.solprofile.dto.BehavioralMetrics;
import com.solprofile.dto.BehavioralPattern;
import com.solprofile.dto.ExitPattern;
import com.solprofile.dto.HistoricalBehaviorType;
import com.solprofile.dto.PositionStatus;
import com.solprofile.dto.RiskLevel;
import com.solprofile.dto.TokenPositionLifecycle;
import com.solprofile.dto.TradingInterpretation;
import com.solprofile.dto.TradingSpeedCategory;
import com.solprofile.dto.WalletHistoricalPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("TradingStyleClassifier Tests")
class TradingStyleClassifierTest {

    private final TradingStyleClassifier classifier = new TradingStyleClassifier();

    private static BehavioralMetrics active(int buys, int sells, double symmetry, double consistency) {
        return BehavioralMetrics.builder()
                .totalTradeCount(buys + sells)
                .totalBuyCount(buys)
                .totalSellCount(sells)
                .tokensWithBothBuyAndSell(3)
                .buySellSymmetry(symmetry)
                .sequenceConsistency(consistency)
                .build();
    }

    private static TokenPositionLifecycle lifecycle(String mint, double hours) {
        return new TokenPositionLifecycle(mint, 0, 0L, 3600L, 100, 0, 0, PositionStatus.EXITED,
                null, hours, 100, 100, 1, 1, 0);
    }

    private static WalletHistoricalPattern pattern(double average, int cycles, double dataQuality) {
        return new WalletHistoricalPattern("w", average, average, cycles, cycles,
                HistoricalBehaviorType.fromMedianHours(average), ExitPattern.ALL_AT_ONCE, dataQuality, 1.0);
    }

    @Nested
    @DisplayName("Speed category")
    class Speed {

        @Test
        @DisplayName("Exactly three minutes is a flipper, not an ultra flipper")
        void boundaryIsExclusive() {
            BehavioralMetrics m = active(5, 5, 1, 1);
            TradingInterpretation at = classifier.classify(m, pattern(1, 3, 0.5),
                    List.of(lifecycle("A", 180.0 / 3600.0)));
            TradingInterpretation below = classifier.classify(m, pattern(1, 3, 0.5),
                    List.of(lifecycle("A", 179.0 / 3600.0)));

            assertThat(at.speedCategory()).isEqualTo(TradingSpeedCategory.FLIPPER);
            assertThat(below.speedCategory()).isEqualTo(TradingSpeedCategory.ULTRA_FLIPPER);
        }

        @Test
        @DisplayName("Typical hold is the median over all lifecycles, economic hold comes from the pattern")
        void typicalAndEconomic() {
            TradingInterpretation ti = classifier.classify(active(5, 5, 1, 1), pattern(30, 3, 0.5),
                    List.of(lifecycle("A", 0.5), lifecycle("B", 2), lifecycle("C", 100)));

            assertThat(ti.typicalHoldTimeHours()).isCloseTo(2.0, within(1e-9));
            assertThat(ti.economicHoldTimeHours()).isCloseTo(30.0, within(1e-9));
            assertThat(ti.speedCategory()).isEqualTo(TradingSpeedCategory.DAY_TRADER);
            assertThat(ti.economicRisk()).isEqualTo(RiskLevel.LOW);
            assertThat(ti.legacyFallback()).isFalse();
        }

        @Test
        @DisplayName("Few trades or few round-tripped tokens is low activity")
        void lowActivity() {
            BehavioralMetrics fewTrades = active(2, 2, 1, 1);
            BehavioralMetrics oneToken = active(5, 5, 1, 1);
            oneToken.setTokensWithBothBuyAndSell(1);

            assertThat(classifier.classify(fewTrades, null, List.of()).speedCategory())
                    .isEqualTo(TradingSpeedCategory.LOW_ACTIVITY);
            TradingInterpretation ti = classifier.classify(oneToken, null, List.of());
            assertThat(ti.speedCategory()).isEqualTo(TradingSpeedCategory.LOW_ACTIVITY);
            assertThat(ti.interpretation()).startsWith("Low Activity");
        }
    }

    @Nested
    @DisplayName("Behavioral pattern")
    class Pattern {

        @Test
        @DisplayName("One-sided wallets")
        void oneSided() {
            assertThat(TradingStyleClassifier.behavioralPattern(active(5, 0, 0, 0))).isEqualTo(BehavioralPattern.HOLDER);
            assertThat(TradingStyleClassifier.behavioralPattern(active(0, 5, 0, 0))).isEqualTo(BehavioralPattern.DUMPER);
        }

        @Test
        @DisplayName("Lopsided ratios")
        void lopsided() {
            assertThat(TradingStyleClassifier.behavioralPattern(active(9, 3, 0, 0))).isEqualTo(BehavioralPattern.ACCUMULATOR);
            assertThat(TradingStyleClassifier.behavioralPattern(active(3, 9, 0, 0))).isEqualTo(BehavioralPattern.DISTRIBUTOR);
            assertThat(TradingStyleClassifier.behavioralPattern(active(8, 4, 1, 1))).isEqualTo(BehavioralPattern.HOLDER);
        }

        @Test
        @DisplayName("Symmetric and consistent is balanced, otherwise mixed")
        void balancedOrMixed() {
            assertThat(TradingStyleClassifier.behavioralPattern(active(5, 5, 0.9, 0.8))).isEqualTo(BehavioralPattern.BALANCED);
            assertThat(TradingStyleClassifier.behavioralPattern(active(5, 5, 0.9, 0.5))).isEqualTo(BehavioralPattern.MIXED);
        }
    }

    @Nested
    @DisplayName("Confidence and label")
    class Confidence {

        @Test
        @DisplayName("Legacy mode halves the confidence")
        void legacyHalved() {
            BehavioralMetrics m = active(5, 5, 1, 1);
            m.setMedianHoldTime(0.5);
            m.setAverageFlipDurationHours(0.75);

            TradingInterpretation ti = classifier.classify(m, null, List.of());

            assertThat(ti.legacyFallback()).isTrue();
            assertThat(ti.confidence()).isCloseTo(0.15, within(1e-9));
            assertThat(ti.typicalHoldTimeHours()).isEqualTo(0.5);
            assertThat(ti.economicHoldTimeHours()).isEqualTo(0.75);
            assertThat(ti.speedCategory()).isEqualTo(TradingSpeedCategory.FAST_TRADER);
            assertThat(ti.label()).isEqualTo("FAST_TRADER (BALANCED)");
            assertThat(ti.interpretation()).isEqualTo("fast trader - balanced (Low confidence)");
        }

        @Test
        @DisplayName("Confidence grows with data quality, cycles and symmetry")
        void confidenceComponents() {
            assertThat(TradingStyleClassifier.confidence(10, 1.0, 1.0, 1.0)).isCloseTo(1.0, within(1e-9));
            assertThat(TradingStyleClassifier.confidence(5, 0.5, 0.0, 1.0)).isCloseTo(0.4, within(1e-9));
            assertThat(TradingStyleClassifier.confidence(3, 0.0, 0.5, 0.5)).isCloseTo(0.175, within(1e-9));
            assertThat(TradingStyleClassifier.confidence(2, 0.0, 0.0, 0.0)).isZero();
        }

        @Test
        @DisplayName("Full pattern gives a high confidence description")
        void highConfidence() {
            TradingInterpretation ti = classifier.classify(active(5, 5, 1, 1), pattern(2, 10, 1.0),
                    List.of(lifecycle("A", 2)));

            assertThat(ti.confidence()).isCloseTo(1.0, within(1e-9));
            assertThat(ti.interpretation()).endsWith("(High confidence)");
        }
    }
}
