package com.solprofile.service;

import com.solprofile.dto.ExitPattern;
import com.solprofile.dto.HistoricalBehaviorType;
import com.solprofile.dto.HolderBehaviorType;
import com.solprofile.dto.PositionStatus;
import com.solprofile.dto.RiskLevel;
import com.solprofile.dto.TokenPositionLifecycle;
import com.solprofile.dto.WalletHistoricalPattern;
import com.solprofile.dto.WalletTokenPrediction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ExitPredictionService Tests")
class ExitPredictionServiceTest {

    private final ExitPredictionService service = new ExitPredictionService();

    private static final WalletHistoricalPattern TWO_HOUR_PATTERN = new WalletHistoricalPattern("w", 2.5, 2.0, 4, 6,
            HistoricalBehaviorType.INTRADAY, ExitPattern.ALL_AT_ONCE, 4.0 / 9.0, 10.0);

    private static TokenPositionLifecycle cycle(String mint, int index, PositionStatus status, long entry) {
        return new TokenPositionLifecycle(mint, index, entry, null, 100, 80, 80, status,
                HolderBehaviorType.FULL_HOLDER, 0.5, 100, 20, 1, 1, 0);
    }

    @Test
    @DisplayName("Remaining time is the historical median minus the position age")
    void remainingTime() {
        WalletTokenPrediction p = service.predict("w", "A", TWO_HOUR_PATTERN,
                List.of(cycle("A", 0, PositionStatus.ACTIVE, 0L)), 1800L);

        assertThat(p).isNotNull();
        assertThat(p.positionAgeHours()).isCloseTo(0.5, within(1e-9));
        assertThat(p.estimatedExitHours()).isCloseTo(1.5, within(1e-9));
        assertThat(p.estimatedExitTimestamp()).isEqualTo(7200L);
        assertThat(p.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(p.predictionConfidence()).isCloseTo(4.0 / 9.0, within(1e-9));
        assertThat(p.percentOfPeakRemaining()).isEqualTo(80.0);
        assertThat(p.isOverdue()).isFalse();
    }

    @Test
    @DisplayName("An overdue position is critical and expected to exit now")
    void overdue() {
        WalletTokenPrediction p = service.predict("w", "A", TWO_HOUR_PATTERN,
                List.of(cycle("A", 0, PositionStatus.ACTIVE, 0L)), 3 * 3600L);

        assertThat(p.estimatedExitHours()).isZero();
        assertThat(p.estimatedExitTimestamp()).isEqualTo(3 * 3600L);
        assertThat(p.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(p.isOverdue()).isTrue();
    }

    @Test
    @DisplayName("Only the latest cycle of the mint is considered")
    void latestCycle() {
        List<TokenPositionLifecycle> cycles = List.of(
                cycle("A", 0, PositionStatus.EXITED, 0L),
                cycle("A", 1, PositionStatus.ACTIVE, 5000L));

        WalletTokenPrediction p = service.predict("w", "A", TWO_HOUR_PATTERN, cycles, 5000L);

        assertThat(p.entryTimestamp()).isEqualTo(5000L);
        assertThat(p.positionAgeHours()).isZero();
    }

    @Test
    @DisplayName("No prediction without a pattern, for unknown mints, or when the position is closed")
    void noPrediction() {
        List<TokenPositionLifecycle> cycles = List.of(
                cycle("A", 0, PositionStatus.ACTIVE, 0L),
                cycle("B", 0, PositionStatus.ACTIVE, 0L),
                cycle("B", 1, PositionStatus.EXITED, 100L));

        assertThat(service.predict("w", "A", null, cycles, 10L)).isNull();
        assertThat(service.predict("w", "C", TWO_HOUR_PATTERN, cycles, 10L)).isNull();
        assertThat(service.predict("w", "B", TWO_HOUR_PATTERN, cycles, 10L)).isNull();
    }
}
