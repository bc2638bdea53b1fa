package com.solprofile.service;

import com.solprofile.dto.BehavioralMetrics;
import com.solprofile.dto.BehavioralPattern;
import com.solprofile.dto.RiskLevel;
import com.solprofile.dto.TokenPositionLifecycle;
import com.solprofile.dto.TradingInterpretation;
import com.solprofile.dto.TradingSpeedCategory;
import com.solprofile.dto.WalletHistoricalPattern;
import com.solprofile.util.CommonUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Combines two independent scales: trading speed (typical hold of all positions) and
 * buy/sell shape. Without a historical pattern it falls back to flip durations.
 */
@Slf4j
public class TradingStyleClassifier {

    static final int MIN_TRADES_FOR_CLASSIFICATION = 5;
    static final int MIN_TOKENS_FOR_CLASSIFICATION = 2;

    private static final int HIGH_CONFIDENCE_CYCLES = 10;
    private static final int MEDIUM_CONFIDENCE_CYCLES = 5;
    private static final int LOW_CONFIDENCE_CYCLES = 3;

    public TradingInterpretation classify(BehavioralMetrics metrics,
                                          WalletHistoricalPattern pattern,
                                          List<TokenPositionLifecycle> lifecycles) {
        boolean legacy = pattern == null;

        double typicalHours;
        double economicHours;
        double dataQuality;
        int completedCycles;
        if (legacy) {
            typicalHours = metrics.getMedianHoldTime();
            economicHours = metrics.getAverageFlipDurationHours();
            dataQuality = 0.0;
            completedCycles = 0;
        } else {
            typicalHours = CommonUtil.median(lifecycles.stream()
                    .mapToDouble(TokenPositionLifecycle::weightedHoldingTimeHours).toArray());
            economicHours = pattern.historicalAverageHoldTimeHours();
            dataQuality = pattern.dataQuality();
            completedCycles = pattern.completedCycleCount();
        }

        TradingSpeedCategory speed = lowActivity(metrics)
                ? TradingSpeedCategory.LOW_ACTIVITY
                : TradingSpeedCategory.fromMedianHours(typicalHours);
        BehavioralPattern shape = behavioralPattern(metrics);

        double confidence = confidence(completedCycles, dataQuality,
                metrics.getBuySellSymmetry(), metrics.getSequenceConsistency());
        if (legacy) {
            confidence /= 2.0;
        }

        String label = speed.name() + " (" + shape.name() + ")";
        return new TradingInterpretation(speed, shape, typicalHours, economicHours,
                RiskLevel.fromRemainingHours(economicHours), label,
                describe(speed, shape, confidence), confidence, legacy);
    }

    private static boolean lowActivity(BehavioralMetrics m) {
        return m.getTotalTradeCount() < MIN_TRADES_FOR_CLASSIFICATION
                || m.getTokensWithBothBuyAndSell() < MIN_TOKENS_FOR_CLASSIFICATION;
    }

    /** Order matters: one-sided wallets first, then the lopsided shapes, then balance. */
    static BehavioralPattern behavioralPattern(BehavioralMetrics m) {
        int buys = m.getTotalBuyCount();
        int sells = m.getTotalSellCount();
        if (sells == 0) return BehavioralPattern.HOLDER;
        if (buys == 0) return BehavioralPattern.DUMPER;

        double ratio = (double) buys / sells;
        if (ratio > 2.5 && buys > 2 * sells) return BehavioralPattern.ACCUMULATOR;
        if (ratio < 0.4 && sells > 2 * buys) return BehavioralPattern.DISTRIBUTOR;
        if (ratio > 1.5) return BehavioralPattern.HOLDER;
        if (m.getBuySellSymmetry() > 0.7 && m.getSequenceConsistency() > 0.7) return BehavioralPattern.BALANCED;
        return BehavioralPattern.MIXED;
    }

    static double confidence(int completedCycles, double dataQuality, double symmetry, double consistency) {
        double c = dataQuality * 0.4;
        if (completedCycles >= HIGH_CONFIDENCE_CYCLES) c += 0.3;
        else if (completedCycles >= MEDIUM_CONFIDENCE_CYCLES) c += 0.2;
        else if (completedCycles >= LOW_CONFIDENCE_CYCLES) c += 0.1;
        c += symmetry * consistency * 0.3;
        return CommonUtil.clamp(c, 0.0, 1.0);
    }

    private static String describe(TradingSpeedCategory speed, BehavioralPattern shape, double confidence) {
        String confidenceText = confidence > 0.8 ? "High confidence"
                : confidence > 0.6 ? "Medium confidence"
                : "Low confidence";
        if (speed == TradingSpeedCategory.LOW_ACTIVITY) {
            return "Low Activity (" + confidenceText + ")";
        }
        return speed.name().replace('_', ' ').toLowerCase() + " - "
                + shape.name().toLowerCase() + " (" + confidenceText + ")";
    }
}
