package com.solprofile.service;

import com.solprofile.bean.BehaviorAnalysisConfig.BotDetection;
import com.solprofile.dto.BehavioralMetrics;
import com.solprofile.dto.BotDetectionResult;
import com.solprofile.dto.BotDetectionResult.BotType;
import com.solprofile.dto.BotDetectionResult.Classification;
import com.solprofile.dto.SwapRecord;
import com.solprofile.dto.TradingInterpretation;
import com.solprofile.dto.TradingSpeedCategory;
import com.solprofile.util.CommonUtil;
import com.solprofile.util.Constant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bot vs human heuristic. Each matched pattern adds a weight to a bot score:
 * above 0.5 is a bot, below 0.2 a human, anything in between stays unknown.
 * Advisory only; never fails an analysis.
 */
@Slf4j
@RequiredArgsConstructor
public class BotDetectionService {

    private static final double BOT_SCORE_THRESHOLD = 0.5;
    private static final double HUMAN_SCORE_THRESHOLD = 0.2;
    private static final double MIN_CONFIDENCE = 0.1;
    private static final double MAX_CONFIDENCE = 0.95;

    private static final double FLIPPER_CONFIDENCE_THRESHOLD = 0.8;
    private static final double HIGH_CONSISTENCY_THRESHOLD = 0.9;
    private static final double ROUND_NUMBER_SHARE = 0.7;
    private static final double ULTRA_SHORT_HOLD_HOURS = 3.0 / 60.0;
    private static final double SPAM_AVG_VALUE_SOL = 0.01;
    private static final double FREQUENCY_NORMALIZER_PER_DAY = 50.0;
    private static final int MIN_RECORDS_FOR_CONSISTENCY = 5;

    private static final double[] COMMON_FRACTIONS = {0.5, 0.25, 0.33, 0.66, 0.75, 0.125, 0.375, 0.625, 0.875};

    static final String HF_MICRO = "high_frequency_micro_transactions";
    static final String EXCESSIVE_DAILY_TOKENS = "excessive_daily_tokens";
    static final String ULTRA_FLIPPER = "ultra_flipper";
    static final String HIGH_CONSISTENCY = "high_consistency";
    static final String ROUND_NUMBERS = "round_numbers";
    static final String ULTRA_SHORT_HOLDS = "ultra_short_holds";
    static final String INSTITUTIONAL_SIZE = "institutional_size";

    private final BotDetection config;

    /**
     * @param records swaps already stripped of excluded mints
     * @param metrics behaviour of the same records, may be null
     */
    public BotDetectionResult detect(List<SwapRecord> records, BehavioralMetrics metrics) {
        if (records == null || records.isEmpty()) {
            return BotDetectionResult.builder()
                    .classification(Classification.UNKNOWN)
                    .confidence(0.0)
                    .patterns(List.of())
                    .reasons(List.of("No transaction data available"))
                    .metrics(BotDetectionResult.Diagnostics.builder().build())
                    .build();
        }

        List<String> patterns = new ArrayList<>();
        List<String> reasons = new ArrayList<>();

        int total = records.size();
        double totalValue = records.stream().mapToDouble(SwapRecord::solValue).sum();
        double avgValue = totalValue / total;
        int maxDailyTokens = maxDailyTokens(records);

        long first = records.stream().mapToLong(SwapRecord::timestampSeconds).min().orElse(0L);
        long last = records.stream().mapToLong(SwapRecord::timestampSeconds).max().orElse(0L);
        long span = total < 2 ? 1L : Math.max(1L, last - first);
        double perDay = total / (span / Constant.SECONDS_PER_DAY);
        double frequencyScore = Math.min(perDay / FREQUENCY_NORMALIZER_PER_DAY, 1.0);
        double consistencyScore = consistencyScore(records);

        double botScore = 0.0;

        // 1. many tiny trades
        if (total >= config.getHighFrequencyThreshold() && avgValue < config.getMicroTransactionSolThreshold()) {
            botScore += 0.4;
            patterns.add(HF_MICRO);
            reasons.add(String.format("High frequency (%d) with micro transactions (avg: %.4f SOL)", total, avgValue));
        }

        // 2. too many distinct tokens on one day
        if (maxDailyTokens > config.getMaxDailyTokens()) {
            botScore += 0.3;
            patterns.add(EXCESSIVE_DAILY_TOKENS);
            reasons.add("Trades too many tokens per day (max: " + maxDailyTokens + ")");
        }

        // 3. fastest speed category with a confident classification
        TradingInterpretation interpretation = metrics != null ? metrics.getTradingInterpretation() : null;
        if (interpretation != null
                && interpretation.speedCategory() == TradingSpeedCategory.ULTRA_FLIPPER
                && interpretation.confidence() > FLIPPER_CONFIDENCE_THRESHOLD) {
            botScore += 0.25;
            patterns.add(ULTRA_FLIPPER);
            reasons.add("Classified as ultra flipper with high confidence");
        }

        // 4. clockwork intervals
        if (consistencyScore > HIGH_CONSISTENCY_THRESHOLD) {
            botScore += 0.2;
            patterns.add(HIGH_CONSISTENCY);
            reasons.add("Trading pattern is too consistent for human behavior");
        }

        // 5. round amounts
        if (prefersRoundNumbers(records)) {
            botScore += 0.15;
            patterns.add(ROUND_NUMBERS);
            reasons.add("Prefers round number amounts");
        }

        // 6. median hold under three minutes
        double medianHold = typicalHoldHours(metrics);
        if (medianHold > 0 && medianHold < ULTRA_SHORT_HOLD_HOURS) {
            botScore += 0.2;
            patterns.add(ULTRA_SHORT_HOLDS);
            reasons.add(String.format("Extremely short typical holding time: %.1f minutes (median)", medianHold * 60));
        }

        Classification classification;
        BotType botType = null;
        if (botScore > BOT_SCORE_THRESHOLD) {
            classification = Classification.BOT;
            if (patterns.contains(HF_MICRO) && patterns.contains(ULTRA_FLIPPER)) {
                botType = BotType.ARBITRAGE;
            } else if (patterns.contains(EXCESSIVE_DAILY_TOKENS)) {
                botType = BotType.MARKET_MAKER;
            } else if (avgValue < SPAM_AVG_VALUE_SOL) {
                botType = BotType.SPAM;
            } else {
                botType = BotType.MEV;
            }
        } else if (botScore < HUMAN_SCORE_THRESHOLD) {
            if (total >= config.getHighFrequencyThreshold() && avgValue >= config.getInstitutionalMinAvgValueSol()) {
                classification = Classification.INSTITUTIONAL;
                patterns.add(INSTITUTIONAL_SIZE);
                reasons.add(String.format("Sustained large transactions (avg: %.2f SOL over %d trades)", avgValue, total));
            } else {
                classification = Classification.HUMAN;
                reasons.add("Behavior patterns consistent with human trading");
            }
        } else {
            classification = Classification.UNKNOWN;
            reasons.add("Mixed indicators, unable to classify with confidence");
        }

        double confidence = CommonUtil.clamp(botScore, MIN_CONFIDENCE, MAX_CONFIDENCE);
        log.debug("Bot detection: {} (score {}, patterns {})", classification, String.format("%.2f", botScore), patterns);

        return BotDetectionResult.builder()
                .classification(classification)
                .confidence(confidence)
                .botType(botType)
                .patterns(patterns)
                .reasons(reasons)
                .metrics(BotDetectionResult.Diagnostics.builder()
                        .dailyTokensTraded(maxDailyTokens)
                        .avgTransactionValue(avgValue)
                        .totalTransactions(total)
                        .flipperScore(metrics != null ? metrics.getFlipperScore() : 0.0)
                        .frequencyScore(frequencyScore)
                        .consistencyScore(consistencyScore)
                        .botScore(botScore)
                        .build())
                .build();
    }

    private static int maxDailyTokens(List<SwapRecord> records) {
        Map<LocalDate, Set<String>> daily = new HashMap<>();
        for (SwapRecord r : records) {
            daily.computeIfAbsent(CommonUtil.utcDate(r.timestampSeconds()), d -> new HashSet<>()).add(r.mint());
        }
        return daily.values().stream().mapToInt(Set::size).max().orElse(0);
    }

    /** 1 for perfectly regular inter-trade intervals, 0 for highly random ones. */
    static double consistencyScore(List<SwapRecord> records) {
        if (records.size() < MIN_RECORDS_FOR_CONSISTENCY) return 0.0;
        long[] ts = records.stream().mapToLong(SwapRecord::timestampSeconds).sorted().toArray();
        double[] intervals = new double[ts.length - 1];
        for (int i = 1; i < ts.length; i++) {
            intervals[i - 1] = ts[i] - ts[i - 1];
        }
        double mean = CommonUtil.mean(intervals);
        if (mean == 0.0) return 0.0;
        double cv = CommonUtil.stddev(intervals, mean) / mean;
        return Math.max(0.0, 1.0 - Math.min(cv, 2.0) / 2.0);
    }

    static boolean prefersRoundNumbers(List<SwapRecord> records) {
        long round = records.stream().filter(r -> isRound(r.amount())).count();
        return (double) round / records.size() > ROUND_NUMBER_SHARE;
    }

    /** Whole number, at most two decimals, or close to a common fraction. */
    static boolean isRound(double amount) {
        double cents = amount * 100.0;
        if (Math.abs(cents - Math.rint(cents)) < 1e-6) return true;
        double fractional = amount % 1.0;
        for (double f : COMMON_FRACTIONS) {
            if (Math.abs(fractional - f) < 0.01) return true;
        }
        return false;
    }

    private static double typicalHoldHours(BehavioralMetrics metrics) {
        if (metrics == null) return 0.0;
        if (metrics.getHistoricalPattern() != null && metrics.getHistoricalPattern().medianCompletedHoldTimeHours() > 0) {
            return metrics.getHistoricalPattern().medianCompletedHoldTimeHours();
        }
        return metrics.getMedianHoldTime();
    }
}
