package com.solprofile.service;

import com.solprofile.bean.BehaviorAnalysisConfig;
import com.solprofile.dto.BehavioralMetrics;
import com.solprofile.dto.BotDetectionResult;
import com.solprofile.dto.SessionMetrics;
import com.solprofile.dto.SwapRecord;
import com.solprofile.dto.TokenTradeSequence;
import com.solprofile.dto.TradingInterpretation;
import com.solprofile.dto.WalletHistoricalPattern;
import com.solprofile.dto.WalletTokenPrediction;
import com.solprofile.util.BehaviorMetricsCalculator;
import com.solprofile.util.TokenSequenceBuilder;
import com.solprofile.util.TradingSessionCalculator;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;

/**
 * Entry point of the behaviour engine. Every call is a pure function of the swap
 * records, the config and the wallet address: the analysis timestamp comes from the
 * latest trade plus a fixed buffer, never from the clock, so repeated runs over the
 * same history give identical results. Instances hold no state between calls and are
 * safe to share across threads.
 */
@Slf4j
public class BehaviorAnalyzer {

    private final BehaviorAnalysisConfig config;
    private final HistoricalPatternCalculator patternCalculator;
    private final TradingStyleClassifier classifier;
    private final BotDetectionService botDetector;
    private final ExitPredictionService exitPredictor;

    public BehaviorAnalyzer(BehaviorAnalysisConfig config) {
        this.config = config;
        this.patternCalculator = new HistoricalPatternCalculator(config.getHistoricalPatternConfig());
        this.classifier = new TradingStyleClassifier();
        this.botDetector = new BotDetectionService(config.getBotDetection());
        this.exitPredictor = new ExitPredictionService();
    }

    /** Inputs shared by every operation, derived once per call. */
    private record Prepared(List<SwapRecord> records,
                            List<TokenTradeSequence> sequences,
                            LifecycleEngine.Result lifecycles,
                            long analysisTimestamp) {
        boolean isEmpty() {
            return records.isEmpty();
        }
    }

    private Prepared prepare(Collection<SwapRecord> rawRecords) {
        List<SwapRecord> records = TokenSequenceBuilder.withoutExcludedMints(rawRecords, config.getExcludedMints());
        if (records.isEmpty()) {
            return new Prepared(records, List.of(), new LifecycleEngine.Result(), 0L);
        }
        long latest = records.stream().mapToLong(SwapRecord::timestampSeconds).max().orElse(0L);
        long analysisTimestamp = latest + config.getAnalysisTimestampBufferSeconds();
        List<TokenTradeSequence> sequences = TokenSequenceBuilder.build(records);
        LifecycleEngine.Result lifecycles = LifecycleEngine.run(sequences, config.getHoldingThresholds(), analysisTimestamp);
        return new Prepared(records, sequences, lifecycles, analysisTimestamp);
    }

    public BehavioralMetrics analyze(Collection<SwapRecord> rawRecords, String walletAddress) {
        int rawCount = rawRecords == null ? 0 : rawRecords.size();
        log.debug("Wallet {}: starting behavior analysis of {} swap records", walletAddress, rawCount);

        Prepared p = prepare(rawRecords);
        if (p.isEmpty()) {
            log.warn("Wallet {}: no swap records left after excluding utility mints, returning empty metrics", walletAddress);
            return BehaviorMetricsCalculator.createEmptyMetrics();
        }

        BehavioralMetrics metrics = BehaviorMetricsCalculator.fromSequences(
                p.sequences(), p.lifecycles(), config, p.analysisTimestamp());

        SessionMetrics sessions = TradingSessionCalculator.calculate(
                p.records().stream().map(SwapRecord::timestampSeconds).toList(),
                config.getSessionGapThresholdHours());
        metrics.setSessionCount(sessions.sessionCount());
        metrics.setAvgTradesPerSession(sessions.avgTradesPerSession());
        metrics.setAverageSessionStartHour(sessions.averageSessionStartHour());
        metrics.setAverageSessionDurationMinutes(sessions.averageSessionDurationMinutes());
        metrics.setActiveTradingPeriods(sessions.activeTradingPeriods());

        WalletHistoricalPattern pattern = patternCalculator.calculate(
                walletAddress, p.lifecycles().lifecycles, p.analysisTimestamp());
        metrics.setHistoricalPattern(pattern);

        TradingInterpretation interpretation = classifier.classify(metrics, pattern, p.lifecycles().lifecycles);
        metrics.setTradingInterpretation(interpretation);
        metrics.setTradingStyle(interpretation.label());
        metrics.setConfidenceScore(interpretation.confidence());
        if (interpretation.legacyFallback()) {
            log.warn("Wallet {}: no historical pattern, classified from flip durations with reduced confidence",
                    walletAddress);
            metrics.getDataQualityWarnings().add(
                    "No historical pattern; classification uses flip durations and reduced confidence");
        }

        log.info("Wallet {}: behavior analysis done, style {} (confidence {}), {} tokens, {} lifecycles",
                walletAddress, metrics.getTradingStyle(), String.format("%.2f", metrics.getConfidenceScore()),
                metrics.getUniqueTokensTraded(), p.lifecycles().lifecycles.size());
        return metrics;
    }

    /** @return null when there are not enough completed cycles */
    public WalletHistoricalPattern calculateHistoricalPattern(Collection<SwapRecord> rawRecords, String walletAddress) {
        Prepared p = prepare(rawRecords);
        if (p.isEmpty()) {
            log.warn("Wallet {}: no swap records after filtering, cannot calculate historical pattern", walletAddress);
            return null;
        }
        return patternCalculator.calculate(walletAddress, p.lifecycles().lifecycles, p.analysisTimestamp());
    }

    /**
     * @param asOfTimestamp reference time in epoch seconds; null uses the analysis timestamp
     * @return null when there is no pattern or the mint is not currently held
     */
    public WalletTokenPrediction predictTokenExit(Collection<SwapRecord> rawRecords, String walletAddress,
                                                  String mint, Long asOfTimestamp) {
        Prepared p = prepare(rawRecords);
        if (p.isEmpty()) return null;
        WalletHistoricalPattern pattern = patternCalculator.calculate(
                walletAddress, p.lifecycles().lifecycles, p.analysisTimestamp());
        long now = asOfTimestamp != null ? asOfTimestamp : p.analysisTimestamp();
        return exitPredictor.predict(walletAddress, mint, pattern, p.lifecycles().lifecycles, now);
    }

    public BotDetectionResult detectBot(Collection<SwapRecord> rawRecords, String walletAddress) {
        List<SwapRecord> records = TokenSequenceBuilder.withoutExcludedMints(rawRecords, config.getExcludedMints());
        BehavioralMetrics metrics = records.isEmpty() ? null : analyze(records, walletAddress);
        BotDetectionResult result = botDetector.detect(records, metrics);
        log.info("Wallet {}: bot detection {} (confidence {})", walletAddress,
                result.getClassification(), String.format("%.2f", result.getConfidence()));
        return result;
    }
}
