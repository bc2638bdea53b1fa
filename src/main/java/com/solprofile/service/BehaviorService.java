package com.solprofile.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solprofile.dto.BehavioralMetrics;
import com.solprofile.dto.BotDetectionResult;
import com.solprofile.dto.SwapRecord;
import com.solprofile.dto.TradeDirection;
import com.solprofile.dto.WalletTokenPrediction;
import com.solprofile.entity.SwapAnalysisInput;
import com.solprofile.entity.WalletBehaviorProfile;
import com.solprofile.exception.BehaviorAnalysisException;
import com.solprofile.repository.SwapAnalysisInputRepository;
import com.solprofile.repository.WalletBehaviorProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Loads a wallet's swaps, runs the behaviour engine and keeps the latest full-history
 * profile. Only unfiltered analyses are persisted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BehaviorService {

    private final SwapAnalysisInputRepository swapRepository;
    private final WalletBehaviorProfileRepository profileRepository;
    private final BehaviorAnalyzer behaviorAnalyzer;
    private final ObjectMapper objectMapper;

    /**
     * Crash-proof wrapper for the queue consumer: nothing escapes.
     */
    public void analyzeWalletBehaviorSafely(String wallet) {
        try {
            analyzeWalletBehavior(wallet, null, null);
        } catch (Throwable t) {
            log.error("FATAL: Unhandled error in behavior analysis for {}: {}", wallet, t.getMessage(), t);
        }
    }

    /**
     * @param startTs inclusive lower bound in epoch seconds, or null
     * @param endTs   inclusive upper bound in epoch seconds, or null
     */
    @Transactional
    public BehavioralMetrics analyzeWalletBehavior(String wallet, Long startTs, Long endTs) {
        requireWallet(wallet);
        boolean fullHistory = startTs == null && endTs == null;

        log.info("[Stage 1/3] Loading swaps for wallet {}{}", wallet,
                fullHistory ? "" : String.format(" in range [%s, %s]", startTs, endTs));
        List<SwapRecord> records = loadSwapRecords(wallet, startTs, endTs);

        log.info("[Stage 2/3] Analyzing {} swaps for wallet {}", records.size(), wallet);
        BehavioralMetrics metrics = behaviorAnalyzer.analyze(records, wallet);

        if (fullHistory && metrics.getTotalTradeCount() > 0) {
            log.info("[Stage 3/3] Saving behavior profile for wallet {}", wallet);
            saveProfile(wallet, metrics);
        } else {
            log.debug("[Stage 3/3] Skipping persistence for wallet {} (range filter or no trades)", wallet);
        }
        return metrics;
    }

    public Optional<WalletBehaviorProfile> getProfile(String wallet) {
        requireWallet(wallet);
        return profileRepository.findByWalletAddress(wallet);
    }

    public BotDetectionResult detectBot(String wallet) {
        requireWallet(wallet);
        return behaviorAnalyzer.detectBot(loadSwapRecords(wallet, null, null), wallet);
    }

    /** @return null when no exit can be predicted */
    public WalletTokenPrediction predictTokenExit(String wallet, String mint, Long asOfTimestamp) {
        requireWallet(wallet);
        if (mint == null || mint.isBlank()) {
            throw new IllegalArgumentException("Mint must not be blank");
        }
        return behaviorAnalyzer.predictTokenExit(loadSwapRecords(wallet, null, null), wallet, mint, asOfTimestamp);
    }

    List<SwapRecord> loadSwapRecords(String wallet, Long startTs, Long endTs) {
        List<SwapAnalysisInput> rows;
        try {
            rows = startTs == null && endTs == null
                    ? swapRepository.findByWalletAddressOrderByTimestampAsc(wallet)
                    : swapRepository.findInRange(wallet,
                            startTs != null ? startTs : 0L,
                            endTs != null ? endTs : Long.MAX_VALUE);
        } catch (DataAccessException e) {
            throw new BehaviorAnalysisException(wallet, "load_swaps", e.getMessage(), e);
        }

        List<SwapRecord> records = new ArrayList<>(rows.size());
        int skipped = 0;
        for (SwapAnalysisInput row : rows) {
            try {
                records.add(toSwapRecord(row));
            } catch (IllegalArgumentException e) {
                skipped++;
                log.warn("Skipping malformed swap row {} of wallet {}: {}", row.getId(), wallet, e.getMessage());
            }
        }
        if (skipped > 0) {
            log.warn("Wallet {}: skipped {} of {} swap rows", wallet, skipped, rows.size());
        }
        return records;
    }

    private static SwapRecord toSwapRecord(SwapAnalysisInput row) {
        if (row.getTimestamp() == null || row.getAmount() == null) {
            throw new IllegalArgumentException("Swap row " + row.getId() + " has no timestamp or amount");
        }
        return new SwapRecord(
                row.getMint(),
                row.getTimestamp(),
                TradeDirection.fromCode(row.getDirection()),
                row.getAmount(),
                row.getAssociatedSolValue() != null ? row.getAssociatedSolValue() : 0.0,
                row.getAssociatedUsdcValue());
    }

    private void saveProfile(String wallet, BehavioralMetrics metrics) {
        WalletBehaviorProfile profile = profileRepository.findByWalletAddress(wallet)
                .orElseGet(() -> WalletBehaviorProfile.builder().walletAddress(wallet).build());
        try {
            profile.setTradingStyle(metrics.getTradingStyle());
            profile.setConfidenceScore(metrics.getConfidenceScore());
            profile.setFlipperScore(metrics.getFlipperScore());
            profile.setBuySellRatio(Double.isFinite(metrics.getBuySellRatio()) ? metrics.getBuySellRatio() : null);
            profile.setMedianHoldTimeHours(metrics.getMedianHoldTime());
            profile.setWeightedAverageHoldingDurationHours(metrics.getWeightedAverageHoldingDurationHours());
            profile.setHistoricalAverageHoldTimeHours(metrics.getHistoricalPattern() != null
                    ? metrics.getHistoricalPattern().historicalAverageHoldTimeHours() : null);
            profile.setTotalTradeCount(metrics.getTotalTradeCount());
            profile.setUniqueTokensTraded(metrics.getUniqueTokensTraded());
            profile.setFirstTransactionTimestamp(metrics.getFirstTransactionTimestamp());
            profile.setLastTransactionTimestamp(metrics.getLastTransactionTimestamp());
            profile.setHistoricalPatternJson(metrics.getHistoricalPattern() != null
                    ? objectMapper.writeValueAsString(metrics.getHistoricalPattern()) : null);
            profile.setMetricsJson(objectMapper.writeValueAsString(metrics));
            profile.setAnalyzedAt(LocalDateTime.now());
        } catch (JsonProcessingException e) {
            throw new BehaviorAnalysisException(wallet, "serialize_profile", e.getMessage(), e);
        }

        try {
            profileRepository.save(profile);
            log.debug("Saved behavior profile for wallet {}: style={}", wallet, profile.getTradingStyle());
        } catch (DataAccessException e) {
            throw new BehaviorAnalysisException(wallet, "save_profile", e.getMessage(), e);
        }
    }

    private static void requireWallet(String wallet) {
        if (wallet == null || wallet.isBlank()) {
            throw new IllegalArgumentException("Wallet address must not be blank");
        }
    }
}
