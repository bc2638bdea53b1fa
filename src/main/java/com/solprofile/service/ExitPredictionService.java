package com.solprofile.service;

import com.solprofile.dto.RiskLevel;
import com.solprofile.dto.TokenPositionLifecycle;
import com.solprofile.dto.WalletHistoricalPattern;
import com.solprofile.dto.WalletTokenPrediction;
import com.solprofile.util.Constant;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Projects when a wallet is likely to exit a token it still holds, from its
 * historical median completed hold time.
 */
@Slf4j
public class ExitPredictionService {

    /**
     * @param asOfTimestamp reference "now" in epoch seconds
     * @return null without a pattern, or when the mint's latest lifecycle is not ACTIVE
     */
    public WalletTokenPrediction predict(String walletAddress,
                                         String mint,
                                         WalletHistoricalPattern pattern,
                                         List<TokenPositionLifecycle> lifecycles,
                                         long asOfTimestamp) {
        if (pattern == null) {
            log.debug("Wallet {}: no historical pattern, cannot predict exit for {}", walletAddress, mint);
            return null;
        }
        Optional<TokenPositionLifecycle> latest = lifecycles.stream()
                .filter(lc -> lc.mint().equals(mint))
                .max(Comparator.comparingInt(TokenPositionLifecycle::cycleIndex));
        if (latest.isEmpty() || !latest.get().isActive()) {
            log.debug("Wallet {}: token {} is not currently held", walletAddress, mint);
            return null;
        }

        TokenPositionLifecycle lc = latest.get();
        double ageHours = Math.max(0L, asOfTimestamp - lc.entryTimestamp()) / Constant.SECONDS_PER_HOUR;
        double median = pattern.medianCompletedHoldTimeHours();
        double remaining = Math.max(0.0, median - ageHours);
        long exitTs = asOfTimestamp + Math.round(remaining * Constant.SECONDS_PER_HOUR);

        return new WalletTokenPrediction(walletAddress, mint, lc.entryTimestamp(), asOfTimestamp,
                ageHours, median, remaining, exitTs, RiskLevel.fromRemainingHours(remaining),
                lc.percentOfPeakRemaining(), pattern.dataQuality());
    }
}
