package com.solprofile.service;

import com.solprofile.bean.BehaviorAnalysisConfig.HistoricalPatternConfig;
import com.solprofile.dto.ExitPattern;
import com.solprofile.dto.HistoricalBehaviorType;
import com.solprofile.dto.TokenPositionLifecycle;
import com.solprofile.dto.WalletHistoricalPattern;
import com.solprofile.util.CommonUtil;
import com.solprofile.util.Constant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a wallet's baseline holding behaviour from completed (EXITED) lifecycles.
 * DUST cycles usually reflect missing buys and ACTIVE ones have no known exit, so
 * neither takes part.
 */
@Slf4j
@RequiredArgsConstructor
public class HistoricalPatternCalculator {

    private static final double MAX_GRADUAL_SELLS = 2.0;

    private final HistoricalPatternConfig config;

    /**
     * @return the pattern, or {@code null} when fewer than the configured minimum of
     *         distinct tokens have a usable completed cycle
     */
    public WalletHistoricalPattern calculate(String walletAddress,
                                             List<TokenPositionLifecycle> lifecycles,
                                             long analysisTimestamp) {
        int minCycles = config.getMinimumCompletedCycles();
        long maxAgeSeconds = (long) config.getMaximumDataAgeDays() * (long) Constant.SECONDS_PER_DAY;

        List<TokenPositionLifecycle> valid = new ArrayList<>();
        for (TokenPositionLifecycle lc : lifecycles) {
            if (!lc.isExited()) continue;
            if (config.getMaximumDataAgeDays() > 0 && analysisTimestamp - lc.entryTimestamp() > maxAgeSeconds) continue;
            double h = lc.weightedHoldingTimeHours();
            if (!(h > 0 && h < Constant.HOURS_PER_YEAR)) {
                log.warn("Wallet {}: ignoring lifecycle of {} with implausible hold time {}h",
                        walletAddress, lc.mint(), h);
                continue;
            }
            valid.add(lc);
        }

        Map<String, List<TokenPositionLifecycle>> byMint = new LinkedHashMap<>();
        for (TokenPositionLifecycle lc : valid) {
            byMint.computeIfAbsent(lc.mint(), k -> new ArrayList<>()).add(lc);
        }
        int uniqueTokens = byMint.size();
        if (uniqueTokens < minCycles) {
            log.debug("Wallet {}: insufficient completed tokens ({}/{}) for a historical pattern",
                    walletAddress, uniqueTokens, minCycles);
            return null;
        }

        // peak-weighted: larger positions count more
        double weighted = 0.0;
        double weight = 0.0;
        for (TokenPositionLifecycle lc : valid) {
            weighted += lc.weightedHoldingTimeHours() * lc.peakPosition();
            weight += lc.peakPosition();
        }
        double average = weight > 0 ? weighted / weight : 0.0;

        // median of per-token medians, so one re-traded token cannot dominate
        List<Double> tokenMedians = new ArrayList<>(uniqueTokens);
        int totalSells = 0;
        for (List<TokenPositionLifecycle> cycles : byMint.values()) {
            tokenMedians.add(CommonUtil.median(cycles.stream()
                    .mapToDouble(TokenPositionLifecycle::weightedHoldingTimeHours).toArray()));
            totalSells += cycles.stream().mapToInt(TokenPositionLifecycle::sellCount).sum();
        }
        double median = CommonUtil.median(tokenMedians);

        double sellsPerToken = (double) totalSells / uniqueTokens;
        ExitPattern exitPattern = sellsPerToken > MAX_GRADUAL_SELLS ? ExitPattern.GRADUAL : ExitPattern.ALL_AT_ONCE;
        double dataQuality = Math.min(1.0, uniqueTokens / (minCycles * 3.0));

        long oldestEntry = valid.stream().mapToLong(TokenPositionLifecycle::entryTimestamp).min().orElse(0L);
        long newestExit = valid.stream()
                .mapToLong(lc -> lc.exitTimestamp() != null ? lc.exitTimestamp() : lc.entryTimestamp())
                .max().orElse(oldestEntry);
        double observationDays = (newestExit - oldestEntry) / Constant.SECONDS_PER_DAY;

        HistoricalBehaviorType type = HistoricalBehaviorType.fromMedianHours(median);
        log.debug("Wallet {}: historical pattern {} ({} tokens, {} cycles, avg {}h, median {}h)",
                walletAddress, type, uniqueTokens, valid.size(),
                String.format("%.2f", average), String.format("%.2f", median));

        return new WalletHistoricalPattern(walletAddress, average, median, uniqueTokens, valid.size(),
                type, exitPattern, dataQuality, observationDays);
    }
}
