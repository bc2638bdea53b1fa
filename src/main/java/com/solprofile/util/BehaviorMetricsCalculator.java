package com.solprofile.util;

import com.solprofile.bean.BehaviorAnalysisConfig;
import com.solprofile.bean.BehaviorAnalysisConfig.HoldingThresholds;
import com.solprofile.bean.BehaviorAnalysisConfig.ScamFiltering;
import com.solprofile.dto.BehavioralMetrics;
import com.solprofile.dto.BehavioralMetrics.RiskMetrics;
import com.solprofile.dto.BehavioralMetrics.TokenMetrics;
import com.solprofile.dto.BehavioralMetrics.TokenPreferences;
import com.solprofile.dto.BehavioralMetrics.TradingFrequency;
import com.solprofile.dto.BehavioralMetrics.TradingTimeDistribution;
import com.solprofile.dto.TokenPositionLifecycle;
import com.solprofile.dto.TokenTrade;
import com.solprofile.dto.TokenTradeSequence;
import com.solprofile.service.LifecycleEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces token sequences and lifecycles into wallet-level {@link BehavioralMetrics}.
 * Classification, pattern and session fields are filled in by the analyzer afterwards.
 */
@Slf4j
public class BehaviorMetricsCalculator {

    private static final int TOP_TOKENS = 5;

    public static BehavioralMetrics fromSequences(List<TokenTradeSequence> sequences,
                                                  LifecycleEngine.Result lifecycles,
                                                  BehaviorAnalysisConfig config,
                                                  long analysisTimestamp) {
        if (sequences == null || sequences.isEmpty()) {
            return createEmptyMetrics();
        }
        log.debug("Calculating metrics for {} token sequences", sequences.size());

        BehavioralMetrics m = createEmptyMetrics();

        // ---- counts ----
        m.setUniqueTokensTraded(sequences.size());
        m.setTokensWithBothBuyAndSell((int) sequences.stream().filter(TokenTradeSequence::isDualSided).count());
        m.setTokensWithOnlyBuys((int) sequences.stream().filter(s -> s.buyCount() > 0 && s.sellCount() == 0).count());
        m.setTokensWithOnlySells((int) sequences.stream().filter(s -> s.sellCount() > 0 && s.buyCount() == 0).count());

        int buys = sequences.stream().mapToInt(TokenTradeSequence::buyCount).sum();
        int sells = sequences.stream().mapToInt(TokenTradeSequence::sellCount).sum();
        m.setTotalBuyCount(buys);
        m.setTotalSellCount(sells);
        m.setTotalTradeCount(buys + sells);
        m.setCompletePairsCount(sequences.stream().mapToInt(TokenTradeSequence::completePairs).sum());
        m.setAverageTradesPerToken((double) (buys + sells) / sequences.size());

        if (sells > 0) {
            m.setBuySellRatio((double) buys / sells);
        } else if (buys > 0) {
            m.setBuySellRatio(Double.POSITIVE_INFINITY); // only buys
        }

        // ---- symmetry / consistency over dual-sided tokens ----
        int dual = m.getTokensWithBothBuyAndSell();
        if (dual > 0) {
            double symmetrySum = 0.0;
            double consistencySum = 0.0;
            for (TokenTradeSequence s : sequences) {
                if (!s.isDualSided()) continue;
                int min = Math.min(s.buyCount(), s.sellCount());
                int max = Math.max(s.buyCount(), s.sellCount());
                symmetrySum += (double) min / max;
                // unclamped: one sell closing several lots counts one pair per lot, so this can exceed 1
                consistencySum += (double) s.completePairs() / min;
            }
            m.setBuySellSymmetry(symmetrySum / dual);
            m.setSequenceConsistency(consistencySum / dual);
            long reentered = sequences.stream().filter(s -> s.completePairs() > 1).count();
            m.setReentryRate((double) reentered / dual);
        }
        m.setPercentageOfUnpairedTokens((double) (sequences.size() - dual) / sequences.size() * 100.0);

        // ---- flip durations ----
        List<Double> flips = new ArrayList<>();
        for (TokenTradeSequence s : sequences) {
            flips.addAll(flipDurationsHours(s.trades()));
        }
        applyTimeDistribution(m, flips);

        // ---- current holdings ----
        HoldingsSnapshot holdings = currentHoldings(sequences, config.getHoldingThresholds(), analysisTimestamp);
        m.setAverageCurrentHoldingDurationHours(CommonUtil.mean(holdings.durations));
        m.setMedianCurrentHoldingDurationHours(CommonUtil.median(holdings.durations));
        double pctHeld = holdings.valueTraded > 0 ? holdings.valueHeld / holdings.valueTraded * 100.0 : 0.0;
        m.setPercentOfValueInCurrentHoldings(pctHeld);
        double currentWeight = pctHeld / 100.0;
        m.setWeightedAverageHoldingDurationHours(
                m.getAverageFlipDurationHours() * (1 - currentWeight)
                        + m.getAverageCurrentHoldingDurationHours() * currentWeight);

        m.setFlipperScore(flipperScore(m));

        // ---- frequency / risk ----
        long first = Long.MAX_VALUE;
        long last = Long.MIN_VALUE;
        double totalSol = 0.0;
        double largest = 0.0;
        for (TokenTradeSequence s : sequences) {
            for (TokenTrade t : s.trades()) {
                first = Math.min(first, t.timestamp());
                last = Math.max(last, t.timestamp());
                totalSol += t.solValue();
                largest = Math.max(largest, t.solValue());
            }
        }
        m.setFirstTransactionTimestamp(first);
        m.setLastTransactionTimestamp(last);
        m.setRiskMetrics(new RiskMetrics(totalSol / m.getTotalTradeCount(), largest));
        m.setTradingFrequency(tradingFrequency(m.getTotalTradeCount(), first, last));

        // ---- token preferences ----
        Map<String, TokenMetrics> perToken = tokenMetrics(sequences);
        List<TokenMetrics> mostTraded = mostTradedTokens(perToken, config.getScamFiltering(), m);
        List<TokenMetrics> mostHeld = mostHeldTokens(lifecycles.lifecycles, perToken);
        m.setTokenPreferences(new TokenPreferences(mostTraded, mostHeld));

        // ---- data quality ----
        m.setExcessSellCount(lifecycles.excessSellCount);
        if (lifecycles.excessSellCount > 0) {
            m.getDataQualityWarnings().add(String.format(
                    "%d sells exceeded tracked buys (%.6f tokens ignored); history may be incomplete",
                    lifecycles.excessSellCount, lifecycles.excessSellAmount));
        }
        if (m.getScamTokensFiltered() > 0) {
            m.getDataQualityWarnings().add(m.getScamTokensFiltered() + " tokens excluded from most traded as likely scams");
        }

        log.debug("Finished calculating metrics: {} trades, {} flips, {} open holdings",
                m.getTotalTradeCount(), flips.size(), holdings.durations.length);
        return m;
    }

    /** One duration per lot touched by a sell, FIFO. */
    static List<Double> flipDurationsHours(List<TokenTrade> sortedTrades) {
        List<Double> out = new ArrayList<>();
        FifoLedger ledger = new FifoLedger();
        for (TokenTrade t : sortedTrades) {
            if (t.isBuy()) {
                ledger.buy(t.timestamp(), t.amount(), t.solValue());
            } else {
                ledger.sell(t.timestamp(), t.amount(),
                        (lot, consumed, sellTs) -> out.add(CommonUtil.secondsToHours(Math.max(0L, sellTs - lot.timestamp()))));
            }
        }
        return out;
    }

    private static void applyTimeDistribution(BehavioralMetrics m, List<Double> flips) {
        if (flips.isEmpty()) return;

        double[] bins = new double[7];
        for (double h : flips) {
            if (h < 0.5) bins[0]++;          // < 30 min
            else if (h < 1) bins[1]++;       // 30-60 min
            else if (h < 4) bins[2]++;       // 1-4h
            else if (h < 8) bins[3]++;       // 4-8h
            else if (h < 24) bins[4]++;      // 8-24h
            else if (h < 168) bins[5]++;     // 1-7d
            else bins[6]++;                  // > 7d
        }
        int n = flips.size();
        for (int i = 0; i < bins.length; i++) bins[i] /= n;

        m.setTradingTimeDistribution(new TradingTimeDistribution(
                bins[0], bins[1], bins[2], bins[3], bins[4], bins[5], bins[6]));
        m.setPercentTradesUnder1Hour(bins[0] + bins[1]);
        m.setPercentTradesUnder4Hours(bins[0] + bins[1] + bins[2]);
        m.setAverageFlipDurationHours(flips.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
        m.setMedianHoldTime(CommonUtil.median(flips));
    }

    private record HoldingsSnapshot(double[] durations, double valueHeld, double valueTraded) {}

    /** Open lots left after FIFO matching, without dust remainders. */
    private static HoldingsSnapshot currentHoldings(List<TokenTradeSequence> sequences,
                                                    HoldingThresholds thresholds,
                                                    long analysisTimestamp) {
        List<Double> durations = new ArrayList<>();
        double held = 0.0;
        double traded = 0.0;
        for (TokenTradeSequence s : sequences) {
            FifoLedger ledger = new FifoLedger();
            for (TokenTrade t : s.trades()) {
                traded += t.solValue();
                if (t.isBuy()) ledger.buy(t.timestamp(), t.amount(), t.solValue());
                else ledger.sell(t.timestamp(), t.amount(), null);
            }
            for (FifoLedger.Lot lot : ledger.lots()) {
                long age = analysisTimestamp - lot.timestamp();
                boolean significant = lot.solValue() >= thresholds.getMinimumSolValue()
                        && lot.remainingFraction() >= thresholds.getMinimumPercentageRemaining()
                        && age >= thresholds.getMinimumHoldingTimeSeconds();
                if (!significant) continue;
                durations.add(CommonUtil.secondsToHours(age));
                held += lot.solValue();
            }
        }
        return new HoldingsSnapshot(durations.stream().mapToDouble(Double::doubleValue).toArray(), held, traded);
    }

    /** Speed weighted 70%, buy/sell balance 30%; boosted when ultra-fast flips dominate. */
    private static double flipperScore(BehavioralMetrics m) {
        TradingTimeDistribution d = m.getTradingTimeDistribution();
        double speed = d.getUltraFast() * 0.85 + d.getVeryFast() * 0.10 + d.getFast() * 0.05;
        double balance = (m.getBuySellSymmetry() + m.getSequenceConsistency()) / 2.0;
        double score = speed * 0.7 + balance * 0.3;
        if (d.getUltraFast() > 0.5) {
            score = Math.min(1.0, score + 0.2);
        }
        return CommonUtil.clamp(score, 0.0, 1.0);
    }

    private static TradingFrequency tradingFrequency(int tradeCount, long first, long last) {
        if (tradeCount == 0 || last < first) return new TradingFrequency();
        double days = (last - first) / Constant.SECONDS_PER_DAY;
        double perDay = tradeCount / Math.max(1.0, days);
        // single instant of activity: use one minute so the rates stay finite
        double rateDays = days == 0 ? 1.0 / (24 * 60) : days;
        return new TradingFrequency(perDay,
                tradeCount / rateDays * 7,
                tradeCount / rateDays * Constant.DAYS_PER_MONTH);
    }

    private static Map<String, TokenMetrics> tokenMetrics(List<TokenTradeSequence> sequences) {
        Map<String, TokenMetrics> out = new HashMap<>();
        for (TokenTradeSequence s : sequences) {
            double sol = 0.0;
            double usdc = 0.0;
            long firstSeen = Long.MAX_VALUE;
            long lastSeen = 0L;
            for (TokenTrade t : s.trades()) {
                sol += t.solValue();
                usdc += t.usdcValueOrZero();
                firstSeen = Math.min(firstSeen, t.timestamp());
                lastSeen = Math.max(lastSeen, t.timestamp());
            }
            out.put(s.mint(), TokenMetrics.builder()
                    .mint(s.mint())
                    .count(s.tradeCount())
                    .totalValue(sol)
                    .totalUsdcValue(usdc)
                    .firstSeen(firstSeen == Long.MAX_VALUE ? 0L : firstSeen)
                    .lastSeen(lastSeen)
                    .build());
        }
        return out;
    }

    private static List<TokenMetrics> mostTradedTokens(Map<String, TokenMetrics> perToken,
                                                       ScamFiltering scam,
                                                       BehavioralMetrics m) {
        List<TokenMetrics> legit = new ArrayList<>();
        int filtered = 0;
        for (TokenMetrics tm : perToken.values()) {
            if (scam.isEnabled() && isScamTokenByValue(tm, scam.getThresholds())) {
                filtered++;
                if (scam.isLogFilteredTokens()) {
                    log.debug("Filtered out scam token {}: {} trades but only {} SOL total value",
                            tm.getMint(), tm.getCount(), String.format("%.6f", tm.getTotalValue()));
                }
                continue;
            }
            legit.add(tm);
        }
        if (scam.isEnabled() && filtered > 0) {
            log.info("Scam token filtering: processed {} tokens, filtered out {}", perToken.size(), filtered);
        }
        m.setScamTokensFiltered(filtered);

        legit.sort(Comparator.comparingInt(TokenMetrics::getCount).reversed()
                .thenComparing(TokenMetrics::getMint));
        return new ArrayList<>(legit.subList(0, Math.min(TOP_TOKENS, legit.size())));
    }

    /**
     * Heavily traded tokens that never carried real value. A heuristic, not a proof:
     * zero value on both sides is always treated as a scam.
     */
    static boolean isScamTokenByValue(TokenMetrics tm, ScamFiltering.Thresholds th) {
        if (tm.getTotalValue() == 0.0 && tm.getTotalUsdcValue() == 0.0) return true;
        return tm.getCount() >= th.getMinTradeCount()
                && tm.getTotalValue() < th.getMinTotalValue()
                && tm.getTotalUsdcValue() < th.getMinTotalUsdcValue();
    }

    /** Mints still held, largest remaining share of peak first. */
    private static List<TokenMetrics> mostHeldTokens(List<TokenPositionLifecycle> lifecycles,
                                                     Map<String, TokenMetrics> perToken) {
        return lifecycles.stream()
                .filter(TokenPositionLifecycle::isActive)
                .sorted(Comparator.comparingDouble(TokenPositionLifecycle::percentOfPeakRemaining).reversed()
                        .thenComparing(TokenPositionLifecycle::mint))
                .map(lc -> perToken.get(lc.mint()))
                .distinct()
                .limit(TOP_TOKENS)
                .collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
    }

    public static BehavioralMetrics createEmptyMetrics() {
        return BehavioralMetrics.empty();
    }
}
