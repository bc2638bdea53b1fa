package com.solprofile.service;

import com.solprofile.bean.BehaviorAnalysisConfig.HoldingThresholds;
import com.solprofile.dto.HolderBehaviorType;
import com.solprofile.dto.PositionStatus;
import com.solprofile.dto.TokenPositionLifecycle;
import com.solprofile.dto.TokenTrade;
import com.solprofile.dto.TokenTradeSequence;
import com.solprofile.util.CommonUtil;
import com.solprofile.util.Constant;
import com.solprofile.util.FifoLedger;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconstructs position lifecycles per token with a FIFO ledger of buy lots.
 * A lifecycle ends when the position returns to zero; any later buy opens a new one.
 */
@Slf4j
public class LifecycleEngine {

    private static final double FULL_HOLDER_SHARE = 0.75;

    @ToString
    public static class Result {
        public final List<TokenPositionLifecycle> lifecycles = new ArrayList<>();
        public int excessSellCount = 0;       // sells (or sell remainders) with no open lot
        public double excessSellAmount = 0.0;
    }

    /** Running state of the cycle being walked. */
    private static class Cycle {
        final int index;
        final long entryTimestamp;
        Long exitTimestamp;
        double peak;
        double totalBought;
        double totalSold;
        int buyCount;
        int sellCount;
        double weightedSeconds;    // Σ(holding_seconds * qtyMatched)
        double matchedAmount;
        double excessSold;

        Cycle(int index, long entryTimestamp) {
            this.index = index;
            this.entryTimestamp = entryTimestamp;
        }
    }

    /**
     * @param analysisTimestamp fixed "now" for open lots; must be derived from the input
     */
    public static Result run(List<TokenTradeSequence> sequences, HoldingThresholds thresholds, long analysisTimestamp) {
        Result res = new Result();
        for (TokenTradeSequence seq : sequences) {
            walk(seq, thresholds, analysisTimestamp, res);
        }
        log.debug("Built {} lifecycles from {} sequences ({} excess sells)",
                res.lifecycles.size(), sequences.size(), res.excessSellCount);
        return res;
    }

    private static void walk(TokenTradeSequence seq, HoldingThresholds thresholds, long analysisTimestamp, Result res) {
        double exitThreshold = thresholds.getExitThreshold();
        FifoLedger ledger = new FifoLedger();
        Cycle cycle = null;
        int nextIndex = 0;

        for (TokenTrade t : seq.trades()) {
            if (t.isBuy()) {
                if (cycle == null) {
                    if (t.amount() <= CommonUtil.EPS) continue;
                    cycle = new Cycle(nextIndex++, t.timestamp());
                }
                ledger.buy(t.timestamp(), t.amount(), t.solValue());
                cycle.buyCount++;
                cycle.totalBought += t.amount();
                cycle.peak = Math.max(cycle.peak, ledger.position());
                continue;
            }

            // SELL
            if (cycle == null) {
                res.excessSellCount++;
                res.excessSellAmount += t.amount();
                continue;
            }
            final Cycle current = cycle;
            current.sellCount++;
            current.totalSold += t.amount();

            double excess = ledger.sell(t.timestamp(), t.amount(), (lot, consumed, sellTs) -> {
                long sec = Math.max(0L, sellTs - lot.timestamp());
                current.weightedSeconds += sec * consumed;
                current.matchedAmount += consumed;
            });
            if (excess > 0) {
                current.excessSold += excess;
                res.excessSellCount++;
                res.excessSellAmount += excess;
            }

            if (current.exitTimestamp == null && ledger.position() <= exitThreshold * current.peak + CommonUtil.EPS) {
                current.exitTimestamp = t.timestamp();
            }

            if (ledger.isFlat()) {
                res.lifecycles.add(closed(seq.mint(), current, thresholds));
                cycle = null;
            }
        }

        if (cycle != null) {
            res.lifecycles.add(open(seq.mint(), cycle, ledger, thresholds, analysisTimestamp));
        }
    }

    /** Cycle that returned to a flat position. */
    private static TokenPositionLifecycle closed(String mint, Cycle c, HoldingThresholds thresholds) {
        // drained by more than the tracked lots: the buys that funded it are missing
        PositionStatus status = c.excessSold > thresholds.getDustThreshold() * c.peak
                ? PositionStatus.DUST
                : PositionStatus.EXITED;
        double hours = c.matchedAmount > 0 ? c.weightedSeconds / c.matchedAmount / Constant.SECONDS_PER_HOUR : 0.0;
        return new TokenPositionLifecycle(mint, c.index, c.entryTimestamp, c.exitTimestamp,
                c.peak, 0.0, 0.0, status, HolderBehaviorType.MOSTLY_EXITED, hours,
                c.totalBought, c.totalSold, c.buyCount, c.sellCount, c.excessSold);
    }

    /** Last cycle of a token, still holding lots at the end of the history. */
    private static TokenPositionLifecycle open(String mint, Cycle c, FifoLedger ledger,
                                               HoldingThresholds thresholds, long analysisTimestamp) {
        double current = Math.min(ledger.position(), c.peak);
        double remainingShare = c.peak > 0 ? current / c.peak : 0.0;
        boolean exited = c.exitTimestamp != null;

        double weightedSeconds = c.weightedSeconds;
        double amount = c.matchedAmount;
        if (!exited) {
            // held so far, measured against the fixed analysis timestamp
            for (FifoLedger.Lot lot : ledger.lots()) {
                weightedSeconds += Math.max(0L, analysisTimestamp - lot.timestamp()) * lot.amount();
                amount += lot.amount();
            }
        }
        double hours = amount > 0 ? weightedSeconds / amount / Constant.SECONDS_PER_HOUR : 0.0;

        PositionStatus status = exited ? PositionStatus.EXITED : PositionStatus.ACTIVE;
        HolderBehaviorType behavior;
        if (exited) {
            behavior = HolderBehaviorType.MOSTLY_EXITED;
        } else if (remainingShare > FULL_HOLDER_SHARE) {
            behavior = HolderBehaviorType.FULL_HOLDER;
        } else if (remainingShare > thresholds.getExitThreshold()) {
            behavior = HolderBehaviorType.PROFIT_TAKER;
        } else {
            behavior = null;
        }

        return new TokenPositionLifecycle(mint, c.index, c.entryTimestamp, c.exitTimestamp,
                c.peak, current, remainingShare, status, behavior, hours,
                c.totalBought, c.totalSold, c.buyCount, c.sellCount, c.excessSold);
    }
}
