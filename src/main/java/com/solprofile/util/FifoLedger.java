package com.solprofile.util;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;

/**
 * First-in first-out queue of open buy lots for one token.
 * Sells consume the oldest lots first; a partially consumed lot shrinks in place.
 * Leftovers are judged relative to the lot or sell size, since raw token amounts
 * reach the billions where double rounding alone exceeds any absolute epsilon.
 */
public class FifoLedger {

    public static final class Lot {
        private final long timestamp;
        private final double originalAmount;
        private double amount;      // remaining qty
        private double solValue;    // remaining SOL value, scaled with amount

        Lot(long timestamp, double amount, double solValue) {
            this.timestamp = timestamp;
            this.originalAmount = amount;
            this.amount = amount;
            this.solValue = solValue;
        }

        public long timestamp() { return timestamp; }
        public double amount() { return amount; }
        public double solValue() { return solValue; }
        public double originalAmount() { return originalAmount; }

        /** Share of the original lot still open, in [0,1]. */
        public double remainingFraction() {
            return originalAmount <= 0 ? 0.0 : amount / originalAmount;
        }
    }

    /** Receives one callback per lot touched by a sell. */
    @FunctionalInterface
    public interface MatchListener {
        void onMatch(Lot lot, double consumedAmount, long sellTimestamp);
    }

    private final Deque<Lot> lots = new ArrayDeque<>();
    private double position = 0.0;

    public void buy(long timestamp, double amount, double solValue) {
        if (amount <= CommonUtil.EPS) return;
        lots.addLast(new Lot(timestamp, amount, solValue));
        position += amount;
    }

    /**
     * Consumes {@code amount} from the oldest lots.
     *
     * @return the part of the sell that found no open lot (0 when fully matched)
     */
    public double sell(long timestamp, double amount, MatchListener listener) {
        double tolerance = tolerance(amount);
        double remaining = amount;
        while (remaining > tolerance && !lots.isEmpty()) {
            Lot lot = lots.peekFirst();
            double take = Math.min(remaining, lot.amount);
            if (listener != null) {
                listener.onMatch(lot, take, timestamp);
            }
            double before = lot.amount;
            lot.amount -= take;
            lot.solValue = before <= 0 ? 0.0 : lot.solValue * (lot.amount / before);
            remaining -= take;
            position -= take;
            if (lot.amount <= tolerance(lot.originalAmount)) {
                // rounding residue of a fully sold lot
                position -= lot.amount;
                lots.removeFirst();
            }
        }
        position = lots.isEmpty() ? 0.0 : Math.max(0.0, position);
        return remaining > tolerance ? remaining : 0.0;
    }

    /** Amounts at or below this are rounding noise relative to {@code reference}. */
    static double tolerance(double reference) {
        return CommonUtil.EPS * Math.max(1.0, Math.abs(reference));
    }

    public double position() {
        return position;
    }

    public boolean isFlat() {
        return lots.isEmpty();
    }

    public Iterable<Lot> lots() {
        return Collections.unmodifiableCollection(lots);
    }
}
