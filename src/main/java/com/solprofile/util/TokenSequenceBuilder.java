package com.solprofile.util;

import com.solprofile.dto.SwapRecord;
import com.solprofile.dto.TokenTrade;
import com.solprofile.dto.TokenTradeSequence;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups a wallet's swaps per mint into chronologically ordered sequences.
 */
@Slf4j
public class TokenSequenceBuilder {

    /** Drops swaps on utility/stable mints; these are not trading positions. */
    public static List<SwapRecord> withoutExcludedMints(Collection<SwapRecord> records, Set<String> excludedMints) {
        if (records == null || records.isEmpty()) return List.of();
        if (excludedMints == null || excludedMints.isEmpty()) return List.copyOf(records);
        return records.stream()
                .filter(r -> !excludedMints.contains(r.mint()))
                .toList();
    }

    /**
     * Builds one sequence per mint, mints in first-seen order, trades sorted ascending by
     * timestamp. The sort is stable so same-second trades keep their input order.
     */
    public static List<TokenTradeSequence> build(Collection<SwapRecord> records) {
        if (records == null || records.isEmpty()) return List.of();

        Map<String, List<TokenTrade>> byMint = new LinkedHashMap<>();
        for (SwapRecord r : records) {
            byMint.computeIfAbsent(r.mint(), k -> new ArrayList<>()).add(TokenTrade.from(r));
        }

        List<TokenTradeSequence> sequences = new ArrayList<>(byMint.size());
        for (var e : byMint.entrySet()) {
            List<TokenTrade> trades = e.getValue();
            trades.sort(Comparator.comparingLong(TokenTrade::timestamp));

            int buyCount = (int) trades.stream().filter(TokenTrade::isBuy).count();
            int sellCount = trades.size() - buyCount;
            double ratio = 0.0;
            if (sellCount > 0) {
                ratio = (double) buyCount / sellCount;
            } else if (buyCount > 0) {
                ratio = Double.POSITIVE_INFINITY; // only buys
            }

            sequences.add(new TokenTradeSequence(e.getKey(), trades, buyCount, sellCount,
                    countCompletePairs(trades), ratio));
        }

        log.debug("Built {} token sequences from {} swap records", sequences.size(), records.size());
        return sequences;
    }

    /**
     * Counts FIFO buy/sell matches: every lot touched by a sell, fully or partially,
     * is one pair. Same matching as the flip duration calculation.
     */
    static int countCompletePairs(List<TokenTrade> sortedTrades) {
        FifoLedger ledger = new FifoLedger();
        int[] pairs = {0};
        for (TokenTrade t : sortedTrades) {
            if (t.isBuy()) {
                ledger.buy(t.timestamp(), t.amount(), t.solValue());
            } else {
                ledger.sell(t.timestamp(), t.amount(), (lot, consumed, ts) -> pairs[0]++);
            }
        }
        return pairs[0];
    }
}
