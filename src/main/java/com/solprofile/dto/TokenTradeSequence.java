package com.solprofile.dto;

import java.util.List;

/**
 * All trades of one mint in ascending timestamp order. Rebuilt on every analysis call.
 *
 * @param buySellRatio crude unweighted buys/sells count ratio; {@code +Infinity} when the token was only bought
 */
public record TokenTradeSequence(
        String mint,
        List<TokenTrade> trades,
        int buyCount,
        int sellCount,
        int completePairs,
        double buySellRatio
) {
    public TokenTradeSequence {
        trades = List.copyOf(trades);
    }

    public int tradeCount() {
        return buyCount + sellCount;
    }

    public boolean isDualSided() {
        return buyCount > 0 && sellCount > 0;
    }
}
