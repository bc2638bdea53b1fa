package com.solprofile.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Latest full-history behaviour snapshot of a wallet. Headline figures are columns;
 * the nested structures are stored as JSON text.
 */
@Entity
@Table(name = "wallet_behavior_profile", indexes = {
    @Index(name = "idx_profile_wallet", columnList = "wallet_address", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletBehaviorProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "wallet_address", nullable = false, unique = true, length = 64)
    private String walletAddress;

    @Column(name = "trading_style", length = 64)
    private String tradingStyle;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "flipper_score")
    private Double flipperScore;

    /** Null when the wallet only bought. */
    @Column(name = "buy_sell_ratio")
    private Double buySellRatio;

    @Column(name = "median_hold_time_hours")
    private Double medianHoldTimeHours;

    @Column(name = "weighted_avg_holding_hours")
    private Double weightedAverageHoldingDurationHours;

    @Column(name = "historical_avg_hold_hours")
    private Double historicalAverageHoldTimeHours;

    @Column(name = "total_trade_count")
    private Integer totalTradeCount;

    @Column(name = "unique_tokens_traded")
    private Integer uniqueTokensTraded;

    @Column(name = "first_transaction_ts")
    private Long firstTransactionTimestamp;

    @Column(name = "last_transaction_ts")
    private Long lastTransactionTimestamp;

    @Column(name = "historical_pattern_json", length = 4000)
    private String historicalPatternJson;

    @Column(name = "metrics_json", length = 200000)
    private String metricsJson;

    @Column(name = "analyzed_at", nullable = false)
    private LocalDateTime analyzedAt;
}
