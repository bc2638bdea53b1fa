package com.solprofile.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One swap leg of a wallet, as written by the ingestion pipeline.
 */
@Entity
@Table(name = "swap_analysis_input", indexes = {
    @Index(name = "idx_swap_wallet_ts", columnList = "wallet_address, block_time")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwapAnalysisInput {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "wallet_address", nullable = false, length = 64)
    private String walletAddress;

    @Column(name = "signature", length = 128)
    private String signature;

    @Column(name = "mint", nullable = false, length = 64)
    private String mint;

    @Column(name = "block_time", nullable = false)
    private Long timestamp;

    /** "in" for buys, "out" for sells. */
    @Column(name = "direction", nullable = false, length = 8)
    private String direction;

    @Column(name = "amount", nullable = false)
    private Double amount;

    @Column(name = "associated_sol_value")
    private Double associatedSolValue;

    @Column(name = "associated_usdc_value")
    private Double associatedUsdcValue;
}
