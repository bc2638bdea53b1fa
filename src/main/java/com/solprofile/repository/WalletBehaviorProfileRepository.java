package com.solprofile.repository;

import com.solprofile.entity.WalletBehaviorProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WalletBehaviorProfileRepository extends JpaRepository<WalletBehaviorProfile, Long> {

    Optional<WalletBehaviorProfile> findByWalletAddress(String walletAddress);

    /**
     * Profiles with a given style label, most confident first
     */
    List<WalletBehaviorProfile> findByTradingStyleOrderByConfidenceScoreDesc(String tradingStyle);
}
