package com.solprofile.repository;

import com.solprofile.entity.SwapAnalysisInput;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SwapAnalysisInputRepository extends JpaRepository<SwapAnalysisInput, Long> {

    List<SwapAnalysisInput> findByWalletAddressOrderByTimestampAsc(String walletAddress);

    /**
     * Swaps inside an inclusive time range
     */
    @Query("SELECT s FROM SwapAnalysisInput s WHERE s.walletAddress = :wallet "
            + "AND s.timestamp >= :startTs AND s.timestamp <= :endTs ORDER BY s.timestamp ASC")
    List<SwapAnalysisInput> findInRange(@Param("wallet") String walletAddress,
                                        @Param("startTs") long startTs,
                                        @Param("endTs") long endTs);

    long countByWalletAddress(String walletAddress);
}
