package com.solprofile.controller;

import com.solprofile.dto.BehavioralMetrics;
import com.solprofile.dto.BotDetectionResult;
import com.solprofile.dto.WalletTokenPrediction;
import com.solprofile.entity.WalletBehaviorProfile;
import com.solprofile.service.BehaviorService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for wallet behaviour analysis
 */
@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
public class WalletBehaviorController {

    private final BehaviorService behaviorService;

    /**
     * Analyze a wallet, optionally restricted to a time range (not persisted then)
     * GET /api/wallets/{address}/behavior?startTs=..&endTs=..
     */
    @GetMapping("/{address}/behavior")
    public ResponseEntity<BehavioralMetrics> analyze(@PathVariable String address,
                                                     @RequestParam(required = false) Long startTs,
                                                     @RequestParam(required = false) Long endTs) {
        if (startTs != null && endTs != null && startTs > endTs) {
            throw new IllegalArgumentException("startTs must not be after endTs");
        }
        return ResponseEntity.ok(behaviorService.analyzeWalletBehavior(address, startTs, endTs));
    }

    /**
     * Latest stored full-history profile
     * GET /api/wallets/{address}/behavior/profile
     */
    @GetMapping("/{address}/behavior/profile")
    public ResponseEntity<WalletBehaviorProfile> getProfile(@PathVariable String address) {
        return behaviorService.getProfile(address)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/wallets/{address}/behavior/bot-detection
     */
    @GetMapping("/{address}/behavior/bot-detection")
    public ResponseEntity<BotDetectionResult> detectBot(@PathVariable String address) {
        return ResponseEntity.ok(behaviorService.detectBot(address));
    }

    /**
     * Exit forecast for a token the wallet still holds; 404 when none can be made
     * GET /api/wallets/{address}/tokens/{mint}/exit-prediction?asOf=..
     */
    @GetMapping("/{address}/tokens/{mint}/exit-prediction")
    public ResponseEntity<WalletTokenPrediction> predictExit(@PathVariable String address,
                                                             @PathVariable String mint,
                                                             @RequestParam(required = false) Long asOf) {
        WalletTokenPrediction prediction = behaviorService.predictTokenExit(address, mint, asOf);
        return prediction != null ? ResponseEntity.ok(prediction) : ResponseEntity.notFound().build();
    }
}
