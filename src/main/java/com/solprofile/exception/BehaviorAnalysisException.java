package com.solprofile.exception;

/**
 * Thrown when a wallet's behaviour analysis cannot be loaded, serialized or persisted.
 * Data problems inside the engine never raise this.
 */
public class BehaviorAnalysisException extends RuntimeException {

    private final String walletAddress;
    private final String stage;

    public BehaviorAnalysisException(String walletAddress, String stage, String message, Throwable cause) {
        super(String.format("Behavior analysis of wallet %s failed at stage '%s': %s", walletAddress, stage, message), cause);
        this.walletAddress = walletAddress;
        this.stage = stage;
    }

    public String getWalletAddress() {
        return walletAddress;
    }

    public String getStage() {
        return stage;
    }
}
