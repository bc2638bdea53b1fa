package com.solprofile.dto;

/** Shape of a single lifecycle relative to its peak position. */
public enum HolderBehaviorType {
    FULL_HOLDER,
    PROFIT_TAKER,
    MOSTLY_EXITED
}
