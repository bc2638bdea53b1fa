package com.solprofile.dto;

public enum ExitPattern {
    GRADUAL,
    ALL_AT_ONCE
}
