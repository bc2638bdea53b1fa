package com.solprofile.dto;

public enum PositionStatus {
    ACTIVE,
    EXITED,
    DUST
}
