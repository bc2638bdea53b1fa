package com.solprofile.dto;

/** Buy/sell shape of a wallet. */
public enum BehavioralPattern {
    BALANCED,
    ACCUMULATOR,
    DISTRIBUTOR,
    HOLDER,
    DUMPER,
    MIXED
}
