package com.solprofile.util;

import java.util.List;

public final class Constant {

    private Constant() {}

    public static final String WSOL_MINT = "So11111111111111111111111111111111111111112";
    public static final String USDC_MINT = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
    public static final String USDT_MINT = "Es9vMFrzaCERmJfrF4H2FYD4KCoNkY11McCe8BenwNYB";

    /** Utility and stable mints that are not trading positions. */
    public static final List<String> DEFAULT_EXCLUDED_MINTS = List.of(WSOL_MINT, USDC_MINT, USDT_MINT);

    public static final double SECONDS_PER_HOUR = 3600.0;
    public static final double SECONDS_PER_DAY = 86_400.0;
    public static final double HOURS_PER_YEAR = 8760.0;
    public static final double DAYS_PER_MONTH = 30.4375;
}
