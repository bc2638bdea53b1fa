package com.solprofile.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collection;

public class CommonUtil {

    /** Amounts within this distance of zero count as a flat position. */
    public static final double EPS = 1e-9;

    public static double secondsToHours(long seconds) {
        return seconds / Constant.SECONDS_PER_HOUR;
    }

    public static LocalDate utcDate(long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds).atOffset(ZoneOffset.UTC).toLocalDate();
    }

    public static int utcHour(long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds).atOffset(ZoneOffset.UTC).getHour();
    }

    public static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    public static double mean(double[] a) {
        if (a.length == 0) return 0.0;
        double s = 0.0;
        for (double v : a) s += v;
        return s / a.length;
    }

    public static double stddev(double[] a, double mean) {
        if (a.length == 0) return 0.0;
        double s2 = 0.0;
        for (double v : a) {
            double d = v - mean;
            s2 += d * d;
        }
        return Math.sqrt(s2 / a.length); // population std
    }

    public static double median(Collection<Double> values) {
        return median(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /** Median of an unsorted array; 0 for an empty one. The input is not modified. */
    public static double median(double[] values) {
        if (values.length == 0) return 0.0;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 != 0 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Circular mean of hour-of-day values, result in [0, 24).
     * Hours {23, 1} average to 0, not 12.
     */
    public static double circularMeanHour(Collection<Integer> hours) {
        if (hours.isEmpty()) return 0.0;
        double sumSin = 0.0;
        double sumCos = 0.0;
        for (int h : hours) {
            double angle = h * (2 * Math.PI / 24.0);
            sumSin += Math.sin(angle);
            sumCos += Math.cos(angle);
        }
        double mean = (Math.atan2(sumSin, sumCos) * (24.0 / (2 * Math.PI)) + 24.0) % 24.0;
        if (mean < 0) mean += 24.0;
        // rounding noise just below midnight
        return mean > 24.0 - 1e-9 ? 0.0 : mean;
    }
}
