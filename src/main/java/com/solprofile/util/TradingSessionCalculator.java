package com.solprofile.util;

import com.solprofile.dto.ActiveTradingPeriods;
import com.solprofile.dto.IdentifiedTradingWindow;
import com.solprofile.dto.SessionMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time-of-day activity: UTC hourly histogram, high-activity windows and gap-based sessions.
 * Windows and sessions are separate views of the same timestamps.
 */
@Slf4j
public class TradingSessionCalculator {

    private static final int HOURS = 24;

    public static SessionMetrics calculate(Collection<Long> timestamps, double sessionGapThresholdHours) {
        if (timestamps == null || timestamps.isEmpty()) {
            return SessionMetrics.empty();
        }
        long[] sorted = timestamps.stream().mapToLong(Long::longValue).sorted().toArray();
        int total = sorted.length;

        int[] hourly = new int[HOURS];
        for (long ts : sorted) {
            hourly[CommonUtil.utcHour(ts)]++;
        }
        Map<Integer, Integer> hourlyCounts = new LinkedHashMap<>();
        for (int h = 0; h < HOURS; h++) hourlyCounts.put(h, hourly[h]);

        List<IdentifiedTradingWindow> windows = identifyWindows(hourly, total);
        int inWindows = windows.stream().mapToInt(IdentifiedTradingWindow::tradeCountInWindow).sum();
        double focus = (double) inWindows / total * 100.0;

        // ---- sessions ----
        int sessionCount = 1;
        long sessionStart = sorted[0];
        double totalDurationMinutes = 0.0;
        List<Integer> startHours = new ArrayList<>();
        startHours.add(CommonUtil.utcHour(sorted[0]));
        for (int i = 1; i < total; i++) {
            double gapHours = (sorted[i] - sorted[i - 1]) / Constant.SECONDS_PER_HOUR;
            if (gapHours > sessionGapThresholdHours) {
                totalDurationMinutes += (sorted[i - 1] - sessionStart) / 60.0;
                sessionCount++;
                sessionStart = sorted[i];
                startHours.add(CommonUtil.utcHour(sorted[i]));
            }
        }
        totalDurationMinutes += (sorted[total - 1] - sessionStart) / 60.0;

        log.debug("Session metrics: {} sessions, {} windows, focus {}%", sessionCount, windows.size(),
                String.format("%.1f", focus));
        return new SessionMetrics(
                sessionCount,
                (double) total / sessionCount,
                CommonUtil.circularMeanHour(startHours),
                totalDurationMinutes / sessionCount,
                new ActiveTradingPeriods(hourlyCounts, windows, focus));
    }

    /**
     * Contiguous hours whose 3-hour smoothed count reaches the 75th percentile of the
     * non-zero smoothed hours. Windows shorter than 2h holding under 5% of trades are
     * dropped; neighbours separated by at most one reasonably active hour are merged.
     * A window may wrap past midnight, in which case its start hour exceeds its end hour.
     */
    static List<IdentifiedTradingWindow> identifyWindows(int[] hourly, int totalTrades) {
        if (totalTrades == 0) return List.of();

        double[] smoothed = new double[HOURS];
        for (int h = 0; h < HOURS; h++) {
            int sum = 0;
            for (int i = -1; i <= 1; i++) {
                sum += hourly[(h + i + HOURS) % HOURS];
            }
            smoothed[h] = sum / 3.0;
        }

        double threshold = activityThreshold(smoothed);
        if (threshold <= 0) return List.of();

        List<IdentifiedTradingWindow> raw = new ArrayList<>();
        Integer start = null;
        for (int h = 0; h < HOURS; h++) {
            if (smoothed[h] >= threshold) {
                if (start == null) start = h;
            } else if (start != null) {
                addWindow(raw, hourly, totalTrades, start, h - 1);
                start = null;
            }
        }
        if (start != null) {
            addWindow(raw, hourly, totalTrades, start, HOURS - 1);
        }
        // a block running through midnight is one window ending after 0h
        if (raw.size() > 1
                && raw.get(0).startTimeUtc() == 0
                && raw.get(raw.size() - 1).endTimeUtc() == HOURS - 1) {
            IdentifiedTradingWindow first = raw.remove(0);
            IdentifiedTradingWindow last = raw.remove(raw.size() - 1);
            raw.add(window(hourly, totalTrades, last.startTimeUtc(), first.endTimeUtc()));
        }

        List<IdentifiedTradingWindow> significant = raw.stream()
                .filter(w -> !(w.durationHours() < 2 && w.percentageOfTotalTrades() < 5))
                .toList();
        if (significant.size() < 2) {
            return significant;
        }

        List<IdentifiedTradingWindow> merged = new ArrayList<>();
        IdentifiedTradingWindow current = significant.get(0);
        for (int i = 1; i < significant.size(); i++) {
            IdentifiedTradingWindow next = significant.get(i);
            int gap = (next.startTimeUtc() - current.endTimeUtc() + HOURS - 1) % HOURS;
            boolean canMerge = gap == 0
                    || (gap == 1 && smoothed[(current.endTimeUtc() + 1) % HOURS] >= threshold * 0.5);
            if (canMerge) {
                current = window(hourly, totalTrades, current.startTimeUtc(), next.endTimeUtc());
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }

    /** 75th percentile of non-zero smoothed hours, at least 1; half the peak when nothing qualifies. */
    private static double activityThreshold(double[] smoothed) {
        double[] nonZero = Arrays.stream(smoothed).filter(v -> v > 0).sorted().toArray();
        double threshold = 0.0;
        if (nonZero.length > 0) {
            int idx = (int) Math.floor(nonZero.length * 0.75);
            threshold = Math.max(1.0, nonZero[Math.min(idx, nonZero.length - 1)]);
        }
        if (threshold == 0.0) {
            double max = Arrays.stream(smoothed).max().orElse(0.0);
            threshold = Math.max(max, 0.1) / 2.0;
        }
        return threshold;
    }

    private static void addWindow(List<IdentifiedTradingWindow> out, int[] hourly, int total, int start, int end) {
        IdentifiedTradingWindow w = window(hourly, total, start, end);
        if (w.tradeCountInWindow() > 0) {
            out.add(w);
        }
    }

    private static IdentifiedTradingWindow window(int[] hourly, int total, int start, int end) {
        int duration = ((end - start + HOURS) % HOURS) + 1;
        int trades = 0;
        for (int h = 0; h < duration; h++) {
            trades += hourly[(start + h) % HOURS];
        }
        return new IdentifiedTradingWindow(start, end, duration, trades,
                (double) trades / total * 100.0,
                (double) trades / duration);
    }
}
