package com.z254.conclave.dispatch.accounting;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-tool capped series of execution durations.
 */
public class PerformanceSeriesStore {

    private final int windowSize;
    private final Map<String, SlidingWindow<Duration>> series = new ConcurrentHashMap<>();

    public PerformanceSeriesStore(int windowSize) {
        this.windowSize = windowSize;
    }

    public void record(String toolName, Duration duration) {
        series.computeIfAbsent(toolName, k -> new SlidingWindow<>(windowSize)).add(duration);
    }

    public List<Duration> series(String toolName) {
        SlidingWindow<Duration> window = series.get(toolName);
        return window != null ? window.snapshot() : List.of();
    }

    public Map<String, PerformanceStats> stats() {
        Map<String, PerformanceStats> stats = new LinkedHashMap<>();
        series.forEach((tool, window) -> {
            List<Duration> durations = window.snapshot();
            if (durations.isEmpty()) {
                return;
            }
            long total = 0;
            long min = Long.MAX_VALUE;
            long max = Long.MIN_VALUE;
            for (Duration d : durations) {
                long nanos = d.toNanos();
                total += nanos;
                min = Math.min(min, nanos);
                max = Math.max(max, nanos);
            }
            stats.put(tool, new PerformanceStats(
                    Duration.ofNanos(total / durations.size()), Duration.ofNanos(min), Duration.ofNanos(max),
                    durations.size()));
        });
        return stats;
    }

    public void clear() {
        series.clear();
    }
}
