package com.z254.conclave.dispatch.accounting;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Error frequencies and capped occurrence buffers keyed by {@code tool:errorType}.
 */
public class ErrorPatternStore {

    static final int TOP_ERRORS = 10;
    static final int RECENT_PER_PATTERN = 5;
    static final int RECENT_ERRORS = 20;

    private final int windowSize;
    private final Duration recentWindow;
    private final Clock clock;

    private final Map<String, AtomicLong> frequencies = new ConcurrentHashMap<>();
    private final Map<String, SlidingWindow<ErrorOccurrence>> patterns = new ConcurrentHashMap<>();

    public ErrorPatternStore(int windowSize, Duration recentWindow, Clock clock) {
        this.windowSize = windowSize;
        this.recentWindow = recentWindow;
        this.clock = clock;
    }

    public static String patternKey(String toolName, String errorType) {
        return toolName + ":" + errorType;
    }

    public void record(String toolName, String errorType, String error, int retryCount, Duration duration) {
        String key = patternKey(toolName, errorType);
        frequencies.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        patterns.computeIfAbsent(key, k -> new SlidingWindow<>(windowSize))
                .add(new ErrorOccurrence(clock.instant(), error, retryCount, duration));
    }

    public List<ErrorOccurrence> occurrences(String patternKey) {
        SlidingWindow<ErrorOccurrence> window = patterns.get(patternKey);
        return window != null ? window.snapshot() : List.of();
    }

    public Map<String, Long> frequencies() {
        Map<String, Long> snapshot = new LinkedHashMap<>();
        frequencies.forEach((key, count) -> snapshot.put(key, count.get()));
        return snapshot;
    }

    public ErrorAnalysis analyze() {
        Instant cutoff = clock.instant().minus(recentWindow);
        Map<String, ErrorAnalysis.PatternSummary> summaries = new LinkedHashMap<>();
        List<ErrorAnalysis.RecentError> recent = new ArrayList<>();

        patterns.forEach((key, window) -> {
            List<ErrorOccurrence> entries = window.snapshot();
            if (entries.isEmpty()) {
                return;
            }
            int recentCount = (int) entries.stream()
                    .filter(e -> e.timestamp().isAfter(cutoff))
                    .count();
            long avgNanos = (long) entries.stream()
                    .mapToLong(e -> e.duration() != null ? e.duration().toNanos() : 0L)
                    .average()
                    .orElse(0);
            double avgRetry = entries.stream()
                    .mapToInt(ErrorOccurrence::retryCount)
                    .average()
                    .orElse(0);
            summaries.put(key, new ErrorAnalysis.PatternSummary(
                    entries.size(), recentCount, Duration.ofNanos(avgNanos), avgRetry,
                    entries.get(entries.size() - 1).timestamp()));

            entries.subList(Math.max(0, entries.size() - RECENT_PER_PATTERN), entries.size())
                    .forEach(e -> recent.add(new ErrorAnalysis.RecentError(
                            key, e.timestamp(), e.error(), e.retryCount(), e.duration())));
        });

        Map<String, Long> frequencySnapshot = frequencies();
        List<ErrorAnalysis.ErrorFrequency> top = frequencySnapshot.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(TOP_ERRORS)
                .map(e -> new ErrorAnalysis.ErrorFrequency(e.getKey(), e.getValue()))
                .toList();
        List<ErrorAnalysis.RecentError> newest = recent.stream()
                .sorted(Comparator.comparing(ErrorAnalysis.RecentError::timestamp).reversed())
                .limit(RECENT_ERRORS)
                .toList();

        return new ErrorAnalysis(frequencySnapshot, summaries, top, newest);
    }

    public void clear() {
        frequencies.clear();
        patterns.clear();
    }
}
