package com.z254.conclave.dispatch.accounting;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-tool execution counters.
 */
public class ExecutionCounters {

    private final Map<String, Counters> counters = new ConcurrentHashMap<>();

    public void record(String toolName, boolean success, boolean fromCache, boolean retried) {
        Counters c = counters.computeIfAbsent(toolName, k -> new Counters());
        c.total.increment();
        if (success) {
            c.successful.increment();
            if (fromCache) {
                c.cacheHits.increment();
            }
        } else {
            c.failed.increment();
        }
        if (retried) {
            c.retried.increment();
        }
    }

    public ToolExecutionCounts get(String toolName) {
        Counters c = counters.get(toolName);
        return c != null ? c.snapshot() : new ToolExecutionCounts(0, 0, 0, 0, 0);
    }

    public Map<String, ToolExecutionCounts> snapshot() {
        Map<String, ToolExecutionCounts> snapshot = new LinkedHashMap<>();
        counters.forEach((tool, c) -> snapshot.put(tool, c.snapshot()));
        return snapshot;
    }

    public void clear() {
        counters.clear();
    }

    private static final class Counters {
        private final LongAdder total = new LongAdder();
        private final LongAdder successful = new LongAdder();
        private final LongAdder failed = new LongAdder();
        private final LongAdder cacheHits = new LongAdder();
        private final LongAdder retried = new LongAdder();

        ToolExecutionCounts snapshot() {
            return new ToolExecutionCounts(
                    total.sum(), successful.sum(), failed.sum(), cacheHits.sum(), retried.sum());
        }
    }
}
