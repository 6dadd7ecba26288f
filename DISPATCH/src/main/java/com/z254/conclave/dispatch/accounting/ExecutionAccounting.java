package com.z254.conclave.dispatch.accounting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.conclave.dispatch.config.DispatchProperties;
import com.z254.conclave.dispatch.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rolling execution accounting: counters, performance series, error patterns and history.
 */
@Component
@Slf4j
public class ExecutionAccounting {

    private final Clock clock;
    private final ExecutionCounters counters;
    private final PerformanceSeriesStore performance;
    private final ErrorPatternStore errorPatterns;
    private final ExecutionHistoryStore history;

    @Autowired
    public ExecutionAccounting(DispatchProperties dispatchProperties, ObjectMapper objectMapper) {
        this(dispatchProperties, objectMapper, Clock.systemUTC());
    }

    public ExecutionAccounting(DispatchProperties dispatchProperties, ObjectMapper objectMapper, Clock clock) {
        DispatchProperties.InterceptorProperties config = dispatchProperties.getInterceptor();
        this.clock = clock;
        this.counters = new ExecutionCounters();
        this.performance = new PerformanceSeriesStore(config.getPerformanceWindowSize());
        this.errorPatterns = new ErrorPatternStore(config.getErrorWindowSize(), config.getRecentErrorWindow(), clock);
        this.history = new ExecutionHistoryStore(config.getHistorySize(), config.getResultSummaryLength(), objectMapper);
    }

    public void recordExecution(String toolName, ToolResult result) {
        counters.record(toolName, result.isSuccess(), result.isFromCache(), result.getRetryCount() > 0);
    }

    public void recordPerformance(String toolName, Duration duration) {
        performance.record(toolName, duration);
    }

    public void recordError(String toolName, ToolResult result, Duration duration) {
        errorPatterns.record(toolName, result.getErrorType(), result.getError(), result.getRetryCount(), duration);
    }

    public void recordHistory(String toolName, String executionId, Map<String, Object> input,
                              Map<String, Object> context, ToolResult result, Duration duration) {
        history.append(new ExecutionHistoryEntry(
                toolName, executionId, clock.instant(), input, context, result.isSuccess(), duration,
                history.summarize(result.isSuccess() ? result.getOutput() : result.getError())));
    }

    public Map<String, ToolExecutionCounts> executionCounts() {
        return counters.snapshot();
    }

    public Map<String, PerformanceStats> performanceStats() {
        return performance.stats();
    }

    public Map<String, Long> errorFrequencies() {
        return errorPatterns.frequencies();
    }

    public ErrorAnalysis errorAnalysis() {
        return errorPatterns.analyze();
    }

    public List<ErrorOccurrence> errorOccurrences(String toolName, String errorType) {
        return errorPatterns.occurrences(ErrorPatternStore.patternKey(toolName, errorType));
    }

    public List<ExecutionHistoryEntry> history(int limit) {
        return history.latest(limit);
    }

    public Optional<ExecutionHistoryEntry> findHistory(String executionId) {
        return history.find(executionId);
    }

    /**
     * Reset every store together.
     */
    public void clear() {
        history.clear();
        counters.clear();
        errorPatterns.clear();
        performance.clear();
        log.info("Execution statistics cleared");
    }
}
