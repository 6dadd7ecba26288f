package com.z254.conclave.dispatch.accounting;

import com.z254.conclave.dispatch.config.DispatchProperties;
import com.z254.conclave.dispatch.support.DispatchFixtures;
import com.z254.conclave.dispatch.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionAccountingTest {

    private DispatchProperties properties;
    private ExecutionAccounting accounting;

    @BeforeEach
    void setUp() {
        properties = DispatchFixtures.properties();
        properties.getInterceptor().setResultSummaryLength(20);
        properties.getInterceptor().setHistorySize(3);
        accounting = new ExecutionAccounting(properties, DispatchFixtures.objectMapper());
    }

    @Test
    @DisplayName("should count outcomes per tool")
    void countsOutcomes() {
        accounting.recordExecution("search", ToolResult.success("a"));
        accounting.recordExecution("search", ToolResult.cached("b"));
        accounting.recordExecution("search", ToolResult.failure("c"));

        ToolExecutionCounts counts = accounting.executionCounts().get("search");
        assertThat(counts.total()).isEqualTo(3);
        assertThat(counts.successful()).isEqualTo(2);
        assertThat(counts.failed()).isEqualTo(1);
        assertThat(counts.cacheHits()).isEqualTo(1);
        assertThat(counts.successRate()).isEqualTo(2.0 / 3.0);
    }

    @Test
    @DisplayName("should aggregate durations per tool")
    void aggregatesPerformance() {
        accounting.recordPerformance("search", Duration.ofMillis(100));
        accounting.recordPerformance("search", Duration.ofMillis(300));

        PerformanceStats stats = accounting.performanceStats().get("search");
        assertThat(stats.count()).isEqualTo(2);
        assertThat(stats.average()).isEqualTo(Duration.ofMillis(200));
        assertThat(stats.min()).isEqualTo(Duration.ofMillis(100));
        assertThat(stats.max()).isEqualTo(Duration.ofMillis(300));
    }

    @Test
    @DisplayName("should store history with JSON summaries truncated to the configured length")
    void truncatesSummaries() {
        // Given
        ToolResult result = ToolResult.success(Map.of("payload", "a long value that will be cut"));

        // When
        accounting.recordHistory("search", "search_1", Map.of(), Map.of(), result, Duration.ofMillis(5));

        // Then
        ExecutionHistoryEntry entry = accounting.findHistory("search_1").orElseThrow();
        assertThat(entry.resultSummary()).hasSize(20).startsWith("{\"payload\":");
        assertThat(entry.success()).isTrue();
    }

    @Test
    @DisplayName("should keep only the newest history entries")
    void capsHistory() {
        for (int i = 0; i < 5; i++) {
            accounting.recordHistory("search", "search_" + i, Map.of(), Map.of(), ToolResult.success(i),
                    Duration.ZERO);
        }

        List<ExecutionHistoryEntry> history = accounting.history(10);
        assertThat(history).extracting(ExecutionHistoryEntry::executionId)
                .containsExactly("search_2", "search_3", "search_4");
        assertThat(accounting.findHistory("search_0")).isEmpty();
    }

    @Test
    @DisplayName("should reset every store on clear")
    void clearsAllStores() {
        accounting.recordExecution("search", ToolResult.failure("x"));
        accounting.recordPerformance("search", Duration.ofMillis(1));
        accounting.recordError("search", ToolResult.failure("x"), Duration.ofMillis(1));
        accounting.recordHistory("search", "search_1", Map.of(), Map.of(), ToolResult.failure("x"), Duration.ZERO);

        accounting.clear();

        assertThat(accounting.executionCounts()).isEmpty();
        assertThat(accounting.performanceStats()).isEmpty();
        assertThat(accounting.errorFrequencies()).isEmpty();
        assertThat(accounting.errorOccurrences("search", "ToolFailure")).isEmpty();
        assertThat(accounting.history(10)).isEmpty();
    }
}
