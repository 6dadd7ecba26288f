package com.z254.conclave.dispatch.accounting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Capped ring buffer of execution summaries.
 */
@Slf4j
public class ExecutionHistoryStore {

    private final SlidingWindow<ExecutionHistoryEntry> entries;
    private final int summaryLength;
    private final ObjectMapper objectMapper;

    public ExecutionHistoryStore(int capacity, int summaryLength, ObjectMapper objectMapper) {
        this.entries = new SlidingWindow<>(capacity);
        this.summaryLength = summaryLength;
        this.objectMapper = objectMapper;
    }

    public void append(ExecutionHistoryEntry entry) {
        entries.add(entry);
    }

    /**
     * The newest {@code limit} entries, oldest first.
     */
    public List<ExecutionHistoryEntry> latest(int limit) {
        return entries.latest(limit);
    }

    public Optional<ExecutionHistoryEntry> find(String executionId) {
        List<ExecutionHistoryEntry> snapshot = entries.snapshot();
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            if (snapshot.get(i).executionId().equals(executionId)) {
                return Optional.of(snapshot.get(i));
            }
        }
        return Optional.empty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Render a result payload as JSON, truncated to the configured summary length.
     */
    public String summarize(Object output) {
        if (output == null) {
            return null;
        }
        String rendered;
        if (output instanceof String text) {
            rendered = text;
        } else {
            try {
                rendered = objectMapper.writeValueAsString(output);
            } catch (JsonProcessingException e) {
                log.debug("Result of type {} is not serializable, using toString: {}",
                        output.getClass().getSimpleName(), e.getMessage());
                rendered = String.valueOf(output);
            }
        }
        return rendered.length() > summaryLength ? rendered.substring(0, summaryLength) : rendered;
    }

    public void clear() {
        entries.clear();
    }
}
