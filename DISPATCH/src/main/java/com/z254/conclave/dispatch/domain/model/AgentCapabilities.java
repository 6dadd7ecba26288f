package com.z254.conclave.dispatch.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A pool member: declared specializations, a concurrency ceiling and observed performance.
 * Load changes only through {@link #tryAcquireSlot()} and {@link #releaseSlot()}, which keep it
 * within {@code [0, maxConcurrentTasks]}.
 */
@Getter
public class AgentCapabilities {

    private final String name;
    private final Set<String> specializations;
    private final List<String> tools;

    private final AtomicInteger currentLoad = new AtomicInteger();
    private volatile int maxConcurrentTasks;
    private volatile double successRate;
    private volatile double avgResponseTime;

    @Builder
    private AgentCapabilities(String name, @Singular Set<String> specializations, @Singular List<String> tools,
                              Integer maxConcurrentTasks, Double successRate, Double avgResponseTime) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Agent name must not be blank");
        }
        this.name = name;
        this.specializations = Set.copyOf(specializations);
        this.tools = List.copyOf(tools);
        this.maxConcurrentTasks = Math.max(1, maxConcurrentTasks != null ? maxConcurrentTasks : 3);
        this.successRate = clampRate(successRate != null ? successRate : 1.0);
        this.avgResponseTime = Math.max(0.0, avgResponseTime != null ? avgResponseTime : 0.0);
    }

    public int getCurrentLoad() {
        return currentLoad.get();
    }

    public boolean hasCapacity() {
        return currentLoad.get() < maxConcurrentTasks;
    }

    /**
     * Availability in [0, 1]: 40% free capacity, 40% success rate, 20% responsiveness.
     */
    public double availabilityScore() {
        double loadFactor = 1.0 - (double) currentLoad.get() / Math.max(maxConcurrentTasks, 1);
        double responseFactor = 1.0 / (1.0 + avgResponseTime / 10.0);
        return 0.4 * Math.max(0.0, loadFactor) + 0.4 * successRate + 0.2 * responseFactor;
    }

    public double utilization() {
        return (double) currentLoad.get() / Math.max(maxConcurrentTasks, 1);
    }

    public boolean hasAll(Set<String> capabilities) {
        return specializations.containsAll(capabilities);
    }

    public long overlap(Set<String> capabilities) {
        return capabilities.stream().filter(specializations::contains).count();
    }

    /**
     * Take one slot if the agent is below its ceiling.
     */
    public boolean tryAcquireSlot() {
        while (true) {
            int load = currentLoad.get();
            if (load >= maxConcurrentTasks) {
                return false;
            }
            if (currentLoad.compareAndSet(load, load + 1)) {
                return true;
            }
        }
    }

    public void releaseSlot() {
        currentLoad.updateAndGet(load -> load > 0 ? load - 1 : 0);
    }

    /**
     * Set the concurrency ceiling. Never drops below the current load.
     *
     * @return the ceiling actually applied
     */
    public synchronized int adjustMaxConcurrentTasks(int requested) {
        int applied = Math.max(Math.max(1, requested), currentLoad.get());
        this.maxConcurrentTasks = applied;
        return applied;
    }

    /**
     * Fold an observed outcome into the success rate and response time averages.
     */
    public synchronized void recordOutcome(boolean success, double responseSeconds, double smoothing) {
        this.successRate = clampRate((1 - smoothing) * successRate + smoothing * (success ? 1.0 : 0.0));
        this.avgResponseTime = Math.max(0.0, (1 - smoothing) * avgResponseTime + smoothing * responseSeconds);
    }

    public AgentWorkload workload() {
        return new AgentWorkload(name, currentLoad.get(), maxConcurrentTasks, utilization(),
                availabilityScore(), successRate, avgResponseTime);
    }

    private static double clampRate(double rate) {
        return Math.min(1.0, Math.max(0.0, rate));
    }

    @Override
    public String toString() {
        return "AgentCapabilities{name=" + name + ", load=" + currentLoad.get() + "/" + maxConcurrentTasks
                + ", successRate=" + successRate + "}";
    }
}
