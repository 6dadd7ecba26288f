package com.z254.conclave.dispatch.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the DISPATCH service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private InterceptorProperties interceptor = new InterceptorProperties();
    private HookProperties hooks = new HookProperties();
    private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
    private PoolProperties pool = new PoolProperties();
    private CoordinationProperties coordination = new CoordinationProperties();
    private InvestigationProperties investigation = new InvestigationProperties();
    private CapacityProperties capacity = new CapacityProperties();

    @Data
    public static class InterceptorProperties {
        private int maxConcurrentExecutions = 10;
        private boolean executionTrackingEnabled = true;
        private boolean performanceMonitoringEnabled = true;
        private boolean errorAggregationEnabled = true;
        private boolean replayEnabled = false;
        private boolean rollbackEnabled = false;
        private int historySize = 100;
        private int errorWindowSize = 50;
        private int performanceWindowSize = 1000;
        private Duration recentErrorWindow = Duration.ofHours(1);
        private int resultSummaryLength = 200;
    }

    @Data
    public static class HookProperties {
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(5);
        private int workerThreads = 4;
        private int workerQueueCapacity = 1000;
        private boolean standardHooksEnabled = true;
        private Duration slowExecutionThreshold = Duration.ofSeconds(10);
    }

    @Data
    public static class CircuitBreakerProperties {
        private boolean enabled = true;
        private float failureRateThreshold = 50.0f;
        private int slidingWindowSize = 50;
        private int minimumNumberOfCalls = 20;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
        private int permittedCallsInHalfOpenState = 3;
    }

    @Data
    public static class PoolProperties {
        private boolean performanceTrackingEnabled = true;
        private double performanceSmoothing = 0.1;
        private List<AgentDefinition> agents = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AgentDefinition {
        private String name;
        private Set<String> specializations = new LinkedHashSet<>();
        private int maxConcurrentTasks = 3;
        private double successRate = 1.0;
        private double avgResponseTime = 0.0;
        private List<String> tools = new ArrayList<>();
    }

    @Data
    public static class CoordinationProperties {
        private int committeeQuorum = 3;
        private int committeeMaxVoters = 5;
        private int sequentialMaxStages = 3;
        private Long samplingSeed;
    }

    @Data
    public static class InvestigationProperties {
        private int ledgerCapacity = 1000;
        private List<PhaseTask> gathering = new ArrayList<>(List.of(
                new PhaseTask("device_check", "analysis", 0.6, Set.of("device_fingerprinting"), 8,
                        "device", "device_data"),
                new PhaseTask("network_check", "analysis", 0.7, Set.of("network_forensics"), 7,
                        "network", "network_data"),
                new PhaseTask("log_check", "analysis", 0.5, Set.of("log_parsing"), 6,
                        "logs", "log_data")));
        private PhaseTask assessment = new PhaseTask(
                "risk_assessment", "evaluation", 0.8, Set.of("risk_scoring", "fraud_detection"), 9,
                null, null);
        private PhaseTask synthesis = new PhaseTask(
                "final_decision", "synthesis", 0.9, Set.of("decision_synthesis", "recommendation"), 10,
                null, null);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PhaseTask {
        private String name;
        private String taskType;
        private double complexity;
        private Set<String> requiredCapabilities = new LinkedHashSet<>();
        private int priority = 5;
        /**
         * Case data entry handed to the task. Gathering tasks only.
         */
        private String caseDataKey;
        private String inputKey;
    }

    @Data
    public static class CapacityProperties {
        private boolean adjustmentEnabled = true;
        private Duration adjustmentInterval = Duration.ofMinutes(5);
        private double successRateFloor = 0.85;
        private double successRateCeiling = 0.95;
        private double fastResponseSeconds = 2.0;
        private int minCapacity = 1;
        private int maxCapacity = 10;
    }
}
