package com.z254.conclave.dispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * DISPATCH - Tool Execution and Agent Coordination Service
 *
 * <p>Runs units of work under lifecycle instrumentation and spreads tasks across a pool of
 * specialized agents:
 * <ul>
 *   <li>Execution interceptor with hooks, concurrency limits, timeouts and circuit breaking</li>
 *   <li>Rolling execution statistics and error pattern analysis</li>
 *   <li>Parallel, sequential, committee and load-balanced coordination</li>
 *   <li>Three-phase investigations with periodic capacity tuning</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class DispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DispatchApplication.class, args);
    }
}
