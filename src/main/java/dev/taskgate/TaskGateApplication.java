package dev.taskgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * TaskGate — multi-tenant webhook-to-task orchestration.
 *
 * <p>Architecture overview:
 * <pre>
 * Provider webhook → WebhookController → WebhookRouter → WebhookHandler (validate, parse, trigger)
 *   → LoopGuard → TaskLifecycleService (QUEUED record) → TaskPublisher → TaskQueue
 *   → TaskWorkerPool → ExecutionEngine → TaskLifecycleService (terminal state) → ResultPoster
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>One handler per provider behind a registry: adding a provider never touches the router</li>
 *   <li>Tenant credentials live in one TokenService instance, refreshed under a per-installation lock</li>
 *   <li>Queue leases with a reaper: a dead consumer never hides a message forever</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class TaskGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskGateApplication.class, args);
    }
}
