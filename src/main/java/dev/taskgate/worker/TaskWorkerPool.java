package dev.taskgate.worker;

import dev.taskgate.config.WorkerProperties;
import dev.taskgate.domain.entity.TaskRecord;
import dev.taskgate.domain.event.TaskCancelledEvent;
import dev.taskgate.domain.valueobject.TaskMessage;
import dev.taskgate.exception.InvalidTransitionException;
import dev.taskgate.exception.TaskNotFoundException;
import dev.taskgate.loopguard.LoopGuard;
import dev.taskgate.queue.Lease;
import dev.taskgate.queue.TaskQueue;
import dev.taskgate.service.TaskLifecycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fixed set of long-lived consumers on the {@link TaskQueue}.
 *
 * <p>Per message: mark RUNNING, execute while a heartbeat keeps the lease alive, record
 * the terminal (or waiting) state, post the result, then acknowledge. A worker that dies
 * mid-task never acknowledges, so the lease expires and another worker picks the
 * message up; {@link TaskLifecycleService#beginExecution} resumes it. A result that
 * cannot be stored sends the message back for another run; any other failure after
 * the task started marks it FAILED and dead-letters the message.
 */
@Component
@ConditionalOnProperty(prefix = "taskgate.worker", name = "enabled", havingValue = "true")
public class TaskWorkerPool implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(TaskWorkerPool.class);

    private final TaskQueue queue;
    private final TaskLifecycleService lifecycle;
    private final LoopGuard loopGuard;
    private final ObjectProvider<ExecutionEngine> engineProvider;
    private final ObjectProvider<ResultPoster> posterProvider;
    private final ExecutorService workerExecutor;
    private final ScheduledExecutorService heartbeatScheduler;
    private final WorkerProperties properties;
    private volatile boolean running;

    public TaskWorkerPool(TaskQueue queue, TaskLifecycleService lifecycle, LoopGuard loopGuard,
                          ObjectProvider<ExecutionEngine> engineProvider,
                          ObjectProvider<ResultPoster> posterProvider,
                          @Qualifier("workerExecutorService") ExecutorService workerExecutor,
                          @Qualifier("leaseHeartbeatScheduler") ScheduledExecutorService heartbeatScheduler,
                          WorkerProperties properties) {
        this.queue = queue;
        this.lifecycle = lifecycle;
        this.loopGuard = loopGuard;
        this.engineProvider = engineProvider;
        this.posterProvider = posterProvider;
        this.workerExecutor = workerExecutor;
        this.heartbeatScheduler = heartbeatScheduler;
        this.properties = properties;
    }

    @Override
    public void start() {
        ExecutionEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            log.warn("Worker pool enabled but no ExecutionEngine bean found; not starting");
            return;
        }
        running = true;
        for (int i = 0; i < properties.poolSize(); i++) workerExecutor.execute(() -> consume(engine));
        log.info("Started {} task workers", properties.poolSize());
    }

    @Override
    public void stop() {
        running = false;
        log.info("Stopping task workers; in-flight tasks finish or return to the queue on lease expiry");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onTaskCancelled(TaskCancelledEvent event) {
        ExecutionEngine engine = engineProvider.getIfAvailable();
        if (engine == null) return;
        log.info("Requesting cancellation of task {}", event.taskId());
        engine.cancel(event.taskId());
    }

    private void consume(ExecutionEngine engine) {
        while (running) {
            Optional<Lease> next;
            try {
                next = queue.dequeue(properties.pollTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            next.ifPresent(lease -> process(engine, lease));
        }
    }

    void process(ExecutionEngine engine, Lease lease) {
        TaskMessage task = lease.message();
        MDC.put("taskId", task.taskId());
        MDC.put("provider", task.provider());
        try {
            Optional<TaskRecord> started;
            try {
                started = lifecycle.beginExecution(task.taskId());
            } catch (TaskNotFoundException e) {
                log.error("Dequeued task {} has no record; dead-lettering", task.taskId());
                queue.reject(lease, false);
                return;
            }
            if (started.isEmpty()) {
                queue.acknowledge(lease);
                return;
            }

            ExecutionResult result = executeWithHeartbeat(engine, lease);
            if (result == null) return;

            boolean recorded;
            try {
                recorded = record(task, result);
            } catch (DataAccessException e) {
                log.warn("Could not record result of task {}; returning it to the queue", task.taskId(), e);
                queue.reject(lease, true);
                return;
            }
            if (recorded) postResult(task, result);
            queue.acknowledge(lease);
        } catch (RuntimeException e) {
            log.error("Worker failed on task {}", task.taskId(), e);
            tryFail(task.taskId(), e.getClass().getSimpleName() + ": " + e.getMessage());
            queue.reject(lease, false);
        } finally {
            MDC.remove("taskId");
            MDC.remove("provider");
        }
    }

    /**
     * Null when the run ended without a result; the message has then already been rejected.
     */
    private ExecutionResult executeWithHeartbeat(ExecutionEngine engine, Lease lease) {
        TaskMessage task = lease.message();
        long interval = properties.heartbeatInterval().toMillis();
        ScheduledFuture<?> heartbeat = heartbeatScheduler.scheduleAtFixedRate(
                () -> queue.heartbeat(lease), interval, interval, TimeUnit.MILLISECONDS);
        long startNanos = System.nanoTime();
        try {
            return engine.execute(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted while running task {}; returning it to the queue", task.taskId());
            queue.reject(lease, true);
            return null;
        } catch (Exception e) {
            log.error("Execution engine failed on task {}", task.taskId(), e);
            tryFail(task.taskId(), e.getClass().getSimpleName() + ": " + e.getMessage());
            queue.reject(lease, false);
            return null;
        } finally {
            heartbeat.cancel(false);
            log.debug("Task {} ran for {}", task.taskId(), Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    /**
     * False when the task was cancelled (or otherwise finished) while it ran.
     */
    private boolean record(TaskMessage task, ExecutionResult result) {
        try {
            switch (result.outcome()) {
                case COMPLETED -> lifecycle.complete(task.taskId(), result.output(), result.tokensUsed(),
                        result.costUsd());
                case FAILED -> lifecycle.fail(task.taskId(), result.error(), result.tokensUsed(), result.costUsd());
                case NEEDS_INPUT -> lifecycle.awaitInput(task.taskId());
            }
            return true;
        } catch (InvalidTransitionException e) {
            log.info("Result for task {} dropped: {}", task.taskId(), e.getMessage());
            return false;
        }
    }

    private void tryFail(String taskId, String error) {
        try {
            lifecycle.fail(taskId, error, 0L, BigDecimal.ZERO);
        } catch (InvalidTransitionException e) {
            log.info("Task {} not marked failed: {}", taskId, e.getMessage());
        } catch (DataAccessException e) {
            log.error("Task {} could not be marked failed", taskId, e);
        }
    }

    /**
     * The result is already recorded, so a posting failure is logged and the message is
     * still acknowledged.
     */
    private void postResult(TaskMessage task, ExecutionResult result) {
        ResultPoster poster = posterProvider.getIfAvailable();
        if (poster == null) return;
        try {
            poster.post(task, result).ifPresent(externalId -> {
                loopGuard.recordSelfPosted(externalId);
                log.debug("Recorded self-posted {} for task {}", externalId, task.taskId());
            });
        } catch (RuntimeException e) {
            log.error("Posting result of task {} failed", task.taskId(), e);
        }
    }
}
