package dev.taskgate.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Thread pools for the worker side.
 *
 * <p>Workers are long-lived consumers blocked in {@code dequeue}, so the pool is a fixed
 * set of platform threads sized by {@code taskgate.worker.pool-size}. Every submitted task
 * is wrapped so the submitter's MDC (provider, taskId) survives the hop to the worker thread.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "workerExecutorService")
    public ExecutorService workerExecutorService(WorkerProperties properties) {
        ExecutorService base = Executors.newFixedThreadPool(
                properties.poolSize(), new CustomizableThreadFactory("task-worker-"));
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
    }

    /**
     * Single scheduler that extends queue leases for in-flight tasks.
     */
    @Bean(name = "leaseHeartbeatScheduler")
    public ScheduledExecutorService leaseHeartbeatScheduler() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("lease-heartbeat-"));
    }

    /**
     * Propagates MDC context from the calling thread to the worker thread.
     */
    static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }

    /**
     * Wraps an ExecutorService to apply MDC propagation to all submitted tasks.
     */
    static class DelegatingExecutorService extends AbstractExecutorService {
        private final ExecutorService delegate;
        private final MdcPropagatingTaskDecorator decorator;

        DelegatingExecutorService(ExecutorService delegate, MdcPropagatingTaskDecorator decorator) {
            this.delegate = delegate;
            this.decorator = decorator;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(decorator.decorate(command));
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit)
                throws InterruptedException { return delegate.awaitTermination(timeout, unit); }
    }
}
