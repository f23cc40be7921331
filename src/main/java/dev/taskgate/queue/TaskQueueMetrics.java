package dev.taskgate.queue;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

@Component
public class TaskQueueMetrics implements MeterBinder {

    private final TaskQueue queue;

    public TaskQueueMetrics(TaskQueue queue) {
        this.queue = queue;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("taskgate.queue.depth", queue, TaskQueue::length)
                .description("Tasks waiting for a worker")
                .register(registry);
        Gauge.builder("taskgate.queue.in_flight", queue, TaskQueue::inFlight)
                .description("Tasks leased to a worker")
                .register(registry);
    }
}
