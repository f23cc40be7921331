package dev.taskgate.queue;

import dev.taskgate.config.QueueProperties;
import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.support.Fixtures;
import dev.taskgate.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TaskQueueMetricsTest {

    @Test
    void gaugesTrackDepthAndLeases() throws Exception {
        InMemoryTaskQueue queue = new InMemoryTaskQueue(QueueProperties.defaults(), new MutableClock(Fixtures.NOW));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new TaskQueueMetrics(queue).bindTo(registry);

        queue.enqueue(Fixtures.message("task-1", TaskPriority.NORMAL));
        queue.enqueue(Fixtures.message("task-2", TaskPriority.HIGH));
        queue.dequeue(Duration.ZERO);

        assertThat(registry.get("taskgate.queue.depth").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("taskgate.queue.in_flight").gauge().value()).isEqualTo(1.0);
    }
}
