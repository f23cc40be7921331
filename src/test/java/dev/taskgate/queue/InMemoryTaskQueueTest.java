package dev.taskgate.queue;

import dev.taskgate.config.QueueProperties;
import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.domain.valueobject.TaskMessage;
import dev.taskgate.exception.QueueUnavailableException;
import dev.taskgate.support.Fixtures;
import dev.taskgate.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static dev.taskgate.support.Fixtures.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTaskQueueTest {

    private static final Duration NO_WAIT = Duration.ZERO;

    private final MutableClock clock = new MutableClock(Fixtures.NOW);
    private final InMemoryTaskQueue queue = new InMemoryTaskQueue(QueueProperties.defaults(), clock);

    @Test
    void deliversByPriorityThenEnqueueOrder() throws Exception {
        queue.enqueue(message("low-1", TaskPriority.LOW));
        queue.enqueue(message("normal-1", TaskPriority.NORMAL));
        queue.enqueue(message("critical-1", TaskPriority.CRITICAL));
        queue.enqueue(message("normal-2", TaskPriority.NORMAL));
        queue.enqueue(message("high-1", TaskPriority.HIGH));
        queue.enqueue(message("critical-2", TaskPriority.CRITICAL));

        assertThat(drainIds()).containsExactly("critical-1", "critical-2", "high-1", "normal-1", "normal-2", "low-1");
    }

    @Test
    void samePriorityIsFifo() throws Exception {
        for (int i = 0; i < 50; i++) queue.enqueue(message("t" + i, TaskPriority.NORMAL));

        List<String> ids = drainIds();

        assertThat(ids).hasSize(50);
        for (int i = 0; i < 50; i++) assertThat(ids.get(i)).isEqualTo("t" + i);
    }

    @Test
    void dequeueLeasesInsteadOfRemoving() throws Exception {
        queue.enqueue(message("a", TaskPriority.NORMAL));

        Lease lease = queue.dequeue(NO_WAIT).orElseThrow();

        assertThat(queue.length()).isZero();
        assertThat(queue.inFlight()).isEqualTo(1);
        assertThat(queue.acknowledge(lease)).isTrue();
        assertThat(queue.inFlight()).isZero();
        assertThat(queue.acknowledge(lease)).isFalse();
    }

    @Test
    void dequeueTimesOutWhenEmpty() throws Exception {
        long start = System.nanoTime();

        Optional<Lease> next = queue.dequeue(Duration.ofMillis(50));

        assertThat(next).isEmpty();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(40));
    }

    @Test
    void blockedConsumerWakesOnEnqueue() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<Lease>> pending = executor.submit(() -> queue.dequeue(Duration.ofSeconds(5)));
            Thread.sleep(50);
            queue.enqueue(message("late", TaskPriority.LOW));

            assertThat(pending.get(2, TimeUnit.SECONDS)).map(Lease::taskId).contains("late");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void expiredLeaseReturnsMessageAtOriginalPosition() throws Exception {
        queue.enqueue(message("first", TaskPriority.NORMAL));
        queue.enqueue(message("second", TaskPriority.NORMAL));
        queue.dequeue(NO_WAIT);

        clock.advance(Duration.ofMinutes(5));
        assertThat(queue.reapExpiredLeases()).isEqualTo(1);

        assertThat(queue.inFlight()).isZero();
        Lease redelivered = queue.dequeue(NO_WAIT).orElseThrow();
        assertThat(redelivered.taskId()).isEqualTo("first");
        assertThat(drainIds()).containsExactly("second");
        assertThat(queue.acknowledge(redelivered)).isTrue();
    }

    @Test
    void heartbeatKeepsLease() throws Exception {
        queue.enqueue(message("busy", TaskPriority.NORMAL));
        Lease lease = queue.dequeue(NO_WAIT).orElseThrow();

        clock.advance(Duration.ofMinutes(4));
        assertThat(queue.heartbeat(lease)).isTrue();
        clock.advance(Duration.ofMinutes(4));

        assertThat(queue.reapExpiredLeases()).isZero();
        assertThat(queue.inFlight()).isEqualTo(1);
        assertThat(queue.heartbeat(new Lease(message("unknown", TaskPriority.NORMAL), 99L))).isFalse();
    }

    @Test
    void ackAfterReapFails() throws Exception {
        queue.enqueue(message("slow", TaskPriority.NORMAL));
        Lease lease = queue.dequeue(NO_WAIT).orElseThrow();
        clock.advance(Duration.ofMinutes(6));
        queue.reapExpiredLeases();

        assertThat(queue.acknowledge(lease)).isFalse();
        assertThat(queue.length()).isEqualTo(1);
    }

    @Test
    void staleHolderCannotSettleOrExtendTheRedeliveredLease() throws Exception {
        queue.enqueue(message("t1", TaskPriority.NORMAL));
        Lease first = queue.dequeue(NO_WAIT).orElseThrow();
        clock.advance(Duration.ofMinutes(6));
        queue.reapExpiredLeases();
        Lease second = queue.dequeue(NO_WAIT).orElseThrow();

        assertThat(second.taskId()).isEqualTo("t1");
        assertThat(second.epoch()).isNotEqualTo(first.epoch());
        assertThat(queue.reject(first, true)).isFalse();
        assertThat(queue.acknowledge(first)).isFalse();
        assertThat(queue.heartbeat(first)).isFalse();

        assertThat(queue.length()).isZero();
        assertThat(queue.inFlight()).isEqualTo(1);
        assertThat(queue.dequeue(NO_WAIT)).isEmpty();
        assertThat(queue.acknowledge(second)).isTrue();
    }

    @Test
    void rejectWithRequeueKeepsPriorityAndOrder() throws Exception {
        queue.enqueue(message("n1", TaskPriority.NORMAL));
        queue.enqueue(message("n2", TaskPriority.NORMAL));
        Lease lease = queue.dequeue(NO_WAIT).orElseThrow();
        queue.enqueue(message("l1", TaskPriority.LOW));

        assertThat(queue.reject(lease, true)).isTrue();

        assertThat(drainIds()).containsExactly("n1", "n2", "l1");
    }

    @Test
    void rejectWithoutRequeueDeadLetters() throws Exception {
        queue.enqueue(message("bad", TaskPriority.HIGH));
        Lease lease = queue.dequeue(NO_WAIT).orElseThrow();

        assertThat(queue.reject(lease, false)).isTrue();

        assertThat(queue.length()).isZero();
        assertThat(queue.inFlight()).isZero();
        assertThat(queue.deadLettered()).containsExactly("bad");
        assertThat(queue.reject(lease, true)).isFalse();
    }

    @Test
    void deadLetterListKeepsOnlyTheMostRecentIds() throws Exception {
        InMemoryTaskQueue small = new InMemoryTaskQueue(
                new QueueProperties(null, 0, null, 3), clock);
        for (int i = 0; i < 5; i++) {
            small.enqueue(message("bad-" + i, TaskPriority.NORMAL));
            small.reject(small.dequeue(NO_WAIT).orElseThrow(), false);
        }

        assertThat(small.deadLettered()).containsExactly("bad-2", "bad-3", "bad-4");
    }

    @Test
    void closedQueueRefusesEnqueueAndReleasesConsumers() throws Exception {
        queue.close();

        assertThatThrownBy(() -> queue.enqueue(message("x", TaskPriority.NORMAL)))
                .isInstanceOf(QueueUnavailableException.class);
        assertThat(queue.dequeue(Duration.ofSeconds(5))).isEmpty();
    }

    @Test
    void concurrentConsumersNeverShareAMessage() throws Exception {
        int messages = 200;
        for (int i = 0; i < messages; i++) queue.enqueue(message("m" + i, TaskPriority.values()[i % 4]));

        Set<String> seen = ConcurrentHashMap.newKeySet();
        List<String> duplicates = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        for (int w = 0; w < 8; w++) {
            executor.execute(() -> {
                try {
                    Optional<Lease> next;
                    while ((next = queue.dequeue(Duration.ofMillis(50))).isPresent()) {
                        if (!seen.add(next.get().taskId())) {
                            synchronized (duplicates) {
                                duplicates.add(next.get().taskId());
                            }
                        }
                        queue.acknowledge(next.get());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdownNow();
        assertThat(duplicates).isEmpty();
        assertThat(seen).hasSize(messages);
        assertThat(queue.inFlight()).isZero();
    }

    @Test
    void concurrentProducersKeepPriorityAndPerProducerOrder() throws Exception {
        int producers = 6;
        int perProducer = 100;
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(producers);
        for (int p = 0; p < producers; p++) {
            int producer = p;
            executor.execute(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        TaskPriority priority = TaskPriority.values()[(producer + i) % 4];
                        queue.enqueue(message("p" + producer + "-" + i, priority));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdownNow();

        List<TaskMessage> drained = new ArrayList<>();
        Optional<Lease> next;
        while ((next = queue.dequeue(NO_WAIT)).isPresent()) drained.add(next.get().message());

        assertThat(drained).hasSize(producers * perProducer);
        assertThat(drained).extracting(TaskMessage::priority).isSorted();
        for (TaskPriority priority : TaskPriority.values()) {
            for (int p = 0; p < producers; p++) {
                String prefix = "p" + p + "-";
                List<Integer> order = drained.stream()
                        .filter(m -> m.priority() == priority && m.taskId().startsWith(prefix))
                        .map(m -> Integer.parseInt(m.taskId().substring(prefix.length())))
                        .toList();
                assertThat(order).isSorted();
            }
        }
    }

    private List<String> drainIds() throws InterruptedException {
        List<String> ids = new ArrayList<>();
        Optional<Lease> next;
        while ((next = queue.dequeue(NO_WAIT)).isPresent()) ids.add(next.get().taskId());
        return ids;
    }
}
