package dev.taskgate.queue;

import dev.taskgate.config.QueueProperties;
import dev.taskgate.domain.valueobject.TaskMessage;
import dev.taskgate.exception.QueueUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-process {@link TaskQueue}. One lock guards the ready heap and the lease table;
 * consumers park on a condition instead of polling.
 *
 * <p>Each message keeps the sequence number it got on first enqueue, so a redelivered
 * message goes back ahead of anything enqueued after it at the same priority. Leases
 * are fenced by epoch: only the consumer holding the latest delivery can settle it.
 */
@Component
public class InMemoryTaskQueue implements TaskQueue, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskQueue.class);

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> e.message().priority().ordinal())
            .thenComparingLong(Entry::sequence);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final PriorityQueue<Entry> ready = new PriorityQueue<>(ORDER);
    private final Map<String, Held> leases = new HashMap<>();
    private final Set<String> deadLettered = new LinkedHashSet<>();
    private final Duration visibilityTimeout;
    private final int deadLetterRetention;
    private final Clock clock;
    private long nextSequence;
    private long nextEpoch = 1L;
    private boolean closed;

    public InMemoryTaskQueue(QueueProperties properties, Clock clock) {
        this.visibilityTimeout = properties.visibilityTimeout();
        this.deadLetterRetention = properties.deadLetterRetention();
        this.clock = clock;
    }

    @Override
    public void enqueue(TaskMessage message) {
        lock.lock();
        try {
            if (closed) throw new QueueUnavailableException("Queue is closed");
            ready.add(new Entry(message, nextSequence++));
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
        log.debug("Enqueued task {} priority={}", message.taskId(), message.priority());
    }

    @Override
    public Optional<Lease> dequeue(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (ready.isEmpty() && !closed) {
                if (remaining <= 0L) return Optional.empty();
                remaining = notEmpty.awaitNanos(remaining);
            }
            if (ready.isEmpty()) return Optional.empty();
            Entry entry = ready.poll();
            long epoch = nextEpoch++;
            leases.put(entry.message().taskId(), new Held(entry, epoch, deadline()));
            return Optional.of(new Lease(entry.message(), epoch));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean acknowledge(Lease lease) {
        lock.lock();
        try {
            return release(lease) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean reject(Lease lease, boolean requeue) {
        lock.lock();
        try {
            Held held = release(lease);
            if (held == null) {
                log.debug("Stale reject for task {} epoch={} ignored", lease.taskId(), lease.epoch());
                return false;
            }
            if (requeue) {
                ready.add(held.entry());
                notEmpty.signal();
            } else {
                deadLetter(lease.taskId());
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean heartbeat(Lease lease) {
        lock.lock();
        try {
            Held held = leases.get(lease.taskId());
            if (held == null || held.epoch() != lease.epoch()) return false;
            leases.put(lease.taskId(), new Held(held.entry(), held.epoch(), deadline()));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int reapExpiredLeases() {
        Instant now = clock.instant();
        int reaped = 0;
        lock.lock();
        try {
            Iterator<Held> it = leases.values().iterator();
            while (it.hasNext()) {
                Held held = it.next();
                if (held.deadline().isAfter(now)) continue;
                it.remove();
                ready.add(held.entry());
                reaped++;
            }
            if (reaped > 0) notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        return reaped;
    }

    @Override
    public int length() {
        lock.lock();
        try {
            return ready.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int inFlight() {
        lock.lock();
        try {
            return leases.size();
        } finally {
            lock.unlock();
        }
    }

    /** Most recently dead-lettered task ids, oldest first, capped at the configured retention. */
    public Set<String> deadLettered() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(deadLettered));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting messages and wakes blocked consumers. Messages still queued are
     * dropped with the process.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            log.info("Task queue closed with {} queued and {} in flight", ready.size(), leases.size());
        } finally {
            lock.unlock();
        }
    }

    /** Removes and returns the held lease, or null when {@code lease} is not the live one. */
    private Held release(Lease lease) {
        Held held = leases.get(lease.taskId());
        if (held == null || held.epoch() != lease.epoch()) return null;
        return leases.remove(lease.taskId());
    }

    private void deadLetter(String taskId) {
        deadLettered.remove(taskId);
        deadLettered.add(taskId);
        if (deadLettered.size() > deadLetterRetention) {
            Iterator<String> oldest = deadLettered.iterator();
            oldest.next();
            oldest.remove();
        }
        log.warn("Task {} dead-lettered", taskId);
    }

    private Instant deadline() {
        return clock.instant().plus(visibilityTimeout);
    }

    private record Entry(TaskMessage message, long sequence) {}

    private record Held(Entry entry, long epoch, Instant deadline) {}
}
