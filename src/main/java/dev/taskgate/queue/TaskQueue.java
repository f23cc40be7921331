package dev.taskgate.queue;

import dev.taskgate.domain.valueobject.TaskMessage;

import java.time.Duration;
import java.util.Optional;

/**
 * Priority queue of {@link TaskMessage}s with at-least-once delivery.
 *
 * <p>Messages are delivered in (priority, enqueue order). A dequeued message is leased,
 * not removed: it must be acknowledged or rejected before its visibility timeout runs
 * out, otherwise {@link #reapExpiredLeases()} hands it out again. Settling calls take the
 * {@link Lease} returned by {@link #dequeue}; they do nothing for a lease that has since
 * expired, even when the same message is now leased to someone else.
 */
public interface TaskQueue {

    /**
     * @throws dev.taskgate.exception.QueueUnavailableException if the queue is closed
     */
    void enqueue(TaskMessage message);

    /**
     * Blocks up to {@code timeout} for the next message and leases it. Empty on timeout
     * or once closed.
     */
    Optional<Lease> dequeue(Duration timeout) throws InterruptedException;

    /** Removes a leased message for good. False if the lease is no longer live. */
    boolean acknowledge(Lease lease);

    /**
     * Releases a leased message: back to the queue at its original position when
     * {@code requeue}, otherwise dead-lettered. False if the lease is no longer live.
     */
    boolean reject(Lease lease, boolean requeue);

    /** Extends a live lease by a full visibility timeout. */
    boolean heartbeat(Lease lease);

    /** Returns every message whose lease has expired to the queue; returns how many. */
    int reapExpiredLeases();

    /** Messages waiting for delivery, leased ones excluded. */
    int length();

    int inFlight();
}
