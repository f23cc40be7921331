package dev.taskgate.loopguard;

/**
 * Remembers the external ids of comments/messages this system posted, so the webhooks
 * they cause are not turned into new tasks. Entries expire after a TTL.
 */
public interface LoopGuard {

    void recordSelfPosted(String externalId);

    /** False for null/blank ids and for entries older than the TTL. */
    boolean isSelfPosted(String externalId);
}
