package com.sharedsolve.store;

import com.sharedsolve.extraction.ComponentResult;
import com.sharedsolve.fingerprint.TaskFingerprint;

import java.time.Duration;
import java.util.Optional;

/**
 * Time-bounded cache of solutions shared between sibling nodes.
 *
 * <p>The store is advisory. No operation throws on connectivity problems: writes report
 * {@code false} and reads report an empty result, so every caller keeps a local path.</p>
 */
public interface SharedSolutionStore {

    /**
     * Publishes a payload under the fingerprint, replacing any earlier entry.
     *
     * @param fingerprint The task identity.
     * @param payload The extracted result to share.
     * @param ttl How long the entry stays readable.
     * @return {@code true} when the write was accepted.
     */
    boolean put(TaskFingerprint fingerprint, ComponentResult payload, Duration ttl);

    /**
     * Reads the full entry, including when it was stored.
     *
     * @param fingerprint The task identity.
     * @return The entry, or empty when missing, expired, unreadable or the store is down.
     */
    Optional<SharedSolutionEntry> find(TaskFingerprint fingerprint);

    /**
     * Reads the payload published for the fingerprint.
     *
     * @param fingerprint The task identity.
     * @return The payload, or empty when missing, expired, unreadable or the store is down.
     */
    default Optional<ComponentResult> get(TaskFingerprint fingerprint) {
        return find(fingerprint).map(SharedSolutionEntry::payload);
    }

    /**
     * Polls {@link #get(TaskFingerprint)} until a payload shows up or the timeout elapses.
     * Staleness is bounded by the poll interval.
     *
     * @param fingerprint The task identity.
     * @param timeout Upper bound on the wait.
     * @param pollInterval Delay between reads.
     * @return The payload, or empty after the timeout.
     */
    Optional<ComponentResult> waitFor(TaskFingerprint fingerprint, Duration timeout, Duration pollInterval);

    /**
     * Removes the entry. Expiry makes this optional for correctness.
     *
     * @param fingerprint The task identity.
     * @return {@code true} when the delete was sent.
     */
    boolean delete(TaskFingerprint fingerprint);

    /**
     * @return {@code true} when the store answers a health check.
     */
    boolean isAvailable();
}
