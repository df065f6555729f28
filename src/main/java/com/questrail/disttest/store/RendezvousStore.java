package com.questrail.disttest.store;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * RendezvousStore
 * -----------------------------------------------------------------------------
 * Minimal key/value port shared by every participant of one rendezvous.
 *
 * <p>Values are opaque bytes except for counters maintained through
 * {@link #add(String, long)}, which are stored as decimal text. Participants
 * withdraw their own keys with {@link #remove(String)} when an attempt fails;
 * otherwise the whole store is discarded once the last participant leaves.</p>
 *
 * <p>Every blocking call takes an explicit timeout and fails with
 * {@link com.questrail.disttest.error.RendezvousException} when it elapses.</p>
 */
public interface RendezvousStore
{
    void set(String key, byte[] value);

    /**
     * Remove {@code key}; absent keys are left as they are.
     */
    void remove(String key);

    Optional<byte[]> tryGet(String key);

    /**
     * Block until {@code key} is present, then return its latest value.
     */
    byte[] get(String key, Duration timeout);

    /**
     * Atomically add {@code delta} to the counter at {@code key} (absent counts
     * as zero) and return the new value.
     */
    long add(String key, long delta);

    boolean check(Collection<String> keys);

    /**
     * Block until every key in {@code keys} is present.
     */
    void await(Collection<String> keys, Duration timeout);

    /**
     * Block until the counter at {@code key} reaches at least {@code target}.
     *
     * @return the observed counter value
     */
    long awaitCount(String key, long target, Duration timeout);

    /**
     * Latest value of every key starting with {@code prefix}, in first-write order.
     */
    Map<String, byte[]> entriesWithPrefix(String prefix);
}
