/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.session;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded FIFO of client input held while no engine is attached.
 * Not thread safe; {@link Session} guards it with its own monitor.
 */
public class PendingInput {

    /**
     * Outcome of {@link #offer(byte[])}.
     */
    public enum Offer {
        QUEUED,
        /** Queued after evicting the oldest entry. */
        QUEUED_DROPPED_OLDEST,
        REJECTED
    }

    private final int capacity;
    private final OverflowPolicy policy;
    private final ArrayDeque<byte[]> queue = new ArrayDeque<>();

    public PendingInput(int capacity, OverflowPolicy policy) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public Offer offer(byte[] input) {
        if (queue.size() < capacity) {
            queue.addLast(input);
            return Offer.QUEUED;
        }
        if (policy == OverflowPolicy.REJECT_NEW) {
            return Offer.REJECTED;
        }
        queue.removeFirst();
        queue.addLast(input);
        return Offer.QUEUED_DROPPED_OLDEST;
    }

    /**
     * @return everything queued, oldest first; the queue is left empty
     */
    public List<byte[]> drain() {
        List<byte[]> drained = new ArrayList<>(queue);
        queue.clear();
        return drained;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public OverflowPolicy policy() {
        return policy;
    }
}
