/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.ferryman.internal;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Holds the engine link that session input is routed to.
 *
 * <p>Routing reads the link under the read lock for the whole of a forward, and attach and
 * detach replace it under the write lock, so a forward can never reach an engine that is
 * half attached or has just been detached.</p>
 */
public class EngineSlot {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private @Nullable EngineLink current;

    /**
     * Run {@code action} with the current link, holding the read lock.
     *
     * @param action receives the link, or null if none is attached
     * @return the action's result
     */
    public <T> T withLink(Function<EngineLink, T> action) {
        lock.readLock().lock();
        try {
            return action.apply(current);
        }
        finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return true if {@code link} is attached and not draining
     */
    public static boolean isAccepting(@Nullable EngineLink link) {
        return link != null && !link.isDraining();
    }

    @Nullable
    public EngineLink current() {
        lock.readLock().lock();
        try {
            return current;
        }
        finally {
            lock.readLock().unlock();
        }
    }

    void attach(EngineLink link) {
        lock.writeLock().lock();
        try {
            current = link;
        }
        finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stop routing input to {@code link} while it shuts down. Input already forwarded is
     * ahead of anything the caller sends afterwards.
     *
     * @return false if the slot no longer holds {@code link}
     */
    boolean drain(EngineLink link) {
        lock.writeLock().lock();
        try {
            if (current != link) {
                return false;
            }
            link.markDraining();
            return true;
        }
        finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Clear the slot if it still holds {@code link}.
     *
     * @return true if the slot was cleared
     */
    boolean detach(EngineLink link) {
        lock.writeLock().lock();
        try {
            if (current != link) {
                return false;
            }
            current = null;
            return true;
        }
        finally {
            lock.writeLock().unlock();
        }
    }
}
