/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.ferryman.internal;

import java.time.Instant;
import java.util.Objects;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

import io.ferryman.protocol.ControlMessage;

/**
 * The gateway's end of the control connection to one attached engine instance.
 *
 * <p>Each attach gets a new, strictly increasing generation. Sessions remember the
 * generation they were last resynced to, which is how the router knows whether a session
 * still needs resyncing before its input may flow to this engine.</p>
 */
public class EngineLink {

    private final long generation;
    private final long pid;
    private final Channel channel;
    private final Instant attachedAt;

    private volatile boolean draining;
    private volatile boolean stopAnnounced;
    private volatile boolean cleanStop;

    public EngineLink(long generation, long pid, Channel channel, Instant attachedAt) {
        this.generation = generation;
        this.pid = pid;
        this.channel = Objects.requireNonNull(channel, "channel");
        this.attachedAt = Objects.requireNonNull(attachedAt, "attachedAt");
    }

    public long generation() {
        return generation;
    }

    public long pid() {
        return pid;
    }

    public Channel channel() {
        return channel;
    }

    public Instant attachedAt() {
        return attachedAt;
    }

    /**
     * Queue a message for the engine. Never blocks; ordering follows call order.
     */
    public void send(ControlMessage message) {
        channel.writeAndFlush(message, channel.voidPromise());
    }

    /**
     * Set, under the slot's write lock, once the engine has been asked to shut down. A
     * draining engine still gets disconnects for its sessions but no new input or sessions.
     */
    void markDraining() {
        this.draining = true;
    }

    public boolean isDraining() {
        return draining;
    }

    /**
     * Record the engine's {@code Stopping} announcement.
     */
    public void announceStopping(boolean clean) {
        this.cleanStop = clean;
        this.stopAnnounced = true;
    }

    /**
     * @return true if the engine said it is shutting down cleanly before the connection dropped
     */
    public boolean isCleanStop() {
        return stopAnnounced && cleanStop;
    }

    public boolean isStopAnnounced() {
        return stopAnnounced;
    }

    public void close() {
        if (channel.isActive()) {
            channel.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public String toString() {
        return "EngineLink{" +
                "generation=" + generation +
                ", pid=" + pid +
                ", draining=" + draining +
                ", remote=" + channel.remoteAddress() +
                ", stopAnnounced=" + stopAnnounced +
                ", cleanStop=" + cleanStop +
                '}';
    }
}
