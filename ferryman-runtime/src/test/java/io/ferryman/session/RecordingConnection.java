/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.session;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Client connection double that records what the gateway sends it.
 */
public class RecordingConnection implements ClientConnection {

    private final List<byte[]> delivered = new CopyOnWriteArrayList<>();
    private final List<String> notices = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile String closeReason;

    @Override
    public void deliver(byte[] payload) {
        delivered.add(payload);
    }

    @Override
    public void sendNotice(String text) {
        notices.add(text);
    }

    @Override
    public void close(String reason) {
        open = false;
        closeReason = reason;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public List<String> deliveredText() {
        return delivered.stream().map(bytes -> new String(bytes, StandardCharsets.UTF_8)).toList();
    }

    public List<String> notices() {
        return notices;
    }

    public String closeReason() {
        return closeReason;
    }
}
