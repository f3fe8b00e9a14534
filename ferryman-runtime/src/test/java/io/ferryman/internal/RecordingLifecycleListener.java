/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.internal;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingLifecycleListener implements EngineLifecycleListener {

    final List<EngineLink> attached = new CopyOnWriteArrayList<>();
    final List<String> detached = new CopyOnWriteArrayList<>();

    @Override
    public void engineAttached(EngineLink link) {
        attached.add(link);
    }

    @Override
    public void engineDetached(EngineLink link, boolean clean) {
        detached.add(link.generation() + (clean ? ":clean" : ":crash"));
    }
}
