/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SerialExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void tasksRunInSubmissionOrder() throws Exception {
        SerialExecutor executor = new SerialExecutor(pool);
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(200);

        for (int i = 0; i < 200; i++) {
            int n = i;
            executor.execute(() -> {
                order.add(n);
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 200; i++) {
            assertEquals(i, order.get(i));
        }
    }

    @Test
    void tasksNeverOverlap() throws Exception {
        SerialExecutor executor = new SerialExecutor(pool);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(50);

        for (int i = 0; i < 50; i++) {
            executor.execute(() -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                Thread.yield();
                active.decrementAndGet();
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(1, maxActive.get());
    }

    @Test
    void failingTaskDoesNotStopLaterTasks() throws Exception {
        SerialExecutor executor = new SerialExecutor(pool);
        CountDownLatch done = new CountDownLatch(1);

        executor.execute(() -> {
            throw new IllegalStateException("boom");
        });
        executor.execute(done::countDown);

        assertTrue(done.await(5, TimeUnit.SECONDS));
    }
}
