package me.golemcore.proxy.domain.election;


/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal for one leadership term. Created when a replica becomes
 * leader and cancelled, exactly once, when it stops being leader. Work started
 * under leadership checks {@link #isCancelled()} before each unit of work.
 */
@Slf4j
public final class LeadershipContext {

    private final String identity;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch done = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public LeadershipContext(String identity) {
        this.identity = identity;
    }

    public String getIdentity() {
        return identity;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Register a listener run on cancellation. Runs immediately if the context
     * is already cancelled.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            runListener(listener);
        }
    }

    /**
     * Cancel the context. Only the first call has an effect.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        done.countDown();
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                runListener(listener);
            }
        }
    }

    /**
     * Block until the context is cancelled or the timeout elapses.
     *
     * @return {@code true} if cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("[LeaderElection] Cancellation listener failed", e);
        }
    }
}
