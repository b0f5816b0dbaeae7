package io.github.goodees.esp.core.subscription;

/*-
 * #%L
 * esp
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Coordinates lifecycle of subscriptions sharing a shutdown flag.
 *
 * <p>Shutdown is cooperative. {@link #requestShutdown()} only sets the flag and wakes up waiting subscriptions;
 * subscriptions check the flag between batches and while waiting for new events, finish the batch they are
 * processing and stop.
 */
public class SubscriptionMaster {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionMaster.class);

    private final AtomicBoolean shutdownRequested = new AtomicBoolean();
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final List<Runnable> shutdownListeners = new CopyOnWriteArrayList<>();
    private final Set<String> activeSubscriptions = ConcurrentHashMap.newKeySet();
    private final Object activityMonitor = new Object();

    /**
     * Handle for removing a shutdown listener.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Ask all subscriptions of this master to stop at their next safe point. Subsequent calls have no effect.
     */
    public void requestShutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            logger.info("Shutdown requested, active subscriptions: {}", activeSubscriptions);
            shutdownLatch.countDown();
            for (Runnable listener : shutdownListeners) {
                listener.run();
            }
        }
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    /**
     * Wait until shutdown is requested or timeout expires.
     * @param timeout maximum time to wait
     * @return true if shutdown was requested
     * @throws InterruptedException when the waiting thread is interrupted
     */
    public boolean awaitShutdown(Duration timeout) throws InterruptedException {
        return shutdownLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Register a callback to run when shutdown is requested. If shutdown was already requested, it runs immediately.
     * Callbacks should only wake up waiting threads.
     * @param listener the callback
     * @return registration to remove the callback
     */
    public Registration onShutdownRequested(Runnable listener) {
        shutdownListeners.add(listener);
        if (isShutdownRequested()) {
            listener.run();
        }
        return () -> shutdownListeners.remove(listener);
    }

    /**
     * Mark a subscription as running.
     * @param subscriptionId id of subscription, usually the processor name
     * @throws IllegalStateException when subscription with same id is already running
     */
    public void subscriptionStarted(String subscriptionId) {
        if (!activeSubscriptions.add(subscriptionId)) {
            throw new IllegalStateException("Subscription " + subscriptionId + " is already running");
        }
    }

    public void subscriptionStopped(String subscriptionId) {
        synchronized (activityMonitor) {
            activeSubscriptions.remove(subscriptionId);
            activityMonitor.notifyAll();
        }
    }

    public Set<String> activeSubscriptions() {
        return Collections.unmodifiableSet(new HashSet<>(activeSubscriptions));
    }

    /**
     * Wait until no subscription of this master is running.
     * @param timeout maximum time to wait
     * @return true if all subscriptions stopped within the timeout
     * @throws InterruptedException when the waiting thread is interrupted
     */
    public boolean awaitSubscriptionsStopped(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (activityMonitor) {
            while (!activeSubscriptions.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(activityMonitor, remaining);
            }
            return true;
        }
    }
}
