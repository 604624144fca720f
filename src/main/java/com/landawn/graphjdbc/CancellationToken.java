/*
 * Copyright (c) 2025, Haiyang Li.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.landawn.graphjdbc;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;

/**
 * Cooperative cancellation signal passed to asynchronous and streaming executions.
 * Callbacks registered with {@link #onCancel(Runnable)} run on the thread that calls {@link #cancel()}.
 */
public final class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;

    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    private volatile boolean cancelled;

    private CancellationToken(final boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Requests cancellation and runs the registered callbacks. Calling it again has no effect.
     *
     * @throws UnsupportedOperationException on {@link #NONE}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE can't be cancelled");
        }

        synchronized (this) {
            if (cancelled) {
                return;
            }

            cancelled = true;
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Cancellation requested, running {} callback(s)", callbacks.size());
        }

        RuntimeException failure = null;

        for (final Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (final RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        callbacks.clear();

        if (failure != null) {
            throw failure;
        }
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * @throws CancellationException if cancellation has been requested
     */
    public void throwIfCancellationRequested() throws CancellationException {
        if (cancelled) {
            throw new CancellationException("Operation was cancelled");
        }
    }

    /**
     * Registers {@code callback} to run on cancellation. If cancellation was already requested it runs immediately.
     *
     * @param callback the action
     * @return a registration whose {@code close()} removes the callback
     */
    public Registration onCancel(final Runnable callback) {
        N.checkArgNotNull(callback, "callback");

        if (!cancellable) {
            return Registration.EMPTY;
        }

        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> callbacks.remove(callback);
            }
        }

        callback.run();

        return Registration.EMPTY;
    }

    /**
     * Handle returned by {@link CancellationToken#onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        Registration EMPTY = () -> {
            // nothing registered.
        };

        @Override
        void close();
    }
}
