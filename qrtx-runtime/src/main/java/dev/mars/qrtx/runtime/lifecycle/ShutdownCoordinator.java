/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.qrtx.runtime.lifecycle;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Orderly stop of an orchestrator.
 *
 * <p>Phases run in declaration order of {@link Phase}; hooks within a phase run sequentially
 * in registration order. A hook that fails or exceeds its phase timeout is logged and
 * recorded in {@link #getFailedHooks()}, and shutdown moves on.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class ShutdownCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

    public enum Phase {
        /** Stop admitting jobs. */
        DRAIN,
        /** Let admitted jobs reach a terminal state. */
        AWAIT_COMPLETION,
        /** Cancel timers and background sweeps. */
        STOP_SERVICES,
        /** Flush persisted records and release collaborators. */
        CLOSE_RESOURCES
    }

    public enum State {
        RUNNING,
        DRAINING,
        SHUTTING_DOWN,
        STOPPED
    }

    private final long drainTimeoutMs;
    private final long completionTimeoutMs;
    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final Map<Phase, List<Hook>> hooks = new EnumMap<>(Phase.class);
    private final List<String> failedHooks = new CopyOnWriteArrayList<>();
    private final Promise<Void> completion = Promise.promise();

    /**
     * @param drainTimeoutMs timeout for each {@link Phase#DRAIN} hook
     * @param completionTimeoutMs timeout for each hook of the later phases
     */
    public ShutdownCoordinator(long drainTimeoutMs, long completionTimeoutMs) {
        if (drainTimeoutMs <= 0 || completionTimeoutMs <= 0) {
            throw new IllegalArgumentException("Shutdown timeouts must be positive");
        }
        this.drainTimeoutMs = drainTimeoutMs;
        this.completionTimeoutMs = completionTimeoutMs;
        for (Phase phase : Phase.values()) {
            hooks.put(phase, new ArrayList<>());
        }
    }

    public State getState() {
        return state.get();
    }

    public boolean isAcceptingWork() {
        return state.get() == State.RUNNING;
    }

    /**
     * Names of hooks that failed or timed out, in the order they ran.
     */
    public List<String> getFailedHooks() {
        return Collections.unmodifiableList(failedHooks);
    }

    public synchronized ShutdownCoordinator register(Phase phase, String name, Supplier<Future<Void>> hook) {
        if (state.get() != State.RUNNING) {
            throw new IllegalStateException("Cannot register shutdown hook '" + name + "' after shutdown started");
        }
        hooks.get(phase).add(new Hook(name, hook));
        return this;
    }

    /**
     * Run all phases. Idempotent: later calls return the same completion.
     */
    public Future<Void> shutdown() {
        if (!state.compareAndSet(State.RUNNING, State.DRAINING)) {
            logger.debug("Shutdown already in progress ({})", state.get());
            return completion.future();
        }
        logger.info("Shutting down (drain timeout {} ms, completion timeout {} ms)", drainTimeoutMs, completionTimeoutMs);
        Future<Void> chain = Future.succeededFuture();
        for (Phase phase : Phase.values()) {
            chain = chain.compose(v -> runPhase(phase));
        }
        chain.onComplete(ar -> {
            state.set(State.STOPPED);
            if (failedHooks.isEmpty()) {
                logger.info("Shutdown complete");
            } else {
                logger.warn("Shutdown complete with failed hooks: {}", failedHooks);
            }
            completion.tryComplete();
        });
        return completion.future();
    }

    private Future<Void> runPhase(Phase phase) {
        if (phase == Phase.STOP_SERVICES) {
            state.set(State.SHUTTING_DOWN);
        }
        List<Hook> phaseHooks;
        synchronized (this) {
            phaseHooks = List.copyOf(hooks.get(phase));
        }
        logger.debug("Shutdown phase {} ({} hooks)", phase, phaseHooks.size());
        long timeoutMs = phase == Phase.DRAIN ? drainTimeoutMs : completionTimeoutMs;
        Future<Void> chain = Future.succeededFuture();
        for (Hook hook : phaseHooks) {
            chain = chain.compose(v -> runHook(phase, hook, timeoutMs));
        }
        return chain;
    }

    private Future<Void> runHook(Phase phase, Hook hook, long timeoutMs) {
        Future<Void> result;
        try {
            result = hook.action().get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result
                .timeout(timeoutMs, TimeUnit.MILLISECONDS)
                .recover(err -> {
                    logger.warn("Shutdown hook '{}' in phase {} failed: {}", hook.name(), phase, err.getMessage());
                    failedHooks.add(hook.name());
                    return Future.succeededFuture();
                });
    }

    private record Hook(String name, Supplier<Future<Void>> action) {
    }
}
