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

package dev.mars.qrtx.runtime.simulator;

import dev.mars.qrtx.backend.BackendExecutor;
import dev.mars.qrtx.backend.ExecutionRequest;
import dev.mars.qrtx.backend.ExecutionResult;
import dev.mars.qrtx.core.exceptions.BackendExecutionException;
import dev.mars.qrtx.core.exceptions.ExecutionFailureCause;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory quantum backend.
 *
 * <p>Counts are a pure function of payload and shot count. Failures can be scripted per call;
 * executions can be held open until {@link #releaseHeld()} to observe in-flight behaviour.</p>
 *
 * <pre>{@code
 * SimulatedBackend backend = new SimulatedBackend(vertx);
 * backend.failNext(ExecutionFailureCause.RESOURCE_BUSY, 2);
 * }</pre>
 */
public class SimulatedBackend implements BackendExecutor {

    private static final Logger log = LoggerFactory.getLogger(SimulatedBackend.class);

    private final Vertx vertx;
    private final Queue<ExecutionFailureCause> scriptedFailures = new ConcurrentLinkedQueue<>();
    private final List<ExecutionRequest> requests = new CopyOnWriteArrayList<>();
    private final List<String> cancelled = new CopyOnWriteArrayList<>();
    private final Map<String, Held> held = new ConcurrentHashMap<>();
    private volatile long latencyMs;
    private volatile boolean holding;

    public SimulatedBackend(Vertx vertx) {
        this.vertx = vertx;
    }

    public SimulatedBackend withLatency(long latencyMs) {
        this.latencyMs = latencyMs;
        return this;
    }

    /**
     * The next {@code times} executions fail with {@code cause}.
     */
    public void failNext(ExecutionFailureCause cause, int times) {
        for (int i = 0; i < times; i++) {
            scriptedFailures.add(cause);
        }
    }

    /**
     * Keep later executions open until {@link #releaseHeld()}.
     */
    public void holdExecutions() {
        holding = true;
    }

    /**
     * Complete every held execution and stop holding new ones.
     */
    public void releaseHeld() {
        holding = false;
        for (String executionId : new ArrayList<>(held.keySet())) {
            Held execution = held.remove(executionId);
            if (execution != null) {
                execution.promise().tryComplete(resultFor(execution.request()));
            }
        }
    }

    public int heldCount() {
        return held.size();
    }

    public List<ExecutionRequest> getRequests() {
        return List.copyOf(requests);
    }

    public List<String> getCancelled() {
        return List.copyOf(cancelled);
    }

    @Override
    public Future<ExecutionResult> execute(ExecutionRequest request) {
        requests.add(request);
        ExecutionFailureCause failure = scriptedFailures.poll();
        if (failure != null) {
            log.debug("Execution {} failing with {}", request.executionId(), failure);
            return Future.failedFuture(new BackendExecutionException(failure, request.resource().getId(),
                    "Simulated " + failure));
        }
        Promise<ExecutionResult> promise = Promise.promise();
        if (holding) {
            held.put(request.executionId(), new Held(request, promise));
            log.debug("Holding execution {}", request.executionId());
        } else if (latencyMs > 0) {
            vertx.setTimer(latencyMs, id -> promise.tryComplete(resultFor(request)));
        } else {
            promise.complete(resultFor(request));
        }
        return promise.future();
    }

    @Override
    public void cancel(String executionId) {
        log.debug("Cancel requested for {}", executionId);
        cancelled.add(executionId);
    }

    /**
     * Two-outcome distribution whose split depends only on payload and shots.
     */
    static ExecutionResult resultFor(ExecutionRequest request) {
        int shots = request.shots();
        int seed = Math.floorMod(request.payload().hashCode(), Math.max(1, shots / 4) + 1);
        long zeros = shots / 2 + seed - (long) (shots / 8);
        zeros = Math.max(0, Math.min(shots, zeros));
        Map<String, Long> counts = new TreeMap<>();
        counts.put("00", zeros);
        counts.put("11", shots - zeros);
        return new ExecutionResult(counts, new JsonObject().put("backend", "simulator"));
    }

    private record Held(ExecutionRequest request, Promise<ExecutionResult> promise) {
    }
}
