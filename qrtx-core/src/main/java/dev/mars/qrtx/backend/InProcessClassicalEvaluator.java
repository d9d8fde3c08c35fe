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

package dev.mars.qrtx.backend;

import dev.mars.qrtx.core.exceptions.ClassicalEvaluationException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of named {@link ClassicalFunction}s, evaluated on the Vert.x worker pool so
 * that long computations never block the event loop.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class InProcessClassicalEvaluator implements ClassicalEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(InProcessClassicalEvaluator.class);

    private final Vertx vertx;
    private final Map<String, ClassicalFunction> functions = new ConcurrentHashMap<>();

    public InProcessClassicalEvaluator(Vertx vertx) {
        this.vertx = vertx;
    }

    public InProcessClassicalEvaluator register(String name, ClassicalFunction function) {
        if (functions.putIfAbsent(name, function) != null) {
            throw new IllegalStateException("Classical function already registered: " + name);
        }
        logger.debug("Registered classical function '{}'", name);
        return this;
    }

    public boolean isRegistered(String name) {
        return functions.containsKey(name);
    }

    public Set<String> registeredFunctions() {
        return Set.copyOf(functions.keySet());
    }

    @Override
    public Future<JsonObject> evaluate(String function, JsonObject inputs, Map<String, Object> parameters) {
        ClassicalFunction fn = functions.get(function);
        if (fn == null) {
            return Future.failedFuture(new ClassicalEvaluationException(function,
                    "Unknown classical function: " + function));
        }
        return vertx.executeBlocking(() -> {
            JsonObject result;
            try {
                result = fn.apply(inputs.copy(), parameters);
            } catch (Exception e) {
                throw new ClassicalEvaluationException(function,
                        "Classical function '" + function + "' failed: " + e.getMessage(), e);
            }
            if (result == null) {
                throw new ClassicalEvaluationException(function,
                        "Classical function '" + function + "' returned no result");
            }
            return result;
        }, false);
    }
}
