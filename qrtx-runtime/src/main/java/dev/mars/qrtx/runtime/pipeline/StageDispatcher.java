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

package dev.mars.qrtx.runtime.pipeline;

import dev.mars.qrtx.backend.CompilationResult;
import dev.mars.qrtx.backend.ExecutionRequest;
import dev.mars.qrtx.backend.ExecutionResult;
import dev.mars.qrtx.core.ClassicalSpec;
import dev.mars.qrtx.core.CompileSpec;
import dev.mars.qrtx.core.QuantumSpec;
import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.core.exceptions.BackendExecutionException;
import dev.mars.qrtx.core.exceptions.ClassicalEvaluationException;
import dev.mars.qrtx.core.exceptions.ExecutionFailureCause;
import dev.mars.qrtx.resource.ResourceDescriptor;
import dev.mars.qrtx.scheduler.ResourceAllocation;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Hands one stage attempt to the collaborator for its kind and turns the reply into the
 * stage's output bundle: a JSON object with one entry per declared output.
 *
 * <ul>
 *   <li>COMPILE: each output holds {@code {payload, format, metadata}}</li>
 *   <li>QUANTUM: each output holds {@code {counts, shots, resourceId, metadata}}</li>
 *   <li>CLASSICAL: each output holds the value of the same name returned by the function</li>
 * </ul>
 */
class StageDispatcher {

    private final Collaborators collaborators;

    StageDispatcher(Collaborators collaborators) {
        this.collaborators = collaborators;
    }

    /**
     * @param inputs      values of the stage's declared inputs
     * @param allocation  reserved allocation for QUANTUM stages, null otherwise
     * @param resource    allocated resource for QUANTUM stages, null otherwise
     * @param executionId identifier of this attempt, used for cancellation
     */
    Future<JsonObject> dispatch(StageDefinition stage, JsonObject inputs, ResourceAllocation allocation,
                                ResourceDescriptor resource, String executionId) {
        return switch (stage.getKind()) {
            case COMPILE -> compile(stage);
            case QUANTUM -> execute(stage, inputs, allocation, resource, executionId);
            case CLASSICAL -> evaluate(stage, inputs);
        };
    }

    /**
     * Forward a best-effort stop request for an in-flight quantum execution.
     */
    void cancel(String executionId) {
        collaborators.backend().cancel(executionId);
    }

    private Future<JsonObject> compile(StageDefinition stage) {
        CompileSpec spec = stage.getCompile();
        return collaborators.compiler().compile(spec.source(), spec.target(), spec.options())
                .map(result -> bundle(stage, result));
    }

    private static JsonObject bundle(StageDefinition stage, CompilationResult result) {
        JsonObject outputs = new JsonObject();
        for (String output : stage.getOutputs()) {
            outputs.put(output, result.toJson());
        }
        return outputs;
    }

    private Future<JsonObject> execute(StageDefinition stage, JsonObject inputs, ResourceAllocation allocation,
                                       ResourceDescriptor resource, String executionId) {
        QuantumSpec spec = stage.getQuantum();
        String payload;
        String format;
        if (spec.hasInlinePayload()) {
            payload = spec.payload();
            format = stage.getConstraints().payloadFormat();
        } else {
            Object compiled = inputs.getValue(spec.circuitInput());
            if (!(compiled instanceof JsonObject) || ((JsonObject) compiled).getString("payload") == null) {
                return Future.failedFuture(new BackendExecutionException(ExecutionFailureCause.UNSUPPORTED_FORMAT,
                        resource.getId(), "Input '" + spec.circuitInput() + "' does not hold a compiled circuit"));
            }
            JsonObject circuit = (JsonObject) compiled;
            payload = circuit.getString("payload");
            format = circuit.getString("format", stage.getConstraints().payloadFormat());
        }
        ExecutionRequest request = new ExecutionRequest(executionId, payload, format, resource, spec.shots(),
                spec.options(), allocation.getQubitMapping());
        return collaborators.backend().execute(request).map(result -> bundle(stage, result, resource));
    }

    private static JsonObject bundle(StageDefinition stage, ExecutionResult result, ResourceDescriptor resource) {
        JsonObject outputs = new JsonObject();
        for (String output : stage.getOutputs()) {
            outputs.put(output, new JsonObject()
                    .put("counts", result.countsAsJson())
                    .put("shots", result.totalShots())
                    .put("resourceId", resource.getId())
                    .put("metadata", result.metadata().copy()));
        }
        return outputs;
    }

    private Future<JsonObject> evaluate(StageDefinition stage, JsonObject inputs) {
        ClassicalSpec spec = stage.getClassical();
        return collaborators.evaluator().evaluate(spec.function(), inputs, spec.parameters())
                .compose(result -> {
                    JsonObject outputs = new JsonObject();
                    for (String output : stage.getOutputs()) {
                        if (!result.containsKey(output)) {
                            return Future.failedFuture(new ClassicalEvaluationException(spec.function(),
                                    "Function '" + spec.function() + "' did not produce output '" + output + "'"));
                        }
                        outputs.put(output, result.getValue(output));
                    }
                    return Future.succeededFuture(outputs);
                });
    }
}
