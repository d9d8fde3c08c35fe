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

package dev.mars.qrtx.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declarative description of one node of a workflow graph, as produced by the
 * intermediate representation. A definition is immutable; per-execution data
 * (attempts, allocation, output references) lives with the pipeline driver.
 *
 * <p>Exactly one of the kind-specific blocks ({@link #getCompile()},
 * {@link #getQuantum()}, {@link #getClassical()}) is expected to be present and to
 * match {@link #getKind()}. The graph builder reports a mismatch as a validation
 * issue rather than failing construction here, so that every problem of a document
 * is reported at once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
@JsonDeserialize(builder = StageDefinition.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StageDefinition {

    private final String id;
    private final StageKind kind;
    private final List<String> dependsOn;
    private final List<String> inputs;
    private final List<String> outputs;
    private final ResourceConstraints constraints;
    private final RetryPolicy retry;
    private final Boolean checkpointable;
    private final CompileSpec compile;
    private final QuantumSpec quantum;
    private final ClassicalSpec classical;

    private StageDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Stage ID cannot be null");
        this.kind = Objects.requireNonNull(builder.kind, "Stage kind cannot be null");
        this.dependsOn = List.copyOf(builder.dependsOn);
        this.inputs = List.copyOf(builder.inputs);
        this.outputs = List.copyOf(builder.outputs);
        this.constraints = builder.constraints != null ? builder.constraints : ResourceConstraints.NONE;
        this.retry = builder.retry;
        this.checkpointable = builder.checkpointable;
        this.compile = builder.compile;
        this.quantum = builder.quantum;
        this.classical = builder.classical;
    }

    public static Builder builder(String id, StageKind kind) {
        return new Builder().id(id).kind(kind);
    }

    public String getId() {
        return id;
    }

    public StageKind getKind() {
        return kind;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    /**
     * Names of outputs this stage consumes; each must be produced by an ancestor.
     */
    public List<String> getInputs() {
        return inputs;
    }

    public List<String> getOutputs() {
        return outputs;
    }

    public ResourceConstraints getConstraints() {
        return constraints;
    }

    /**
     * @return the declared retry policy, or null when the orchestrator default applies
     */
    public RetryPolicy getRetry() {
        return retry;
    }

    public RetryPolicy effectiveRetry(RetryPolicy fallback) {
        return retry != null ? retry : fallback;
    }

    /**
     * @return the declared flag, or null when the kind default applies
     */
    public Boolean getCheckpointable() {
        return checkpointable;
    }

    public boolean shouldCheckpoint() {
        return checkpointable != null ? checkpointable : kind.isCheckpointableByDefault();
    }

    public CompileSpec getCompile() {
        return compile;
    }

    public QuantumSpec getQuantum() {
        return quantum;
    }

    public ClassicalSpec getClassical() {
        return classical;
    }

    /**
     * Copy of this definition with a replaced dependency list, used when deriving graphs.
     */
    public StageDefinition withDependsOn(List<String> newDependsOn) {
        return new Builder(this).dependsOn(newDependsOn).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StageDefinition that = (StageDefinition) o;
        return id.equals(that.id) && kind == that.kind
                && dependsOn.equals(that.dependsOn)
                && inputs.equals(that.inputs)
                && outputs.equals(that.outputs)
                && constraints.equals(that.constraints)
                && Objects.equals(retry, that.retry)
                && Objects.equals(checkpointable, that.checkpointable)
                && Objects.equals(compile, that.compile)
                && Objects.equals(quantum, that.quantum)
                && Objects.equals(classical, that.classical);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, dependsOn);
    }

    @Override
    public String toString() {
        return "StageDefinition{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", dependsOn=" + dependsOn +
                '}';
    }

    /**
     * Builder for StageDefinition instances.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String id;
        private StageKind kind;
        private List<String> dependsOn = new ArrayList<>();
        private List<String> inputs = new ArrayList<>();
        private List<String> outputs = new ArrayList<>();
        private ResourceConstraints constraints;
        private RetryPolicy retry;
        private Boolean checkpointable;
        private CompileSpec compile;
        private QuantumSpec quantum;
        private ClassicalSpec classical;

        public Builder() {
        }

        public Builder(StageDefinition existing) {
            this.id = existing.id;
            this.kind = existing.kind;
            this.dependsOn = new ArrayList<>(existing.dependsOn);
            this.inputs = new ArrayList<>(existing.inputs);
            this.outputs = new ArrayList<>(existing.outputs);
            this.constraints = existing.constraints;
            this.retry = existing.retry;
            this.checkpointable = existing.checkpointable;
            this.compile = existing.compile;
            this.quantum = existing.quantum;
            this.classical = existing.classical;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(StageKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn != null ? new ArrayList<>(dependsOn) : new ArrayList<>();
            return this;
        }


        public Builder inputs(List<String> inputs) {
            this.inputs = inputs != null ? new ArrayList<>(inputs) : new ArrayList<>();
            return this;
        }


        public Builder outputs(List<String> outputs) {
            this.outputs = outputs != null ? new ArrayList<>(outputs) : new ArrayList<>();
            return this;
        }


        public Builder constraints(ResourceConstraints constraints) {
            this.constraints = constraints;
            return this;
        }

        public Builder retry(RetryPolicy retry) {
            this.retry = retry;
            return this;
        }

        public Builder checkpointable(Boolean checkpointable) {
            this.checkpointable = checkpointable;
            return this;
        }

        public Builder compile(CompileSpec compile) {
            this.compile = compile;
            return this;
        }

        public Builder quantum(QuantumSpec quantum) {
            this.quantum = quantum;
            return this;
        }

        public Builder classical(ClassicalSpec classical) {
            this.classical = classical;
            return this;
        }

        public StageDefinition build() {
            return new StageDefinition(this);
        }
    }
}
