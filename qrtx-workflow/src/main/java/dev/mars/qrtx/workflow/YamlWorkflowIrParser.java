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

package dev.mars.qrtx.workflow;

import dev.mars.qrtx.core.ClassicalSpec;
import dev.mars.qrtx.core.CompileSpec;
import dev.mars.qrtx.core.QuantumSpec;
import dev.mars.qrtx.core.QubitPair;
import dev.mars.qrtx.core.ResourceConstraints;
import dev.mars.qrtx.core.RetryPolicy;
import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.core.StageKind;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML-based implementation of {@link WorkflowIrParser}, using SnakeYAML with the safe
 * constructor.
 *
 * <pre>
 * metadata:
 *   name: vqe-iteration
 * spec:
 *   stages:
 *     - id: compile
 *       kind: compile
 *       outputs: [circuit]
 *       compile: { source: "...", sourceFormat: openqasm3, target: eagle }
 *     - id: execute
 *       kind: quantum
 *       dependsOn: [compile]
 *       inputs: [circuit]
 *       outputs: [counts]
 *       constraints: { qubits: 3, connectivity: [[0, 1], [1, 2]], minFidelity: 0.9, estimatedDuration: 2s }
 *       retry: { maxAttempts: 3, initialBackoff: 100ms, multiplier: 2, maxBackoff: 5s }
 *       quantum: { circuitInput: circuit, shots: 1024 }
 * </pre>
 *
 * <p>Structural problems (syntax, missing blocks, wrong types) are reported as
 * {@link WorkflowParseException} with the field path. Graph-level checks such as cycles
 * or unresolved inputs belong to {@link WorkflowGraphBuilder}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class YamlWorkflowIrParser implements WorkflowIrParser {

    private final Yaml yaml;

    public YamlWorkflowIrParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    @Override
    public WorkflowIr parse(Path yamlFile) throws WorkflowParseException {
        try {
            String content = Files.readString(yamlFile);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + yamlFile, e);
        }
    }

    @Override
    public WorkflowIr parseFromString(String yamlContent) throws WorkflowParseException {
        Object loaded;
        try {
            loaded = yaml.load(yamlContent);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        return parseWorkflow(asMap(loaded));
    }

    private WorkflowIr parseWorkflow(Map<String, Object> data) throws WorkflowParseException {
        Map<String, Object> metadata = getMapValue(data, "metadata", "metadata");
        if (metadata == null) {
            throw new WorkflowParseException("metadata", "Required block 'metadata' is missing");
        }
        String name = getStringValue(metadata, "name", null);
        if (name == null || name.isBlank()) {
            throw new WorkflowParseException("metadata.name", "Workflow name is required");
        }
        String version = getStringValue(metadata, "version", "1.0");
        Map<String, String> labels = parseLabels(getMapValue(metadata, "labels", "metadata.labels"));

        Map<String, Object> spec = getMapValue(data, "spec", "spec");
        if (spec == null) {
            throw new WorkflowParseException("spec", "Required block 'spec' is missing");
        }
        List<Object> stageList = getListValue(spec, "stages", "spec.stages");
        if (stageList == null || stageList.isEmpty()) {
            throw new WorkflowParseException("spec.stages", "At least one stage is required");
        }

        List<StageDefinition> stages = new ArrayList<>();
        for (int i = 0; i < stageList.size(); i++) {
            String path = "spec.stages[" + i + "]";
            Object item = stageList.get(i);
            if (!(item instanceof Map)) {
                throw new WorkflowParseException(path, "Stage must be a mapping");
            }
            stages.add(parseStage(asMap(item), path));
        }
        return new WorkflowIr(name, version, labels, stages);
    }

    private StageDefinition parseStage(Map<String, Object> data, String path) throws WorkflowParseException {
        String id = getStringValue(data, "id", null);
        if (id == null || id.isBlank()) {
            throw new WorkflowParseException(path + ".id", "Stage id is required");
        }
        String kindValue = getStringValue(data, "kind", null);
        if (kindValue == null) {
            throw new WorkflowParseException(path + ".kind", "Stage kind is required");
        }
        StageKind kind;
        try {
            kind = StageKind.fromString(kindValue);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".kind", e.getMessage());
        }

        StageDefinition.Builder builder = StageDefinition.builder(id, kind)
                .dependsOn(parseStringList(data, "dependsOn", path))
                .inputs(parseStringList(data, "inputs", path))
                .outputs(parseStringList(data, "outputs", path));

        Object checkpointable = data.get("checkpointable");
        if (checkpointable != null) {
            builder.checkpointable(Boolean.parseBoolean(checkpointable.toString()));
        }

        Map<String, Object> constraints = getMapValue(data, "constraints", path + ".constraints");
        if (constraints != null) {
            builder.constraints(parseConstraints(constraints, path + ".constraints"));
        }
        Map<String, Object> retry = getMapValue(data, "retry", path + ".retry");
        if (retry != null) {
            builder.retry(parseRetry(retry, path + ".retry"));
        }

        Map<String, Object> compile = getMapValue(data, "compile", path + ".compile");
        if (compile != null) {
            builder.compile(new CompileSpec(
                    getStringValue(compile, "source", null),
                    getStringValue(compile, "sourceFormat", null),
                    getStringValue(compile, "target", null),
                    getMapValue(compile, "options", path + ".compile.options")));
        }
        Map<String, Object> quantum = getMapValue(data, "quantum", path + ".quantum");
        if (quantum != null) {
            int shots = getIntValue(quantum, "shots", 1024, path + ".quantum.shots");
            try {
                builder.quantum(new QuantumSpec(
                        getStringValue(quantum, "circuitInput", null),
                        getStringValue(quantum, "payload", null),
                        shots,
                        getMapValue(quantum, "options", path + ".quantum.options")));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(path + ".quantum", e.getMessage());
            }
        }
        Map<String, Object> classical = getMapValue(data, "classical", path + ".classical");
        if (classical != null) {
            builder.classical(new ClassicalSpec(
                    getStringValue(classical, "function", null),
                    getMapValue(classical, "parameters", path + ".classical.parameters")));
        }
        return builder.build();
    }

    private ResourceConstraints parseConstraints(Map<String, Object> data, String path) throws WorkflowParseException {
        int qubits = getIntValue(data, "qubits", 0, path + ".qubits");
        List<QubitPair> connectivity = new ArrayList<>();
        List<Object> pairs = getListValue(data, "connectivity", path + ".connectivity");
        if (pairs != null) {
            for (int i = 0; i < pairs.size(); i++) {
                Object pair = pairs.get(i);
                if (!(pair instanceof List) || ((List<?>) pair).size() != 2) {
                    throw new WorkflowParseException(path + ".connectivity[" + i + "]",
                            "Coupling must be a pair of qubit indices");
                }
                List<?> ends = (List<?>) pair;
                try {
                    connectivity.add(new QubitPair(toInt(ends.get(0)), toInt(ends.get(1))));
                } catch (IllegalArgumentException e) {
                    throw new WorkflowParseException(path + ".connectivity[" + i + "]", e.getMessage());
                }
            }
        }
        double minFidelity = getDoubleValue(data, "minFidelity", 0.0, path + ".minFidelity");
        String format = getStringValue(data, "format", null);
        long duration = parseDurationMs(data.get("estimatedDuration"), 0, path + ".estimatedDuration");
        try {
            return new ResourceConstraints(qubits, connectivity, minFidelity, format, duration);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage());
        }
    }

    private RetryPolicy parseRetry(Map<String, Object> data, String path) throws WorkflowParseException {
        RetryPolicy d = RetryPolicy.DEFAULT;
        int maxAttempts = getIntValue(data, "maxAttempts", d.maxAttempts(), path + ".maxAttempts");
        long initial = parseDurationMs(data.get("initialBackoff"), d.initialBackoffMs(), path + ".initialBackoff");
        double multiplier = getDoubleValue(data, "multiplier", d.multiplier(), path + ".multiplier");
        long max = parseDurationMs(data.get("maxBackoff"), Math.max(d.maxBackoffMs(), initial), path + ".maxBackoff");
        double jitter = getDoubleValue(data, "jitter", 0.0, path + ".jitter");
        try {
            return new RetryPolicy(maxAttempts, initial, multiplier, max, jitter);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage());
        }
    }

    /**
     * Accepts {@code 250ms}, {@code 30s}, {@code 5m}, {@code 2h} or a bare number of milliseconds.
     */
    static long parseDurationMs(Object value, long defaultValue, String path) throws WorkflowParseException {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        String trimmed = value.toString().trim().toLowerCase();
        try {
            if (trimmed.endsWith("ms")) {
                return Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim());
            } else if (trimmed.endsWith("s")) {
                return Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()) * 1000;
            } else if (trimmed.endsWith("m")) {
                return Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()) * 60_000;
            } else if (trimmed.endsWith("h")) {
                return Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()) * 3_600_000;
            }
            return Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path, "Invalid duration: " + value);
        }
    }

    // Utility methods for safe type conversion
    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private Map<String, Object> getMapValue(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(path, "Expected a mapping");
        }
        return new LinkedHashMap<>(asMap(value));
    }

    @SuppressWarnings("unchecked")
    private List<Object> getListValue(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException(path, "Expected a list");
        }
        return (List<Object>) value;
    }

    private List<String> parseStringList(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        List<Object> values = getListValue(data, key, path + "." + key);
        if (values == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : values) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private int getIntValue(Map<String, Object> data, String key, int defaultValue, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return toInt(value);
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path, "Expected an integer but got: " + value);
        }
    }

    private double getDoubleValue(Map<String, Object> data, String key, double defaultValue, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path, "Expected a number but got: " + value);
        }
    }

    private static int toInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }

    private Map<String, String> parseLabels(Map<String, Object> data) {
        if (data == null) {
            return Map.of();
        }
        Map<String, String> labels = new LinkedHashMap<>();
        data.forEach((k, v) -> labels.put(k, String.valueOf(v)));
        return labels;
    }
}
