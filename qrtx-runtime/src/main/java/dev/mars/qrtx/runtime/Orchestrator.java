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

package dev.mars.qrtx.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.qrtx.backend.BackendExecutor;
import dev.mars.qrtx.backend.CircuitCompiler;
import dev.mars.qrtx.backend.ClassicalEvaluator;
import dev.mars.qrtx.config.QrtxConfiguration;
import dev.mars.qrtx.core.JobPriority;
import dev.mars.qrtx.core.JsonMappers;
import dev.mars.qrtx.runtime.checkpoint.CheckpointCoordinator;
import dev.mars.qrtx.runtime.checkpoint.ResumePoint;
import dev.mars.qrtx.runtime.events.JobEvent;
import dev.mars.qrtx.runtime.events.JobEventFeed;
import dev.mars.qrtx.runtime.lifecycle.ShutdownCoordinator;
import dev.mars.qrtx.runtime.observability.OrchestratorMetrics;
import dev.mars.qrtx.runtime.pipeline.Collaborators;
import dev.mars.qrtx.runtime.pipeline.JobRepository;
import dev.mars.qrtx.runtime.pipeline.JobResults;
import dev.mars.qrtx.runtime.pipeline.JobStatus;
import dev.mars.qrtx.runtime.pipeline.PipelineDriver;
import dev.mars.qrtx.runtime.pipeline.PipelineSettings;
import dev.mars.qrtx.runtime.pipeline.RecoveredJob;
import dev.mars.qrtx.scheduler.ResourceRegistry;
import dev.mars.qrtx.scheduler.SchedulingContext;
import dev.mars.qrtx.scheduler.SchedulingEngine;
import dev.mars.qrtx.scheduler.SchedulingPolicies;
import dev.mars.qrtx.scheduler.SchedulingPolicy;
import dev.mars.qrtx.storage.ArtifactStore;
import dev.mars.qrtx.storage.CheckpointRef;
import dev.mars.qrtx.storage.ChecksumCalculator;
import dev.mars.qrtx.workflow.WorkflowGraph;
import dev.mars.qrtx.workflow.WorkflowGraphBuilder;
import dev.mars.qrtx.workflow.WorkflowIr;
import dev.mars.qrtx.workflow.WorkflowValidationException;
import io.opentelemetry.api.metrics.Meter;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Entry point of the orchestration kernel: job admission, status, results, cancellation,
 * the per-job event feed, recovery of jobs persisted by an earlier process, and shutdown.
 *
 * <pre>{@code
 * Orchestrator orchestrator = Orchestrator.builder(vertx)
 *         .compiler(compiler)
 *         .backend(backend)
 *         .evaluator(evaluator)
 *         .store(store)
 *         .registry(registry)
 *         .build();
 * orchestrator.submit("bell", graph).compose(orchestrator::status) ...
 * }</pre>
 *
 * <p>Instances share nothing: each has its own scheduling engine, event feed and driver
 * context, so several can run side by side in one JVM.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class Orchestrator {
    private static final Logger logger = LoggerFactory.getLogger(Orchestrator.class);

    private final SchedulingEngine engine;
    private final CheckpointCoordinator checkpoints;
    private final JobRepository repository;
    private final JobEventFeed events;
    private final PipelineDriver driver;
    private final ShutdownCoordinator shutdownCoordinator;

    private Orchestrator(Builder builder) {
        QrtxConfiguration config = builder.configuration;
        ObjectMapper mapper = JsonMappers.create();
        SchedulingPolicy policy = builder.policy != null
                ? builder.policy
                : SchedulingPolicies.fromName(config.getSchedulerPolicy());
        this.engine = new SchedulingEngine(builder.registry, SchedulingContext.fromConfiguration(config, builder.clock), policy);
        this.checkpoints = new CheckpointCoordinator(builder.store, new ChecksumCalculator(config.getChecksumAlgorithm()),
                mapper, builder.clock);
        this.repository = new JobRepository(builder.store, mapper);
        this.events = new JobEventFeed(builder.clock);
        OrchestratorMetrics metrics = builder.meter != null
                ? new OrchestratorMetrics(builder.meter)
                : new OrchestratorMetrics();
        this.driver = new PipelineDriver(builder.vertx, PipelineSettings.fromConfiguration(config),
                new Collaborators(builder.compiler, builder.backend, builder.evaluator, builder.store),
                engine, checkpoints, repository, events, metrics, builder.clock);
        this.shutdownCoordinator = new ShutdownCoordinator(config.getShutdownDrainTimeoutMs(), config.getShutdownTimeoutMs())
                .register(ShutdownCoordinator.Phase.DRAIN, "stop-admission", driver::stopAccepting)
                .register(ShutdownCoordinator.Phase.AWAIT_COMPLETION, "await-jobs", driver::awaitIdle)
                .register(ShutdownCoordinator.Phase.STOP_SERVICES, "pipeline-timers", driver::stop)
                .register(ShutdownCoordinator.Phase.CLOSE_RESOURCES, "flush-job-records", driver::flush);
        logger.info("Orchestrator created with policy '{}' and {} registered resource(s)",
                policy.getName(), builder.registry.size());
    }

    public static Builder builder(Vertx vertx) {
        return new Builder(vertx);
    }

    public Future<String> submit(String name, WorkflowGraph graph) {
        return submit(name, graph, JobPriority.NORMAL, null);
    }

    public Future<String> submit(String name, WorkflowGraph graph, JobPriority priority) {
        return submit(name, graph, priority, null);
    }

    /**
     * Admit a job.
     *
     * @param deadline wall-clock budget for the whole job, null for the configured default,
     *                 zero for none
     * @return the job id, or a failed future if the name is blank or the orchestrator is
     *         shutting down
     */
    public Future<String> submit(String name, WorkflowGraph graph, JobPriority priority, Duration deadline) {
        Objects.requireNonNull(graph, "graph must not be null");
        if (!shutdownCoordinator.isAcceptingWork()) {
            return Future.failedFuture(new IllegalStateException("Orchestrator is shutting down"));
        }
        return driver.submit(name, graph, priority != null ? priority : JobPriority.NORMAL, deadline);
    }

    /**
     * Validate an IR and admit it. Invalid graphs fail with {@link WorkflowValidationException}
     * and never create a job.
     */
    public Future<String> submit(String name, WorkflowIr ir, JobPriority priority) {
        WorkflowGraph graph;
        try {
            graph = WorkflowGraphBuilder.build(ir);
        } catch (WorkflowValidationException e) {
            logger.warn("Rejected workflow '{}': {}", ir.name(), e.getMessage());
            return Future.failedFuture(e);
        }
        return submit(name, graph, priority, null);
    }

    /**
     * @return empty for an unknown job, and for a terminal job once {@code qrtx.job.retention.ms}
     *         has passed; its record stays in storage
     */
    public Future<Optional<JobStatus>> status(String jobId) {
        return driver.status(jobId);
    }

    public Future<Optional<JobResults>> results(String jobId) {
        return driver.results(jobId);
    }

    /**
     * @return true if the request was accepted, false if the job is unknown or already
     *         terminal
     */
    public Future<Boolean> cancel(String jobId) {
        return driver.cancel(jobId);
    }

    /**
     * Events with a sequence greater than {@code afterSequence}, in order.
     */
    public List<JobEvent> events(String jobId, long afterSequence) {
        return events.events(jobId, afterSequence);
    }

    public void subscribe(String jobId, Consumer<JobEvent> subscriber) {
        events.subscribe(jobId, subscriber);
    }

    public void unsubscribe(String jobId, Consumer<JobEvent> subscriber) {
        events.unsubscribe(jobId, subscriber);
    }

    /**
     * Re-admit a job persisted by an earlier process. Stages whose checkpoints verify, and
     * whose ancestors all verify, are not run again.
     */
    public Future<String> recover(String jobId) {
        if (!shutdownCoordinator.isAcceptingWork()) {
            return Future.failedFuture(new IllegalStateException("Orchestrator is shutting down"));
        }
        logger.info("Recovering job {}", jobId);
        return repository.loadWorkflow(jobId)
                .compose(ir -> {
                    try {
                        return Future.succeededFuture(WorkflowGraphBuilder.build(ir));
                    } catch (WorkflowValidationException e) {
                        return Future.failedFuture(e);
                    }
                })
                .compose(graph -> repository.loadRecord(jobId).compose(record -> {
                    if (record.state().isTerminal()) {
                        return Future.failedFuture(new IllegalStateException(
                                "Job " + jobId + " already finished in state " + record.state()));
                    }
                    return checkpoints.resume(jobId)
                            .map(resumePoint -> new RecoveredJob(record, graph, closedUnderAncestry(graph, resumePoint)));
                }))
                .compose(driver::resume)
                .onFailure(err -> logger.warn("Recovery of job {} failed: {}", jobId, err.getMessage()));
    }

    public Future<Void> shutdown() {
        return shutdownCoordinator.shutdown();
    }

    public ShutdownCoordinator.State getShutdownState() {
        return shutdownCoordinator.getState();
    }

    public SchedulingEngine getSchedulingEngine() {
        return engine;
    }

    /**
     * Drop verified stages that have an unverified ancestor; those must run again and so must
     * everything downstream of them.
     */
    static ResumePoint closedUnderAncestry(WorkflowGraph graph, ResumePoint resumePoint) {
        Set<String> completed = new LinkedHashSet<>();
        for (String stageId : graph.topologicalOrder()) {
            if (resumePoint.completedStages().contains(stageId)
                    && completed.containsAll(graph.dependenciesOf(stageId))) {
                completed.add(stageId);
            }
        }
        if (completed.size() == resumePoint.completedStages().size()) {
            return resumePoint;
        }
        logger.info("Job {}: {} verified stage(s) will re-run because an ancestor did not verify",
                resumePoint.jobId(), resumePoint.completedStages().size() - completed.size());
        Map<String, JsonObject> outputs = new HashMap<>();
        Map<String, Integer> attempts = new HashMap<>();
        Map<String, CheckpointRef> refs = new HashMap<>();
        String latest = null;
        long latestSequence = -1;
        for (String stageId : completed) {
            outputs.put(stageId, resumePoint.stageOutputs().get(stageId));
            attempts.put(stageId, resumePoint.attempts().get(stageId));
            CheckpointRef ref = resumePoint.checkpoints().get(stageId);
            refs.put(stageId, ref);
            if (ref != null && ref.sequence() > latestSequence) {
                latestSequence = ref.sequence();
                latest = stageId;
            }
        }
        return new ResumePoint(resumePoint.jobId(), Collections.unmodifiableSet(completed),
                Collections.unmodifiableMap(outputs), Collections.unmodifiableMap(attempts),
                Collections.unmodifiableMap(refs), latest, resumePoint.lastSequence(), resumePoint.rejected());
    }

    /**
     * Builder for {@link Orchestrator}. Compiler, backend, evaluator, store and registry are
     * required.
     */
    public static class Builder {
        private final Vertx vertx;
        private QrtxConfiguration configuration = new QrtxConfiguration();
        private CircuitCompiler compiler;
        private BackendExecutor backend;
        private ClassicalEvaluator evaluator;
        private ArtifactStore store;
        private ResourceRegistry registry;
        private SchedulingPolicy policy;
        private Clock clock = Clock.systemUTC();
        private Meter meter;

        private Builder(Vertx vertx) {
            this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        }

        public Builder configuration(QrtxConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder compiler(CircuitCompiler compiler) {
            this.compiler = compiler;
            return this;
        }

        public Builder backend(BackendExecutor backend) {
            this.backend = backend;
            return this;
        }

        public Builder evaluator(ClassicalEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder store(ArtifactStore store) {
            this.store = store;
            return this;
        }

        public Builder registry(ResourceRegistry registry) {
            this.registry = registry;
            return this;
        }

        /** Overrides {@code qrtx.scheduler.policy}. */
        public Builder policy(SchedulingPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder meter(Meter meter) {
            this.meter = meter;
            return this;
        }

        public Orchestrator build() {
            Objects.requireNonNull(configuration, "configuration must not be null");
            Objects.requireNonNull(compiler, "compiler must not be null");
            Objects.requireNonNull(backend, "backend must not be null");
            Objects.requireNonNull(evaluator, "evaluator must not be null");
            Objects.requireNonNull(store, "store must not be null");
            Objects.requireNonNull(registry, "registry must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
            return new Orchestrator(this);
        }
    }
}
