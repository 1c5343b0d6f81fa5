package com.keystone.core.engine;

import com.keystone.config.KeystoneProperties;
import com.keystone.core.artifact.ArtifactContentStore;
import com.keystone.core.artifact.ArtifactRegistry;
import com.keystone.core.budget.HandoffManager;
import com.keystone.core.classifier.TaskClassifier;
import com.keystone.core.conflict.ConflictArbiter;
import com.keystone.core.conflict.ConflictLedger;
import com.keystone.core.conflict.ConflictResolver;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.KeystoneEvent;
import com.keystone.core.fallback.FallbackRouter;
import com.keystone.core.gate.GateLedger;
import com.keystone.core.gate.GateValidator;
import com.keystone.core.gate.HeuristicQualityAssessor;
import com.keystone.core.gate.QualityRubric;
import com.keystone.core.gate.SchemaCatalog;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import com.keystone.core.plan.FileSystemPlanStore;
import com.keystone.core.roles.RoleCatalog;
import com.keystone.core.routing.AgentRouter;
import com.keystone.core.worker.Worker;
import com.keystone.core.worker.WorkerRegistry;
import com.keystone.core.worker.WorkerRequest;
import com.keystone.core.worker.WorkerResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * One orchestration instance wired by hand against a workspace directory. Two harnesses on the
 * same directory behave like two processes sharing durable state.
 */
final class EngineHarness implements AutoCloseable {

    static final String GOOD_OUTPUT = """
            {"summary": "Implemented the requested change with tests", "actions": ["edited the service"]}
            """;

    final KeystoneProperties properties;
    final JsonDocumentStore documents = new JsonDocumentStore();
    final WorkspaceLayout layout;
    final RoleCatalog roles = new RoleCatalog();
    final FileSystemPlanStore plans;
    final GateLedger gateLedger;
    final GateValidator gate;
    final SchemaCatalog schemas = new SchemaCatalog();
    final ArtifactRegistry registry;
    final WorkerRegistry workers = new WorkerRegistry();
    final KeystoneMetrics metrics = new KeystoneMetrics(new SimpleMeterRegistry());
    final EventBus eventBus = new EventBus();
    final ConflictResolver conflicts;
    final HandoffManager handoff;
    final StepScheduler scheduler = new StepScheduler();
    final WorkflowEngine engine;
    final OperatorActions operator;
    final List<KeystoneEvent> events = new CopyOnWriteArrayList<>();

    EngineHarness(Path workspace) {
        this(workspace, new KeystoneProperties(), (role, record, candidates) -> Optional.empty());
    }

    EngineHarness(Path workspace, KeystoneProperties properties, ConflictArbiter arbiter) {
        this.properties = properties;
        this.layout = new WorkspaceLayout(workspace);
        this.plans = new FileSystemPlanStore(documents, layout, roles, properties.getMaxStepsPerPhase());
        this.gateLedger = new GateLedger(documents, layout);
        this.gate = new GateValidator(gateLedger, new HeuristicQualityAssessor(), documents.mapper(),
                properties.getMaxGateAttempts(), QualityRubric.from(properties.getGate()));
        this.registry = new ArtifactRegistry(documents, layout, new ArtifactContentStore(documents, layout), gateLedger);
        this.conflicts = new ConflictResolver(roles, arbiter, new ConflictLedger(documents, layout), Duration.ofSeconds(2));
        this.handoff = new HandoffManager(plans, registry, documents, layout);
        var runner = new StepRunner(plans, registry, gate, gateLedger, schemas, workers,
                new FallbackRouter(workers::isAvailable), metrics, layout, documents);
        this.engine = new WorkflowEngine(new TaskClassifier(properties), new AgentRouter(roles), plans, scheduler,
                new WaveExecutor(runner, plans, metrics), registry, conflicts, handoff, eventBus, metrics, properties);
        this.operator = new OperatorActions(plans, gate, gateLedger, schemas, registry, conflicts, documents,
                layout, eventBus);
        eventBus.subscribeAll(events::add);
    }

    ScriptedWorker worker(String role, Function<WorkerRequest, WorkerResponse> script) {
        var worker = new ScriptedWorker(role, script);
        workers.register(worker);
        return worker;
    }

    List<String> eventTypes(String stepId) {
        return events.stream().filter(e -> stepId.equals(e.stepId())).map(KeystoneEvent::eventType).toList();
    }

    @Override
    public void close() {
        conflicts.close();
    }

    /** In-process worker answering from a script and remembering every request. */
    static final class ScriptedWorker implements Worker {
        private final String role;
        private final Function<WorkerRequest, WorkerResponse> script;
        final List<WorkerRequest> requests = new CopyOnWriteArrayList<>();

        ScriptedWorker(String role, Function<WorkerRequest, WorkerResponse> script) {
            this.role = role;
            this.script = script;
        }

        @Override
        public String role() {
            return role;
        }

        @Override
        public WorkerResponse execute(WorkerRequest request) {
            requests.add(request);
            return script.apply(request);
        }
    }
}
