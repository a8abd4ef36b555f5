package io.warden.engine;

import io.warden.audit.AuditLedger;
import io.warden.audit.AuditLedgerRegistry;
import io.warden.config.EngineSettings;
import io.warden.connector.Connector;
import io.warden.connector.ConnectorRegistry;
import io.warden.graph.CompileException;
import io.warden.graph.ExecutionPlan;
import io.warden.graph.GraphCompiler;
import io.warden.idempotency.IdempotencyStore;
import io.warden.idempotency.InMemoryIdempotencyStore;
import io.warden.model.Case;
import io.warden.model.IdempotencyRecord;
import io.warden.model.Playbook;
import io.warden.model.RunResult;
import io.warden.model.Task;
import io.warden.model.TaskDefinition;
import io.warden.model.TaskStatus;
import io.warden.model.TaskView;
import io.warden.policy.PolicyChecker;
import io.warden.policy.PolicyEvaluationException;
import io.warden.policy.PolicyGate;
import io.warden.policy.PolicyPhase;
import io.warden.policy.PolicyViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one playbook run at a time through its compiled layers.
 *
 * <p>Layers execute strictly in order; the tasks of one layer run concurrently on a bounded
 * worker pool, and the next layer starts only after every task of the current one is terminal,
 * suspended on approval, or deferred behind a suspended producer. Every state change is appended
 * to the case's {@link AuditLedger}.
 *
 * <p>Dependents of a producer that ended FAILED or BLOCKED are BLOCKED. Dependents of a producer
 * that is still waiting for approval stay PENDING and are picked up by {@link #approve} once the
 * producer resolves. SKIPPED producers count as satisfied and expose the output remembered by the
 * idempotency store.
 *
 * <p>{@link #run} and {@link #approve} are serialized; task records are only ever handed out as
 * {@link TaskView} snapshots.
 */
public final class ExecutionEngine implements AutoCloseable {
    public static final String ENGINE_ACTOR = "warden-engine";
    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final AuditLedgerRegistry ledgers;
    private final ConnectorRegistry connectors;
    private final IdempotencyStore idempotencyStore;
    private final PolicyGate policyGate;
    private final PolicyChecker policyChecker;
    private final EngineSettings settings;
    private final GraphCompiler compiler;
    private final InputResolver inputResolver;
    private final ExecutorService workers;
    private final ExecutorService connectorCalls;
    private final Object runLock = new Object();
    private volatile PlaybookRun current;

    private ExecutionEngine(Builder b) {
        this.ledgers = b.ledgers;
        this.connectors = b.connectors == null ? ConnectorRegistry.withDefaults() : b.connectors;
        this.idempotencyStore = b.idempotencyStore == null ? new InMemoryIdempotencyStore() : b.idempotencyStore;
        this.policyGate = b.policyGate == null ? PolicyGate.defaults() : b.policyGate;
        this.policyChecker = b.policyChecker;
        this.settings = b.settings == null ? EngineSettings.defaults() : b.settings;
        this.compiler = new GraphCompiler();
        this.inputResolver = new InputResolver();
        this.workers = Executors.newFixedThreadPool(settings.workerThreads(), namedThreads("warden-worker"));
        this.connectorCalls = Executors.newCachedThreadPool(namedThreads("warden-connector"));
    }

    public static Builder builder(AuditLedgerRegistry ledgers) {
        return new Builder(ledgers);
    }

    public RunResult run(Playbook playbook, String caseId, Map<String, Object> context, boolean autoApprove) {
        Map<String, Object> ctx = context == null ? Map.of() : context;
        Object title = ctx.get("case_title");
        Case subject = new Case(
                caseId,
                title == null ? playbook.id() : String.valueOf(title),
                Map.of("playbook_id", playbook.id())
        );
        return run(playbook, subject, ctx, autoApprove);
    }

    /**
     * Starts a new run and makes it the engine's current run. Only the current run can be queried
     * or approved; tasks still waiting for approval in a replaced run can no longer be approved.
     */
    public RunResult run(Playbook playbook, Case subject, Map<String, Object> context, boolean autoApprove) {
        synchronized (runLock) {
            warnIfSuspendedRunIsReplaced(subject);
            AuditLedger ledger = ledgers.open(subject.caseId());
            Map<String, Object> started = new LinkedHashMap<>();
            started.put("case_id", subject.caseId());
            started.put("playbook_id", playbook.id());
            started.put("task_count", playbook.tasks().size());
            started.put("auto_approve", autoApprove);
            ledger.append(ENGINE_ACTOR, "playbook_started", started);

            PlaybookRun run = new PlaybookRun(subject, playbook, context == null ? Map.of() : context, autoApprove, ledger);
            for (TaskDefinition def : playbook.definitions()) {
                Task task = new Task(subject.caseId(), def);
                run.tasks.put(def.name(), task);
                Map<String, Object> created = taskDetails(task);
                created.put("type", def.type());
                created.put("needs", def.needs());
                created.put("approval_required", def.approvalRequired());
                ledger.append(ENGINE_ACTOR, "task_created", created);
            }
            current = run;

            try {
                run.plan = compiler.compile(playbook.tasks());
            } catch (CompileException e) {
                Map<String, Object> rejected = new LinkedHashMap<>();
                rejected.put("playbook_id", playbook.id());
                rejected.put("error", e.getMessage());
                ledger.append(ENGINE_ACTOR, "plan_rejected", rejected);
                log.warn("Playbook {} rejected for case {}: {}", playbook.id(), subject.caseId(), e.getMessage());
                throw e;
            }
            Map<String, Object> compiled = new LinkedHashMap<>();
            compiled.put("playbook_id", playbook.id());
            compiled.put("layer_count", run.plan.layerCount());
            compiled.put("layers", run.plan.layers());
            ledger.append(ENGINE_ACTOR, "plan_compiled", compiled);

            try {
                policyGate.evaluateCase(subject);
            } catch (PolicyViolationException v) {
                Map<String, Object> denied = new LinkedHashMap<>();
                denied.put("case_id", subject.caseId());
                denied.put("rule", v.rule());
                denied.put("reason", v.reason());
                ledger.append(ENGINE_ACTOR, "case_policy_denied", denied);
                for (Task task : run.tasks.values()) {
                    task.markBlocked(v.getMessage());
                    Map<String, Object> blocked = taskDetails(task);
                    blocked.put("rule", v.rule());
                    blocked.put("reason", v.reason());
                    ledger.append(ENGINE_ACTOR, "task_blocked", blocked);
                }
                return finish(run);
            }

            advance(run, false);
            return finish(run);
        }
    }

    /**
     * Approves a task suspended in WAITING_APPROVAL, runs its policy gate, dispatch and completion
     * on the calling thread, then resumes any dependents that were waiting on it.
     */
    public TaskView approve(String taskName, String approver) {
        synchronized (runLock) {
            PlaybookRun run = current;
            Task task = run == null ? null : run.tasks.get(taskName);
            if (task == null) {
                throw new TaskNotFoundException(taskName);
            }
            if (task.status() != TaskStatus.WAITING_APPROVAL) {
                throw new NotAwaitingApprovalException(taskName, task.status());
            }
            if (approver == null || approver.isBlank()) {
                throw new IllegalArgumentException("approver cannot be empty");
            }
            task.markApproved(approver);
            run.ledger.append(approver.trim(), "task_approved", taskDetails(task));
            log.info("Task {} of case {} approved by {}", taskName, run.subject.caseId(), approver);

            execute(run, task);
            advance(run, true);
            finish(run);
            return task.view();
        }
    }

    public TaskStatus status(String taskName) {
        PlaybookRun run = current;
        Task task = run == null ? null : run.tasks.get(taskName);
        if (task == null) {
            throw new TaskNotFoundException(taskName);
        }
        return task.status();
    }

    public List<TaskView> tasksByStatus(TaskStatus status) {
        PlaybookRun run = current;
        if (run == null) {
            return List.of();
        }
        List<TaskView> out = new ArrayList<>();
        for (Task task : run.tasks.values()) {
            if (task.status() == status) {
                out.add(task.view());
            }
        }
        return out;
    }

    public Optional<RunResult> lastResult() {
        PlaybookRun run = current;
        return run == null ? Optional.empty() : Optional.of(snapshot(run));
    }

    @Override
    public void close() {
        workers.shutdown();
        connectorCalls.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void warnIfSuspendedRunIsReplaced(Case next) {
        PlaybookRun previous = current;
        if (previous == null) {
            return;
        }
        List<String> waiting = new ArrayList<>();
        for (Task task : previous.tasks.values()) {
            if (task.status() == TaskStatus.WAITING_APPROVAL) {
                waiting.add(task.name());
            }
        }
        if (!waiting.isEmpty()) {
            log.warn("Run of playbook {} for case {} is replaced by case {} with tasks still awaiting approval: {}",
                    previous.playbook.id(), previous.subject.caseId(), next.caseId(), waiting);
        }
    }

        private void advance(PlaybookRun run, boolean resumed) {
        List<List<String>> layers = run.plan.layers();
        for (int i = 0; i < layers.size(); i++) {
            List<Task> pending = new ArrayList<>();
            for (String name : layers.get(i)) {
                Task task = run.tasks.get(name);
                if (task.status() == TaskStatus.PENDING) {
                    pending.add(task);
                }
            }
            if (pending.isEmpty()) {
                continue;
            }
            log.info("Case {} layer {}: dispatching {} task(s)", run.subject.caseId(), i, pending.size());
            List<CompletableFuture<Void>> futures = new ArrayList<>(pending.size());
            for (Task task : pending) {
                futures.add(CompletableFuture.runAsync(() -> process(run, task), workers));
            }
            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                if (cause instanceof Error err) {
                    throw err;
                }
                throw e;
            }

            Map<String, Object> done = new LinkedHashMap<>();
            done.put("case_id", run.subject.caseId());
            done.put("layer", i);
            done.put("tasks", layers.get(i));
            done.put("statuses", statusCounts(run, layers.get(i)));
            done.put("resumed", resumed);
            run.ledger.append(ENGINE_ACTOR, "layer_completed", done);
        }
    }

    private void process(PlaybookRun run, Task task) {
        TaskDefinition def = task.definition();

        String waitingOn = null;
        for (String dep : def.needs()) {
            TaskStatus upstream = run.tasks.get(dep).status();
            if (upstream == TaskStatus.FAILED || upstream == TaskStatus.BLOCKED) {
                task.markBlocked("upstream task '" + dep + "' ended " + upstream);
                Map<String, Object> blocked = taskDetails(task);
                blocked.put("reason", "upstream_not_completed");
                blocked.put("upstream", dep);
                blocked.put("upstream_status", upstream.name());
                run.ledger.append(ENGINE_ACTOR, "task_blocked", blocked);
                return;
            }
            if (!upstream.isTerminal() && waitingOn == null) {
                waitingOn = dep;
            }
        }
        if (waitingOn != null) {
            if (run.deferred.add(def.name())) {
                Map<String, Object> deferred = taskDetails(task);
                deferred.put("waiting_on", waitingOn);
                run.ledger.append(ENGINE_ACTOR, "task_deferred", deferred);
            }
            return;
        }

        String key = def.idempotencyKey();
        if (key != null) {
            Optional<IdempotencyRecord> previous = idempotencyStore.get(key);
            if (previous.isPresent()) {
                task.markSkipped("idempotency key '" + key + "' already completed by " + previous.get().taskId());
                run.outputs.put(def.name(), previous.get().output());
                Map<String, Object> skipped = taskDetails(task);
                skipped.put("idempotency_key", key);
                skipped.put("original_task_id", previous.get().taskId());
                run.ledger.append(ENGINE_ACTOR, "task_skipped", skipped);
                return;
            }
        }

        Map<String, Object> resolved;
        try {
            resolved = inputResolver.resolve(def.name(), def.inputs(), run.tasks.keySet(),
                    run.plan.upstreamOf(def.name()), run.outputs, run.context);
        } catch (UnresolvedReferenceException e) {
            task.markFailed(e.getMessage());
            Map<String, Object> failed = taskDetails(task);
            failed.put("reason", "unresolved_reference");
            failed.put("reference", e.reference());
            failed.put("error", e.getMessage());
            run.ledger.append(ENGINE_ACTOR, "task_failed", failed);
            log.warn("Task {} of case {} failed: {}", def.name(), run.subject.caseId(), e.getMessage());
            return;
        }
        task.setResolvedInputs(resolved);

        if (def.approvalRequired() && !run.autoApprove) {
            task.markWaitingApproval();
            run.ledger.append(ENGINE_ACTOR, "task_waiting_approval", taskDetails(task));
            return;
        }

        execute(run, task);
    }

    private void execute(PlaybookRun run, Task task) {
        TaskDefinition def = task.definition();
        try {
            policyGate.evaluateTask(run.subject, task.view(), PolicyPhase.PRE_DISPATCH);
            checkExternalPolicy(task);
        } catch (PolicyViolationException v) {
            task.markBlocked(v.getMessage());
            Map<String, Object> blocked = taskDetails(task);
            blocked.put("reason", policyReason(v));
            blocked.put("rule", v.rule());
            blocked.put("message", v.reason());
            run.ledger.append(ENGINE_ACTOR, "task_blocked", blocked);
            return;
        }

        Optional<Connector> connector = connectors.findById(def.connectorId());
        if (connector.isEmpty()) {
            task.markBlocked("no connector registered for '" + def.connectorId() + "'");
            Map<String, Object> blocked = taskDetails(task);
            blocked.put("reason", "missing_connector");
            blocked.put("connector", def.connectorId());
            run.ledger.append(ENGINE_ACTOR, "task_blocked", blocked);
            return;
        }

        task.markRunning();
        Map<String, Object> started = taskDetails(task);
        started.put("connector", def.connectorId());
        started.put("operation", def.operation());
        run.ledger.append(ENGINE_ACTOR, "task_started", started);

        Map<String, Object> output;
        try {
            output = invoke(connector.get(), def.operation(), task.resolvedInputs());
        } catch (ConnectorCallException e) {
            task.markFailed(e.getMessage());
            Map<String, Object> failed = taskDetails(task);
            failed.put("reason", "connector_failure");
            failed.put("error", e.getMessage());
            run.ledger.append(ENGINE_ACTOR, "task_failed", failed);
            log.warn("Task {} of case {} failed: {}", def.name(), run.subject.caseId(), e.getMessage());
            return;
        }

        try {
            policyGate.evaluateTask(run.subject, task.view().withCandidateOutput(output), PolicyPhase.PRE_COMPLETION);
        } catch (PolicyViolationException v) {
            task.markFailed(v.getMessage());
            Map<String, Object> failed = taskDetails(task);
            failed.put("reason", policyReason(v));
            failed.put("rule", v.rule());
            failed.put("error", v.reason());
            run.ledger.append(ENGINE_ACTOR, "task_failed", failed);
            return;
        }

        task.markCompleted(output);
        run.outputs.put(def.name(), task.output());
        Map<String, Object> completed = taskDetails(task);
        String key = def.idempotencyKey();
        if (key != null) {
            boolean recorded = idempotencyStore.put(key, new IdempotencyRecord(
                    key, task.taskId(), def.name(), task.output(), Instant.now()));
            completed.put("idempotency_key", key);
            completed.put("idempotency_recorded", recorded);
        }
        completed.put("output_keys", new ArrayList<>(task.output().keySet()));
        run.ledger.append(ENGINE_ACTOR, "task_completed", completed);
    }

    private void checkExternalPolicy(Task task) {
        if (policyChecker == null) {
            return;
        }
        TaskDefinition def = task.definition();
        boolean allowed;
        try {
            allowed = policyChecker.allows(def.type(), def.name(), task.resolvedInputs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PolicyEvaluationException("policy-checker", "policy check interrupted", e);
        } catch (Exception e) {
            throw new PolicyEvaluationException("policy-checker", "policy check error: " + describe(e), e);
        }
        if (!allowed) {
            throw new PolicyViolationException("policy-checker", "denied by policy checker");
        }
    }

    private static String policyReason(PolicyViolationException v) {
        return v instanceof PolicyEvaluationException ? "policy_error" : "policy_violation";
    }

    private Map<String, Object> invoke(Connector connector, String operation, Map<String, Object> payload)
            throws ConnectorCallException {
        Future<Map<String, Object>> call = connectorCalls.submit(() -> connector.call(operation, payload));
        Map<String, Object> result;
        try {
            long timeoutMs = settings.connectorTimeoutMs();
            result = timeoutMs > 0L ? call.get(timeoutMs, TimeUnit.MILLISECONDS) : call.get();
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ConnectorCallException("connector '" + connector.id() + "' timed out after "
                    + settings.connectorTimeoutMs() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new ConnectorCallException(describe(cause), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConnectorCallException("connector '" + connector.id() + "' call interrupted", e);
        }
        return result == null ? Map.of() : result;
    }

    private RunResult finish(PlaybookRun run) {
        List<String> waiting = new ArrayList<>();
        boolean suspended = false;
        for (Task task : run.tasks.values()) {
            TaskStatus status = task.status();
            if (status == TaskStatus.WAITING_APPROVAL) {
                waiting.add(task.name());
            }
            if (!status.isTerminal()) {
                suspended = true;
            }
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("case_id", run.subject.caseId());
        details.put("playbook_id", run.playbook.id());
        details.put("statuses", statusCounts(run, new ArrayList<>(run.tasks.keySet())));
        if (suspended) {
            details.put("waiting_approval", waiting);
        }
        run.ledger.append(ENGINE_ACTOR, suspended ? "playbook_suspended" : "playbook_completed", details);
        log.info("Case {} playbook {} {}", run.subject.caseId(), run.playbook.id(), suspended ? "suspended" : "completed");
        return snapshot(run);
    }

    private RunResult snapshot(PlaybookRun run) {
        Map<String, TaskView> views = new LinkedHashMap<>();
        Map<String, Map<String, Object>> results = new LinkedHashMap<>();
        boolean suspended = false;
        for (Map.Entry<String, Task> e : run.tasks.entrySet()) {
            TaskView view = e.getValue().view();
            views.put(e.getKey(), view);
            if (view.status() == TaskStatus.COMPLETED) {
                results.put(e.getKey(), view.output());
            }
            suspended |= !view.status().isTerminal();
        }
        return new RunResult(
                run.subject.caseId(),
                run.playbook.id(),
                views,
                results,
                run.plan == null ? List.of() : run.plan.layers(),
                run.ledger.latestHash(),
                suspended
        );
    }

    private static Map<String, Integer> statusCounts(PlaybookRun run, List<String> names) {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (String name : names) {
            counts.merge(run.tasks.get(name).status(), 1, Integer::sum);
        }
        Map<String, Integer> out = new LinkedHashMap<>();
        counts.forEach((k, v) -> out.put(k.name(), v));
        return out;
    }

    private static Map<String, Object> taskDetails(Task task) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("case_id", task.caseId());
        details.put("task_id", task.taskId());
        details.put("task_name", task.name());
        return details;
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class PlaybookRun {
        private final Case subject;
        private final Playbook playbook;
        private final Map<String, Object> context;
        private final boolean autoApprove;
        private final AuditLedger ledger;
        private final Map<String, Task> tasks = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> outputs = new ConcurrentHashMap<>();
        private final Set<String> deferred = ConcurrentHashMap.newKeySet();
        private ExecutionPlan plan;

        private PlaybookRun(Case subject, Playbook playbook, Map<String, Object> context, boolean autoApprove, AuditLedger ledger) {
            this.subject = subject;
            this.playbook = playbook;
            this.context = context;
            this.autoApprove = autoApprove;
            this.ledger = ledger;
        }
    }

    private static final class ConnectorCallException extends Exception {
        private ConnectorCallException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class Builder {
        private final AuditLedgerRegistry ledgers;
        private ConnectorRegistry connectors;
        private IdempotencyStore idempotencyStore;
        private PolicyGate policyGate;
        private PolicyChecker policyChecker;
        private EngineSettings settings;

        private Builder(AuditLedgerRegistry ledgers) {
            if (ledgers == null) {
                throw new IllegalArgumentException("ledger registry cannot be null");
            }
            this.ledgers = ledgers;
        }

        public Builder connectors(ConnectorRegistry value) {
            this.connectors = value;
            return this;
        }

        public Builder idempotencyStore(IdempotencyStore value) {
            this.idempotencyStore = value;
            return this;
        }

        public Builder policyGate(PolicyGate value) {
            this.policyGate = value;
            return this;
        }

        public Builder policyChecker(PolicyChecker value) {
            this.policyChecker = value;
            return this;
        }

        public Builder settings(EngineSettings value) {
            this.settings = value;
            return this;
        }

        public ExecutionEngine build() {
            return new ExecutionEngine(this);
        }
    }
}
