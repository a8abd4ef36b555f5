package io.warden.runtime;

import com.fasterxml.jackson.databind.DeserializationFeature;
import io.warden.audit.AuditLedger;
import io.warden.audit.AuditLedgerRegistry;
import io.warden.audit.LedgerIntegrity;
import io.warden.config.EngineSettings;
import io.warden.config.WardenConfig;
import io.warden.connector.ConnectorRegistry;
import io.warden.connector.ScriptConnector;
import io.warden.engine.ExecutionEngine;
import io.warden.graph.ExecutionPlan;
import io.warden.graph.GraphCompiler;
import io.warden.idempotency.SqliteIdempotencyStore;
import io.warden.model.AnchorRecord;
import io.warden.model.AuditEntry;
import io.warden.model.Playbook;
import io.warden.model.RunResult;
import io.warden.model.TaskStatus;
import io.warden.model.TaskView;
import io.warden.playbook.JsonPlaybookSource;
import io.warden.playbook.PlaybookSource;
import io.warden.policy.PolicyChecker;
import io.warden.policy.PolicyGate;
import io.warden.storage.Database;
import io.warden.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Wires one data root into a working engine: SQLite-backed idempotency, per-case ledgers under
 * {@code ledger/}, playbooks from {@code playbooks/}, and script connectors declared in
 * {@code connectors.json}.
 */
public final class WardenRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WardenRuntime.class);

    private final WardenConfig config;
    private final EngineSettings settings;
    private final Database database;
    private final ConnectorRegistry connectors;
    private final AuditLedgerRegistry ledgers;
    private final PlaybookSource playbooks;
    private final GraphCompiler compiler;
    private final ExecutionEngine engine;

    public WardenRuntime(WardenConfig config) {
        this(config, PolicyGate.defaults(), null);
    }

    public WardenRuntime(WardenConfig config, PolicyGate policyGate, PolicyChecker policyChecker) {
        this.config = config;
        this.settings = EngineSettings.load(config.settingsFile());
        this.database = new Database(config);
        this.connectors = ConnectorRegistry.withDefaults();
        this.ledgers = new AuditLedgerRegistry(config, settings.maskAuditDetails());
        this.playbooks = new JsonPlaybookSource(config.playbooksDir());
        this.compiler = new GraphCompiler();
        this.engine = ExecutionEngine.builder(ledgers)
                .connectors(connectors)
                .idempotencyStore(new SqliteIdempotencyStore(database))
                .policyGate(policyGate)
                .policyChecker(policyChecker)
                .settings(settings)
                .build();
    }

    public void init() {
        database.init();
        registerConfiguredScriptConnectors();
    }

    public WardenConfig config() {
        return config;
    }

    public Collection<String> connectorIds() {
        return connectors.listConnectorIds();
    }

    public RunResult runPlaybook(String playbookId, String caseId, Map<String, Object> context, boolean autoApprove) {
        Map<String, Object> ctx = context == null ? Map.of() : context;
        Playbook playbook = playbooks.resolve(playbookId, ctx);
        log.info("Running playbook {} for case {} (autoApprove={})", playbookId, caseId, autoApprove);
        return engine.run(playbook, caseId, ctx, autoApprove);
    }

    public TaskView approveTask(String taskName, String approver) {
        return engine.approve(taskName, approver);
    }

    public TaskStatus taskStatus(String taskName) {
        return engine.status(taskName);
    }

    public List<TaskView> tasksByStatus(TaskStatus status) {
        return engine.tasksByStatus(status);
    }

    public RunResult lastResult() {
        return engine.lastResult()
                .orElseThrow(() -> new IllegalStateException("No playbook has been run"));
    }

    public CompileOutcome compile(String playbookId) {
        Playbook playbook = playbooks.resolve(playbookId, Map.of());
        ExecutionPlan plan = compiler.compile(playbook.tasks());
        return new CompileOutcome(playbook.id(), plan.taskCount(), plan.layers());
    }

    public List<AuditEntry> ledgerEntries(String caseId, int limit) {
        return existingLedger(caseId).entries(limit);
    }

    public String latestHash(String caseId) {
        return existingLedger(caseId).latestHash();
    }

    public LedgerIntegrity verifyLedger(String caseId) {
        return existingLedger(caseId).verify();
    }

    public String merkleRoot(String caseId) {
        return existingLedger(caseId).merkleRoot();
    }

    public AnchorRecord anchorLedger(String caseId, Map<String, Object> anchorData) {
        return existingLedger(caseId).anchor(anchorData);
    }

    public List<AnchorRecord> anchors(String caseId) {
        return existingLedger(caseId).anchors();
    }

    public boolean verifyAnchor(String caseId, AnchorRecord anchor) {
        return existingLedger(caseId).verifyAnchor(anchor);
    }

    @Override
    public void close() {
        engine.close();
    }

    private AuditLedger existingLedger(String caseId) {
        if (!ledgers.exists(caseId)) {
            throw new IllegalArgumentException("No ledger for case: " + caseId);
        }
        return ledgers.open(caseId);
    }

    private void registerConfiguredScriptConnectors() {
        Path cfg = config.connectorsFile();
        if (!Files.exists(cfg)) {
            return;
        }
        try {
            ConnectorsFile file = Jsons.mapper()
                    .readerFor(ConnectorsFile.class)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(cfg.toFile());
            if (file == null || file.connectors() == null || file.connectors().isEmpty()) {
                return;
            }
            int loaded = 0;
            int skipped = 0;
            for (ConnectorSpec spec : file.connectors()) {
                if (spec == null || spec.id() == null || spec.id().isBlank() || spec.command() == null || spec.command().isEmpty()) {
                    skipped++;
                    continue;
                }
                try {
                    long timeoutMs = spec.timeoutMs() == null ? WardenConfig.DEFAULT_SCRIPT_TIMEOUT_MS : spec.timeoutMs();
                    connectors.register(new ScriptConnector(spec.id(), resolveScriptCommand(spec.command()), timeoutMs));
                    loaded++;
                } catch (IllegalArgumentException e) {
                    skipped++;
                    log.warn("Skipping script connector {}: {}", spec.id(), e.getMessage());
                }
            }
            log.info("Loaded {} script connector(s) from {} (skipped={})", loaded, cfg, skipped);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load connector config: " + cfg, e);
        }
    }

    private List<String> resolveScriptCommand(List<String> rawCommand) {
        List<String> resolved = new ArrayList<>(rawCommand.size());
        for (String token : rawCommand) {
            if (token == null || token.isBlank()) {
                continue;
            }
            Path candidate = config.rootDir().resolve(token).normalize();
            resolved.add(Files.exists(candidate) ? candidate.toString() : token);
        }
        if (resolved.isEmpty()) {
            throw new IllegalArgumentException("script command became empty after normalization");
        }
        return resolved;
    }

    public record CompileOutcome(String playbookId, int taskCount, List<List<String>> layers) {
    }

    private record ConnectorsFile(List<ConnectorSpec> connectors) {
    }

    private record ConnectorSpec(String id, List<String> command, Long timeoutMs) {
    }
}
