package io.warden.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.warden.audit.LedgerIntegrity;
import io.warden.config.WardenConfig;
import io.warden.model.AnchorRecord;
import io.warden.model.RunResult;
import io.warden.model.TaskStatus;
import io.warden.model.TaskView;
import io.warden.runtime.WardenRuntime;
import io.warden.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "warden",
        mixinStandardHelpOptions = true,
        description = "Incident-response playbook runner with a hash-chained audit ledger",
        subcommands = {
                WardenCommand.InitCommand.class,
                WardenCommand.CompileCommand.class,
                WardenCommand.RunCommand.class,
                WardenCommand.LedgerTailCommand.class,
                WardenCommand.LedgerVerifyCommand.class,
                WardenCommand.LedgerAnchorCommand.class,
                WardenCommand.AnchorsCommand.class,
                WardenCommand.ConnectorsCommand.class
        }
)
public final class WardenCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | compile | run | ledger-tail | ledger-verify | ledger-anchor | anchors | connectors");
    }

    WardenRuntime runtime() {
        WardenRuntime runtime = new WardenRuntime(WardenConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static Map<String, Object> parseJsonObject(String raw, String optionName) {
        if (raw == null || raw.isBlank()) {
            return new LinkedHashMap<>();
        }
        JsonNode node = Jsons.readTree(raw);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException(optionName + " must be a JSON object");
        }
        return Jsons.toMap(node);
    }

    @Command(name = "init", description = "Initialize the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println("Initialized Warden at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "compile", description = "Validate a playbook and print its execution layers")
    static final class CompileCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Playbook id (file name under playbooks/ without .json)")
        String playbookId;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.compile(playbookId)));
            }
            return 0;
        }
    }

    @Command(name = "run", description = "Run a playbook against a case")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Playbook id")
        String playbookId;

        @Option(names = {"--case"}, required = true, description = "Case id; also names the ledger")
        String caseId;

        @Option(names = {"--context"}, description = "Run context as a JSON object")
        String context;

        @Option(names = {"--var"}, description = "Context variable key=value, repeatable")
        Map<String, String> vars = new LinkedHashMap<>();

        @Option(names = {"--auto-approve"}, defaultValue = "false", description = "Skip approval gates")
        boolean autoApprove;

        @Option(names = {"--approve"}, description = "Approve a suspended task after the run: task=approver, repeatable")
        Map<String, String> approvals = new LinkedHashMap<>();

        @Override
        public Integer call() {
            Map<String, Object> ctx = parseJsonObject(context, "--context");
            ctx.putAll(vars);
            try (WardenRuntime runtime = parent.runtime()) {
                runtime.runPlaybook(playbookId, caseId, ctx, autoApprove);
                List<TaskView> approved = new ArrayList<>();
                for (Map.Entry<String, String> e : approvals.entrySet()) {
                    approved.add(runtime.approveTask(e.getKey(), e.getValue()));
                }
                RunResult result = runtime.lastResult();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("result", result);
                if (!approved.isEmpty()) {
                    out.put("approved", approved);
                }
                System.out.println(Jsons.toJson(out));
                boolean failed = result.tasks().values().stream()
                        .anyMatch(t -> t.status() == TaskStatus.FAILED || t.status() == TaskStatus.BLOCKED);
                return failed ? 1 : 0;
            }
        }
    }

    @Command(name = "ledger-tail", description = "Show the newest entries of a case ledger")
    static final class LedgerTailCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Case id")
        String caseId;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max entries; 0 shows all")
        int limit;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.ledgerEntries(caseId, limit)));
            }
            return 0;
        }
    }

    @Command(name = "ledger-verify", description = "Recompute the hash chain of a case ledger")
    static final class LedgerVerifyCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Case id")
        String caseId;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                LedgerIntegrity integrity = runtime.verifyLedger(caseId);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("integrity", integrity);
                out.put("merkle_root", runtime.merkleRoot(caseId));
                System.out.println(Jsons.toJson(out));
                return integrity.ok() ? 0 : 2;
            }
        }
    }

    @Command(name = "ledger-anchor", description = "Anchor the current ledger tip to external data")
    static final class LedgerAnchorCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Case id")
        String caseId;

        @Option(names = {"--data"}, description = "Anchor data as a JSON object, e.g. a timestamp token reference")
        String data;

        @Override
        public Integer call() {
            Map<String, Object> anchorData = parseJsonObject(data, "--data");
            try (WardenRuntime runtime = parent.runtime()) {
                AnchorRecord anchor = runtime.anchorLedger(caseId, anchorData);
                System.out.println(Jsons.toJson(anchor));
            }
            return 0;
        }
    }

    @Command(name = "anchors", description = "List anchors of a case ledger and whether each still verifies")
    static final class AnchorsCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Parameters(index = "0", description = "Case id")
        String caseId;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                List<Map<String, Object>> rows = new ArrayList<>();
                boolean allValid = true;
                for (AnchorRecord anchor : runtime.anchors(caseId)) {
                    boolean valid = runtime.verifyAnchor(caseId, anchor);
                    allValid &= valid;
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("anchor", anchor);
                    row.put("valid", valid);
                    rows.add(row);
                }
                System.out.println(Jsons.toJson(rows));
                return allValid ? 0 : 2;
            }
        }
    }

    @Command(name = "connectors", description = "List registered connectors")
    static final class ConnectorsCommand implements Callable<Integer> {
        @ParentCommand
        WardenCommand parent;

        @Override
        public Integer call() {
            try (WardenRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.connectorIds()));
            }
            return 0;
        }
    }
}
