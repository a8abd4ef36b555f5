package io.warden.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem layout of one Warden data root. Every durable artifact lives under {@link #rootDir()}.
 */
public final class WardenConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final long DEFAULT_CONNECTOR_TIMEOUT_MS = 300_000L;
    public static final long DEFAULT_SCRIPT_TIMEOUT_MS = 60_000L;

    private final Path rootDir;

    public WardenConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static WardenConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new WardenConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("warden.db");
    }

    public Path ledgerRoot() {
        return rootDir.resolve("ledger");
    }

    public Path playbooksDir() {
        return rootDir.resolve("playbooks");
    }

    public Path connectorsFile() {
        return rootDir.resolve("connectors.json");
    }

    public Path settingsFile() {
        return rootDir.resolve("warden-settings.json");
    }

    public Path ledgerFile(String caseId) {
        return ledgerRoot().resolve(safeFileStem(caseId) + ".log");
    }

    public Path anchorFile(String caseId) {
        return ledgerRoot().resolve(safeFileStem(caseId) + ".anchors.jsonl");
    }

    static String safeFileStem(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("case id cannot be empty");
        }
        String normalized = raw.trim();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        if (value.startsWith(".")) {
            value = "case" + value;
        }
        return value;
    }
}
