package io.warden.audit;

import io.warden.config.WardenConfig;

import java.nio.file.Files;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Hands out one {@link AuditLedger} per case id so all appends to a ledger file go through a single
 * serializing handle.
 */
public final class AuditLedgerRegistry {
    private final WardenConfig config;
    private final boolean maskDetails;
    private final ConcurrentMap<String, AuditLedger> ledgers = new ConcurrentHashMap<>();

    public AuditLedgerRegistry(WardenConfig config, boolean maskDetails) {
        this.config = config;
        this.maskDetails = maskDetails;
    }

    public AuditLedger open(String caseId) {
        return ledgers.computeIfAbsent(caseId, id -> new AuditLedger(
                id,
                config.ledgerFile(id),
                config.anchorFile(id),
                maskDetails
        ));
    }

    public boolean exists(String caseId) {
        return ledgers.containsKey(caseId) || Files.exists(config.ledgerFile(caseId));
    }
}
