package io.warden.model;

import java.util.Map;

/**
 * One ledger row. {@code hash} covers every other field, {@code parentHash} included.
 */
public record AuditEntry(
        long index,
        String timestamp,
        String actor,
        String action,
        Map<String, Object> details,
        String hash,
        String parentHash
) {
}
