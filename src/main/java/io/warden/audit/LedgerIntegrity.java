package io.warden.audit;

/**
 * Result of replaying a ledger file. {@code brokenLine} is 1-based and zero when the chain is
 * intact; {@code reason} names the first check that failed.
 */
public record LedgerIntegrity(
        boolean ok,
        int checkedRows,
        int brokenLine,
        String reason,
        String tipHash
) {
}
